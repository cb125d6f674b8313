package com.justtrades.integration;

import static com.justtrades.support.EngineHarness.ACCOUNT;
import static com.justtrades.support.EngineHarness.KEY;
import static com.justtrades.support.EngineHarness.SYMBOL;
import static org.assertj.core.api.Assertions.assertThat;

import com.justtrades.domain.enums.DcaTriggerMode;
import com.justtrades.domain.enums.ExitReason;
import com.justtrades.domain.enums.ExitState;
import com.justtrades.domain.enums.KillSwitchOutcome;
import com.justtrades.domain.enums.OrderSide;
import com.justtrades.domain.model.DcaConfig;
import com.justtrades.domain.model.Position;
import com.justtrades.event.ExitStateEvent;
import com.justtrades.event.RiskEvent;
import com.justtrades.event.RiskEventType;
import com.justtrades.risk.KillSwitchResult;
import com.justtrades.support.EngineHarness;
import com.justtrades.support.HoldingBrokerGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Operator kill switch over the paper broker.
 */
class KillSwitchIntegrationTest {

    private EngineHarness harness;

    @BeforeEach
    void setUp() {
        harness = new EngineHarness();
        harness.tick("100");
        harness.tradingEngine.openOrScalePosition(ACCOUNT, SYMBOL, OrderSide.BUY, 3,
                DcaConfig.builder().mode(DcaTriggerMode.TICKS).takeProfitTicks(20).build()).join();
    }

    @Test
    @DisplayName("Force flatten cancels the take-profit, flattens at the broker and leaves the ledger flat")
    void forceFlatten_flattensAndCancels() {
        KillSwitchResult result = harness.tradingEngine.requestForceFlatten(ACCOUNT, SYMBOL).join();

        assertThat(result.getOutcome()).isEqualTo(KillSwitchOutcome.FLAT_CONFIRMED);
        assertThat(result.isQuantityFromBroker()).isTrue();
        assertThat(result.getQuantityAtActivation()).isEqualTo(3);
        assertThat(result.getOrdersCancelled()).isEqualTo(1);
        assertThat(result.getFlattenOrderId()).isNotNull();
        assertThat(result.hasErrors()).isFalse();

        Position position = harness.positionLedger.currentPosition(KEY);
        assertThat(position.isFlat()).isTrue();
        assertThat(position.getExitState()).isEqualTo(ExitState.IDLE);
        assertThat(position.getTakeProfitOrderId()).isNull();
        assertThat(harness.broker.queryPosition(ACCOUNT, SYMBOL).isFlat()).isTrue();
        assertThat(harness.broker.queryOrders(ACCOUNT, SYMBOL)).isEmpty();
        assertThat(harness.eventsOf(RiskEvent.class))
                .anySatisfy(e -> assertThat(e.getEventType()).isEqualTo(RiskEventType.KILL_SWITCH_TRIGGERED));
    }

    @Test
    @DisplayName("A second activation on a flat position reports ALREADY_FLAT and sends nothing")
    void forceFlatten_isIdempotent() {
        harness.tradingEngine.requestForceFlatten(ACCOUNT, SYMBOL).join();

        KillSwitchResult second = harness.tradingEngine.requestForceFlatten(ACCOUNT, SYMBOL).join();

        assertThat(second.getOutcome()).isEqualTo(KillSwitchOutcome.ALREADY_FLAT);
        assertThat(second.getFlattenOrderId()).isNull();
        assertThat(harness.positionLedger.currentPosition(KEY).isFlat()).isTrue();
    }

    @Test
    @DisplayName("New signals are accepted once the kill switch has confirmed flat")
    void afterFlatten_positionCanReopen() {
        harness.tradingEngine.requestForceFlatten(ACCOUNT, SYMBOL).join();

        harness.tradingEngine.openOrScalePosition(ACCOUNT, SYMBOL, OrderSide.SELL, 1, null).join();

        assertThat(harness.positionLedger.currentPosition(KEY).getQuantity()).isEqualTo(-1);
    }

    @Nested
    @DisplayName("While an exit is working")
    class DuringWorkingExit {

        private EngineHarness held;
        private HoldingBrokerGateway broker;

        @BeforeEach
        void setUp() {
            held = EngineHarness.holding();
            broker = held.holdingBroker();
            held.tick("100");
            held.tradingEngine.openOrScalePosition(ACCOUNT, SYMBOL, OrderSide.BUY, 3, null).join();
            broker.holdExits(true);
            held.tradingEngine.requestExit(ACCOUNT, SYMBOL, ExitReason.MANUAL).join();

            assertThat(held.positionLedger.currentPosition(KEY).getExitState()).isEqualTo(ExitState.WORKING_EXIT);
            assertThat(broker.heldOrders()).hasSize(1);
            assertThat(held.scheduler.liveTasks()).isEqualTo(1);
        }

        @Test
        @DisplayName("Force flatten sends the market flatten within the deadline, pulls the stuck exit and ends IDLE")
        void forceFlatten_overridesWorkingExit() {
            KillSwitchResult result = held.tradingEngine.requestForceFlatten(ACCOUNT, SYMBOL).join();

            assertThat(result.getOutcome()).isEqualTo(KillSwitchOutcome.FLAT_CONFIRMED);
            assertThat(result.getFlattenOrderId()).isNotNull().doesNotStartWith("HELD-");
            assertThat(result.getFlattenIssuedAfterMs())
                    .isBetween(0L, held.engineConfig.getKillSwitchDeadline().toMillis());
            assertThat(result.getOrdersCancelled()).isEqualTo(1);
            assertThat(broker.heldOrders()).isEmpty();

            Position position = held.positionLedger.currentPosition(KEY);
            assertThat(position.isFlat()).isTrue();
            assertThat(position.getExitState()).isEqualTo(ExitState.IDLE);
            assertThat(held.exitConfirmationLoop.isActive(KEY)).isFalse();
            assertThat(held.scheduler.liveTasks()).isZero();
            assertThat(broker.queryPosition(ACCOUNT, SYMBOL).isFlat()).isTrue();
        }

        @Test
        @DisplayName("With the flatten fill push lost, the result itself stops polling, reconciles and forces IDLE")
        void forceFlatten_withoutFillPush_reconcilesToIdle() {
            broker.dropPushes(true);

            KillSwitchResult result = held.tradingEngine.requestForceFlatten(ACCOUNT, SYMBOL).join();

            assertThat(result.getOutcome()).isEqualTo(KillSwitchOutcome.FLAT_CONFIRMED);
            assertThat(result.getFlattenIssuedAfterMs())
                    .isBetween(0L, held.engineConfig.getKillSwitchDeadline().toMillis());

            Position position = held.positionLedger.currentPosition(KEY);
            assertThat(position.isFlat()).isTrue();
            assertThat(position.getExitState()).isEqualTo(ExitState.IDLE);
            assertThat(held.scheduler.liveTasks()).isZero();
            assertThat(held.eventsOf(ExitStateEvent.class)).last().satisfies(e -> {
                assertThat(e.getFrom()).isEqualTo(ExitState.WORKING_EXIT);
                assertThat(e.getTo()).isEqualTo(ExitState.IDLE);
                assertThat(e.getReason()).isEqualTo(ExitReason.KILL_SWITCH);
            });
            assertThat(held.driftReconciler.recentDrift(KEY)).singleElement()
                    .satisfies(record -> assertThat(record.getBrokerQuantity()).isZero());
        }
    }
}
