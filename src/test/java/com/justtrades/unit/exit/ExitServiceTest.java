package com.justtrades.unit.exit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.justtrades.broker.BrokerGateway;
import com.justtrades.config.EngineConfig;
import com.justtrades.core.engine.EntryService;
import com.justtrades.core.engine.PendingEntry;
import com.justtrades.core.engine.PositionEventLoop;
import com.justtrades.dca.DcaEngine;
import com.justtrades.domain.enums.DriftTrigger;
import com.justtrades.domain.enums.ExitReason;
import com.justtrades.domain.enums.ExitState;
import com.justtrades.domain.enums.KillSwitchOutcome;
import com.justtrades.domain.enums.OrderPurpose;
import com.justtrades.domain.enums.OrderSide;
import com.justtrades.domain.enums.OrderType;
import com.justtrades.domain.enums.PositionSide;
import com.justtrades.domain.enums.RejectedExitPolicy;
import com.justtrades.domain.model.BrokerPosition;
import com.justtrades.domain.model.OrderIntent;
import com.justtrades.domain.model.Position;
import com.justtrades.domain.model.PositionKey;
import com.justtrades.event.EventPublisherHelper;
import com.justtrades.event.RiskEventType;
import com.justtrades.event.RiskLevel;
import com.justtrades.exception.OrderRejectedException;
import com.justtrades.exit.ExitConfirmationLoop;
import com.justtrades.exit.ExitService;
import com.justtrades.exit.ExitStateMachine;
import com.justtrades.ledger.PositionLedger;
import com.justtrades.oms.OrderRouter;
import com.justtrades.reconciliation.DriftReconciler;
import com.justtrades.risk.KillSwitchResult;
import com.justtrades.risk.KillSwitchService;
import com.justtrades.support.MutableClock;
import java.math.BigDecimal;
import java.util.Optional;
import java.util.function.Consumer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ExitServiceTest {

    private static final PositionKey KEY = PositionKey.of("ACC-1", "MNQZ5");

    @Mock
    private PositionLedger positionLedger;

    @Mock
    private ExitConfirmationLoop confirmationLoop;

    @Mock
    private OrderRouter orderRouter;

    @Mock
    private BrokerGateway brokerGateway;

    @Mock
    private DriftReconciler driftReconciler;

    @Mock
    private KillSwitchService killSwitchService;

    @Mock
    private DcaEngine dcaEngine;

    @Mock
    private EntryService entryService;

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    private EngineConfig engineConfig;
    private ExitService exitService;
    private Position position;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.startingAt("2025-03-03T14:30:00Z");
        engineConfig = new EngineConfig();
        ExitStateMachine exitStateMachine = new ExitStateMachine(positionLedger, eventPublisherHelper, clock);
        exitService = new ExitService(positionLedger, exitStateMachine, confirmationLoop, orderRouter, brokerGateway,
                driftReconciler, killSwitchService, dcaEngine, entryService, new PositionEventLoop(Runnable::run),
                eventPublisherHelper, engineConfig, Runnable::run, clock);

        position = Position.flat(KEY);
        position.setQuantity(2);
        position.setSide(PositionSide.LONG);
        position.setAverageEntryPrice(new BigDecimal("21000"));
        lenient().when(positionLedger.currentPosition(KEY)).thenReturn(position);
    }

    private void brokerHolds(int quantity) {
        when(brokerGateway.queryPosition(KEY.accountId(), KEY.symbol()))
                .thenReturn(quantity == 0 ? BrokerPosition.flat() : BrokerPosition.of(quantity, new BigDecimal("21000")));
    }

    private static OrderRejectedException rejection() {
        return new OrderRejectedException(KEY.symbol(), OrderPurpose.EXIT, "insufficient margin");
    }

    private void goFlat() {
        position.setQuantity(0);
        position.setSide(PositionSide.FLAT);
        position.setAverageEntryPrice(null);
    }

    @Nested
    @DisplayName("Starting an exit")
    class Start {

        @Test
        @DisplayName("Cancels resting orders, then sends a MARKET exit for the broker quantity")
        void requestExit_marketForBrokerQuantity() {
            brokerHolds(2);

            ExitState state = exitService.requestExit(KEY, ExitReason.MANUAL);

            assertThat(state).isEqualTo(ExitState.WORKING_EXIT);
            verify(orderRouter).cancelAllResting(KEY);
            ArgumentCaptor<OrderIntent> intent = ArgumentCaptor.forClass(OrderIntent.class);
            verify(orderRouter).place(intent.capture());
            assertThat(intent.getValue().getType()).isEqualTo(OrderType.MARKET);
            assertThat(intent.getValue().getPurpose()).isEqualTo(OrderPurpose.EXIT);
            assertThat(intent.getValue().getSide()).isEqualTo(OrderSide.SELL);
            assertThat(intent.getValue().getQuantity()).isEqualTo(2);
            verify(confirmationLoop).start(eq(KEY), any(), any());
        }

        @Test
        @DisplayName("A second request while one is preparing is a no-op")
        void secondRequest_noOp() {
            position.setExitState(ExitState.PREPARE_EXIT);

            ExitState state = exitService.requestExit(KEY, ExitReason.STOP_LOSS);

            assertThat(state).isEqualTo(ExitState.PREPARE_EXIT);
            verifyNoInteractions(orderRouter, brokerGateway, confirmationLoop);
        }

        @Test
        @DisplayName("A second request while one is working sends no second order")
        void secondRequest_whileWorking() {
            brokerHolds(2);
            exitService.requestExit(KEY, ExitReason.MANUAL);

            exitService.requestExit(KEY, ExitReason.TAKE_PROFIT);

            verify(orderRouter, times(1)).place(any(OrderIntent.class));
            assertThat(position.getExitState()).isEqualTo(ExitState.WORKING_EXIT);
        }

        @Test
        @DisplayName("A broker quantity that disagrees is reconciled and the exit sized from the broker")
        void drift_reconciledThenBrokerSized() {
            brokerHolds(3);

            exitService.requestExit(KEY, ExitReason.MANUAL);

            verify(driftReconciler).reconcile(KEY, 3, DriftTrigger.EXIT, true);
            ArgumentCaptor<OrderIntent> intent = ArgumentCaptor.forClass(OrderIntent.class);
            verify(orderRouter).place(intent.capture());
            assertThat(intent.getValue().getQuantity()).isEqualTo(3);
        }

        @Test
        @DisplayName("A broker that is already flat ends the exit without an order")
        void brokerFlat_noOrder() {
            brokerHolds(0);
            when(driftReconciler.reconcile(KEY, 0, DriftTrigger.EXIT, true)).thenAnswer(inv -> {
                goFlat();
                return Optional.empty();
            });

            ExitState state = exitService.requestExit(KEY, ExitReason.MANUAL);

            assertThat(state).isEqualTo(ExitState.IDLE);
            verify(orderRouter, never()).place(any(OrderIntent.class));
            verify(dcaEngine).resetForFlat(position);
        }
    }

    @Nested
    @DisplayName("Rejected exit")
    class Rejected {

        @Test
        @DisplayName("REQUIRE_MANUAL_CLEAR returns to IDLE with attention set")
        void manualClear() {
            engineConfig.setRejectedExitPolicy(RejectedExitPolicy.REQUIRE_MANUAL_CLEAR);
            brokerHolds(2);
            when(orderRouter.place(any(OrderIntent.class))).thenThrow(rejection());

            ExitState state = exitService.requestExit(KEY, ExitReason.MANUAL);

            assertThat(state).isEqualTo(ExitState.IDLE);
            assertThat(position.isAttentionRequired()).isTrue();
            assertThat(position.getAttentionReason()).contains("insufficient margin").contains("broker quantity 2");
            verify(eventPublisherHelper).publishRisk(any(), eq(KEY), eq(RiskEventType.ATTENTION_REQUIRED),
                    eq(RiskLevel.CRITICAL), anyString(), anyMap());
            verify(killSwitchService, never()).activate(any(), anyInt(), anyString());
        }

        @Test
        @DisplayName("RETRY_ONCE resubmits once and proceeds when the retry is accepted")
        void retryOnce_accepted() {
            engineConfig.setRejectedExitPolicy(RejectedExitPolicy.RETRY_ONCE);
            brokerHolds(2);
            when(orderRouter.place(any(OrderIntent.class))).thenThrow(rejection()).thenReturn(null);

            ExitState state = exitService.requestExit(KEY, ExitReason.MANUAL);

            assertThat(state).isEqualTo(ExitState.WORKING_EXIT);
            verify(orderRouter, times(2)).place(any(OrderIntent.class));
            assertThat(position.isAttentionRequired()).isFalse();
        }

        @Test
        @DisplayName("RETRY_ONCE falls back to manual clear when the retry is also rejected")
        void retryOnce_rejectedTwice() {
            engineConfig.setRejectedExitPolicy(RejectedExitPolicy.RETRY_ONCE);
            brokerHolds(2);
            when(orderRouter.place(any(OrderIntent.class))).thenThrow(rejection());

            ExitState state = exitService.requestExit(KEY, ExitReason.MANUAL);

            assertThat(state).isEqualTo(ExitState.IDLE);
            verify(orderRouter, times(2)).place(any(OrderIntent.class));
            assertThat(position.isAttentionRequired()).isTrue();
        }

        @Test
        @DisplayName("ESCALATE_TO_KILL_SWITCH hands the position to the kill switch")
        void escalate() {
            engineConfig.setRejectedExitPolicy(RejectedExitPolicy.ESCALATE_TO_KILL_SWITCH);
            brokerHolds(2);
            when(orderRouter.place(any(OrderIntent.class))).thenThrow(rejection());
            when(killSwitchService.activate(eq(KEY), eq(2), anyString())).thenReturn(
                    KillSwitchResult.builder().key(KEY).outcome(KillSwitchOutcome.FLAT_CONFIRMED).build());

            exitService.requestExit(KEY, ExitReason.MANUAL);

            verify(killSwitchService).activate(eq(KEY), eq(2), anyString());
            verify(driftReconciler).reconcile(KEY, 0, DriftTrigger.EXIT, true);
            assertThat(position.getExitState()).isEqualTo(ExitState.IDLE);
            assertThat(position.isAttentionRequired()).isFalse();
        }

        @Test
        @DisplayName("A rejection with the broker already flat reconciles and finishes")
        void brokerFlatAfterRejection() {
            when(brokerGateway.queryPosition(KEY.accountId(), KEY.symbol()))
                    .thenReturn(BrokerPosition.of(2, new BigDecimal("21000")))
                    .thenReturn(BrokerPosition.flat());
            when(orderRouter.place(any(OrderIntent.class))).thenThrow(rejection());

            ExitState state = exitService.requestExit(KEY, ExitReason.MANUAL);

            assertThat(state).isEqualTo(ExitState.IDLE);
            verify(driftReconciler).reconcile(KEY, 0, DriftTrigger.EXIT, true);
            assertThat(position.isAttentionRequired()).isFalse();
        }
    }

    @Nested
    @DisplayName("Confirmation")
    class Confirmation {

        @SuppressWarnings("unchecked")
        private final ArgumentCaptor<Consumer<BrokerPosition>> onPoll = ArgumentCaptor.forClass(Consumer.class);

        private final ArgumentCaptor<Runnable> onTimeout = ArgumentCaptor.forClass(Runnable.class);

        @BeforeEach
        void startExit() {
            brokerHolds(2);
            exitService.requestExit(KEY, ExitReason.MANUAL);
            verify(confirmationLoop).start(eq(KEY), onPoll.capture(), onTimeout.capture());
        }

        @Test
        @DisplayName("Exit fill moves to CONFIRM_FLAT, broker flat then ends in IDLE")
        void fillThenBrokerFlat() {
            goFlat();
            exitService.onExitFill(position);
            assertThat(position.getExitState()).isEqualTo(ExitState.CONFIRM_FLAT);

            onPoll.getValue().accept(BrokerPosition.flat());

            assertThat(position.getExitState()).isEqualTo(ExitState.IDLE);
            verify(dcaEngine).resetForFlat(position);
        }

        @Test
        @DisplayName("A poll that still shows a position changes nothing")
        void brokerNotFlat() {
            onPoll.getValue().accept(BrokerPosition.of(2, new BigDecimal("21000")));

            assertThat(position.getExitState()).isEqualTo(ExitState.WORKING_EXIT);
        }

        @Test
        @DisplayName("Broker flat on repeated polls with no exit fill reconciles the ledger, then confirms")
        void brokerFlatWithoutFill_reconcilesThenConfirms() {
            when(driftReconciler.reconcile(KEY, 0, DriftTrigger.EXIT, true)).thenAnswer(inv -> {
                goFlat();
                return Optional.empty();
            });

            onPoll.getValue().accept(BrokerPosition.flat());
            onPoll.getValue().accept(BrokerPosition.flat());

            verify(driftReconciler, never()).reconcile(KEY, 0, DriftTrigger.EXIT, true);
            assertThat(position.getExitState()).isEqualTo(ExitState.WORKING_EXIT);

            onPoll.getValue().accept(BrokerPosition.flat());

            verify(driftReconciler).reconcile(KEY, 0, DriftTrigger.EXIT, true);
            assertThat(position.getExitState()).isEqualTo(ExitState.IDLE);
            verify(dcaEngine).resetForFlat(position);
        }

        @Test
        @DisplayName("A poll that shows the position again restarts the broker-flat count")
        void brokerFlatCount_resetByOpenPoll() {
            onPoll.getValue().accept(BrokerPosition.flat());
            onPoll.getValue().accept(BrokerPosition.flat());
            onPoll.getValue().accept(BrokerPosition.of(2, new BigDecimal("21000")));
            onPoll.getValue().accept(BrokerPosition.flat());
            onPoll.getValue().accept(BrokerPosition.flat());

            verify(driftReconciler, never()).reconcile(eq(KEY), anyInt(), eq(DriftTrigger.EXIT), eq(true));
            assertThat(position.getExitState()).isEqualTo(ExitState.WORKING_EXIT);
        }

        @Test
        @DisplayName("Timeout escalates to the kill switch; a missed deadline halts the position")
        void timeout_deadlineExceeded() {
            when(killSwitchService.activate(eq(KEY), eq(2), anyString())).thenReturn(
                    KillSwitchResult.builder().key(KEY).outcome(KillSwitchOutcome.DEADLINE_EXCEEDED).build());

            onTimeout.getValue().run();

            verify(eventPublisherHelper).publishRisk(any(), eq(KEY), eq(RiskEventType.EXIT_CONFIRMATION_TIMEOUT),
                    eq(RiskLevel.CRITICAL), anyString(), anyMap());
            assertThat(position.getExitState()).isEqualTo(ExitState.IDLE);
            verify(positionLedger).halt(eq(position), anyString());
        }
    }

    @Test
    @DisplayName("Reversal on a flat position places the parked entry at once")
    void reversal_flat_placesEntry() {
        goFlat();

        exitService.requestReversal(KEY, new PendingEntry(OrderSide.SELL, 1, null));

        verify(entryService).placeEntry(position, OrderSide.SELL, 1, null);
        assertThat(exitService.hasPendingEntry(KEY)).isFalse();
    }

    @Test
    @DisplayName("Reversal entry waits for the exit to confirm flat")
    void reversal_waitsForFlat() {
        brokerHolds(2);

        exitService.requestReversal(KEY, new PendingEntry(OrderSide.SELL, 1, null));

        assertThat(exitService.hasPendingEntry(KEY)).isTrue();
        verify(entryService, never()).placeEntry(any(), any(), anyInt(), any());
    }

    @Test
    @DisplayName("Resuming after restart starts confirmation only for positions mid-exit")
    void resumeAfterRestart() {
        exitService.resumeAfterRestart(position);
        verifyNoInteractions(confirmationLoop);

        position.setExitState(ExitState.WORKING_EXIT);
        exitService.resumeAfterRestart(position);
        verify(confirmationLoop).start(eq(KEY), any(), any());
    }
}
