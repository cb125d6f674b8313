package com.justtrades.unit.engine;

import static com.justtrades.support.EngineHarness.ACCOUNT;
import static com.justtrades.support.EngineHarness.KEY;
import static com.justtrades.support.EngineHarness.SYMBOL;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.justtrades.domain.enums.DcaTriggerMode;
import com.justtrades.domain.enums.ExitState;
import com.justtrades.domain.enums.OrderSide;
import com.justtrades.domain.model.DcaConfig;
import com.justtrades.domain.model.PositionStatus;
import com.justtrades.exception.ConflictingIntentException;
import com.justtrades.exception.PositionHaltedException;
import com.justtrades.exception.ValidationException;
import com.justtrades.support.EngineHarness;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TradingEngineTest {

    private EngineHarness harness;

    @BeforeEach
    void setUp() {
        harness = new EngineHarness();
        harness.tick("100");
    }

    @Test
    @DisplayName("Signals for lower-case symbols address the same position")
    void symbolNormalized() {
        harness.tradingEngine.openOrScalePosition(ACCOUNT, " mnqz5 ", OrderSide.BUY, 1, null).join();

        PositionStatus status = harness.tradingEngine.getStatus(ACCOUNT, SYMBOL);

        assertThat(status.position().getQuantity()).isEqualTo(1);
    }

    @Test
    @DisplayName("Non-positive quantities and missing keys are rejected up front")
    void validation() {
        assertThatThrownBy(() -> harness.tradingEngine.openOrScalePosition(ACCOUNT, SYMBOL, OrderSide.BUY, 0, null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> harness.tradingEngine.getStatus(" ", SYMBOL))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("A same-direction signal during an exit is a conflict")
    void sameDirectionMidExit_conflict() {
        harness.tradingEngine.openOrScalePosition(ACCOUNT, SYMBOL, OrderSide.BUY, 2, null).join();
        harness.positionLedger.currentPosition(KEY).setExitState(ExitState.WORKING_EXIT);

        assertThatThrownBy(() -> harness.tradingEngine
                        .openOrScalePosition(ACCOUNT, SYMBOL, OrderSide.BUY, 1, null)
                        .join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(ConflictingIntentException.class);
    }

    @Test
    @DisplayName("An opposite signal during an exit parks a reversal entry")
    void oppositeMidExit_parksReversal() {
        harness.tradingEngine.openOrScalePosition(ACCOUNT, SYMBOL, OrderSide.BUY, 2, null).join();
        harness.positionLedger.currentPosition(KEY).setExitState(ExitState.WORKING_EXIT);

        harness.tradingEngine.openOrScalePosition(ACCOUNT, SYMBOL, OrderSide.SELL, 1, null).join();

        assertThat(harness.exitService.hasPendingEntry(KEY)).isTrue();
        assertThat(harness.positionLedger.currentPosition(KEY).getQuantity()).isEqualTo(2);
    }

    @Test
    @DisplayName("Signals on a position that needs attention are refused")
    void blocked_refused() {
        harness.positionLedger.currentPosition(KEY).setAttentionRequired(true);

        assertThatThrownBy(() -> harness.tradingEngine
                        .openOrScalePosition(ACCOUNT, SYMBOL, OrderSide.BUY, 1, null)
                        .join())
                .hasCauseInstanceOf(PositionHaltedException.class);
    }

    @Test
    @DisplayName("Clearing attention unblocks the position and is audited")
    void clearAttention() {
        harness.positionLedger.currentPosition(KEY).setAttentionRequired(true);
        harness.positionLedger.currentPosition(KEY).setAttentionReason("exit rejected");

        PositionStatus status = harness.tradingEngine.clearAttention(ACCOUNT, SYMBOL).join();

        assertThat(status.position().isAttentionRequired()).isFalse();
        assertThat(status.recentEvents()).anyMatch(e -> e.getEventType().equals("ATTENTION_CLEARED"));
        harness.tradingEngine.openOrScalePosition(ACCOUNT, SYMBOL, OrderSide.BUY, 1, null).join();
        assertThat(harness.positionLedger.currentPosition(KEY).getQuantity()).isEqualTo(1);
    }

    @Test
    @DisplayName("The DCA config is adopted only when opening from flat")
    void dcaConfigAdoptedOnOpen() {
        DcaConfig first = DcaConfig.builder().mode(DcaTriggerMode.TICKS).takeProfitTicks(10).build();
        DcaConfig second = DcaConfig.builder().mode(DcaTriggerMode.TICKS).takeProfitTicks(99).build();

        harness.tradingEngine.openOrScalePosition(ACCOUNT, SYMBOL, OrderSide.BUY, 1, first).join();
        harness.tradingEngine.openOrScalePosition(ACCOUNT, SYMBOL, OrderSide.BUY, 1, second).join();

        assertThat(harness.positionLedger.currentPosition(KEY).getDcaConfig().getTakeProfitTicks()).isEqualTo(10);
    }
}
