package com.justtrades.unit.exit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.justtrades.domain.enums.ExitReason;
import com.justtrades.domain.enums.ExitState;
import com.justtrades.domain.model.Position;
import com.justtrades.domain.model.PositionKey;
import com.justtrades.event.EventPublisherHelper;
import com.justtrades.exit.ExitStateMachine;
import com.justtrades.ledger.PositionLedger;
import com.justtrades.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ExitStateMachineTest {

    private static final PositionKey KEY = PositionKey.of("ACC-1", "MNQZ5");

    @Mock
    private PositionLedger positionLedger;

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    private ExitStateMachine exitStateMachine;
    private Position position;

    @BeforeEach
    void setUp() {
        exitStateMachine = new ExitStateMachine(positionLedger, eventPublisherHelper,
                MutableClock.startingAt("2025-03-03T14:30:00Z"));
        position = Position.flat(KEY);
    }

    @ParameterizedTest(name = "{0} -> {1} allowed={2}")
    @CsvSource({
        "IDLE, PREPARE_EXIT, true",
        "IDLE, WORKING_EXIT, false",
        "IDLE, CONFIRM_FLAT, false",
        "PREPARE_EXIT, WORKING_EXIT, true",
        "PREPARE_EXIT, IDLE, true",
        "PREPARE_EXIT, CONFIRM_FLAT, false",
        "WORKING_EXIT, CONFIRM_FLAT, true",
        "WORKING_EXIT, IDLE, true",
        "WORKING_EXIT, PREPARE_EXIT, false",
        "CONFIRM_FLAT, IDLE, true",
        "CONFIRM_FLAT, WORKING_EXIT, false"
    })
    void transitionTable(ExitState from, ExitState to, boolean allowed) {
        assertThat(ExitStateMachine.isAllowed(from, to)).isEqualTo(allowed);
    }

    @Test
    @DisplayName("A legal transition is persisted, recorded and published")
    void transition_persistsAndPublishes() {
        exitStateMachine.transition(position, ExitState.PREPARE_EXIT, ExitReason.STOP_LOSS, "stop hit");

        assertThat(position.getExitState()).isEqualTo(ExitState.PREPARE_EXIT);
        assertThat(position.getLastEvent()).isEqualTo("EXIT IDLE -> PREPARE_EXIT: stop hit");
        verify(positionLedger).save(position);
        verify(eventPublisherHelper).publishExitTransition(any(), eq(KEY), eq(ExitState.IDLE),
                eq(ExitState.PREPARE_EXIT), eq(ExitReason.STOP_LOSS), eq("stop hit"));
    }

    @Test
    @DisplayName("An illegal transition throws and leaves the state alone")
    void transition_illegal() {
        assertThatThrownBy(() -> exitStateMachine.transition(position, ExitState.CONFIRM_FLAT, ExitReason.MANUAL, null))
                .isInstanceOf(IllegalStateException.class);

        assertThat(position.getExitState()).isEqualTo(ExitState.IDLE);
        verifyNoInteractions(positionLedger, eventPublisherHelper);
    }

    @Test
    @DisplayName("Kill switch reset reaches IDLE from any state and is a no-op when already IDLE")
    void forceIdle() {
        exitStateMachine.forceIdle(position, "kill switch");
        verifyNoInteractions(positionLedger);

        position.setExitState(ExitState.WORKING_EXIT);
        exitStateMachine.forceIdle(position, "kill switch");

        assertThat(position.getExitState()).isEqualTo(ExitState.IDLE);
        verify(eventPublisherHelper).publishExitTransition(any(), eq(KEY), eq(ExitState.WORKING_EXIT),
                eq(ExitState.IDLE), eq(ExitReason.KILL_SWITCH), eq("kill switch"));
    }
}
