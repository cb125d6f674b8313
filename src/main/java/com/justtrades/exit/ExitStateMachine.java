package com.justtrades.exit;

import com.justtrades.domain.enums.ExitReason;
import com.justtrades.domain.enums.ExitState;
import com.justtrades.domain.model.Position;
import com.justtrades.event.EventPublisherHelper;
import com.justtrades.ledger.PositionLedger;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Transition table for {@link ExitState}.
 *
 * <pre>
 *   IDLE          -> PREPARE_EXIT
 *   PREPARE_EXIT  -> WORKING_EXIT | IDLE (rejected, broker already flat, cancel failure)
 *   WORKING_EXIT  -> CONFIRM_FLAT | IDLE (rejected)
 *   CONFIRM_FLAT  -> IDLE
 *   any           -> IDLE via the kill switch
 * </pre>
 *
 * Every transition is persisted, recorded on the position and published.
 */
@Component
public class ExitStateMachine {

    private static final Logger log = LoggerFactory.getLogger(ExitStateMachine.class);

    private final PositionLedger positionLedger;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    public ExitStateMachine(PositionLedger positionLedger, EventPublisherHelper eventPublisherHelper, Clock clock) {
        this.positionLedger = positionLedger;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    public static boolean isAllowed(ExitState from, ExitState to) {
        return switch (from) {
            case IDLE -> to == ExitState.PREPARE_EXIT;
            case PREPARE_EXIT -> to == ExitState.WORKING_EXIT || to == ExitState.IDLE;
            case WORKING_EXIT -> to == ExitState.CONFIRM_FLAT || to == ExitState.IDLE;
            case CONFIRM_FLAT -> to == ExitState.IDLE;
        };
    }

    /**
     * @throws IllegalStateException if the table does not allow {@code from -> to}
     */
    public void transition(Position position, ExitState to, ExitReason reason, String detail) {
        ExitState from = position.getExitState();
        if (!isAllowed(from, to)) {
            throw new IllegalStateException("Illegal exit transition " + from + " -> " + to + " for " + position.key());
        }
        apply(position, from, to, reason, detail);
    }

    /** Kill switch reset: any state to IDLE. */
    public void forceIdle(Position position, String detail) {
        ExitState from = position.getExitState();
        if (from == ExitState.IDLE) {
            return;
        }
        apply(position, from, ExitState.IDLE, ExitReason.KILL_SWITCH, detail);
    }

    private void apply(Position position, ExitState from, ExitState to, ExitReason reason, String detail) {
        position.setExitState(to);
        position.recordEvent("EXIT " + from + " -> " + to + (detail != null ? ": " + detail : ""), clock.instant());
        positionLedger.save(position);
        log.info("Exit {} -> {} for {} ({}){}", from, to, position.key(), reason,
                detail != null ? ": " + detail : "");
        eventPublisherHelper.publishExitTransition(this, position.key(), from, to, reason, detail);
    }
}
