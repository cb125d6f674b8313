package com.justtrades.exception;

import com.justtrades.domain.enums.ExitState;
import com.justtrades.domain.model.PositionKey;

/**
 * An action would grow a position while an exit is in flight. Raised locally,
 * before anything reaches the broker.
 */
public class ConflictingIntentException extends BaseException {

    public ConflictingIntentException(PositionKey key, ExitState exitState, String message) {
        super(
                ErrorCode.CONFLICTING_INTENT,
                message,
                positionDetails(key, "exitState", exitState));
    }
}
