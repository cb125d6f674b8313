package com.justtrades.exception;

import com.justtrades.domain.model.PositionKey;

public class PositionHaltedException extends BaseException {

    public PositionHaltedException(PositionKey key, String reason) {
        super(
                ErrorCode.POSITION_HALTED,
                "Automated trading halted for " + key + ": " + reason,
                positionDetails(key, "reason", reason));
    }
}
