package com.justtrades.exception;

import java.util.Map;

/**
 * A confirmation or kill-switch deadline elapsed. Escalated, never retried.
 */
public class EngineTimeoutException extends BaseException {

    public EngineTimeoutException(String operation, long deadlineMs) {
        super(
                ErrorCode.ENGINE_TIMEOUT,
                operation + " did not complete within " + deadlineMs + "ms",
                Map.of("operation", operation, "deadlineMs", deadlineMs));
    }
}
