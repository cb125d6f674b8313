package com.justtrades.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    CONFLICTING_INTENT("CONFLICTING_INTENT", 409),
    DRIFT_DETECTED("DRIFT_DETECTED", 409),
    ORDER_REJECTED("ORDER_REJECTED", 422),
    POSITION_HALTED("POSITION_HALTED", 423),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    LEDGER_CORRUPTION("LEDGER_CORRUPTION", 500),
    BROKER_ERROR("BROKER_ERROR", 502),
    ENGINE_TIMEOUT("ENGINE_TIMEOUT", 504);

    private final String code;
    private final int httpStatus;
}
