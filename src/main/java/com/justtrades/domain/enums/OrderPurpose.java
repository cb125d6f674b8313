package com.justtrades.domain.enums;

/**
 * Why an order was placed. Drives fill-role inference and which component
 * reacts to the order's fill or rejection.
 */
public enum OrderPurpose {
    ENTRY,
    TAKE_PROFIT,
    STOP_LOSS,
    DCA_ENTRY,
    EXIT;

    /** True for purposes whose fills reduce the position. */
    public boolean isReducing() {
        return this == TAKE_PROFIT || this == STOP_LOSS || this == EXIT;
    }
}
