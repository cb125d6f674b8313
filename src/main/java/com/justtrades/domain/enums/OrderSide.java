package com.justtrades.domain.enums;

public enum OrderSide {
    BUY,
    SELL;

    public OrderSide opposite() {
        return this == BUY ? SELL : BUY;
    }

    /** +1 for BUY, -1 for SELL. Multiplying a fill quantity by this gives its signed delta. */
    public int sign() {
        return this == BUY ? 1 : -1;
    }
}
