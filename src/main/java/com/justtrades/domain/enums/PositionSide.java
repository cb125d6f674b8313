package com.justtrades.domain.enums;

public enum PositionSide {
    LONG,
    SHORT,
    FLAT;

    public static PositionSide fromQuantity(int quantity) {
        if (quantity > 0) {
            return LONG;
        }
        return quantity < 0 ? SHORT : FLAT;
    }

    /** Order side that increases a position of this side. FLAT has none. */
    public OrderSide entrySide() {
        return switch (this) {
            case LONG -> OrderSide.BUY;
            case SHORT -> OrderSide.SELL;
            case FLAT -> throw new IllegalStateException("FLAT has no entry side");
        };
    }

    public int sign() {
        return switch (this) {
            case LONG -> 1;
            case SHORT -> -1;
            case FLAT -> 0;
        };
    }
}
