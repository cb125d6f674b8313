package com.justtrades.domain.model;

import java.util.Objects;

/**
 * Identity of a position: one per (account, symbol). Also the unit of
 * serialization for the position event loop.
 */
public record PositionKey(String accountId, String symbol) {

    public PositionKey {
        Objects.requireNonNull(accountId, "accountId");
        Objects.requireNonNull(symbol, "symbol");
    }

    public static PositionKey of(String accountId, String symbol) {
        return new PositionKey(accountId, symbol);
    }

    /** Row id used by the positions table. */
    public String asId() {
        return accountId + ":" + symbol;
    }

    public static PositionKey fromId(String id) {
        int idx = id.indexOf(':');
        if (idx <= 0) {
            throw new IllegalArgumentException("Malformed position id: " + id);
        }
        return new PositionKey(id.substring(0, idx), id.substring(idx + 1));
    }

    @Override
    public String toString() {
        return asId();
    }
}
