package com.justtrades.domain.enums;

public enum FillRole {
    ENTRY,
    EXIT,
    DCA,
    /** Accounting-only adjustment written by the drift reconciler. Never backed by an order. */
    RECONCILIATION
}
