package com.justtrades.event;

/**
 * Classifies the condition behind a {@link RiskEvent}.
 */
public enum RiskEventType {

    /** Broker rejected an entry, DCA or protective order. */
    ORDER_REJECTED,

    /** Broker rejected a market exit. */
    EXIT_REJECTED,

    /** Exit did not confirm flat before the confirmation deadline. */
    EXIT_CONFIRMATION_TIMEOUT,

    /** A broker fill would have grown a position mid-exit. */
    CONFLICTING_FILL,

    /** Kill switch activated for a position. */
    KILL_SWITCH_TRIGGERED,

    /** Kill switch could not confirm flat within its deadline. Human intervention required. */
    KILL_SWITCH_DEADLINE_EXCEEDED,

    /** Fill log replay failed. */
    LEDGER_CORRUPTION,

    /** Position flagged for operator attention. */
    ATTENTION_REQUIRED,

    /** A position went flat but an order for it could not be cancelled at the broker. */
    RESTING_ORDER_NOT_CANCELLED,

    /** Account PnL for the trading day reached the configured loss limit. */
    DAILY_LOSS_LIMIT_BREACHED
}
