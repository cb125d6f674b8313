package com.justtrades.domain.enums;

/**
 * What to do when an exit order is rejected and the broker still reports a
 * nonzero position afterwards.
 */
public enum RejectedExitPolicy {
    /** Return to IDLE, flag the position for attention and halt automation on it. */
    REQUIRE_MANUAL_CLEAR,
    /** Hand the position to the kill switch. */
    ESCALATE_TO_KILL_SWITCH,
    /** Submit one more exit order; a second rejection falls back to manual clear. */
    RETRY_ONCE
}
