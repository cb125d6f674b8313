package com.justtrades.event;

/**
 * Classifies the ledger change behind a {@link PositionEvent}.
 */
public enum PositionEventType {

    /** First fill from flat. */
    OPENED,

    /** Size grew in the same direction (entry or DCA fill). */
    INCREASED,

    /** Partial reduction. */
    REDUCED,

    /** Quantity reached zero. */
    CLOSED,

    /** A single fill closed the position and opened one on the other side. */
    FLIPPED,

    /** Replayed from the fill log (restart or reconciliation). */
    REBUILT
}
