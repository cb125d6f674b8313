package com.justtrades.domain.enums;

/**
 * Unit in which a DCA rung distance is expressed.
 */
public enum DcaTriggerMode {
    /** Fixed number of instrument ticks. */
    TICKS,
    /** Percent of the average entry price. */
    PERCENT,
    /** Multiple of the current average true range. */
    ATR
}
