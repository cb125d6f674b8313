package com.justtrades.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Contract economics for one symbol root.
 *
 * @param tickSize  minimum price increment
 * @param tickValue currency value of one tick for one contract
 */
public record InstrumentSpec(BigDecimal tickSize, BigDecimal tickValue) {

    /** Currency value of a one-point move for one contract. */
    public BigDecimal multiplier() {
        return tickValue.divide(tickSize, 10, RoundingMode.HALF_UP);
    }

    /** Rounds a price to the nearest tick. */
    public BigDecimal roundToTick(BigDecimal price) {
        BigDecimal ticks = price.divide(tickSize, 0, RoundingMode.HALF_UP);
        return ticks.multiply(tickSize);
    }
}
