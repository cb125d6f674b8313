package com.justtrades.marketdata;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Getter;

/**
 * OHLC bar still being built from ticks. Only touched under the owning
 * {@link AtrTracker} series lock.
 */
@Getter
public class PendingBar {

    private final Instant openTime;
    private BigDecimal open;
    private BigDecimal high;
    private BigDecimal low;
    private BigDecimal close;
    private long ticks;

    public PendingBar(Instant openTime) {
        this.openTime = openTime;
    }

    public void update(BigDecimal price) {
        if (open == null) {
            open = price;
            high = price;
            low = price;
        }
        if (price.compareTo(high) > 0) {
            high = price;
        }
        if (price.compareTo(low) < 0) {
            low = price;
        }
        close = price;
        ticks++;
    }

    public boolean hasData() {
        return open != null;
    }
}
