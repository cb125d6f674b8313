package com.justtrades.event;

import java.math.BigDecimal;
import java.time.Instant;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the price feed adapter for every accepted tick.
 *
 * <p>The highest-frequency event in the engine. Listeners hand work to the
 * position event loop instead of processing inline.
 */
public class TickEvent extends ApplicationEvent {

    private final String symbol;
    private final BigDecimal lastPrice;
    private final Instant receivedAt;

    public TickEvent(Object source, String symbol, BigDecimal lastPrice, Instant receivedAt) {
        super(source);
        this.symbol = symbol;
        this.lastPrice = lastPrice;
        this.receivedAt = receivedAt;
    }

    public String getSymbol() {
        return symbol;
    }

    public BigDecimal getLastPrice() {
        return lastPrice;
    }

    public Instant getReceivedAt() {
        return receivedAt;
    }
}
