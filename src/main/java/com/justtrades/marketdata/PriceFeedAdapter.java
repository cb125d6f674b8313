package com.justtrades.marketdata;

import com.justtrades.event.EventPublisherHelper;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Entry point for pushed quotes. Keeps the per-symbol last-price table,
 * feeds the ATR bars and publishes a {@code TickEvent} that drives PnL marks,
 * DCA evaluation and target/stop checks.
 */
@Component
public class PriceFeedAdapter {

    private static final Logger log = LoggerFactory.getLogger(PriceFeedAdapter.class);

    private final AtrTracker atrTracker;
    private final EventPublisherHelper eventPublisherHelper;
    private final Map<String, BigDecimal> lastPrices = new ConcurrentHashMap<>();

    public PriceFeedAdapter(AtrTracker atrTracker, EventPublisherHelper eventPublisherHelper) {
        this.atrTracker = atrTracker;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    public void onTick(String symbol, BigDecimal lastPrice) {
        onTick(symbol, lastPrice, Instant.now());
    }

    public void onTick(String symbol, BigDecimal lastPrice, Instant timestamp) {
        if (symbol == null || symbol.isBlank() || lastPrice == null || lastPrice.signum() <= 0) {
            log.debug("Dropping malformed tick: symbol={} price={}", symbol, lastPrice);
            return;
        }
        String normalized = symbol.trim().toUpperCase(Locale.ROOT);
        lastPrices.put(normalized, lastPrice);
        atrTracker.onTick(normalized, lastPrice, timestamp);
        eventPublisherHelper.publishTick(this, normalized, lastPrice);
    }

    public Optional<BigDecimal> lastPrice(String symbol) {
        return Optional.ofNullable(lastPrices.get(symbol));
    }
}
