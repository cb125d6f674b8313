package com.justtrades.marketdata;

import com.justtrades.config.EngineConfig;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBarSeriesBuilder;
import org.ta4j.core.indicators.ATRIndicator;

/**
 * Average true range per symbol, for ATR-mode DCA rungs.
 *
 * <p>Ticks are aggregated into fixed-duration bars held in a ta4j
 * {@link BarSeries}; the ATR is read from {@link ATRIndicator} once the series
 * has {@code period} bars. An ATR pushed from outside (the charting platform
 * sends its own) takes precedence over the computed value.
 */
@Component
public class AtrTracker {

    private static final Logger log = LoggerFactory.getLogger(AtrTracker.class);

    private final EngineConfig.Atr atrConfig;
    private final Map<String, SymbolSeries> seriesBySymbol = new ConcurrentHashMap<>();
    private final Map<String, BigDecimal> overrides = new ConcurrentHashMap<>();

    public AtrTracker(EngineConfig engineConfig) {
        this.atrConfig = engineConfig.getAtr();
    }

    public void onTick(String symbol, BigDecimal price, Instant timestamp) {
        seriesBySymbol
                .computeIfAbsent(symbol, s -> new SymbolSeries(s, atrConfig))
                .onTick(price, timestamp);
    }

    /** Externally supplied ATR. A null or non-positive value clears the override. */
    public void setOverride(String symbol, BigDecimal atr) {
        if (atr == null || atr.signum() <= 0) {
            overrides.remove(symbol);
        } else {
            overrides.put(symbol, atr);
        }
    }

    /** Current ATR, empty until enough bars have closed and no override is set. */
    public Optional<BigDecimal> currentAtr(String symbol) {
        BigDecimal override = overrides.get(symbol);
        if (override != null) {
            return Optional.of(override);
        }
        SymbolSeries series = seriesBySymbol.get(symbol);
        return series == null ? Optional.empty() : series.atr();
    }

    private static final class SymbolSeries {

        private final String symbol;
        private final Duration barDuration;
        private final int period;
        private final BarSeries barSeries;
        private final ATRIndicator atrIndicator;
        private PendingBar pendingBar;

        SymbolSeries(String symbol, EngineConfig.Atr config) {
            this.symbol = symbol;
            this.barDuration = config.getBarDuration();
            this.period = config.getPeriod();
            this.barSeries = new BaseBarSeriesBuilder()
                    .withName(symbol)
                    .withMaxBarCount(config.getMaxBars())
                    .build();
            this.atrIndicator = new ATRIndicator(barSeries, period);
        }

        synchronized void onTick(BigDecimal price, Instant timestamp) {
            if (pendingBar == null) {
                pendingBar = new PendingBar(timestamp);
            }
            if (Duration.between(pendingBar.getOpenTime(), timestamp).compareTo(barDuration) >= 0) {
                closeBar(pendingBar.getOpenTime().plus(barDuration));
                pendingBar = new PendingBar(timestamp);
            }
            pendingBar.update(price);
        }

        private void closeBar(Instant endTime) {
            if (!pendingBar.hasData()) {
                return;
            }
            if (!barSeries.isEmpty()
                    && !endTime.isAfter(barSeries.getLastBar().getEndTime().toInstant())) {
                return;
            }
            barSeries.addBar(
                    barDuration,
                    endTime.atZone(ZoneOffset.UTC),
                    pendingBar.getOpen(),
                    pendingBar.getHigh(),
                    pendingBar.getLow(),
                    pendingBar.getClose(),
                    pendingBar.getTicks());
            log.debug("Bar closed for {} [H={} L={} C={}]", symbol, pendingBar.getHigh(), pendingBar.getLow(),
                    pendingBar.getClose());
        }

        synchronized Optional<BigDecimal> atr() {
            if (barSeries.getBarCount() < period) {
                return Optional.empty();
            }
            double value = atrIndicator.getValue(barSeries.getEndIndex()).doubleValue();
            if (Double.isNaN(value) || value <= 0) {
                return Optional.empty();
            }
            return Optional.of(BigDecimal.valueOf(value));
        }
    }
}
