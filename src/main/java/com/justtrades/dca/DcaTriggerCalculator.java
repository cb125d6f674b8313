package com.justtrades.dca;

import com.justtrades.domain.enums.DcaTriggerMode;
import com.justtrades.domain.model.DcaRung;
import com.justtrades.domain.model.Position;
import com.justtrades.marketdata.AtrTracker;
import com.justtrades.marketdata.InstrumentRegistry;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Converts a rung distance into a trigger price relative to the current
 * average entry. Distances are adverse magnitudes; their sign is ignored.
 *
 * <ul>
 *   <li>TICKS: {@code avg -/+ distance * tickSize}</li>
 *   <li>PERCENT: {@code avg * (1 -/+ distance / 100)}</li>
 *   <li>ATR: {@code avg -/+ distance * ATR}; no trigger while ATR is unknown</li>
 * </ul>
 * Minus for long positions, plus for short.
 */
@Component
public class DcaTriggerCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final InstrumentRegistry instrumentRegistry;
    private final AtrTracker atrTracker;

    public DcaTriggerCalculator(InstrumentRegistry instrumentRegistry, AtrTracker atrTracker) {
        this.instrumentRegistry = instrumentRegistry;
        this.atrTracker = atrTracker;
    }

    public Optional<BigDecimal> triggerPrice(Position position, DcaTriggerMode mode, DcaRung rung) {
        BigDecimal average = position.getAverageEntryPrice();
        if (position.isFlat() || average == null || rung.getDistance() == null) {
            return Optional.empty();
        }
        BigDecimal distance = rung.getDistance().abs();
        Optional<BigDecimal> offset = switch (mode) {
            case TICKS -> Optional.of(distance.multiply(instrumentRegistry.specFor(position.getSymbol()).tickSize()));
            case PERCENT -> Optional.of(average.multiply(distance).divide(HUNDRED, 6, RoundingMode.HALF_UP));
            case ATR -> atrTracker.currentAtr(position.getSymbol()).map(distance::multiply);
        };
        int sign = position.getSide().sign();
        return offset.map(o -> average.subtract(o.multiply(BigDecimal.valueOf(sign))));
    }

    /** True once {@code lastPrice} is at or beyond the trigger in the adverse direction. */
    public boolean reached(Position position, BigDecimal triggerPrice, BigDecimal lastPrice) {
        int cmp = lastPrice.compareTo(triggerPrice);
        return position.getQuantity() > 0 ? cmp <= 0 : cmp >= 0;
    }
}
