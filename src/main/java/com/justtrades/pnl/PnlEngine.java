package com.justtrades.pnl;

import com.justtrades.domain.model.PnlSnapshot;
import com.justtrades.domain.model.Position;
import com.justtrades.marketdata.InstrumentRegistry;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.springframework.stereotype.Component;

/**
 * Realized/unrealized PnL for futures positions.
 *
 * <p>Formulas:
 * <ul>
 *   <li>Unrealized: {@code (last - avg) * |qty| * multiplier * sideSign}</li>
 *   <li>Realized (per reducing fill): {@code (fillPrice - avgAtFill) * closedQty * multiplier * sideSign}</li>
 * </ul>
 * where {@code multiplier = tickValue / tickSize}. Realized PnL uses the average
 * entry at the moment of the reducing fill, so a partial exit books against the
 * cost basis that existed then, not the final one.
 *
 * <p>Worst and best unrealized PnL are excursion high-water marks for the current
 * position: worst only moves down, best only moves up.
 */
@Component
public class PnlEngine {

    private static final int SCALE = 2;

    private final InstrumentRegistry instrumentRegistry;

    public PnlEngine(InstrumentRegistry instrumentRegistry) {
        this.instrumentRegistry = instrumentRegistry;
    }

    /** PnL booked by closing {@code closedQuantity} contracts of a position with sign {@code positionSign}. */
    public static BigDecimal realizedPnl(
            BigDecimal averageEntryPrice,
            BigDecimal fillPrice,
            int closedQuantity,
            int positionSign,
            BigDecimal multiplier) {
        return fillPrice
                .subtract(averageEntryPrice)
                .multiply(BigDecimal.valueOf((long) closedQuantity * positionSign))
                .multiply(multiplier)
                .setScale(SCALE, RoundingMode.HALF_UP);
    }

    public BigDecimal unrealizedPnl(Position position, BigDecimal lastPrice) {
        if (position.isFlat() || lastPrice == null || position.getAverageEntryPrice() == null) {
            return BigDecimal.ZERO;
        }
        BigDecimal multiplier = instrumentRegistry.specFor(position.getSymbol()).multiplier();
        return lastPrice
                .subtract(position.getAverageEntryPrice())
                .multiply(BigDecimal.valueOf(position.absQuantity()))
                .multiply(multiplier)
                .multiply(BigDecimal.valueOf(position.getSide().sign()))
                .setScale(SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Marks the position to {@code lastPrice}: updates unrealized PnL and the
     * excursion high-water marks.
     *
     * @return true if worst or best excursion moved (worth persisting)
     */
    public boolean mark(Position position, BigDecimal lastPrice) {
        position.setLastPrice(lastPrice);
        BigDecimal unrealized = unrealizedPnl(position, lastPrice);
        position.setUnrealizedPnl(unrealized);
        if (position.isFlat()) {
            return false;
        }
        boolean moved = false;
        BigDecimal worst = position.getWorstUnrealizedPnl();
        if (worst == null || unrealized.compareTo(worst) < 0) {
            position.setWorstUnrealizedPnl(unrealized.min(BigDecimal.ZERO));
            moved = worst == null || position.getWorstUnrealizedPnl().compareTo(worst) != 0;
        }
        BigDecimal best = position.getBestUnrealizedPnl();
        if (best == null || unrealized.compareTo(best) > 0) {
            position.setBestUnrealizedPnl(unrealized.max(BigDecimal.ZERO));
            moved = moved || best == null || position.getBestUnrealizedPnl().compareTo(best) != 0;
        }
        return moved;
    }

    public PnlSnapshot snapshot(Position position) {
        return new PnlSnapshot(
                nullToZero(position.getRealizedPnl()),
                nullToZero(position.getUnrealizedPnl()),
                nullToZero(position.getWorstUnrealizedPnl()),
                nullToZero(position.getBestUnrealizedPnl()),
                position.getLastPrice());
    }

    private static BigDecimal nullToZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
