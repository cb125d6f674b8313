package com.justtrades.ledger;

import com.justtrades.domain.enums.PositionSide;
import com.justtrades.domain.model.Fill;
import com.justtrades.domain.model.Position;
import com.justtrades.event.PositionEventType;
import com.justtrades.pnl.PnlEngine;
import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * The fold from an ordered fill sequence to a position's quantity, average entry
 * and realized PnL. Used by both incremental recording and full replay, which
 * is what makes a rebuild equal to the incremental result.
 */
public final class PositionCalculator {

    /** Scale of the stored average entry price. */
    static final int PRICE_SCALE = 6;

    private PositionCalculator() {}

    /**
     * Applies one fill to {@code position} in place.
     *
     * @param multiplier currency value of a one-point move per contract
     * @return the kind of change the fill caused
     * @throws IllegalArgumentException if the fill is malformed
     */
    public static PositionEventType apply(Position position, Fill fill, BigDecimal multiplier) {
        validate(fill);

        int oldQuantity = position.getQuantity();
        int delta = fill.signedQuantity();
        int newQuantity = oldQuantity + delta;
        BigDecimal price = fill.getPrice();
        BigDecimal realized = BigDecimal.ZERO;
        PositionEventType type;

        if (oldQuantity == 0) {
            position.setAverageEntryPrice(price.setScale(PRICE_SCALE, RoundingMode.HALF_UP));
            openFresh(position, fill);
            type = PositionEventType.OPENED;
        } else if (Integer.signum(oldQuantity) == Integer.signum(delta)) {
            BigDecimal cost = position.getAverageEntryPrice()
                    .multiply(BigDecimal.valueOf(Math.abs(oldQuantity)))
                    .add(price.multiply(BigDecimal.valueOf(Math.abs(delta))));
            position.setAverageEntryPrice(
                    cost.divide(BigDecimal.valueOf(Math.abs(newQuantity)), PRICE_SCALE, RoundingMode.HALF_UP));
            type = PositionEventType.INCREASED;
        } else {
            int closed = Math.min(Math.abs(delta), Math.abs(oldQuantity));
            realized = PnlEngine.realizedPnl(
                    position.getAverageEntryPrice(), price, closed, Integer.signum(oldQuantity), multiplier);
            if (newQuantity == 0) {
                position.setAverageEntryPrice(null);
                position.setClosedAt(fill.getTimestamp());
                position.setUnrealizedPnl(BigDecimal.ZERO);
                type = PositionEventType.CLOSED;
            } else if (Integer.signum(newQuantity) == Integer.signum(oldQuantity)) {
                type = PositionEventType.REDUCED;
            } else {
                position.setAverageEntryPrice(price.setScale(PRICE_SCALE, RoundingMode.HALF_UP));
                openFresh(position, fill);
                type = PositionEventType.FLIPPED;
            }
        }

        if (type != PositionEventType.REDUCED) {
            // an armed break-even belongs to the average it was armed against
            position.setBreakEvenStopPrice(null);
        }
        position.setQuantity(newQuantity);
        position.setSide(PositionSide.fromQuantity(newQuantity));
        BigDecimal previousRealized = position.getRealizedPnl() == null ? BigDecimal.ZERO : position.getRealizedPnl();
        position.setRealizedPnl(previousRealized.add(realized));
        position.setFillCount(position.getFillCount() + 1);
        return type;
    }

    /** True if applying {@code delta} to {@code quantity} moves it away from zero or through it. */
    public static boolean growsPosition(int quantity, int delta) {
        int result = quantity + delta;
        if (result == 0) {
            return false;
        }
        if (quantity == 0 || Integer.signum(result) != Integer.signum(quantity)) {
            return true;
        }
        return Math.abs(result) > Math.abs(quantity);
    }

    private static void openFresh(Position position, Fill fill) {
        position.setOpenedAt(fill.getTimestamp());
        position.setClosedAt(null);
        position.setUnrealizedPnl(BigDecimal.ZERO);
        position.setWorstUnrealizedPnl(BigDecimal.ZERO);
        position.setBestUnrealizedPnl(BigDecimal.ZERO);
    }

    private static void validate(Fill fill) {
        if (fill.getSide() == null) {
            throw new IllegalArgumentException("Fill " + fill.getFillId() + " has no side");
        }
        if (fill.getQuantity() <= 0) {
            throw new IllegalArgumentException("Fill " + fill.getFillId() + " has non-positive quantity");
        }
        if (fill.getPrice() == null || fill.getPrice().signum() <= 0) {
            throw new IllegalArgumentException("Fill " + fill.getFillId() + " has no valid price");
        }
    }
}
