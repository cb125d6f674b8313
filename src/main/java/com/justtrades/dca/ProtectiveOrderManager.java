package com.justtrades.dca;

import com.justtrades.domain.enums.ExitState;
import com.justtrades.domain.enums.OrderPurpose;
import com.justtrades.domain.enums.OrderType;
import com.justtrades.domain.model.DcaConfig;
import com.justtrades.domain.model.InstrumentSpec;
import com.justtrades.domain.model.OrderIntent;
import com.justtrades.domain.model.Position;
import com.justtrades.domain.model.TrackedOrder;
import com.justtrades.exception.BaseException;
import com.justtrades.exception.BrokerException;
import com.justtrades.ledger.PositionLedger;
import com.justtrades.marketdata.InstrumentRegistry;
import com.justtrades.oms.OrderRouter;
import java.math.BigDecimal;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resting take-profit limit for an open position, priced at
 * {@code avg +/- takeProfitTicks * tickSize} and sized to the full position.
 *
 * <p>Stops are not rested at the broker; the engine watches them on ticks and
 * exits with a market order. A break-even stop, once armed, sits at the
 * average entry alongside any configured stop.
 */
@Component
public class ProtectiveOrderManager {

    private static final Logger log = LoggerFactory.getLogger(ProtectiveOrderManager.class);

    private final OrderRouter orderRouter;
    private final PositionLedger positionLedger;
    private final InstrumentRegistry instrumentRegistry;

    public ProtectiveOrderManager(
            OrderRouter orderRouter, PositionLedger positionLedger, InstrumentRegistry instrumentRegistry) {
        this.orderRouter = orderRouter;
        this.positionLedger = positionLedger;
        this.instrumentRegistry = instrumentRegistry;
    }

    public BigDecimal takeProfitPrice(Position position) {
        InstrumentSpec spec = instrumentRegistry.specFor(position.getSymbol());
        BigDecimal offset = spec.tickSize().multiply(BigDecimal.valueOf(position.getDcaConfig().getTakeProfitTicks()));
        BigDecimal raw = position.getAverageEntryPrice().add(offset.multiply(BigDecimal.valueOf(position.getSide().sign())));
        return spec.roundToTick(raw);
    }

    /** Engine-side stop level, {@code avg -/+ stopLossTicks * tickSize}. */
    public BigDecimal stopLossPrice(Position position) {
        InstrumentSpec spec = instrumentRegistry.specFor(position.getSymbol());
        BigDecimal offset = spec.tickSize().multiply(BigDecimal.valueOf(position.getDcaConfig().getStopLossTicks()));
        BigDecimal raw = position.getAverageEntryPrice().subtract(offset.multiply(BigDecimal.valueOf(position.getSide().sign())));
        return spec.roundToTick(raw);
    }

    /**
     * The stop the engine is watching: the configured stop, an armed
     * break-even stop, or the tighter of the two when both apply.
     */
    public Optional<BigDecimal> activeStopPrice(Position position) {
        DcaConfig config = position.getDcaConfig();
        if (position.isFlat() || position.getAverageEntryPrice() == null) {
            return Optional.empty();
        }
        BigDecimal configured = config != null && config.getStopLossTicks() > 0 ? stopLossPrice(position) : null;
        BigDecimal breakEven = position.getBreakEvenStopPrice();
        if (configured == null || breakEven == null) {
            return Optional.ofNullable(configured != null ? configured : breakEven);
        }
        return Optional.of(position.getSide().sign() > 0 ? configured.max(breakEven) : configured.min(breakEven));
    }

    /** True if {@code lastPrice} is at or through the active stop for the position's side. */
    public boolean stopLossHit(Position position, BigDecimal lastPrice) {
        Optional<BigDecimal> stop = activeStopPrice(position);
        if (stop.isEmpty()) {
            return false;
        }
        int cmp = lastPrice.compareTo(stop.get());
        return position.getSide().sign() > 0 ? cmp <= 0 : cmp >= 0;
    }

    /** True if the active stop is the break-even stop rather than the configured one. */
    public boolean breakEvenStopActive(Position position) {
        BigDecimal breakEven = position.getBreakEvenStopPrice();
        return breakEven != null && activeStopPrice(position).map(stop -> stop.compareTo(breakEven) == 0).orElse(false);
    }

    /**
     * Moves the stop to the average entry once {@code lastPrice} is
     * {@code breakEvenTicks} in favor of it. Arms at most once per average.
     *
     * @return true if this tick armed the stop
     */
    public boolean armBreakEven(Position position, BigDecimal lastPrice) {
        DcaConfig config = position.getDcaConfig();
        if (config == null || config.getBreakEvenTicks() <= 0 || position.isFlat()
                || position.getAverageEntryPrice() == null || position.getBreakEvenStopPrice() != null) {
            return false;
        }
        InstrumentSpec spec = instrumentRegistry.specFor(position.getSymbol());
        int sign = position.getSide().sign();
        BigDecimal activation = position.getAverageEntryPrice().add(spec.tickSize()
                .multiply(BigDecimal.valueOf((long) config.getBreakEvenTicks() * sign)));
        int cmp = lastPrice.compareTo(activation);
        if (sign > 0 ? cmp < 0 : cmp > 0) {
            return false;
        }
        position.setBreakEvenStopPrice(position.getAverageEntryPrice());
        positionLedger.save(position);
        log.info("Break-even armed for {} at {}: stop moved to {}", position.key(), lastPrice,
                position.getBreakEvenStopPrice());
        return true;
    }

    /**
     * True if {@code lastPrice} is at or through the take-profit level while no
     * take-profit limit is resting at the broker.
     */
    public boolean takeProfitHit(Position position, BigDecimal lastPrice) {
        DcaConfig config = position.getDcaConfig();
        if (config == null || config.getTakeProfitTicks() <= 0 || position.isFlat()
                || position.getTakeProfitOrderId() != null) {
            return false;
        }
        int cmp = lastPrice.compareTo(takeProfitPrice(position));
        return position.getSide().sign() > 0 ? cmp >= 0 : cmp <= 0;
    }

    /** Cancels the current take-profit (if any) and rests a new one at the current average. */
    public void replaceTakeProfit(Position position) {
        if (!cancelTakeProfit(position)) {
            return;
        }
        DcaConfig config = position.getDcaConfig();
        if (config == null || config.getTakeProfitTicks() <= 0 || position.isFlat()
                || position.getExitState() != ExitState.IDLE || position.isBlocked()) {
            return;
        }
        OrderIntent intent = OrderIntent.builder()
                .accountId(position.getAccountId())
                .symbol(position.getSymbol())
                .side(position.getSide().entrySide().opposite())
                .quantity(position.absQuantity())
                .type(OrderType.LIMIT)
                .purpose(OrderPurpose.TAKE_PROFIT)
                .limitPrice(takeProfitPrice(position))
                .build();
        try {
            TrackedOrder order = orderRouter.place(intent);
            position.setTakeProfitOrderId(order.getOrderId());
            positionLedger.save(position);
        } catch (BaseException e) {
            log.warn("Take-profit for {} not placed: {}", position.key(), e.getMessage());
        }
    }

    /**
     * Cancels the resting take-profit. The id is cleared when the broker
     * confirms or no longer knows the order.
     *
     * @return false if the cancel failed and the old order may still be working
     */
    public boolean cancelTakeProfit(Position position) {
        String orderId = position.getTakeProfitOrderId();
        if (orderId == null) {
            return true;
        }
        try {
            orderRouter.cancel(position.key(), orderId);
        } catch (BrokerException e) {
            log.warn("Could not cancel take-profit {} for {}: {}", orderId, position.key(), e.getMessage());
            return false;
        }
        position.setTakeProfitOrderId(null);
        positionLedger.save(position);
        return true;
    }

    /**
     * Pulls every order still resting for a position that is now flat: the
     * tracked take-profit, then anything else the broker lists for the symbol.
     * The take-profit id survives a failed cancel, so the next flat event retries it.
     *
     * @return false if an order may still be resting
     */
    public boolean releaseForFlat(Position position) {
        boolean takeProfitReleased = cancelTakeProfit(position);
        try {
            orderRouter.cancelAllResting(position.key());
        } catch (BrokerException e) {
            log.warn("Resting orders for flat {} not all cancelled: {}", position.key(), e.getMessage());
            return false;
        }
        return takeProfitReleased;
    }
}
