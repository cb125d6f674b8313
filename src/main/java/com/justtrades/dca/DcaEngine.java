package com.justtrades.dca;

import com.justtrades.domain.enums.ExitState;
import com.justtrades.domain.enums.OrderPurpose;
import com.justtrades.domain.model.DcaConfig;
import com.justtrades.domain.model.DcaRung;
import com.justtrades.domain.model.OrderIntent;
import com.justtrades.domain.model.Position;
import com.justtrades.exception.BaseException;
import com.justtrades.ledger.PositionLedger;
import com.justtrades.oms.OrderTracker;
import com.justtrades.oms.OrderRouter;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Scale-in engine. Evaluated on every tick for the open position, inside its
 * event loop.
 *
 * <p>Rules:
 * <ul>
 *   <li>Rungs are walked in index order and at most one fires per tick.</li>
 *   <li>A rung fires only if the resulting size, counting scale-ins still in
 *       flight, stays within {@code maxQuantity}.</li>
 *   <li>The rung index is persisted before the order goes out. A rejected or
 *       lost order does not un-fire it; the rejection is surfaced instead.</li>
 *   <li>Firing cancels the resting take-profit. The replacement is placed at
 *       the new average once the scale-in fill has been applied.</li>
 * </ul>
 */
@Service
public class DcaEngine {

    private static final Logger log = LoggerFactory.getLogger(DcaEngine.class);

    private final PositionLedger positionLedger;
    private final OrderRouter orderRouter;
    private final OrderTracker orderTracker;
    private final DcaTriggerCalculator triggerCalculator;
    private final ProtectiveOrderManager protectiveOrderManager;
    private final Clock clock;

    public DcaEngine(
            PositionLedger positionLedger,
            OrderRouter orderRouter,
            OrderTracker orderTracker,
            DcaTriggerCalculator triggerCalculator,
            ProtectiveOrderManager protectiveOrderManager,
            Clock clock) {
        this.positionLedger = positionLedger;
        this.orderRouter = orderRouter;
        this.orderTracker = orderTracker;
        this.triggerCalculator = triggerCalculator;
        this.protectiveOrderManager = protectiveOrderManager;
        this.clock = clock;
    }

    /**
     * Fires at most one eligible rung for {@code lastPrice}.
     *
     * @return the fired rung index, empty if none fired
     */
    public Optional<Integer> evaluate(Position position, BigDecimal lastPrice) {
        DcaConfig config = position.getDcaConfig();
        if (config == null || !config.hasRungs() || position.isFlat() || lastPrice == null
                || position.getExitState() != ExitState.IDLE || position.isBlocked()) {
            return Optional.empty();
        }

        List<DcaRung> rungs = config.getRungs();
        for (int index = 0; index < rungs.size(); index++) {
            if (position.getDcaTriggeredIndices().contains(index)) {
                continue;
            }
            DcaRung rung = rungs.get(index);
            Optional<BigDecimal> trigger = triggerCalculator.triggerPrice(position, config.getMode(), rung);
            if (trigger.isEmpty() || !triggerCalculator.reached(position, trigger.get(), lastPrice)) {
                continue;
            }
            if (!withinMaxQuantity(position, config, rung)) {
                log.debug("Rung {} for {} would exceed max quantity {}", index, position.key(),
                        config.getMaxQuantity());
                continue;
            }
            fire(position, index, rung, trigger.get(), lastPrice);
            return Optional.of(index);
        }
        return Optional.empty();
    }

    /** Called after a scale-in fill has been applied to the ledger. */
    public void onScaleInFilled(Position position) {
        protectiveOrderManager.replaceTakeProfit(position);
    }

    /** Called after an opening or adding entry fill; rests the initial take-profit. */
    public void onEntryFilled(Position position) {
        protectiveOrderManager.replaceTakeProfit(position);
    }

    /**
     * Cancels whatever still rests for a position that is now flat and clears
     * its DCA bookkeeping.
     *
     * @return false if a resting order could not be cancelled
     */
    public boolean resetForFlat(Position position) {
        boolean released = protectiveOrderManager.releaseForFlat(position);
        if (!position.getDcaTriggeredIndices().isEmpty() || position.getBreakEvenStopPrice() != null) {
            position.getDcaTriggeredIndices().clear();
            position.setBreakEvenStopPrice(null);
            positionLedger.save(position);
        }
        return released;
    }

    private boolean withinMaxQuantity(Position position, DcaConfig config, DcaRung rung) {
        if (config.getMaxQuantity() <= 0) {
            return true;
        }
        int projected = position.absQuantity() + orderTracker.pendingEntryQuantity(position.key()) + rung.getQuantity();
        return projected <= config.getMaxQuantity();
    }

    private void fire(Position position, int index, DcaRung rung, BigDecimal trigger, BigDecimal lastPrice) {
        position.getDcaTriggeredIndices().add(index);
        position.recordEvent("DCA rung " + index + " fired at " + lastPrice + " (trigger " + trigger + ")",
                clock.instant());
        positionLedger.save(position);
        log.info("DCA rung {} fired for {}: last={} trigger={} qty={}", index, position.key(), lastPrice, trigger,
                rung.getQuantity());

        OrderIntent intent = OrderIntent.market(
                position.key(), position.getSide().entrySide(), rung.getQuantity(), OrderPurpose.DCA_ENTRY);
        try {
            orderRouter.place(intent, index);
        } catch (BaseException e) {
            log.warn("DCA rung {} for {} stays fired after failed order: {}", index, position.key(), e.getMessage());
        }
        protectiveOrderManager.cancelTakeProfit(position);
    }
}
