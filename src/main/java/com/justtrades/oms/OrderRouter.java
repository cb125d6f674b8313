package com.justtrades.oms;

import com.justtrades.broker.BrokerGateway;
import com.justtrades.domain.enums.OrderPurpose;
import com.justtrades.domain.enums.OrderType;
import com.justtrades.domain.model.OrderIntent;
import com.justtrades.domain.model.Position;
import com.justtrades.domain.model.PositionKey;
import com.justtrades.domain.model.TrackedOrder;
import com.justtrades.event.EventPublisherHelper;
import com.justtrades.event.RiskEventType;
import com.justtrades.event.RiskLevel;
import com.justtrades.exception.BrokerException;
import com.justtrades.exception.OrderNotFoundException;
import com.justtrades.exception.OrderRejectedException;
import com.justtrades.exception.PositionHaltedException;
import com.justtrades.ledger.PositionLedger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Single path from the engine to {@link BrokerGateway#placeOrder} and
 * {@link BrokerGateway#cancelOrder} for normal (non-emergency) flow.
 *
 * <p>Pipeline for placement:
 * <ol>
 *   <li>Halt check: a halted or attention-flagged position accepts no automated
 *       orders except the market exit of an exit already in flight</li>
 *   <li>Broker call (single-shot, see {@code BrokerCallPolicy})</li>
 *   <li>Track the order and publish {@code OrderEvent(PLACED)}</li>
 * </ol>
 * A rejection is recorded against the position, published and rethrown; it is
 * never retried here.
 *
 * <p>Called only from the position's event loop.
 */
@Service
public class OrderRouter {

    private static final Logger log = LoggerFactory.getLogger(OrderRouter.class);

    private final BrokerGateway brokerGateway;
    private final OrderTracker orderTracker;
    private final PositionLedger positionLedger;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    public OrderRouter(
            BrokerGateway brokerGateway,
            OrderTracker orderTracker,
            PositionLedger positionLedger,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.brokerGateway = brokerGateway;
        this.orderTracker = orderTracker;
        this.positionLedger = positionLedger;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    public TrackedOrder place(OrderIntent intent) {
        return place(intent, null);
    }

    /**
     * Places {@code intent} and starts tracking it.
     *
     * @param rungIndex DCA rung for DCA_ENTRY orders, null otherwise
     * @throws PositionHaltedException if automation is blocked on the position
     * @throws OrderRejectedException if the broker refuses the order
     * @throws BrokerException if the outcome is unknown (transport failure)
     */
    public TrackedOrder place(OrderIntent intent, Integer rungIndex) {
        PositionKey key = intent.key();
        Position position = positionLedger.currentPosition(key);
        if (position.isBlocked() && !intent.isEmergency() && intent.getPurpose() != OrderPurpose.EXIT) {
            throw new PositionHaltedException(key, position.getAttentionReason());
        }

        String orderId;
        try {
            orderId = brokerGateway.placeOrder(intent);
        } catch (OrderRejectedException e) {
            recordRejection(position, TrackedOrder.from(null, intent, rungIndex, clock.instant()), e.getReason());
            throw e;
        } catch (BrokerException e) {
            log.error("Order outcome unknown for {} {} {} x{}: {}", key, intent.getPurpose(), intent.getSide(),
                    intent.getQuantity(), e.getMessage());
            eventPublisherHelper.publishRisk(this, key, RiskEventType.ORDER_REJECTED, RiskLevel.WARNING,
                    "Order outcome unknown: " + e.getMessage(),
                    Map.of("purpose", intent.getPurpose().name()));
            throw e;
        }

        TrackedOrder order = TrackedOrder.from(orderId, intent, rungIndex, clock.instant());
        orderTracker.track(order);
        log.info("Placed {} {} {} x{} for {} -> {}", intent.getPurpose(), intent.getType(), intent.getSide(),
                intent.getQuantity(), key, orderId);
        eventPublisherHelper.publishOrderPlaced(this, order);
        return order;
    }

    /**
     * Cancels one order. An order the broker no longer knows (already filled or
     * cancelled) is not an error here.
     *
     * @return true if the broker confirmed the cancel
     */
    public boolean cancel(PositionKey key, String orderId) {
        try {
            brokerGateway.cancelOrder(key.accountId(), orderId);
        } catch (OrderNotFoundException e) {
            log.debug("Cancel of {} for {}: broker does not know the order", orderId, key);
            orderTracker.remove(orderId);
            return false;
        }
        orderTracker.remove(orderId).ifPresent(order -> eventPublisherHelper.publishOrderCancelled(this, order));
        log.info("Cancelled order {} for {}", orderId, key);
        return true;
    }

    /**
     * Cancels every resting order for the position: those tracked here plus any
     * the broker still lists as working. Attempts all of them before reporting.
     *
     * @throws BrokerException if any cancel failed for a reason other than not-found
     */
    public int cancelAllResting(PositionKey key) {
        Set<String> orderIds = new LinkedHashSet<>();
        orderTracker.openOrders(key).stream()
                .filter(o -> o.getType() != OrderType.MARKET)
                .map(TrackedOrder::getOrderId)
                .forEach(orderIds::add);
        orderIds.addAll(brokerGateway.queryOrders(key.accountId(), key.symbol()));

        int cancelled = 0;
        List<String> failed = new ArrayList<>();
        for (String orderId : orderIds) {
            try {
                if (cancel(key, orderId)) {
                    cancelled++;
                }
            } catch (BrokerException e) {
                log.warn("Cancel of {} for {} failed: {}", orderId, key, e.getMessage());
                failed.add(orderId);
            }
        }
        if (!failed.isEmpty()) {
            throw new BrokerException("Could not cancel resting orders " + failed + " for " + key);
        }
        return cancelled;
    }

    private void recordRejection(Position position, TrackedOrder order, String reason) {
        position.recordEvent("REJECTED " + order.getPurpose() + " " + order.getSide() + " " + order.getQuantity()
                + ": " + reason, clock.instant());
        positionLedger.save(position);
        log.warn("Broker rejected {} {} x{} for {}: {}", order.getPurpose(), order.getSide(), order.getQuantity(),
                position.key(), reason);
        eventPublisherHelper.publishOrderRejected(this, order, reason);
        eventPublisherHelper.publishRisk(this, position.key(), RiskEventType.ORDER_REJECTED, RiskLevel.WARNING,
                reason, Map.of("purpose", order.getPurpose().name(), "quantity", order.getQuantity()));
    }
}
