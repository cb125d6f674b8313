package com.justtrades.simulator;

import com.justtrades.broker.BrokerEventListener;
import com.justtrades.broker.BrokerGateway;
import com.justtrades.domain.enums.OrderSide;
import com.justtrades.domain.enums.OrderType;
import com.justtrades.domain.model.BrokerFill;
import com.justtrades.domain.model.BrokerPosition;
import com.justtrades.domain.model.OrderIntent;
import com.justtrades.domain.model.PositionKey;
import com.justtrades.event.TickEvent;
import com.justtrades.exception.OrderNotFoundException;
import com.justtrades.exception.OrderRejectedException;
import com.justtrades.marketdata.PriceFeedAdapter;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Paper-trading broker. Active when {@code justtrades.engine.broker-mode=PAPER} (the default).
 *
 * <p>Fill logic:
 * <ul>
 *   <li>MARKET: fills immediately at the last traded price; rejected if no price has been seen</li>
 *   <li>LIMIT BUY: rests until last price &lt;= limit, fills at the limit</li>
 *   <li>LIMIT SELL: rests until last price &gt;= limit, fills at the limit</li>
 * </ul>
 *
 * <p>Each fill is pushed to subscribers as {@code onFill} followed by
 * {@code onPositionSnapshot}, after the internal lock is released, so a
 * listener may call back into the gateway.
 */
@Component
@ConditionalOnProperty(name = "justtrades.engine.broker-mode", havingValue = "PAPER", matchIfMissing = true)
public class SimulatorBrokerGateway implements BrokerGateway {

    private static final Logger log = LoggerFactory.getLogger(SimulatorBrokerGateway.class);

    private final PriceFeedAdapter priceFeedAdapter;
    private final Clock clock;
    private final List<BrokerEventListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong orderSequence = new AtomicLong();
    private final AtomicLong fillSequence = new AtomicLong();

    private final Object lock = new Object();
    private final Map<String, RestingOrder> restingOrders = new LinkedHashMap<>();
    private final Map<PositionKey, SimPosition> positions = new HashMap<>();
    private final Map<PositionKey, List<BrokerFill>> fillHistory = new HashMap<>();

    public SimulatorBrokerGateway(PriceFeedAdapter priceFeedAdapter, Clock clock) {
        this.priceFeedAdapter = priceFeedAdapter;
        this.clock = clock;
    }

    @Override
    public String placeOrder(OrderIntent intent) {
        PositionKey key = intent.key();
        String orderId = "SIM-" + orderSequence.incrementAndGet();
        List<Runnable> notifications = new ArrayList<>();

        synchronized (lock) {
            if (intent.getType() == OrderType.MARKET) {
                BigDecimal price = priceFeedAdapter
                        .lastPrice(key.symbol())
                        .orElseThrow(() -> new OrderRejectedException(
                                key.symbol(), intent.getPurpose(), "no market price for " + key.symbol()));
                notifications.addAll(fill(key, orderId, intent.getSide(), intent.getQuantity(), price));
            } else {
                restingOrders.put(orderId, new RestingOrder(orderId, key, intent.getSide(), intent.getQuantity(),
                        intent.getLimitPrice()));
            }
        }

        log.info("Paper order {} {} {} {} x{} {}", orderId, intent.getPurpose(), intent.getType(), intent.getSide(),
                intent.getQuantity(), key);
        notifications.forEach(Runnable::run);
        return orderId;
    }

    @Override
    public void cancelOrder(String accountId, String orderId) {
        synchronized (lock) {
            RestingOrder removed = restingOrders.remove(orderId);
            if (removed == null || !removed.key().accountId().equals(accountId)) {
                if (removed != null) {
                    restingOrders.put(orderId, removed);
                }
                throw new OrderNotFoundException(orderId);
            }
        }
        log.info("Paper order {} cancelled", orderId);
    }

    @Override
    public BrokerPosition queryPosition(String accountId, String symbol) {
        synchronized (lock) {
            SimPosition position = positions.get(PositionKey.of(accountId, symbol));
            return position == null ? BrokerPosition.flat() : BrokerPosition.of(position.quantity, position.average);
        }
    }

    @Override
    public List<String> queryOrders(String accountId, String symbol) {
        PositionKey key = PositionKey.of(accountId, symbol);
        synchronized (lock) {
            return restingOrders.values().stream()
                    .filter(o -> o.key().equals(key))
                    .map(RestingOrder::orderId)
                    .toList();
        }
    }

    @Override
    public List<BrokerFill> queryFills(String accountId, String symbol) {
        synchronized (lock) {
            return List.copyOf(fillHistory.getOrDefault(PositionKey.of(accountId, symbol), List.of()));
        }
    }

    @Override
    public void subscribe(BrokerEventListener listener) {
        listeners.add(listener);
    }

    /** Matches resting limit orders against each accepted tick. */
    @EventListener
    @Order(5)
    public void onTick(TickEvent event) {
        List<Runnable> notifications = new ArrayList<>();
        synchronized (lock) {
            Iterator<RestingOrder> it = restingOrders.values().iterator();
            while (it.hasNext()) {
                RestingOrder order = it.next();
                if (!order.key().symbol().equals(event.getSymbol()) || !order.crossedBy(event.getLastPrice())) {
                    continue;
                }
                it.remove();
                notifications.addAll(fill(order.key(), order.orderId(), order.side(), order.quantity(),
                        order.limitPrice()));
                log.info("Paper limit {} {} x{} filled at {}", order.orderId(), order.side(), order.quantity(),
                        order.limitPrice());
            }
        }
        notifications.forEach(Runnable::run);
    }

    /**
     * Moves the paper account by an out-of-band trade, as if placed from another
     * terminal. Only a snapshot is pushed; the fill is visible through {@link #queryFills}.
     */
    public void applyExternalFill(String accountId, String symbol, OrderSide side, int quantity, BigDecimal price) {
        PositionKey key = PositionKey.of(accountId, symbol);
        int quantityAfter;
        synchronized (lock) {
            fill(key, "EXT-" + orderSequence.incrementAndGet(), side, quantity, price);
            quantityAfter = positions.get(key).quantity;
        }
        listeners.forEach(l -> l.onPositionSnapshot(accountId, symbol, quantityAfter));
    }

    // ========================
    // INTERNALS
    // ========================

    /** Must hold {@link #lock}. Returns the push notifications to deliver after release. */
    private List<Runnable> fill(PositionKey key, String orderId, OrderSide side, int quantity, BigDecimal price) {
        BrokerFill brokerFill = new BrokerFill(
                "SIMF-" + fillSequence.incrementAndGet(), orderId, side, quantity, price, clock.instant());
        fillHistory.computeIfAbsent(key, k -> new ArrayList<>()).add(brokerFill);

        SimPosition position = positions.computeIfAbsent(key, k -> new SimPosition());
        position.apply(side.sign() * quantity, price);
        int quantityAfter = position.quantity;

        List<Runnable> notifications = new ArrayList<>();
        for (BrokerEventListener listener : listeners) {
            notifications.add(() -> {
                listener.onFill(key.accountId(), key.symbol(), brokerFill);
                listener.onPositionSnapshot(key.accountId(), key.symbol(), quantityAfter);
            });
        }
        return notifications;
    }

    private record RestingOrder(
            String orderId, PositionKey key, OrderSide side, int quantity, BigDecimal limitPrice) {

        boolean crossedBy(BigDecimal lastPrice) {
            int cmp = lastPrice.compareTo(limitPrice);
            return side == OrderSide.BUY ? cmp <= 0 : cmp >= 0;
        }
    }

    private static final class SimPosition {
        private int quantity;
        private BigDecimal average;

        void apply(int delta, BigDecimal price) {
            int next = quantity + delta;
            if (quantity == 0 || Integer.signum(next) != Integer.signum(quantity)) {
                average = next == 0 ? null : price;
            } else if (Math.abs(next) > Math.abs(quantity)) {
                average = average.multiply(BigDecimal.valueOf(Math.abs(quantity)))
                        .add(price.multiply(BigDecimal.valueOf(Math.abs(delta))))
                        .divide(BigDecimal.valueOf(Math.abs(next)), 6, RoundingMode.HALF_UP);
            }
            quantity = next;
        }
    }
}
