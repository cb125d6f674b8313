package com.justtrades.oms;

import com.justtrades.domain.enums.FillRole;
import com.justtrades.domain.enums.OrderPurpose;
import com.justtrades.domain.enums.OrderSide;
import com.justtrades.domain.enums.OrderType;
import com.justtrades.domain.model.Position;
import com.justtrades.domain.model.PositionKey;
import com.justtrades.domain.model.TrackedOrder;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Orders this engine has placed and not yet seen complete.
 *
 * <p>Written from the position event loop; read by the kill switch and status
 * queries from other threads, hence the concurrent map. An order leaves the
 * tracker when fully filled, cancelled or rejected.
 */
@Component
public class OrderTracker {

    private final Map<String, TrackedOrder> orders = new ConcurrentHashMap<>();

    public void track(TrackedOrder order) {
        orders.put(order.getOrderId(), order);
    }

    public Optional<TrackedOrder> find(String orderId) {
        return Optional.ofNullable(orderId).map(orders::get);
    }

    public Optional<TrackedOrder> remove(String orderId) {
        return Optional.ofNullable(orderId).map(orders::remove);
    }

    /**
     * Adds {@code quantity} to the order's filled amount. A completed order is
     * dropped from the tracker but still returned.
     */
    public Optional<TrackedOrder> recordFill(String orderId, int quantity) {
        TrackedOrder order = orderId == null ? null : orders.get(orderId);
        if (order == null) {
            return Optional.empty();
        }
        order.setFilledQuantity(order.getFilledQuantity() + quantity);
        if (order.isComplete()) {
            orders.remove(orderId);
        }
        return Optional.of(order);
    }

    public List<TrackedOrder> openOrders(PositionKey key) {
        return orders.values().stream().filter(o -> o.getKey().equals(key)).toList();
    }

    public boolean hasInFlightMarketOrders(PositionKey key) {
        return orders.values().stream()
                .anyMatch(o -> o.getKey().equals(key) && o.getType() == OrderType.MARKET);
    }

    /** Unfilled quantity of entry and scale-in orders still working for {@code key}. */
    public int pendingEntryQuantity(PositionKey key) {
        return orders.values().stream()
                .filter(o -> o.getKey().equals(key))
                .filter(o -> o.getPurpose() == OrderPurpose.ENTRY || o.getPurpose() == OrderPurpose.DCA_ENTRY)
                .mapToInt(TrackedOrder::remainingQuantity)
                .sum();
    }

    /**
     * Ledger role of a fill for {@code orderId}. Untracked orders (placed
     * elsewhere, or before a restart) are classified by whether the fill reduces
     * the position.
     */
    public FillRole roleFor(String orderId, Position position, OrderSide side) {
        Optional<TrackedOrder> tracked = find(orderId);
        if (tracked.isPresent()) {
            return switch (tracked.get().getPurpose()) {
                case ENTRY -> FillRole.ENTRY;
                case DCA_ENTRY -> FillRole.DCA;
                case TAKE_PROFIT, STOP_LOSS, EXIT -> FillRole.EXIT;
            };
        }
        boolean reducing = !position.isFlat() && side.sign() != Integer.signum(position.getQuantity());
        return reducing ? FillRole.EXIT : FillRole.ENTRY;
    }
}
