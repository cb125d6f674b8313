package com.justtrades.broker;

import com.justtrades.domain.model.BrokerFill;
import com.justtrades.domain.model.BrokerPosition;
import com.justtrades.domain.model.OrderIntent;
import com.justtrades.exception.BrokerException;
import com.justtrades.exception.OrderNotFoundException;
import com.justtrades.exception.OrderRejectedException;
import java.util.List;

/**
 * Broker capability consumed by the execution engine.
 *
 * <p>Implementations:
 * <ul>
 *   <li>{@code TradovateBrokerGateway} - live/demo Tradovate REST, selected by {@code justtrades.engine.broker-mode=LIVE}</li>
 *   <li>{@code SimulatorBrokerGateway} - in-process paper trading, the default</li>
 * </ul>
 *
 * <p>Order-placing calls are single-shot: an implementation must never resubmit
 * an order on its own. Queries may be retried. All methods may block on network I/O
 * and are called from many threads; per-token rate limiting is the implementation's job.
 */
public interface BrokerGateway {

    /**
     * Places an order.
     *
     * @return the broker order id
     * @throws OrderRejectedException if the broker refused the order
     * @throws BrokerException        if the outcome is unknown (transport failure)
     */
    String placeOrder(OrderIntent intent);

    /**
     * Cancels a working order.
     *
     * @throws OrderNotFoundException if the broker no longer knows the order (filled, cancelled or never existed)
     */
    void cancelOrder(String accountId, String orderId);

    /** Fresh broker-side position for one symbol. Never served from a cache. */
    BrokerPosition queryPosition(String accountId, String symbol);

    /** Ids of working (cancellable) orders for one symbol. */
    List<String> queryOrders(String accountId, String symbol);

    /**
     * Broker fill history for one symbol, oldest first. May be empty when the broker
     * does not expose history for the session.
     */
    List<BrokerFill> queryFills(String accountId, String symbol);

    /** Registers the consumer of the broker push stream. */
    void subscribe(BrokerEventListener listener);
}
