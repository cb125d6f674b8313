package com.justtrades.broker;

import com.justtrades.domain.model.BrokerFill;

/**
 * Consumer of broker push events. Called from the gateway's I/O thread;
 * implementations must hand events off rather than process them inline.
 */
public interface BrokerEventListener {

    void onFill(String accountId, String symbol, BrokerFill fill);

    void onPositionSnapshot(String accountId, String symbol, int quantity);

    void onOrderRejected(String accountId, String orderId, String reason);
}
