package com.justtrades.event;

import com.justtrades.domain.model.TrackedOrder;
import org.springframework.context.ApplicationEvent;

/**
 * Published when an engine-placed order is placed, filled, cancelled or rejected.
 */
public class OrderEvent extends ApplicationEvent {

    private final TrackedOrder order;
    private final OrderEventType eventType;
    private final String reason;

    public OrderEvent(Object source, TrackedOrder order, OrderEventType eventType, String reason) {
        super(source);
        this.order = order;
        this.eventType = eventType;
        this.reason = reason;
    }

    public TrackedOrder getOrder() {
        return order;
    }

    public OrderEventType getEventType() {
        return eventType;
    }

    /** Broker reason for REJECTED, otherwise null. */
    public String getReason() {
        return reason;
    }
}
