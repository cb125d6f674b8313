package com.justtrades.event;

import com.justtrades.domain.enums.ExitReason;
import com.justtrades.domain.enums.ExitState;
import com.justtrades.domain.model.DriftRecord;
import com.justtrades.domain.model.Fill;
import com.justtrades.domain.model.Position;
import com.justtrades.domain.model.PositionKey;
import com.justtrades.domain.model.TrackedOrder;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods over Spring's {@link ApplicationEventPublisher} for
 * every engine event.
 *
 * <p>Delivery is synchronous unless a listener is {@code @Async}. Events
 * published from the position event loop therefore reach synchronous listeners
 * on that loop's thread, in publication order.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Market data ----

    public void publishTick(Object source, String symbol, BigDecimal lastPrice) {
        applicationEventPublisher.publishEvent(new TickEvent(source, symbol, lastPrice, Instant.now()));
    }

    // ---- Position ----

    public void publishPositionChanged(Object source, Position position, PositionEventType type, Fill fill) {
        applicationEventPublisher.publishEvent(new PositionEvent(source, position.snapshot(), type, fill));
    }

    public void publishExitTransition(
            Object source, PositionKey key, ExitState from, ExitState to, ExitReason reason, String detail) {
        applicationEventPublisher.publishEvent(new ExitStateEvent(source, key, from, to, reason, detail));
    }

    // ---- Orders ----

    public void publishOrderPlaced(Object source, TrackedOrder order) {
        applicationEventPublisher.publishEvent(new OrderEvent(source, order, OrderEventType.PLACED, null));
    }

    public void publishOrderFilled(Object source, TrackedOrder order) {
        applicationEventPublisher.publishEvent(new OrderEvent(source, order, OrderEventType.FILLED, null));
    }

    public void publishOrderCancelled(Object source, TrackedOrder order) {
        applicationEventPublisher.publishEvent(new OrderEvent(source, order, OrderEventType.CANCELLED, null));
    }

    public void publishOrderRejected(Object source, TrackedOrder order, String reason) {
        applicationEventPublisher.publishEvent(new OrderEvent(source, order, OrderEventType.REJECTED, reason));
    }

    // ---- Drift ----

    public void publishDrift(Object source, DriftRecord record) {
        applicationEventPublisher.publishEvent(new DriftEvent(source, record));
    }

    // ---- Risk ----

    public void publishRisk(Object source, PositionKey key, RiskEventType type, RiskLevel level, String message) {
        applicationEventPublisher.publishEvent(new RiskEvent(source, key, type, level, message, null));
    }

    public void publishRisk(
            Object source,
            PositionKey key,
            RiskEventType type,
            RiskLevel level,
            String message,
            Map<String, Object> details) {
        applicationEventPublisher.publishEvent(new RiskEvent(source, key, type, level, message, details));
    }
}
