package com.justtrades.event;

import com.justtrades.domain.model.PositionKey;
import java.util.HashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published when the engine hits a condition an operator should know about:
 * rejections, timeouts, kill-switch activations and fatal halts.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>PositionAuditService - records the condition against the position</li>
 *   <li>EngineMetricsService - counts by type and level</li>
 * </ul>
 */
public class RiskEvent extends ApplicationEvent {

    private final PositionKey key;
    private final RiskEventType eventType;
    private final RiskLevel level;
    private final String message;
    private final Map<String, Object> details;

    public RiskEvent(
            Object source,
            PositionKey key,
            RiskEventType eventType,
            RiskLevel level,
            String message,
            Map<String, Object> details) {
        super(source);
        this.key = key;
        this.eventType = eventType;
        this.level = level;
        this.message = message;
        this.details = details != null ? new HashMap<>(details) : new HashMap<>();
    }

    public PositionKey getKey() {
        return key;
    }

    public RiskEventType getEventType() {
        return eventType;
    }

    public RiskLevel getLevel() {
        return level;
    }

    public String getMessage() {
        return message;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
