package com.justtrades.event;

import com.justtrades.domain.model.Fill;
import com.justtrades.domain.model.Position;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the position ledger after every applied fill or rebuild
 * (the "positionChanged" signal).
 *
 * <p>Listeners run synchronously on the position's event loop thread and
 * must not block. The position is a snapshot; mutating it has no effect.
 */
public class PositionEvent extends ApplicationEvent {

    private final Position position;
    private final PositionEventType eventType;
    private final Fill fill;

    /**
     * @param source    the component publishing this event
     * @param position  snapshot after the change
     * @param eventType what kind of change occurred
     * @param fill      the fill that caused it, null for rebuilds
     */
    public PositionEvent(Object source, Position position, PositionEventType eventType, Fill fill) {
        super(source);
        this.position = position;
        this.eventType = eventType;
        this.fill = fill;
    }

    public Position getPosition() {
        return position;
    }

    public PositionEventType getEventType() {
        return eventType;
    }

    public Fill getFill() {
        return fill;
    }
}
