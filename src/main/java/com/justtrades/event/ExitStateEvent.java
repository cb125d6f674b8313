package com.justtrades.event;

import com.justtrades.domain.enums.ExitReason;
import com.justtrades.domain.enums.ExitState;
import com.justtrades.domain.model.PositionKey;
import org.springframework.context.ApplicationEvent;

/**
 * Published on every exit state transition, including kill-switch resets.
 */
public class ExitStateEvent extends ApplicationEvent {

    private final PositionKey key;
    private final ExitState from;
    private final ExitState to;
    private final ExitReason reason;
    private final String detail;

    public ExitStateEvent(
            Object source, PositionKey key, ExitState from, ExitState to, ExitReason reason, String detail) {
        super(source);
        this.key = key;
        this.from = from;
        this.to = to;
        this.reason = reason;
        this.detail = detail;
    }

    public PositionKey getKey() {
        return key;
    }

    public ExitState getFrom() {
        return from;
    }

    public ExitState getTo() {
        return to;
    }

    public ExitReason getReason() {
        return reason;
    }

    public String getDetail() {
        return detail;
    }
}
