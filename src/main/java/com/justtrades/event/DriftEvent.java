package com.justtrades.event;

import com.justtrades.domain.model.DriftRecord;
import org.springframework.context.ApplicationEvent;

/**
 * Published after the drift reconciler records (and corrects) a divergence
 * between the virtual and broker positions.
 */
public class DriftEvent extends ApplicationEvent {

    private final DriftRecord record;

    public DriftEvent(Object source, DriftRecord record) {
        super(source);
        this.record = record;
    }

    public DriftRecord getRecord() {
        return record;
    }
}
