package com.ryuqq.lifecycle.testkit.fixture;

import com.ryuqq.lifecycle.core.model.RecordId;
import com.ryuqq.lifecycle.core.model.StateName;
import com.ryuqq.lifecycle.core.spi.StatefulRecord;

/**
 * Fixture record whose machine computes its initial state and keeps no history.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class Bicycle implements StatefulRecord {

    private final RecordId recordId;
    private final boolean docked;
    private final CallbackTrace trace = new CallbackTrace();
    private StateName state;

    public Bicycle(String id, boolean docked) {
        this.recordId = RecordId.of(id);
        this.docked = docked;
    }

    @Override
    public RecordId recordId() {
        return recordId;
    }

    @Override
    public StateName currentState() {
        return state;
    }

    @Override
    public void assignState(StateName state) {
        this.state = state;
    }

    public boolean isDocked() {
        return docked;
    }

    public CallbackTrace trace() {
        return trace;
    }
}
