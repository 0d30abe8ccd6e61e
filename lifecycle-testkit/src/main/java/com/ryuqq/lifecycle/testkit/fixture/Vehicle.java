package com.ryuqq.lifecycle.testkit.fixture;

import com.ryuqq.lifecycle.core.model.RecordId;
import com.ryuqq.lifecycle.core.model.StateName;
import com.ryuqq.lifecycle.core.spi.StatefulRecord;

/**
 * Fixture record: a vehicle moving between parked, idling, gears and stalled.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class Vehicle implements StatefulRecord {

    private final RecordId recordId;
    private final CallbackTrace trace = new CallbackTrace();
    private StateName state;
    private boolean autoShopOpen;
    private boolean insured = true;

    public Vehicle(String id) {
        this.recordId = RecordId.of(id);
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

    public CallbackTrace trace() {
        return trace;
    }

    public boolean isAutoShopOpen() {
        return autoShopOpen;
    }

    public void setAutoShopOpen(boolean autoShopOpen) {
        this.autoShopOpen = autoShopOpen;
    }

    public boolean isInsured() {
        return insured;
    }

    public void setInsured(boolean insured) {
        this.insured = insured;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + recordId.getValue() + ", state=" + state + '}';
    }
}
