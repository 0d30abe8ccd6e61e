package com.ryuqq.lifecycle.core.spi;

import com.ryuqq.lifecycle.core.model.StateChange;

import java.util.List;

/**
 * Append-only audit log SPI for realized transitions.
 *
 * <p>{@link #append} is only ever called from inside the executor's atomic unit, so an entry is
 * persisted if and only if the transition it describes commits.</p>
 *
 * <p>Owner types that do not opt in to recording are served by
 * {@link com.ryuqq.lifecycle.core.spi.noop.NoOpStateChangeRecorder}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface StateChangeRecorder {

    /**
     * Appends an entry for a realized transition.
     *
     * @param unit the unit of the transition
     * @param record the record that transitioned
     * @param change the entry to append
     * @throws IllegalArgumentException if any argument is null
     */
    void append(AtomicUnit unit, StatefulRecord record, StateChange change);

    /**
     * Returns the committed history of a record, oldest first.
     *
     * @param record the record
     * @return the record's entries (may be empty)
     */
    List<StateChange> historyOf(StatefulRecord record);

    /**
     * Returns whether any entry exists for the record.
     *
     * @param record the record
     * @return true if at least one entry exists
     */
    default boolean hasHistory(StatefulRecord record) {
        return !historyOf(record).isEmpty();
    }
}
