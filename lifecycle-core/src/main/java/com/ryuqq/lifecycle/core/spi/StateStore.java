package com.ryuqq.lifecycle.core.spi;

import com.ryuqq.lifecycle.core.exception.ConcurrentTransitionConflictException;
import com.ryuqq.lifecycle.core.model.StateName;

/**
 * Storage SPI for the current state of stateful records.
 *
 * <p>The engine consumes a record's current-state value and emits desired next-state values;
 * this interface is the boundary through which those values reach durable storage.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Opening atomic units of work</li>
 *   <li>Creating records that already carry their initial state</li>
 *   <li>Reading the persisted current state</li>
 *   <li>Conditional (compare-and-swap) state writes</li>
 *   <li>Counting records per state</li>
 * </ul>
 *
 * <p><strong>Conditional Write Contract:</strong></p>
 * <pre>
 * UPDATE records SET state = :to
 *  WHERE id = :id AND state = :expected;
 * -- 0 rows updated → ConcurrentTransitionConflictException
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: concurrent calls on different records must not block each other</li>
 *   <li>At most one of several concurrent writes with the same expected state may succeed</li>
 *   <li>Every write performed through a unit is undone when that unit rolls back</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface StateStore {

    /**
     * Opens a new atomic unit of work.
     *
     * @return an active unit, to be used with try-with-resources
     */
    AtomicUnit begin();

    /**
     * Durably creates a record.
     *
     * <p>The record's current state must already be assigned, so the first write carries a valid
     * state.</p>
     *
     * @param unit the unit the creation belongs to
     * @param record the record to create
     * @throws IllegalArgumentException if unit or record is null, or the record carries no state
     * @throws IllegalStateException if a record with the same type and id already exists
     */
    void insert(AtomicUnit unit, StatefulRecord record);

    /**
     * Reads the persisted current state of a record.
     *
     * @param record the record
     * @return the persisted state
     * @throws IllegalArgumentException if record is null
     * @throws IllegalStateException if the record has not been created
     */
    StateName readCurrentState(StatefulRecord record);

    /**
     * Writes {@code next} as the record's state only if the persisted state equals {@code expected}.
     *
     * @param unit the unit the write belongs to
     * @param record the record
     * @param expected the state observed when the transition was selected
     * @param next the new state
     * @throws IllegalArgumentException if any argument is null
     * @throws ConcurrentTransitionConflictException if the persisted state differs from expected,
     *         or the record does not exist
     */
    void compareAndSetState(AtomicUnit unit, StatefulRecord record, StateName expected, StateName next);

    /**
     * Counts records of the given type (including subtypes) currently in a state.
     *
     * @param ownerType the record type
     * @param state the state
     * @return number of records in that state
     * @throws IllegalArgumentException if ownerType or state is null
     */
    long countInState(Class<?> ownerType, StateName state);
}
