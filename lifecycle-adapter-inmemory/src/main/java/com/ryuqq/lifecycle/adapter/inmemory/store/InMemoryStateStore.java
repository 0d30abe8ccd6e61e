package com.ryuqq.lifecycle.adapter.inmemory.store;

import com.ryuqq.lifecycle.core.exception.ConcurrentTransitionConflictException;
import com.ryuqq.lifecycle.core.model.RecordId;
import com.ryuqq.lifecycle.core.model.StateName;
import com.ryuqq.lifecycle.core.spi.AtomicUnit;
import com.ryuqq.lifecycle.core.spi.StateStore;
import com.ryuqq.lifecycle.core.spi.StatefulRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link StateStore} SPI for testing and reference purposes.
 *
 * <p>Persisted state values are kept in a {@link ConcurrentHashMap} keyed by
 * {@code (record type, record id)}. The conditional write maps directly onto
 * {@link ConcurrentHashMap#replace(Object, Object, Object)}, which gives the same
 * compare-and-swap guarantee a {@code WHERE state = ?} update gives in a database.</p>
 *
 * <p><strong>Atomic Units:</strong></p>
 * <ul>
 *   <li>{@link #begin()} returns an {@link InMemoryAtomicUnit}</li>
 *   <li>Writes are applied immediately and journal an undo action on the unit</li>
 *   <li>Rollback replays the journal in reverse order</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>No isolation: other threads observe writes before commit</li>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryStateStore store = new InMemoryStateStore();
 * try (AtomicUnit unit = store.begin()) {
 *     store.insert(unit, car);
 *     store.compareAndSetState(unit, car, StateName.of("parked"), StateName.of("idling"));
 *     unit.commit();
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryStateStore implements StateStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryStateStore.class);

    /**
     * Persisted state per record.
     * Key: (record type, record id), Value: current state name
     */
    private final ConcurrentHashMap<RecordKey, StateName> states;

    /**
     * Creates a new InMemoryStateStore with empty storage.
     */
    public InMemoryStateStore() {
        this.states = new ConcurrentHashMap<>();
    }

    @Override
    public AtomicUnit begin() {
        return new InMemoryAtomicUnit();
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalStateException if the record has no state assigned or is already stored
     */
    @Override
    public void insert(AtomicUnit unit, StatefulRecord record) {
        requireActive(unit);
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        StateName state = record.currentState();
        if (state == null) {
            throw new IllegalStateException("Cannot insert " + record.recordId() + " without a state; assign the initial state first");
        }

        RecordKey key = RecordKey.of(record);
        StateName existing = states.putIfAbsent(key, state);
        if (existing != null) {
            throw new IllegalStateException("Record already stored: " + key);
        }
        unit.onRollback(() -> states.remove(key, state));
        log.debug("Inserted {} in state {}", key, state);
    }

    @Override
    public StateName readCurrentState(StatefulRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        return states.get(RecordKey.of(record));
    }

    /**
     * {@inheritDoc}
     *
     * <p>A record that was never inserted is reported as a conflict with a {@code null} actual state.</p>
     */
    @Override
    public void compareAndSetState(AtomicUnit unit, StatefulRecord record, StateName expected, StateName next) {
        requireActive(unit);
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        if (expected == null) {
            throw new IllegalArgumentException("expected cannot be null");
        }
        if (next == null) {
            throw new IllegalArgumentException("next cannot be null");
        }

        RecordKey key = RecordKey.of(record);
        if (!states.replace(key, expected, next)) {
            StateName actual = states.get(key);
            log.debug("Conditional write rejected for {}: expected={}, actual={}", key, expected, actual);
            throw new ConcurrentTransitionConflictException(record.recordId(), expected, actual);
        }
        unit.onRollback(() -> states.replace(key, next, expected));
    }

    /**
     * {@inheritDoc}
     *
     * <p>Records whose type is a subtype of {@code ownerType} are included.</p>
     */
    @Override
    public long countInState(Class<?> ownerType, StateName state) {
        if (ownerType == null) {
            throw new IllegalArgumentException("ownerType cannot be null");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        return states.entrySet().stream()
            .filter(entry -> ownerType.isAssignableFrom(entry.getKey().type()))
            .filter(entry -> state.equals(entry.getValue()))
            .count();
    }

    /**
     * Returns the number of stored records.
     *
     * @return record count
     */
    public int size() {
        return states.size();
    }

    /**
     * Clears all stored data.
     */
    public void clear() {
        states.clear();
    }

    /**
     * Returns a snapshot of every stored state, for test assertions.
     *
     * @return copy of the (record type, id) to state map
     */
    public Map<RecordKey, StateName> snapshot() {
        return Map.copyOf(states);
    }

    private static void requireActive(AtomicUnit unit) {
        if (unit == null) {
            throw new IllegalArgumentException("unit cannot be null");
        }
        if (!unit.isActive()) {
            throw new IllegalStateException("Atomic unit is not active: " + unit);
        }
    }

    /**
     * Storage key of a record.
     *
     * @param type concrete record type
     * @param id record id
     */
    public record RecordKey(Class<?> type, RecordId id) {

        static RecordKey of(StatefulRecord record) {
            return new RecordKey(record.getClass(), record.recordId());
        }

        @Override
        public String toString() {
            return type.getSimpleName() + "/" + id.getValue();
        }
    }
}
