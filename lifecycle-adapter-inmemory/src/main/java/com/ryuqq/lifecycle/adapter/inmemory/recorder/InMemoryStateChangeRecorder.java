package com.ryuqq.lifecycle.adapter.inmemory.recorder;

import com.ryuqq.lifecycle.core.model.RecordId;
import com.ryuqq.lifecycle.core.model.StateChange;
import com.ryuqq.lifecycle.core.spi.AtomicUnit;
import com.ryuqq.lifecycle.core.spi.StateChangeRecorder;
import com.ryuqq.lifecycle.core.spi.StatefulRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link StateChangeRecorder} SPI.
 *
 * <p>Entries are appended immediately and an undo action is journaled on the atomic unit,
 * so a rolled-back transition leaves no history behind.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>history:</strong> ConcurrentHashMap&lt;HistoryKey, List&lt;StateChange&gt;&gt; - append-ordered entries per record</li>
 * </ul>
 *
 * <p>Per-record lists are guarded by their own monitor; distinct records never contend.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryStateChangeRecorder implements StateChangeRecorder {

    private final ConcurrentHashMap<HistoryKey, List<StateChange>> history = new ConcurrentHashMap<>();

    @Override
    public void append(AtomicUnit unit, StatefulRecord record, StateChange change) {
        if (unit == null) {
            throw new IllegalArgumentException("unit cannot be null");
        }
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        if (change == null) {
            throw new IllegalArgumentException("change cannot be null");
        }
        if (!record.recordId().equals(change.recordId())) {
            throw new IllegalArgumentException(
                "change belongs to " + change.recordId() + ", not " + record.recordId()
            );
        }

        List<StateChange> entries = history.computeIfAbsent(HistoryKey.of(record), key -> new ArrayList<>());
        synchronized (entries) {
            entries.add(change);
        }
        unit.onRollback(() -> removeLast(entries, change));
    }

    @Override
    public List<StateChange> historyOf(StatefulRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        List<StateChange> entries = history.get(HistoryKey.of(record));
        if (entries == null) {
            return List.of();
        }
        synchronized (entries) {
            return List.copyOf(entries);
        }
    }

    /**
     * Returns every entry recorded for records of the given type or its subtypes.
     *
     * @param ownerType record type
     * @return entries grouped by record, each group in append order
     */
    public List<StateChange> changesOf(Class<?> ownerType) {
        if (ownerType == null) {
            throw new IllegalArgumentException("ownerType cannot be null");
        }
        List<StateChange> result = new ArrayList<>();
        history.forEach((key, entries) -> {
            if (ownerType.isAssignableFrom(key.type())) {
                synchronized (entries) {
                    result.addAll(entries);
                }
            }
        });
        return result;
    }

    /**
     * Returns the total number of recorded entries.
     *
     * @return entry count across all records
     */
    public int size() {
        int total = 0;
        for (List<StateChange> entries : history.values()) {
            synchronized (entries) {
                total += entries.size();
            }
        }
        return total;
    }

    /**
     * Clears all recorded history.
     */
    public void clear() {
        history.clear();
    }

    private static void removeLast(List<StateChange> entries, StateChange change) {
        synchronized (entries) {
            for (int i = entries.size() - 1; i >= 0; i--) {
                if (entries.get(i) == change) {
                    entries.remove(i);
                    return;
                }
            }
        }
    }

    private record HistoryKey(Class<?> type, RecordId id) {

        static HistoryKey of(StatefulRecord record) {
            return new HistoryKey(record.getClass(), record.recordId());
        }
    }
}
