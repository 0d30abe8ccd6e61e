package com.ryuqq.lifecycle.adapter.inmemory.store;

import com.ryuqq.lifecycle.core.spi.AtomicUnit;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Journaled in-memory implementation of {@link AtomicUnit}.
 *
 * <p>Writes made through the in-memory adapters are applied immediately and register a
 * compensating action here. Rolling back replays those actions in reverse registration order,
 * which restores every touched structure to its state before {@code begin()}.</p>
 *
 * <p><strong>Lifecycle:</strong></p>
 * <pre>
 * ACTIVE --commit()--&gt; COMMITTED
 * ACTIVE --rollback()/close()--&gt; ROLLED_BACK
 * </pre>
 *
 * <p><strong>Failure Handling:</strong> every undo action runs even if an earlier one throws.
 * The first failure is rethrown with later failures attached as suppressed exceptions.</p>
 *
 * <p><strong>Thread Safety:</strong> a unit belongs to the thread that began it and is not
 * meant to be shared.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryAtomicUnit implements AtomicUnit {

    private static final AtomicLong SEQUENCE = new AtomicLong();

    private enum Status { ACTIVE, COMMITTED, ROLLED_BACK }

    private final long id;
    private final Deque<Runnable> undoActions = new ArrayDeque<>();
    private final List<Runnable> commitActions = new ArrayList<>();
    private Status status = Status.ACTIVE;

    /**
     * Creates a new active unit.
     */
    public InMemoryAtomicUnit() {
        this.id = SEQUENCE.incrementAndGet();
    }

    @Override
    public void commit() {
        requireActive("commit");
        status = Status.COMMITTED;
        undoActions.clear();
        for (Runnable action : commitActions) {
            action.run();
        }
        commitActions.clear();
    }

    /**
     * {@inheritDoc}
     *
     * <p>Calling rollback on a unit that is already rolled back does nothing.</p>
     *
     * @throws IllegalStateException if the unit was already committed
     */
    @Override
    public void rollback() {
        if (status == Status.ROLLED_BACK) {
            return;
        }
        if (status == Status.COMMITTED) {
            throw new IllegalStateException("Unit " + id + " already committed");
        }
        status = Status.ROLLED_BACK;
        commitActions.clear();

        RuntimeException failure = null;
        while (!undoActions.isEmpty()) {
            Runnable undo = undoActions.pop();
            try {
                undo.run();
            } catch (RuntimeException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public boolean isActive() {
        return status == Status.ACTIVE;
    }

    @Override
    public void onRollback(Runnable undo) {
        if (undo == null) {
            throw new IllegalArgumentException("undo cannot be null");
        }
        requireActive("onRollback");
        undoActions.push(undo);
    }

    @Override
    public void onCommit(Runnable action) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        requireActive("onCommit");
        commitActions.add(action);
    }

    /**
     * Rolls back if the unit is still active, otherwise does nothing.
     */
    @Override
    public void close() {
        if (status == Status.ACTIVE) {
            rollback();
        }
    }

    /**
     * Returns the number of undo actions currently journaled.
     *
     * @return pending undo action count
     */
    public int pendingUndoCount() {
        return undoActions.size();
    }

    private void requireActive(String operation) {
        if (status != Status.ACTIVE) {
            throw new IllegalStateException("Cannot " + operation + " on unit " + id + " in status " + status);
        }
    }

    @Override
    public String toString() {
        return "InMemoryAtomicUnit{id=" + id + ", status=" + status + '}';
    }
}
