package com.ryuqq.lifecycle.core.spi;

/**
 * Scoped atomic unit of work.
 *
 * <p>Every sub-step of a transition (callbacks, conditional write, audit append) runs inside
 * one unit: either everything commits, or everything is rolled back. The unit is passed
 * explicitly to each collaborator call instead of being looked up from an ambient transaction.</p>
 *
 * <p><strong>Lifecycle:</strong></p>
 * <pre>
 * try (AtomicUnit unit = store.begin()) {
 *     store.compareAndSetState(unit, record, from, to);
 *     recorder.append(unit, record, change);
 *     unit.commit();
 * } // close() rolls back if commit() was not reached
 * </pre>
 *
 * <p><strong>Rollback Semantics:</strong></p>
 * <ul>
 *   <li>Actions registered with {@link #onRollback(Runnable)} run in reverse registration order</li>
 *   <li>Actions registered with {@link #onCommit(Runnable)} run in registration order</li>
 *   <li>commit/rollback after completion are no-ops</li>
 * </ul>
 *
 * <p>Units are confined to the thread that opened them.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface AtomicUnit extends AutoCloseable {

    /**
     * Commits all work performed in this unit.
     *
     * @throws IllegalStateException if the unit has already been rolled back
     */
    void commit();

    /**
     * Rolls back all work performed in this unit.
     *
     * <p>Undo actions are run even if one of them fails; the first failure is rethrown with the
     * others attached as suppressed exceptions.</p>
     */
    void rollback();

    /**
     * Returns whether the unit is still open.
     *
     * @return true if neither commit nor rollback has completed
     */
    boolean isActive();

    /**
     * Registers an undo action executed if this unit rolls back.
     *
     * @param undo the undo action
     * @throws IllegalArgumentException if undo is null
     * @throws IllegalStateException if the unit is no longer active
     */
    void onRollback(Runnable undo);

    /**
     * Registers an action executed after this unit commits.
     *
     * @param action the post-commit action
     * @throws IllegalArgumentException if action is null
     * @throws IllegalStateException if the unit is no longer active
     */
    void onCommit(Runnable action);

    /**
     * Rolls back the unit if it is still active.
     */
    @Override
    void close();
}
