package com.ryuqq.lifecycle.core.spi;

import com.ryuqq.lifecycle.core.model.RecordId;
import com.ryuqq.lifecycle.core.model.StateName;

/**
 * A host entity whose lifecycle is governed by a state machine.
 *
 * <p>The engine only reads and writes the record's <em>current state slot</em>; how the record
 * itself is stored is the storage collaborator's concern. The runtime class of the record selects
 * the state machine it is governed by.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>{@link #recordId()} must be stable from before the first persistence write</li>
 *   <li>{@link #currentState()} returns {@code null} as the "no state" sentinel until the initial
 *       state has been assigned</li>
 *   <li>Outside an in-flight transition, a non-null current state names an active State of the
 *       record's machine</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface StatefulRecord {

    /**
     * Returns the record's identity.
     *
     * @return the record id, never null
     */
    RecordId recordId();

    /**
     * Returns the value of the current-state slot.
     *
     * @return the current state, or {@code null} if no state has been assigned yet
     */
    StateName currentState();

    /**
     * Writes the current-state slot.
     *
     * <p>Called by the engine only; hosts should fire events instead of assigning directly.</p>
     *
     * @param state the new state (null only when restoring a sentinel on rollback)
     */
    void assignState(StateName state);
}
