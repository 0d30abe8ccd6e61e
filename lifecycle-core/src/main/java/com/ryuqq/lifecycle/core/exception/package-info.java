/**
 * State machine error taxonomy.
 *
 * <p>Every failure is an unchecked {@link com.ryuqq.lifecycle.core.exception.StateMachineException}
 * surfaced to the caller. Configuration-time errors abort machine setup; runtime errors abort the
 * transition before any mutation, or roll back the atomic unit in which it ran.</p>
 *
 * <p>A transition with no eligible match is <em>not</em> an error: it is reported as
 * {@link com.ryuqq.lifecycle.core.outcome.NoMatch}.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.lifecycle.core.exception;
