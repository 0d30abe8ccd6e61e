/**
 * Core value objects.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.core.model.StateName} - State identifier within an owner type</li>
 *   <li>{@link com.ryuqq.lifecycle.core.model.EventName} - Event identifier within an owner type</li>
 *   <li>{@link com.ryuqq.lifecycle.core.model.RecordId} - Stable key of a stateful record</li>
 *   <li>{@link com.ryuqq.lifecycle.core.model.Catalog} - Pre-declared state/event vocabulary</li>
 * </ul>
 *
 * <p>All value objects are immutable and validate their input on construction,
 * throwing {@link java.lang.IllegalArgumentException} for invalid values.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.lifecycle.core.model;
