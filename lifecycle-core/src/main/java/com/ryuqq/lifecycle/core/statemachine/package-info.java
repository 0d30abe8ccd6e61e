/**
 * State machine definition package.
 *
 * <p>This package holds the immutable definitions an owner type activates, the builder that
 * validates them, and the registry the engine reads at fire time.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.core.statemachine.State} - active state with phase callbacks</li>
 *   <li>{@link com.ryuqq.lifecycle.core.statemachine.Event} - active event with ordered transitions</li>
 *   <li>{@link com.ryuqq.lifecycle.core.statemachine.Transition} - from-set, target and guards</li>
 *   <li>{@link com.ryuqq.lifecycle.core.statemachine.StateMachine} - per-type definition and builder</li>
 *   <li>{@link com.ryuqq.lifecycle.core.statemachine.StateMachineRegistry} - type to definition lookup</li>
 * </ul>
 *
 * <h2>Selection Rule</h2>
 * <pre>
 * for transition in event.transitions (definition order):
 *     eligible  = transition.from is empty OR transition.from contains current
 *     passes    = if-condition holds AND unless-condition does not hold
 *     if eligible and passes: select it and stop
 * no selection: NoMatch (not an error)
 * </pre>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * StateMachine&lt;Vehicle&gt; machine = StateMachine.builder(Vehicle.class, catalog)
 *     .initialState("parked")
 *     .states("parked", "idling", "first_gear")
 *     .event("ignite", e -&gt; e.transitionTo("idling").from("parked"))
 *     .event("shift_up", e -&gt; e.transitionTo("first_gear").from("idling"))
 *     .build();
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.lifecycle.core.statemachine;
