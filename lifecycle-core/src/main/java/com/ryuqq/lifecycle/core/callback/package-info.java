/**
 * Predicate and callback abstraction.
 *
 * <p>Every guard and every lifecycle callback condition is a single polymorphic
 * {@link com.ryuqq.lifecycle.core.callback.Condition}; every callback body is an
 * {@link com.ryuqq.lifecycle.core.callback.Action}. Method references and inline lambdas
 * satisfy the same capability, so no reflection or name-based lookup is involved.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.core.callback.Condition} - evaluate(record) -&gt; boolean</li>
 *   <li>{@link com.ryuqq.lifecycle.core.callback.Action} - invoke(record, args)</li>
 *   <li>{@link com.ryuqq.lifecycle.core.callback.ConditionalCallback} - Action guarded by a Condition</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.lifecycle.core.callback;
