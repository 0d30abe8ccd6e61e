/**
 * Storage contract tests.
 *
 * <p>Each scenario class is abstract; an adapter module extends it and implements
 * {@link com.ryuqq.lifecycle.testkit.contract.AbstractContractTest#createStateStore()} and
 * {@link com.ryuqq.lifecycle.testkit.contract.AbstractContractTest#createStateChangeRecorder()}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.lifecycle.testkit.contract;
