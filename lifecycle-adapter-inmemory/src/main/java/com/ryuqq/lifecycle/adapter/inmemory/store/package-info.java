/**
 * In-memory state store adapter.
 *
 * <p>Provides {@link com.ryuqq.lifecycle.adapter.inmemory.store.InMemoryStateStore} and its journaled
 * {@link com.ryuqq.lifecycle.adapter.inmemory.store.InMemoryAtomicUnit} for tests and local development.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.lifecycle.adapter.inmemory.store;
