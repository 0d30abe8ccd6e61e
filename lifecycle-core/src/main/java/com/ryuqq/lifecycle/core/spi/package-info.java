/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the boundary contracts the engine consumes from its collaborators.
 * Storage, record persistence and audit persistence stay outside the core.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.core.spi.StatefulRecord} - The host entity with a current-state slot</li>
 *   <li>{@link com.ryuqq.lifecycle.core.spi.StateStore} - Current-state persistence with compare-and-swap writes</li>
 *   <li>{@link com.ryuqq.lifecycle.core.spi.AtomicUnit} - Scoped commit/rollback handle</li>
 *   <li>{@link com.ryuqq.lifecycle.core.spi.StateChangeRecorder} - Append-only audit log</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., lifecycle-adapter-inmemory) provide concrete implementations.
 * The lifecycle-testkit module ships contract tests every adapter should pass.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Explicit Units:</strong> The atomic unit is a parameter, never an ambient transaction</li>
 *   <li><strong>Optimistic Concurrency:</strong> Per-record serialization is a compare-and-swap, not a lock</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.lifecycle.core.spi;
