/**
 * In-memory state change history adapter.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.lifecycle.adapter.inmemory.recorder;
