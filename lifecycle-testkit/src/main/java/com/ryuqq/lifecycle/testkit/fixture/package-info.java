/**
 * Fixture records and machines shared by the contract tests.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.lifecycle.testkit.fixture;
