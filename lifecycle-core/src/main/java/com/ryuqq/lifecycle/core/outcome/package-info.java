/**
 * 이벤트 발생 결과 타입.
 *
 * <p>{@link com.ryuqq.lifecycle.core.outcome.FireOutcome} sealed interface와
 * 세 가지 구현({@code Applied}, {@code NoMatch}, {@code Rejected})을 제공합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.lifecycle.core.outcome;
