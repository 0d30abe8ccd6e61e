/**
 * 전이 실행 패키지.
 *
 * <p>{@link com.ryuqq.lifecycle.core.executor.TransitionExecutor}는 콜백 순서, 조건부 쓰기,
 * 이력 추가, 롤백을 하나의 원자 단위로 묶습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.lifecycle.core.executor;
