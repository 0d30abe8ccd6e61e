/**
 * 생명주기 서비스 계층.
 *
 * <p>호스트 애플리케이션이 사용하는 진입점을 제공합니다.</p>
 *
 * <h2>핵심 구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.application.service.LifecycleService} - 생성, 이벤트 발생, 조회</li>
 *   <li>{@link com.ryuqq.lifecycle.application.service.DefaultLifecycleService} - 충돌 재시도 구현</li>
 *   <li>{@link com.ryuqq.lifecycle.application.service.ConflictRetryConfig} - 재시도 설정</li>
 *   <li>{@link com.ryuqq.lifecycle.application.service.BackoffCalculator} - 재시도 간격 계산</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li>엔진은 충돌을 그대로 전파하고, 재시도 정책은 이 계층이 소유합니다.</li>
 *   <li>조회는 저장소와 이력 기록기만 읽으며 레코드를 변경하지 않습니다.</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.lifecycle.application.service;
