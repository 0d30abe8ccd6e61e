package com.ryuqq.lifecycle.application.service;

/**
 * 동시 전이 충돌 재시도 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxAttempts: 최초 시도를 포함한 최대 시도 횟수 (기본 3)</li>
 *   <li>baseDelayMs: 첫 재시도 전 대기 시간 (기본 10ms)</li>
 *   <li>maxDelayMs: 대기 시간 상한 (기본 200ms)</li>
 *   <li>jitterFactor: 대기 시간에 더할 무작위 비율 (기본 0.1)</li>
 * </ul>
 *
 * <p>maxAttempts=1이면 재시도 없이 첫 충돌을 그대로 전파합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param maxAttempts 최대 시도 횟수 (1 이상)
 * @param baseDelayMs 기본 지연 시간 (밀리초, 양수)
 * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상)
 * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
 */
public record ConflictRetryConfig(
    int maxAttempts,
    long baseDelayMs,
    long maxDelayMs,
    double jitterFactor
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxAttempts=3, baseDelayMs=10ms, maxDelayMs=200ms, jitterFactor=0.1</p>
     */
    public ConflictRetryConfig() {
        this(3, 10, 200, 0.1);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ConflictRetryConfig {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must be positive (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
    }

    /**
     * 재시도 없는 설정.
     *
     * @return maxAttempts=1 설정
     */
    public static ConflictRetryConfig noRetry() {
        return new ConflictRetryConfig().withMaxAttempts(1);
    }

    /**
     * maxAttempts만 변경한 새 인스턴스 생성.
     */
    public ConflictRetryConfig withMaxAttempts(int maxAttempts) {
        return new ConflictRetryConfig(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor);
    }

    /**
     * baseDelayMs만 변경한 새 인스턴스 생성.
     */
    public ConflictRetryConfig withBaseDelayMs(long baseDelayMs) {
        return new ConflictRetryConfig(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor);
    }

    /**
     * maxDelayMs만 변경한 새 인스턴스 생성.
     */
    public ConflictRetryConfig withMaxDelayMs(long maxDelayMs) {
        return new ConflictRetryConfig(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor);
    }

    /**
     * jitterFactor만 변경한 새 인스턴스 생성.
     */
    public ConflictRetryConfig withJitterFactor(double jitterFactor) {
        return new ConflictRetryConfig(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor);
    }
}
