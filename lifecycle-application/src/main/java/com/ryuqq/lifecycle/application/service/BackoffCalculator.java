package com.ryuqq.lifecycle.application.service;

/**
 * 충돌 재시도용 Exponential Backoff with Jitter 계산기.
 *
 * <p>같은 레코드를 두고 경합한 호출자들이 동시에 다시 부딪히지 않도록
 * 재시도 간격을 지수적으로 늘리고 무작위 jitter를 더합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay = min(baseDelay * 2^(retry-1) + jitter, maxDelay)
 * jitter = random(0, exponential * jitterFactor)
 * </pre>
 *
 * <p><strong>예시 (baseDelay=10ms, jitterFactor=0.1):</strong></p>
 * <ul>
 *   <li>retry=1: 10-11ms</li>
 *   <li>retry=2: 20-22ms</li>
 *   <li>retry=3: 40-44ms</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;

    /**
     * 재시도 설정으로 생성.
     *
     * @param config 재시도 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public BackoffCalculator(ConflictRetryConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.baseDelayMs = config.baseDelayMs();
        this.maxDelayMs = config.maxDelayMs();
        this.jitterFactor = config.jitterFactor();
    }

    /**
     * 재시도 지연 시간 계산.
     *
     * @param retry 재시도 순번 (1부터 시작)
     * @return 재시도 전 대기 시간 (밀리초)
     * @throws IllegalArgumentException retry가 양수가 아닌 경우
     */
    public long calculate(int retry) {
        if (retry <= 0) {
            throw new IllegalArgumentException(
                "retry must be positive (current: " + retry + ")"
            );
        }

        // shift 는 62 에서 멈춰 overflow 를 막는다
        int shift = Math.min(retry - 1, 62);
        long exponential = baseDelayMs > (maxDelayMs >> shift)
            ? maxDelayMs
            : Math.min(baseDelayMs << shift, maxDelayMs);

        long jitter = (long) (exponential * jitterFactor * Math.random());

        return Math.min(exponential + jitter, maxDelayMs);
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }
}
