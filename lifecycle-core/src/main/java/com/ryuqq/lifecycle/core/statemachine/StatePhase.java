package com.ryuqq.lifecycle.core.statemachine;

/**
 * State 콜백 단계.
 *
 * <p><strong>실행 순서 (A → B 전이):</strong></p>
 * <pre>
 * BEFORE_EXIT(A) → BEFORE_ENTER(B) → [event BEFORE] → 상태 적용
 *   → AFTER_EXIT(A) → AFTER_ENTER(B) → [event AFTER]
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum StatePhase {

    /**
     * 상태에 진입하기 전.
     */
    BEFORE_ENTER,

    /**
     * 상태에 진입한 후. 초기 상태 부트스트랩 시에도 실행됩니다.
     */
    AFTER_ENTER,

    /**
     * 상태를 떠나기 전.
     */
    BEFORE_EXIT,

    /**
     * 상태를 떠난 후.
     */
    AFTER_EXIT;

    /**
     * 상태 적용 이전 단계인지 확인.
     *
     * @return BEFORE_ENTER 또는 BEFORE_EXIT인 경우 true
     */
    public boolean isBefore() {
        return this == BEFORE_ENTER || this == BEFORE_EXIT;
    }
}
