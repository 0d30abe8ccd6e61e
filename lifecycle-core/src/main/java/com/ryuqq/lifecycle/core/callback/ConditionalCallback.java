package com.ryuqq.lifecycle.core.callback;

import java.util.List;

/**
 * 조건부 콜백.
 *
 * <p>조건을 만족할 때만 동작을 실행합니다. 조건을 지정하지 않으면 항상 실행됩니다.</p>
 *
 * @param action 실행할 동작
 * @param condition 실행 조건
 * @param <R> 레코드 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ConditionalCallback<R>(
    Action<? super R> action,
    Condition<? super R> condition
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException action 또는 condition이 null인 경우
     */
    public ConditionalCallback {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        if (condition == null) {
            throw new IllegalArgumentException("condition cannot be null");
        }
    }

    /**
     * 무조건 실행되는 콜백 생성.
     *
     * @param action 실행할 동작
     * @param <R> 레코드 타입
     * @return ConditionalCallback 인스턴스
     */
    public static <R> ConditionalCallback<R> of(Action<? super R> action) {
        return new ConditionalCallback<>(action, Condition.always());
    }

    /**
     * 조건을 만족하면 동작 실행.
     *
     * @param record 대상 레코드
     * @param args fire 호출 인자
     * @return 동작이 실행된 경우 true
     */
    public boolean runIfApplicable(R record, List<Object> args) {
        if (!condition.evaluate(record)) {
            return false;
        }
        action.invoke(record, args);
        return true;
    }
}
