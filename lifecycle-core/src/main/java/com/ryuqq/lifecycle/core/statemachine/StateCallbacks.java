package com.ryuqq.lifecycle.core.statemachine;

import com.ryuqq.lifecycle.core.callback.Action;
import com.ryuqq.lifecycle.core.callback.Condition;
import com.ryuqq.lifecycle.core.callback.ConditionalCallback;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * State 콜백 선언.
 *
 * <p>{@link StateMachine.Builder#state(String, java.util.function.Consumer)}에 전달되는 람다 안에서
 * 사용됩니다.</p>
 *
 * <pre>
 * builder.state("first_gear", s -&gt; s
 *     .beforeEnter(Action.of(Car::putOnSeatbelt))
 *     .afterExit((car, args) -&gt; car.log("left first gear"), Car::isLogging));
 * </pre>
 *
 * @param <R> 소유 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StateCallbacks<R> {

    private final Map<StatePhase, List<ConditionalCallback<? super R>>> callbacks = new EnumMap<>(StatePhase.class);

    StateCallbacks() {
        for (StatePhase phase : StatePhase.values()) {
            callbacks.put(phase, new ArrayList<>());
        }
    }

    public StateCallbacks<R> beforeEnter(Action<? super R> action) {
        return add(StatePhase.BEFORE_ENTER, action, Condition.always());
    }

    public StateCallbacks<R> beforeEnter(Action<? super R> action, Condition<? super R> condition) {
        return add(StatePhase.BEFORE_ENTER, action, condition);
    }

    public StateCallbacks<R> afterEnter(Action<? super R> action) {
        return add(StatePhase.AFTER_ENTER, action, Condition.always());
    }

    public StateCallbacks<R> afterEnter(Action<? super R> action, Condition<? super R> condition) {
        return add(StatePhase.AFTER_ENTER, action, condition);
    }

    public StateCallbacks<R> beforeExit(Action<? super R> action) {
        return add(StatePhase.BEFORE_EXIT, action, Condition.always());
    }

    public StateCallbacks<R> beforeExit(Action<? super R> action, Condition<? super R> condition) {
        return add(StatePhase.BEFORE_EXIT, action, condition);
    }

    public StateCallbacks<R> afterExit(Action<? super R> action) {
        return add(StatePhase.AFTER_EXIT, action, Condition.always());
    }

    public StateCallbacks<R> afterExit(Action<? super R> action, Condition<? super R> condition) {
        return add(StatePhase.AFTER_EXIT, action, condition);
    }

    /**
     * 단계와 동작, 조건을 직접 지정해 콜백 추가.
     *
     * @param phase 콜백 단계
     * @param action 동작
     * @param condition 실행 조건
     * @return this
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public StateCallbacks<R> add(StatePhase phase, Action<? super R> action, Condition<? super R> condition) {
        if (phase == null) {
            throw new IllegalArgumentException("phase cannot be null");
        }
        callbacks.get(phase).add(new ConditionalCallback<R>(action, condition));
        return this;
    }

    List<ConditionalCallback<? super R>> callbacks(StatePhase phase) {
        return callbacks.get(phase);
    }

    Map<StatePhase, List<ConditionalCallback<? super R>>> asMap() {
        return callbacks;
    }
}
