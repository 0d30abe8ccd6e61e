package com.ryuqq.lifecycle.core.statemachine;

import com.ryuqq.lifecycle.core.callback.Action;
import com.ryuqq.lifecycle.core.callback.Condition;
import com.ryuqq.lifecycle.core.callback.ConditionalCallback;
import com.ryuqq.lifecycle.core.model.EventName;
import com.ryuqq.lifecycle.core.model.StateName;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Event 선언.
 *
 * <p>{@link StateMachine.Builder#event(String, java.util.function.Consumer)}에 전달되는 람다 안에서
 * 전이와 콜백을 선언합니다. 전이는 선언 순서가 곧 우선순위입니다.</p>
 *
 * <pre>
 * builder.event("shift_up", e -&gt; {
 *     e.before(Action.of(Car::checkClutch));
 *     e.transitionTo("first_gear").from("idling").onlyIf(Car::isSeatbeltOn);
 *     e.transitionTo("second_gear").from("first_gear");
 * });
 * </pre>
 *
 * @param <R> 소유 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class EventSpec<R> {

    private final EventName event;
    private final List<TransitionSpec> transitions = new ArrayList<>();
    private final Map<EventPhase, List<ConditionalCallback<? super R>>> callbacks = new EnumMap<>(EventPhase.class);

    EventSpec(EventName event) {
        this.event = event;
        for (EventPhase phase : EventPhase.values()) {
            callbacks.put(phase, new ArrayList<>());
        }
    }

    /**
     * 전이 선언 시작.
     *
     * @param toState 목표 상태 이름
     * @return 전이 선언 (from/가드 지정 가능)
     */
    public TransitionSpec transitionTo(String toState) {
        TransitionSpec spec = new TransitionSpec(StateName.of(toState));
        transitions.add(spec);
        return spec;
    }

    public EventSpec<R> before(Action<? super R> action) {
        return add(EventPhase.BEFORE, action, Condition.always());
    }

    public EventSpec<R> before(Action<? super R> action, Condition<? super R> condition) {
        return add(EventPhase.BEFORE, action, condition);
    }

    public EventSpec<R> after(Action<? super R> action) {
        return add(EventPhase.AFTER, action, Condition.always());
    }

    public EventSpec<R> after(Action<? super R> action, Condition<? super R> condition) {
        return add(EventPhase.AFTER, action, condition);
    }

    private EventSpec<R> add(EventPhase phase, Action<? super R> action, Condition<? super R> condition) {
        callbacks.get(phase).add(new ConditionalCallback<R>(action, condition));
        return this;
    }

    EventName event() {
        return event;
    }

    List<Transition<R>> buildTransitions() {
        List<Transition<R>> built = new ArrayList<>();
        for (TransitionSpec spec : transitions) {
            built.add(spec.build());
        }
        return built;
    }

    List<ConditionalCallback<? super R>> callbacks(EventPhase phase) {
        return callbacks.get(phase);
    }

    Map<EventPhase, List<ConditionalCallback<? super R>>> callbacksByPhase() {
        return callbacks;
    }

    /**
     * 단일 전이 선언.
     */
    public final class TransitionSpec {

        private final StateName to;
        private final Set<StateName> from = new LinkedHashSet<>();
        private Condition<? super R> ifCondition = Condition.always();
        private Condition<? super R> unlessCondition = Condition.never();

        private TransitionSpec(StateName to) {
            this.to = to;
        }

        /**
         * 적격 from 상태 지정. 호출하지 않으면 모든 상태에서 적용됩니다.
         *
         * @param states from 상태 이름
         * @return this
         */
        public TransitionSpec from(String... states) {
            for (String state : states) {
                from.add(StateName.of(state));
            }
            return this;
        }

        /**
         * 만족해야 하는 가드 지정.
         *
         * @param condition 조건
         * @return this
         */
        public TransitionSpec onlyIf(Condition<? super R> condition) {
            if (condition == null) {
                throw new IllegalArgumentException("condition cannot be null");
            }
            this.ifCondition = condition;
            return this;
        }

        /**
         * 만족하면 안 되는 가드 지정.
         *
         * @param condition 조건
         * @return this
         */
        public TransitionSpec unless(Condition<? super R> condition) {
            if (condition == null) {
                throw new IllegalArgumentException("condition cannot be null");
            }
            this.unlessCondition = condition;
            return this;
        }

        private Transition<R> build() {
            return new Transition<R>(event, from, to, ifCondition, unlessCondition);
        }
    }
}
