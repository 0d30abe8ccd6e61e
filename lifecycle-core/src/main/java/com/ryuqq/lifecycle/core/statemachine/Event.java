package com.ryuqq.lifecycle.core.statemachine;

import com.ryuqq.lifecycle.core.callback.ConditionalCallback;
import com.ryuqq.lifecycle.core.model.EventName;
import com.ryuqq.lifecycle.core.model.StateName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 활성화된 이벤트 정의.
 *
 * <p>Event는 {@code (ownerType, name)}으로 식별되며, 순서 있는 전이 목록과
 * 조건부 before/after 콜백을 가집니다.</p>
 *
 * <p><strong>선택 규칙 (first match wins):</strong></p>
 * <ol>
 *   <li>정의 순서대로 전이를 훑는다</li>
 *   <li>from 집합이 비어 있거나 현재 상태를 포함하는 전이만 적격</li>
 *   <li>적격 전이 중 가드를 통과하는 <strong>첫 번째</strong> 전이를 선택</li>
 *   <li>없으면 선택 결과 없음 (오류가 아님)</li>
 * </ol>
 *
 * <p>여러 전이가 동시에 적용 가능해도 모호성 오류를 내지 않고 정의 순서로 결정합니다.</p>
 *
 * @param <R> 소유 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Event<R> {

    private final Class<R> ownerType;
    private final EventName name;
    private final List<Transition<R>> transitions;
    private final Map<EventPhase, List<ConditionalCallback<? super R>>> callbacks;

    Event(Class<R> ownerType, EventName name, List<Transition<R>> transitions,
          Map<EventPhase, List<ConditionalCallback<? super R>>> callbacks) {
        if (ownerType == null) {
            throw new IllegalArgumentException("ownerType cannot be null");
        }
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        this.ownerType = ownerType;
        this.name = name;
        this.transitions = Collections.unmodifiableList(new ArrayList<>(transitions));
        Map<EventPhase, List<ConditionalCallback<? super R>>> copy = new EnumMap<>(EventPhase.class);
        for (EventPhase phase : EventPhase.values()) {
            List<ConditionalCallback<? super R>> list = callbacks.get(phase);
            if (list == null) {
                copy.put(phase, Collections.emptyList());
            } else {
                copy.put(phase, Collections.unmodifiableList(new ArrayList<>(list)));
            }
        }
        this.callbacks = Collections.unmodifiableMap(copy);
    }

    public Class<R> ownerType() {
        return ownerType;
    }

    public EventName name() {
        return name;
    }

    /**
     * 정의 순서의 전이 목록.
     *
     * @return 불변 목록
     */
    public List<Transition<R>> transitions() {
        return transitions;
    }

    public List<ConditionalCallback<? super R>> callbacks(EventPhase phase) {
        return callbacks.get(phase);
    }

    /**
     * 현재 상태에서 선택될 전이 조회.
     *
     * <p>가드는 적격 전이에 대해서만, 정의 순서대로, 첫 통과 시점까지만 평가됩니다.</p>
     *
     * @param current 현재 상태
     * @param record 대상 레코드
     * @return 선택된 전이 (없으면 empty)
     */
    public Optional<Transition<R>> select(StateName current, R record) {
        for (Transition<R> transition : transitions) {
            if (transition.isEligibleFrom(current) && transition.guardPasses(record)) {
                return Optional.of(transition);
            }
        }
        return Optional.empty();
    }

    /**
     * 현재 상태에서 가능한 모든 전이 조회 (읽기 전용 투영).
     *
     * @param current 현재 상태
     * @param record 대상 레코드
     * @return 적격이며 가드를 통과하는 전이 목록 (정의 순서, 첫 번째가 선택될 전이)
     */
    public List<Transition<R>> possibleTransitionsFrom(StateName current, R record) {
        List<Transition<R>> possible = new ArrayList<>();
        for (Transition<R> transition : transitions) {
            if (transition.matches(current, record)) {
                possible.add(transition);
            }
        }
        return possible;
    }

    /**
     * 단계의 콜백 중 조건을 만족하는 것을 선언 순서대로 실행.
     *
     * @param phase 콜백 단계
     * @param record 대상 레코드
     * @param args fire 호출 인자
     */
    public void run(EventPhase phase, R record, List<Object> args) {
        for (ConditionalCallback<? super R> callback : callbacks.get(phase)) {
            callback.runIfApplicable(record, args);
        }
    }

    /**
     * 하위 타입 소유로 복제.
     *
     * @param subclass 새 소유 타입
     * @param <S> 하위 타입
     * @return 전이와 콜백 목록을 복사한 새 Event
     */
    public <S extends R> Event<S> reownedBy(Class<S> subclass) {
        List<Transition<S>> copiedTransitions = new ArrayList<>();
        for (Transition<R> transition : transitions) {
            copiedTransitions.add(transition.<S>narrow());
        }
        Map<EventPhase, List<ConditionalCallback<? super S>>> copiedCallbacks = new EnumMap<>(EventPhase.class);
        for (EventPhase phase : EventPhase.values()) {
            copiedCallbacks.put(phase, new ArrayList<>(callbacks.get(phase)));
        }
        return new Event<>(subclass, name, copiedTransitions, copiedCallbacks);
    }

    /**
     * 전이와 콜백을 추가한 새 Event 생성.
     *
     * @param additions 추가 선언
     * @return 기존 목록 뒤에 추가분이 붙은 새 Event
     */
    public Event<R> amendedWith(EventSpec<R> additions) {
        List<Transition<R>> mergedTransitions = new ArrayList<>(transitions);
        mergedTransitions.addAll(additions.buildTransitions());
        Map<EventPhase, List<ConditionalCallback<? super R>>> mergedCallbacks = new EnumMap<>(EventPhase.class);
        for (EventPhase phase : EventPhase.values()) {
            List<ConditionalCallback<? super R>> list = new ArrayList<>(callbacks.get(phase));
            list.addAll(additions.callbacks(phase));
            mergedCallbacks.put(phase, list);
        }
        return new Event<>(ownerType, name, mergedTransitions, mergedCallbacks);
    }

    @Override
    public String toString() {
        return "Event{" + ownerType.getSimpleName() + "#" + name + ", transitions=" + transitions.size() + '}';
    }
}
