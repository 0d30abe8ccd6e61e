package com.ryuqq.lifecycle.core.statemachine;

import com.ryuqq.lifecycle.core.callback.Condition;
import com.ryuqq.lifecycle.core.model.EventName;
import com.ryuqq.lifecycle.core.model.StateName;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 이벤트에 속한 전이 규칙.
 *
 * <p>Transition은 이벤트를 {@code (from 집합, to 상태, 가드)}에 묶는 불변 값 객체입니다.</p>
 *
 * <p><strong>적용 규칙:</strong></p>
 * <ul>
 *   <li><strong>적격(eligible):</strong> from 집합이 비어 있거나 현재 상태를 포함</li>
 *   <li><strong>가드 통과:</strong> {@code ifCondition}을 만족하고 {@code unlessCondition}을 만족하지 않음</li>
 *   <li>조건이 지정되지 않으면 해당 쪽은 통과로 간주</li>
 * </ul>
 *
 * @param event 소유 이벤트 이름
 * @param from 적격 from 상태 집합 (비어 있으면 모든 상태)
 * @param to 목표 상태
 * @param ifCondition 만족해야 하는 조건
 * @param unlessCondition 만족하면 안 되는 조건
 * @param <R> 소유 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Transition<R>(
    EventName event,
    Set<StateName> from,
    StateName to,
    Condition<? super R> ifCondition,
    Condition<? super R> unlessCondition
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null인 경우
     */
    public Transition {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        if (from == null) {
            throw new IllegalArgumentException("from cannot be null (use an empty set for any state)");
        }
        if (to == null) {
            throw new IllegalArgumentException("to cannot be null");
        }
        if (ifCondition == null) {
            throw new IllegalArgumentException("ifCondition cannot be null");
        }
        if (unlessCondition == null) {
            throw new IllegalArgumentException("unlessCondition cannot be null");
        }
        from = Collections.unmodifiableSet(new LinkedHashSet<>(from));
    }

    /**
     * 가드 없는 전이 생성.
     *
     * @param event 이벤트 이름
     * @param from from 상태 집합
     * @param to 목표 상태
     * @param <R> 소유 타입
     * @return Transition 인스턴스
     */
    public static <R> Transition<R> of(EventName event, Set<StateName> from, StateName to) {
        return new Transition<>(event, from, to, Condition.always(), Condition.never());
    }

    /**
     * 모든 상태에서 적용되는지 확인.
     *
     * @return from 집합이 비어 있으면 true
     */
    public boolean appliesFromAnyState() {
        return from.isEmpty();
    }

    /**
     * 현재 상태에서 적격인지 확인.
     *
     * @param current 현재 상태
     * @return from 집합이 비어 있거나 current를 포함하면 true
     */
    public boolean isEligibleFrom(StateName current) {
        return from.isEmpty() || from.contains(current);
    }

    /**
     * 가드 평가.
     *
     * @param record 대상 레코드
     * @return if 조건을 만족하고 unless 조건을 만족하지 않으면 true
     */
    public boolean guardPasses(R record) {
        return ifCondition.evaluate(record) && !unlessCondition.evaluate(record);
    }

    /**
     * 적격이면서 가드를 통과하는지 확인.
     *
     * @param current 현재 상태
     * @param record 대상 레코드
     * @return 적용 가능하면 true
     */
    public boolean matches(StateName current, R record) {
        return isEligibleFrom(current) && guardPasses(record);
    }

    /**
     * 하위 타입용으로 재타입.
     *
     * @param <S> 하위 타입
     * @return 같은 값을 가진 Transition
     */
    public <S extends R> Transition<S> narrow() {
        return new Transition<S>(event, from, to, ifCondition, unlessCondition);
    }
}
