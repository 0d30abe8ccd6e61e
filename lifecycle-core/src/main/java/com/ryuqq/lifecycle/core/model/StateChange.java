package com.ryuqq.lifecycle.core.model;

import java.time.Instant;

/**
 * 실현된 상태 전이에 대한 감사 로그 항목.
 *
 * <p>StateChange는 추가 전용(append-only)이며, 실현된 전이마다 정확히 한 번 생성됩니다.
 * 엔진은 생성된 항목을 수정하거나 삭제하지 않습니다.</p>
 *
 * <p><strong>초기 상태 항목:</strong></p>
 * <p>{@code fromState}와 {@code event}가 모두 null인 항목은 레코드가 생성되면서
 * 초기 상태로 "태어났음"을 나타냅니다. ({@link #isInitial()})</p>
 *
 * @param recordId 레코드 식별자
 * @param ownerType 레코드의 런타임 타입
 * @param fromState 이전 상태 (초기 상태 항목에서만 null)
 * @param toState 새 상태
 * @param event 전이를 일으킨 이벤트 (초기 상태 항목에서만 null)
 * @param occurredAt 전이 시각
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StateChange(
    RecordId recordId,
    Class<?> ownerType,
    StateName fromState,
    StateName toState,
    EventName event,
    Instant occurredAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 fromState/event 중 하나만 null인 경우
     */
    public StateChange {
        if (recordId == null) {
            throw new IllegalArgumentException("recordId cannot be null");
        }
        if (ownerType == null) {
            throw new IllegalArgumentException("ownerType cannot be null");
        }
        if (toState == null) {
            throw new IllegalArgumentException("toState cannot be null");
        }
        if (occurredAt == null) {
            throw new IllegalArgumentException("occurredAt cannot be null");
        }
        if ((fromState == null) != (event == null)) {
            throw new IllegalArgumentException(
                "fromState and event must both be null (initial entry) or both be present (from: " + fromState + ", event: " + event + ")"
            );
        }
    }

    /**
     * 초기 상태 항목 생성.
     *
     * @param recordId 레코드 식별자
     * @param ownerType 레코드 타입
     * @param initialState 초기 상태
     * @param occurredAt 생성 시각
     * @return from/event가 null인 StateChange
     */
    public static StateChange initial(RecordId recordId, Class<?> ownerType, StateName initialState, Instant occurredAt) {
        return new StateChange(recordId, ownerType, null, initialState, null, occurredAt);
    }

    /**
     * 이벤트에 의한 전이 항목 생성.
     *
     * @param recordId 레코드 식별자
     * @param ownerType 레코드 타입
     * @param fromState 이전 상태
     * @param toState 새 상태
     * @param event 이벤트
     * @param occurredAt 전이 시각
     * @return StateChange 인스턴스
     */
    public static StateChange transition(RecordId recordId, Class<?> ownerType,
                                         StateName fromState, StateName toState,
                                         EventName event, Instant occurredAt) {
        if (fromState == null || event == null) {
            throw new IllegalArgumentException("fromState and event cannot be null for an event transition");
        }
        return new StateChange(recordId, ownerType, fromState, toState, event, occurredAt);
    }

    /**
     * 초기 상태 항목인지 확인.
     *
     * @return from과 event가 모두 null이면 true
     */
    public boolean isInitial() {
        return fromState == null && event == null;
    }
}
