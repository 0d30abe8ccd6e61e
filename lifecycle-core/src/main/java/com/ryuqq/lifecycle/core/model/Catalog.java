package com.ryuqq.lifecycle.core.model;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 소유 타입이 선언한 상태/이벤트 어휘 (vocabulary).
 *
 * <p>상태 머신 정의 시 활성화하는 모든 State와 Event 이름은 반드시 Catalog에
 * 미리 선언되어 있어야 합니다. 오타로 인해 아무도 도달하지 못하는 상태가
 * 조용히 만들어지는 것을 막기 위함입니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Catalog catalog = Catalog.of(
 *     List.of("parked", "idling", "first_gear"),
 *     List.of("ignite", "park", "shift_up")
 * );
 * </pre>
 *
 * @param stateNames 선언된 상태 이름 집합 (선언 순서 유지)
 * @param eventNames 선언된 이벤트 이름 집합 (선언 순서 유지)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Catalog(
    Set<StateName> stateNames,
    Set<EventName> eventNames
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException stateNames 또는 eventNames가 null인 경우
     */
    public Catalog {
        if (stateNames == null) {
            throw new IllegalArgumentException("stateNames cannot be null");
        }
        if (eventNames == null) {
            throw new IllegalArgumentException("eventNames cannot be null");
        }
        stateNames = Collections.unmodifiableSet(new LinkedHashSet<>(stateNames));
        eventNames = Collections.unmodifiableSet(new LinkedHashSet<>(eventNames));
    }

    /**
     * 문자열 목록으로 Catalog 생성.
     *
     * @param states 상태 이름 목록
     * @param events 이벤트 이름 목록
     * @return Catalog 인스턴스
     * @throws IllegalArgumentException 이름이 유효하지 않은 경우
     */
    public static Catalog of(Collection<String> states, Collection<String> events) {
        if (states == null || events == null) {
            throw new IllegalArgumentException("states and events cannot be null");
        }
        return new Catalog(
            states.stream().map(StateName::of).collect(Collectors.toCollection(LinkedHashSet::new)),
            events.stream().map(EventName::of).collect(Collectors.toCollection(LinkedHashSet::new))
        );
    }

    /**
     * 상태만 선언한 Catalog 생성.
     *
     * @param states 상태 이름
     * @return 이벤트가 비어 있는 Catalog
     */
    public static Catalog ofStates(String... states) {
        return of(Arrays.asList(states), Collections.emptyList());
    }

    /**
     * 상태 이름이 선언되어 있는지 확인.
     *
     * @param name 상태 이름
     * @return 선언된 경우 true
     */
    public boolean declaresState(StateName name) {
        return stateNames.contains(name);
    }

    /**
     * 이벤트 이름이 선언되어 있는지 확인.
     *
     * @param name 이벤트 이름
     * @return 선언된 경우 true
     */
    public boolean declaresEvent(EventName name) {
        return eventNames.contains(name);
    }

    /**
     * 이벤트를 추가 선언한 새 Catalog 생성.
     *
     * @param events 추가할 이벤트 이름
     * @return 새 Catalog 인스턴스
     */
    public Catalog withEvents(String... events) {
        Set<EventName> merged = new LinkedHashSet<>(eventNames);
        for (String event : events) {
            merged.add(EventName.of(event));
        }
        return new Catalog(stateNames, merged);
    }

    /**
     * 상태를 추가 선언한 새 Catalog 생성.
     *
     * @param states 추가할 상태 이름
     * @return 새 Catalog 인스턴스
     */
    public Catalog withStates(String... states) {
        Set<StateName> merged = new LinkedHashSet<>(stateNames);
        for (String state : states) {
            merged.add(StateName.of(state));
        }
        return new Catalog(merged, eventNames);
    }
}
