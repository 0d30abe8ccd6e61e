package com.ryuqq.lifecycle.core.statemachine;

import com.ryuqq.lifecycle.core.exception.EventAlreadyActiveException;
import com.ryuqq.lifecycle.core.exception.EventNotActiveException;
import com.ryuqq.lifecycle.core.exception.EventNotFoundException;
import com.ryuqq.lifecycle.core.exception.NoInitialStateException;
import com.ryuqq.lifecycle.core.exception.StateAlreadyActiveException;
import com.ryuqq.lifecycle.core.exception.StateNotActiveException;
import com.ryuqq.lifecycle.core.exception.StateNotFoundException;
import com.ryuqq.lifecycle.core.model.Catalog;
import com.ryuqq.lifecycle.core.model.EventName;
import com.ryuqq.lifecycle.core.model.StateName;
import com.ryuqq.lifecycle.core.spi.StatefulRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * 한 소유 타입의 상태 기계 정의.
 *
 * <p>StateMachine은 활성 State/Event 집합, 초기 상태 규칙, 이력 기록 여부를 묶은
 * 불변 정의입니다. {@link Builder}로만 생성되며, {@link StateMachineRegistry}에 등록되어
 * 실행 엔진에서 조회됩니다.</p>
 *
 * <p><strong>빌드 시점 검증:</strong></p>
 * <ul>
 *   <li>초기 상태 규칙이 없으면 {@link NoInitialStateException}</li>
 *   <li>고정 초기 상태나 전이의 from/to가 활성 상태가 아니면 {@link StateNotActiveException}</li>
 * </ul>
 *
 * <p><strong>상속:</strong> {@link #extend(Class)}는 모든 State/Event를 하위 타입 소유로 복제한
 * Builder를 돌려줍니다. 하위 타입에서 추가한 콜백은 부모 정의에 영향을 주지 않습니다.</p>
 *
 * @param <R> 소유 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StateMachine<R extends StatefulRecord> {

    private final Class<R> ownerType;
    private final Catalog catalog;
    private final InitialStateRule<R> initialStateRule;
    private final boolean recordChanges;
    private final Map<StateName, State<R>> states;
    private final Map<EventName, Event<R>> events;

    private StateMachine(Builder<R> builder) {
        this.ownerType = builder.ownerType;
        this.catalog = builder.catalog;
        this.initialStateRule = builder.initialStateRule;
        this.recordChanges = builder.recordChanges;
        this.states = Collections.unmodifiableMap(new LinkedHashMap<>(builder.states));
        this.events = Collections.unmodifiableMap(new LinkedHashMap<>(builder.events));
    }

    /**
     * Builder 생성.
     *
     * @param ownerType 소유 타입
     * @param catalog 선언 가능한 상태/이벤트 이름 목록
     * @param <R> 소유 타입
     * @return 비어 있는 Builder
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static <R extends StatefulRecord> Builder<R> builder(Class<R> ownerType, Catalog catalog) {
        return new Builder<>(ownerType, catalog);
    }

    /**
     * 하위 타입용 Builder 생성 (같은 Catalog).
     *
     * @param subclass 하위 타입
     * @param <S> 하위 타입
     * @return 부모 정의가 복제된 Builder
     */
    public <S extends R> Builder<S> extend(Class<S> subclass) {
        return extend(subclass, catalog);
    }

    /**
     * 하위 타입용 Builder 생성.
     *
     * <p>모든 State/Event는 하위 타입 소유의 새 인스턴스로 복제되고,
     * 초기 상태 규칙과 이력 기록 여부는 그대로 이어집니다.</p>
     *
     * @param subclass 하위 타입
     * @param subclassCatalog 하위 타입의 Catalog (부모 이름을 모두 포함해야 함)
     * @param <S> 하위 타입
     * @return 부모 정의가 복제된 Builder
     * @throws IllegalArgumentException subclass가 소유 타입의 하위 타입이 아닌 경우
     * @throws StateNotFoundException subclassCatalog에 부모 상태가 없는 경우
     * @throws EventNotFoundException subclassCatalog에 부모 이벤트가 없는 경우
     */
    public <S extends R> Builder<S> extend(Class<S> subclass, Catalog subclassCatalog) {
        if (subclass == null) {
            throw new IllegalArgumentException("subclass cannot be null");
        }
        if (subclass == ownerType || !ownerType.isAssignableFrom(subclass)) {
            throw new IllegalArgumentException(
                subclass.getName() + " is not a proper subtype of " + ownerType.getName()
            );
        }
        Builder<S> builder = new Builder<>(subclass, subclassCatalog);
        for (State<R> state : states.values()) {
            if (!subclassCatalog.declaresState(state.name())) {
                throw new StateNotFoundException(subclass, state.name().getValue());
            }
            builder.states.put(state.name(), state.reownedBy(subclass));
        }
        for (Event<R> event : events.values()) {
            if (!subclassCatalog.declaresEvent(event.name())) {
                throw new EventNotFoundException(subclass, event.name().getValue());
            }
            builder.events.put(event.name(), event.reownedBy(subclass));
        }
        builder.initialStateRule = initialStateRule == null ? null : initialStateRule.<S>narrow();
        builder.recordChanges = recordChanges;
        return builder;
    }

    public Class<R> ownerType() {
        return ownerType;
    }

    public Catalog catalog() {
        return catalog;
    }

    /**
     * 상태 변경 이력을 기록하는지 여부.
     *
     * @return 기록하면 true (기본값)
     */
    public boolean recordsChanges() {
        return recordChanges;
    }

    public InitialStateRule<R> initialStateRule() {
        return initialStateRule;
    }

    /**
     * 이름이 활성 상태인지 확인.
     *
     * <p>이름 형식을 검증하지 않습니다. 형식에 맞지 않는 이름은 활성 상태일 수 없으므로 false입니다.</p>
     *
     * @param name 상태 이름 (null 허용)
     * @return 활성 상태이면 true
     */
    public boolean isActiveState(String name) {
        return name != null && states.keySet().stream().anyMatch(state -> state.getValue().equals(name));
    }

    public boolean isActiveState(StateName name) {
        return states.containsKey(name);
    }

    /**
     * 이름이 활성 이벤트인지 확인.
     *
     * @param name 이벤트 이름 (null 허용)
     * @return 활성 이벤트이면 true, 형식에 맞지 않는 이름이면 false
     */
    public boolean isActiveEvent(String name) {
        return name != null && events.keySet().stream().anyMatch(event -> event.getValue().equals(name));
    }

    public boolean isActiveEvent(EventName name) {
        return events.containsKey(name);
    }

    /**
     * 활성 State 조회.
     *
     * @param name 상태 이름
     * @return State
     * @throws StateNotActiveException 활성 상태가 아닌 경우
     */
    public State<R> state(StateName name) {
        State<R> state = states.get(name);
        if (state == null) {
            throw new StateNotActiveException(ownerType, name.getValue());
        }
        return state;
    }

    public State<R> state(String name) {
        if (!isActiveState(name)) {
            throw new StateNotActiveException(ownerType, name);
        }
        return state(StateName.of(name));
    }

    /**
     * 활성 Event 조회.
     *
     * @param name 이벤트 이름
     * @return Event
     * @throws EventNotActiveException 활성 이벤트가 아닌 경우
     */
    public Event<R> event(EventName name) {
        Event<R> event = events.get(name);
        if (event == null) {
            throw new EventNotActiveException(ownerType, name.getValue());
        }
        return event;
    }

    public Event<R> event(String name) {
        if (!isActiveEvent(name)) {
            throw new EventNotActiveException(ownerType, name);
        }
        return event(EventName.of(name));
    }

    public Optional<State<R>> findState(StateName name) {
        return Optional.ofNullable(states.get(name));
    }

    public Optional<Event<R>> findEvent(EventName name) {
        return Optional.ofNullable(events.get(name));
    }

    /**
     * 활성 상태 이름 (활성화 순서).
     *
     * @return 불변 집합
     */
    public Set<StateName> stateNames() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(states.keySet()));
    }

    /**
     * 활성 이벤트 이름 (활성화 순서).
     *
     * @return 불변 집합
     */
    public Set<EventName> eventNames() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(events.keySet()));
    }

    /**
     * 레코드의 초기 상태 결정.
     *
     * @param record 대상 레코드
     * @return 활성 초기 상태
     * @throws StateNotActiveException 계산된 초기 상태가 활성 상태가 아닌 경우
     */
    public State<R> initialStateFor(R record) {
        return state(initialStateRule.resolve(record));
    }

    /**
     * 주어진 상태에서 가능한 모든 전이 (읽기 전용).
     *
     * <p>이벤트 활성화 순서, 이벤트 내 정의 순서로 나열합니다. 콜백은 실행하지 않습니다.</p>
     *
     * @param record 가드 평가 대상
     * @param state 기준 상태
     * @return 적격이며 가드를 통과하는 전이 목록
     */
    public List<Transition<R>> possibleTransitionsFrom(R record, StateName state) {
        List<Transition<R>> possible = new ArrayList<>();
        for (Event<R> event : events.values()) {
            possible.addAll(event.possibleTransitionsFrom(state, record));
        }
        return possible;
    }

    /**
     * 이벤트가 발생하면 선택될 다음 상태 (읽기 전용).
     *
     * @param record 대상 레코드
     * @param current 현재 상태
     * @param event 이벤트 이름
     * @return 다음 상태 (적용 가능한 전이가 없으면 empty)
     * @throws EventNotActiveException 활성 이벤트가 아닌 경우
     */
    public Optional<StateName> nextStateForEvent(R record, StateName current, EventName event) {
        return event(event).select(current, record).map(Transition::to);
    }

    /**
     * 이벤트가 발생할 때 가능한 모든 다음 상태 (읽기 전용).
     *
     * @param record 대상 레코드
     * @param current 현재 상태
     * @param event 이벤트 이름
     * @return 정의 순서의 다음 상태 목록 (첫 번째가 선택될 상태)
     * @throws EventNotActiveException 활성 이벤트가 아닌 경우
     */
    public List<StateName> nextStatesForEvent(R record, StateName current, EventName event) {
        List<StateName> next = new ArrayList<>();
        for (Transition<R> transition : event(event).possibleTransitionsFrom(current, record)) {
            next.add(transition.to());
        }
        return next;
    }

    @Override
    public String toString() {
        return "StateMachine{" +
            "ownerType=" + ownerType.getSimpleName() +
            ", states=" + states.keySet() +
            ", events=" + events.keySet() +
            ", recordChanges=" + recordChanges +
            '}';
    }

    /**
     * StateMachine Builder.
     *
     * <p>상태와 이벤트는 Catalog에 선언된 이름만 활성화할 수 있으며, 같은 이름을 두 번
     * 활성화하면 예외가 발생합니다. 상속받은 정의를 확장할 때는
     * {@link #amendState(String, Consumer)} / {@link #amendEvent(String, Consumer)}를 사용합니다.</p>
     *
     * @param <R> 소유 타입
     */
    public static final class Builder<R extends StatefulRecord> {

        private final Class<R> ownerType;
        private final Catalog catalog;
        private final Map<StateName, State<R>> states = new LinkedHashMap<>();
        private final Map<EventName, Event<R>> events = new LinkedHashMap<>();
        private InitialStateRule<R> initialStateRule;
        private boolean recordChanges = true;

        private Builder(Class<R> ownerType, Catalog catalog) {
            if (ownerType == null) {
                throw new IllegalArgumentException("ownerType cannot be null");
            }
            if (catalog == null) {
                throw new IllegalArgumentException("catalog cannot be null");
            }
            this.ownerType = ownerType;
            this.catalog = catalog;
        }

        /**
         * 고정 초기 상태 지정.
         *
         * @param state 상태 이름
         * @return this
         */
        public Builder<R> initialState(String state) {
            this.initialStateRule = InitialStateRule.fixed(StateName.of(state));
            return this;
        }

        /**
         * 레코드별로 계산되는 초기 상태 지정.
         *
         * @param resolver 레코드 → 상태 이름 함수
         * @return this
         */
        public Builder<R> initialState(Function<? super R, String> resolver) {
            this.initialStateRule = InitialStateRule.computed(resolver);
            return this;
        }

        /**
         * 상태 변경 이력 기록 여부 (기본값 true).
         *
         * @param recordChanges 기록 여부
         * @return this
         */
        public Builder<R> recordChanges(boolean recordChanges) {
            this.recordChanges = recordChanges;
            return this;
        }

        /**
         * 콜백 없는 상태 활성화.
         *
         * @param names 상태 이름
         * @return this
         * @throws StateNotFoundException Catalog에 없는 이름
         * @throws StateAlreadyActiveException 이미 활성화된 이름
         */
        public Builder<R> states(String... names) {
            for (String name : names) {
                state(name, callbacks -> { });
            }
            return this;
        }

        public Builder<R> state(String name) {
            return state(name, callbacks -> { });
        }

        /**
         * 콜백과 함께 상태 활성화.
         *
         * @param name 상태 이름
         * @param declaration 콜백 선언
         * @return this
         * @throws StateNotFoundException Catalog에 없는 이름
         * @throws StateAlreadyActiveException 이미 활성화된 이름
         */
        public Builder<R> state(String name, Consumer<StateCallbacks<R>> declaration) {
            StateName stateName = StateName.of(name);
            if (states.containsKey(stateName)) {
                throw new StateAlreadyActiveException(ownerType, name);
            }
            if (!catalog.declaresState(stateName)) {
                throw new StateNotFoundException(ownerType, name);
            }
            StateCallbacks<R> callbacks = new StateCallbacks<>();
            declaration.accept(callbacks);
            states.put(stateName, new State<>(ownerType, stateName, callbacks.asMap()));
            return this;
        }

        /**
         * 이미 활성화된 상태에 콜백 추가.
         *
         * @param name 상태 이름
         * @param declaration 추가 콜백 선언
         * @return this
         * @throws StateNotActiveException 활성 상태가 아닌 경우
         */
        public Builder<R> amendState(String name, Consumer<StateCallbacks<R>> declaration) {
            StateName stateName = StateName.of(name);
            State<R> existing = states.get(stateName);
            if (existing == null) {
                throw new StateNotActiveException(ownerType, name);
            }
            StateCallbacks<R> additions = new StateCallbacks<>();
            declaration.accept(additions);
            states.put(stateName, existing.withCallbacks(additions));
            return this;
        }

        /**
         * 이벤트 활성화.
         *
         * @param name 이벤트 이름
         * @param declaration 전이와 콜백 선언
         * @return this
         * @throws EventNotFoundException Catalog에 없는 이름
         * @throws EventAlreadyActiveException 이미 활성화된 이름
         */
        public Builder<R> event(String name, Consumer<EventSpec<R>> declaration) {
            EventName eventName = EventName.of(name);
            if (events.containsKey(eventName)) {
                throw new EventAlreadyActiveException(ownerType, name);
            }
            if (!catalog.declaresEvent(eventName)) {
                throw new EventNotFoundException(ownerType, name);
            }
            EventSpec<R> spec = new EventSpec<>(eventName);
            declaration.accept(spec);
            events.put(eventName, new Event<>(ownerType, eventName, spec.buildTransitions(), spec.callbacksByPhase()));
            return this;
        }

        /**
         * 이미 활성화된 이벤트에 전이와 콜백 추가.
         *
         * <p>추가된 전이는 기존 전이 뒤에 붙으므로 우선순위가 낮습니다.</p>
         *
         * @param name 이벤트 이름
         * @param declaration 추가 선언
         * @return this
         * @throws EventNotActiveException 활성 이벤트가 아닌 경우
         */
        public Builder<R> amendEvent(String name, Consumer<EventSpec<R>> declaration) {
            EventName eventName = EventName.of(name);
            Event<R> existing = events.get(eventName);
            if (existing == null) {
                throw new EventNotActiveException(ownerType, name);
            }
            EventSpec<R> additions = new EventSpec<>(eventName);
            declaration.accept(additions);
            events.put(eventName, existing.amendedWith(additions));
            return this;
        }

        /**
         * StateMachine 생성.
         *
         * @return 불변 StateMachine
         * @throws NoInitialStateException 초기 상태 규칙이 없는 경우
         * @throws StateNotActiveException 고정 초기 상태나 전이 대상이 활성 상태가 아닌 경우
         */
        public StateMachine<R> build() {
            if (initialStateRule == null) {
                throw new NoInitialStateException(ownerType);
            }
            Optional<StateName> fixed = initialStateRule.fixedState();
            if (fixed.isPresent() && !states.containsKey(fixed.get())) {
                throw new StateNotActiveException(ownerType, fixed.get().getValue());
            }
            for (Event<R> event : events.values()) {
                for (Transition<R> transition : event.transitions()) {
                    requireActive(transition.to());
                    for (StateName from : transition.from()) {
                        requireActive(from);
                    }
                }
            }
            return new StateMachine<>(this);
        }

        private void requireActive(StateName name) {
            if (!states.containsKey(name)) {
                throw new StateNotActiveException(ownerType, name.getValue());
            }
        }
    }
}
