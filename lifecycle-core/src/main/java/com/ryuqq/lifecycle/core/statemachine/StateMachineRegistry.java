package com.ryuqq.lifecycle.core.statemachine;

import com.ryuqq.lifecycle.core.model.Catalog;
import com.ryuqq.lifecycle.core.spi.StatefulRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 소유 타입별 StateMachine 등록소.
 *
 * <p>정의는 부팅 시 등록하고, 이후에는 잠금 없이 여러 스레드에서 조회합니다.</p>
 *
 * <p><strong>조회 규칙:</strong> 정확한 타입으로 등록된 정의가 없으면 상위 클래스를 따라
 * 올라가며 가장 가까운 정의를 사용합니다. 하위 타입이 별도 정의 없이 부모의 상태 기계를
 * 공유하는 경우입니다.</p>
 *
 * <pre>
 * StateMachineRegistry registry = new StateMachineRegistry();
 * registry.register(StateMachine.builder(Vehicle.class, catalog)
 *     .initialState("parked")
 *     .states("parked", "idling")
 *     .event("ignite", e -&gt; e.transitionTo("idling").from("parked"))
 *     .build());
 *
 * registry.register(registry.inherit(Vehicle.class, Car.class)
 *     .amendState("idling", s -&gt; s.afterEnter(Action.of(Car::honk)))
 *     .build());
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StateMachineRegistry {

    private static final Logger log = LoggerFactory.getLogger(StateMachineRegistry.class);

    private final ConcurrentHashMap<Class<?>, StateMachine<?>> machines = new ConcurrentHashMap<>();

    /**
     * StateMachine 등록.
     *
     * @param machine 등록할 정의
     * @param <R> 소유 타입
     * @return 등록된 정의
     * @throws IllegalArgumentException machine이 null인 경우
     * @throws IllegalStateException 같은 타입에 이미 정의가 등록된 경우
     */
    public <R extends StatefulRecord> StateMachine<R> register(StateMachine<R> machine) {
        if (machine == null) {
            throw new IllegalArgumentException("machine cannot be null");
        }
        StateMachine<?> existing = machines.putIfAbsent(machine.ownerType(), machine);
        if (existing != null) {
            throw new IllegalStateException("StateMachine already registered for " + machine.ownerType().getName());
        }
        log.info("Registered state machine for {}: states={}, events={}, recordChanges={}",
            machine.ownerType().getSimpleName(), machine.stateNames(), machine.eventNames(), machine.recordsChanges());
        return machine;
    }

    /**
     * 타입에 적용될 StateMachine 조회.
     *
     * @param type 레코드 타입
     * @param <R> 레코드 타입
     * @return 정확한 타입 또는 가장 가까운 상위 타입의 정의
     * @throws IllegalStateException 어떤 상위 타입에도 정의가 없는 경우
     */
    public <R extends StatefulRecord> StateMachine<? super R> machineFor(Class<R> type) {
        return findMachine(type).orElseThrow(() ->
            new IllegalStateException("No state machine registered for " + type.getName())
        );
    }

    /**
     * 레코드 인스턴스에 적용될 StateMachine 조회.
     *
     * <p>반환된 정의의 소유 타입은 레코드 클래스 자신이거나 상위 타입이므로,
     * 정의의 콜백과 조건은 이 레코드를 그대로 받을 수 있습니다.</p>
     *
     * @param record 레코드
     * @return 레코드 타입에 적용될 정의
     * @throws IllegalStateException 어떤 상위 타입에도 정의가 없는 경우
     */
    public StateMachine<StatefulRecord> machineForRecord(StatefulRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        return narrow(machineFor(record.getClass()));
    }

    /**
     * 타입에 적용될 StateMachine 조회 (Optional).
     *
     * @param type 레코드 타입
     * @param <R> 레코드 타입
     * @return 정의 (없으면 empty)
     */
    public <R extends StatefulRecord> Optional<StateMachine<? super R>> findMachine(Class<R> type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        Class<?> current = type;
        while (current != null) {
            StateMachine<?> machine = machines.get(current);
            if (machine != null) {
                return Optional.<StateMachine<? super R>>of(StateMachineRegistry.<R>narrow(machine));
            }
            current = current.getSuperclass();
        }
        return Optional.empty();
    }

    /**
     * 정확한 타입으로 정의가 등록되었는지 확인.
     *
     * @param type 레코드 타입
     * @return 등록되어 있으면 true
     */
    public boolean isRegistered(Class<?> type) {
        return machines.containsKey(type);
    }

    /**
     * 부모 정의를 복제한 하위 타입 Builder 생성.
     *
     * @param parentType 부모 타입 (등록되어 있어야 함)
     * @param subclass 하위 타입
     * @param <P> 부모 타입
     * @param <S> 하위 타입
     * @return 부모의 State/Event가 하위 타입 소유로 복제된 Builder
     * @throws IllegalStateException 부모 타입에 정의가 없는 경우
     */
    public <P extends StatefulRecord, S extends P> StateMachine.Builder<S> inherit(Class<P> parentType, Class<S> subclass) {
        return inherit(parentType, subclass, parentOf(parentType).catalog());
    }

    /**
     * 부모 정의를 복제하고 Catalog를 확장한 하위 타입 Builder 생성.
     *
     * @param parentType 부모 타입 (등록되어 있어야 함)
     * @param subclass 하위 타입
     * @param catalog 하위 타입의 Catalog (부모의 이름을 모두 포함해야 함)
     * @param <P> 부모 타입
     * @param <S> 하위 타입
     * @return 부모의 State/Event가 하위 타입 소유로 복제된 Builder
     * @throws IllegalStateException 부모 타입에 정의가 없는 경우
     */
    public <P extends StatefulRecord, S extends P> StateMachine.Builder<S> inherit(Class<P> parentType, Class<S> subclass,
                                                                                  Catalog catalog) {
        StateMachine<P> parent = parentOf(parentType);
        log.debug("Inheriting state machine {} -> {}", parentType.getSimpleName(), subclass.getSimpleName());
        return parent.extend(subclass, catalog);
    }

    private <P extends StatefulRecord> StateMachine<P> parentOf(Class<P> parentType) {
        if (parentType == null) {
            throw new IllegalArgumentException("parentType cannot be null");
        }
        StateMachine<?> parent = machines.get(parentType);
        if (parent == null) {
            throw new IllegalStateException("No state machine registered for " + parentType.getName());
        }
        return narrow(parent);
    }

    /**
     * 등록된 타입 목록.
     *
     * @return 불변 스냅샷
     */
    public Set<Class<?>> registeredTypes() {
        return Set.copyOf(machines.keySet());
    }

    // 등록 키는 항상 정의의 소유 타입이므로 조회한 타입 또는 그 하위 타입으로만 좁혀진다
    @SuppressWarnings("unchecked")
    private static <T extends StatefulRecord> StateMachine<T> narrow(StateMachine<?> machine) {
        return (StateMachine<T>) machine;
    }
}
