package com.ryuqq.lifecycle.core.engine;

import com.ryuqq.lifecycle.core.executor.TransitionExecutor;
import com.ryuqq.lifecycle.core.model.EventName;
import com.ryuqq.lifecycle.core.model.StateName;
import com.ryuqq.lifecycle.core.outcome.FireOutcome;
import com.ryuqq.lifecycle.core.outcome.NoMatch;
import com.ryuqq.lifecycle.core.outcome.Rejected;
import com.ryuqq.lifecycle.core.spi.AtomicUnit;
import com.ryuqq.lifecycle.core.spi.StateChangeRecorder;
import com.ryuqq.lifecycle.core.spi.StateStore;
import com.ryuqq.lifecycle.core.spi.StatefulRecord;
import com.ryuqq.lifecycle.core.statemachine.Event;
import com.ryuqq.lifecycle.core.statemachine.State;
import com.ryuqq.lifecycle.core.statemachine.StateMachine;
import com.ryuqq.lifecycle.core.statemachine.StateMachineRegistry;
import com.ryuqq.lifecycle.core.statemachine.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 이벤트 발생 엔진.
 *
 * <p>레코드 타입의 StateMachine을 찾아 이벤트를 해석하고, 첫 번째로 적용 가능한 전이를
 * {@link TransitionExecutor}에 위임합니다.</p>
 *
 * <p><strong>fire 알고리즘:</strong></p>
 * <ol>
 *   <li>레코드 타입의 활성 Event 조회 (없으면 {@code EventNotActiveException})</li>
 *   <li>현재 상태 계산 (활성 상태가 아니면 {@code StateNotActiveException})</li>
 *   <li>정의 순서로 적격 전이의 가드를 평가해 첫 통과 전이 선택</li>
 *   <li>선택 결과가 없으면 {@link NoMatch}: 콜백, 쓰기, 이력 모두 없음</li>
 *   <li>선택되면 실행기에 위임</li>
 * </ol>
 *
 * <p>{@link #fire}는 오류를 그대로 던지고, {@link #attempt}는 같은 알고리즘을 실행하되
 * 오류를 {@link Rejected}로 돌려줍니다.</p>
 *
 * <p><strong>동시성:</strong> 엔진 자체는 상태가 없으므로 여러 스레드에서 공유할 수 있습니다.
 * 같은 레코드에 대한 경합은 저장소의 조건부 쓰기가 감지합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StateMachineEngine {

    private static final Logger log = LoggerFactory.getLogger(StateMachineEngine.class);

    private final StateMachineRegistry registry;
    private final TransitionExecutor executor;

    /**
     * 생성자.
     *
     * @param registry StateMachine 등록소
     * @param store 상태 저장소
     * @param recorder 이력 기록기
     * @param clock 이력 시각 기준
     */
    public StateMachineEngine(StateMachineRegistry registry, StateStore store, StateChangeRecorder recorder, Clock clock) {
        this(registry, new TransitionExecutor(store, recorder, clock));
    }

    /**
     * 생성자 (실행기 직접 지정).
     *
     * @param registry StateMachine 등록소
     * @param executor 전이 실행기
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public StateMachineEngine(StateMachineRegistry registry, TransitionExecutor executor) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        this.registry = registry;
        this.executor = executor;
    }

    /**
     * 이벤트 발생.
     *
     * @param record 대상 레코드
     * @param eventName 이벤트 이름
     * @param args 모든 콜백에 전달될 인자
     * @return {@code Applied} 또는 {@link NoMatch}
     * @throws com.ryuqq.lifecycle.core.exception.EventNotActiveException 활성 이벤트가 아닌 경우
     * @throws com.ryuqq.lifecycle.core.exception.StateNotActiveException 현재 상태가 활성 상태가 아닌 경우
     * @throws com.ryuqq.lifecycle.core.exception.ConcurrentTransitionConflictException 조건부 쓰기 충돌
     * @throws RuntimeException 콜백이 던진 예외
     */
    public FireOutcome fire(StatefulRecord record, String eventName, Object... args) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        if (eventName == null) {
            throw new IllegalArgumentException("eventName cannot be null");
        }

        StateMachine<StatefulRecord> machine = machineOf(record);
        return fire(machine, record, machine.event(eventName), args);
    }

    public FireOutcome fire(StatefulRecord record, EventName eventName, Object... args) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        if (eventName == null) {
            throw new IllegalArgumentException("eventName cannot be null");
        }

        StateMachine<StatefulRecord> machine = machineOf(record);
        return fire(machine, record, machine.event(eventName), args);
    }

    /**
     * 이벤트 발생 (예외 대신 결과로 반환).
     *
     * <p>형식이 잘못된 이벤트 이름도 비활성 이벤트로 거부되며,
     * 이때 {@link Rejected#event()}는 null입니다.</p>
     *
     * @param record 대상 레코드
     * @param eventName 이벤트 이름
     * @param args 모든 콜백에 전달될 인자
     * @return {@code Applied}, {@link NoMatch} 또는 {@link Rejected}
     * @throws IllegalArgumentException record 또는 eventName이 null인 경우
     */
    public FireOutcome attempt(StatefulRecord record, String eventName, Object... args) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        if (eventName == null) {
            throw new IllegalArgumentException("eventName cannot be null");
        }
        try {
            return fire(record, eventName, args);
        } catch (RuntimeException e) {
            EventName event = EventName.isValid(eventName) ? EventName.of(eventName) : null;
            return new Rejected(record.recordId(), event, e);
        }
    }

    private FireOutcome fire(StateMachine<StatefulRecord> machine, StatefulRecord record,
                             Event<StatefulRecord> event, Object[] args) {
        State<StatefulRecord> current = machine.state(stateOf(machine, record));

        Optional<Transition<StatefulRecord>> selected = event.select(current.name(), record);
        if (selected.isEmpty()) {
            log.debug("No transition for {} from {} on {}", event.name(), current.name(), record.recordId());
            return new NoMatch(record.recordId(), event.name(), current.name());
        }

        State<StatefulRecord> target = machine.state(selected.get().to());
        return executor.execute(machine, record, current, target, event, argumentsOf(args));
    }

    /**
     * 레코드의 현재 상태.
     *
     * <p>상태 슬롯이 비어 있으면(아직 생성 전) 초기 상태를 돌려줍니다.</p>
     *
     * @param record 대상 레코드
     * @return 현재 상태 이름
     */
    public StateName stateOf(StatefulRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        return stateOf(machineOf(record), record);
    }

    /**
     * 상태 슬롯이 비어 있을 때만 초기 상태를 대입.
     *
     * @param record 대상 레코드
     * @return 대입 후의 상태 (이미 값이 있으면 그 값)
     * @throws com.ryuqq.lifecycle.core.exception.StateNotActiveException 계산된 초기 상태가 활성 상태가 아닌 경우
     */
    public StateName assignInitialState(StatefulRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        if (record.currentState() != null) {
            return record.currentState();
        }
        StateName initial = machineOf(record).initialStateFor(record).name();
        record.assignState(initial);
        log.debug("Assigned initial state {} to {}", initial, record.recordId());
        return initial;
    }

    /**
     * 초기 상태 진입 동작을 자체 원자 단위에서 실행.
     *
     * @param record 방금 생성된 레코드
     * @return 실행했으면 true, 이미 이력이 있으면 false
     */
    public boolean runInitialStateActions(StatefulRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        return executor.runInitialStateActions(machineOf(record), record);
    }

    /**
     * 초기 상태 진입 동작을 호출자의 원자 단위에서 실행.
     *
     * @param unit 호출자의 원자 단위 (커밋은 호출자 책임)
     * @param record 방금 생성된 레코드
     * @return 실행했으면 true, 이미 이력이 있으면 false
     */
    public boolean runInitialStateActions(AtomicUnit unit, StatefulRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        return executor.runInitialStateActions(machineOf(record), unit, record);
    }

    /**
     * 레코드 타입에 적용되는 StateMachine.
     *
     * @param record 대상 레코드
     * @return StateMachine
     * @throws IllegalStateException 등록된 정의가 없는 경우
     */
    public StateMachine<StatefulRecord> machineOf(StatefulRecord record) {
        return registry.machineForRecord(record);
    }

    private static StateName stateOf(StateMachine<StatefulRecord> machine, StatefulRecord record) {
        StateName current = record.currentState();
        return current != null ? current : machine.initialStateFor(record).name();
    }

    private static List<Object> argumentsOf(Object[] args) {
        if (args == null || args.length == 0) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(Arrays.asList(args));
    }
}
