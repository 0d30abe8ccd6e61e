package com.ryuqq.lifecycle.core.executor;

import com.ryuqq.lifecycle.core.model.StateChange;
import com.ryuqq.lifecycle.core.model.StateName;
import com.ryuqq.lifecycle.core.outcome.Applied;
import com.ryuqq.lifecycle.core.spi.AtomicUnit;
import com.ryuqq.lifecycle.core.spi.StateChangeRecorder;
import com.ryuqq.lifecycle.core.spi.StateStore;
import com.ryuqq.lifecycle.core.spi.StatefulRecord;
import com.ryuqq.lifecycle.core.spi.noop.NoOpStateChangeRecorder;
import com.ryuqq.lifecycle.core.statemachine.Event;
import com.ryuqq.lifecycle.core.statemachine.EventPhase;
import com.ryuqq.lifecycle.core.statemachine.State;
import com.ryuqq.lifecycle.core.statemachine.StateMachine;
import com.ryuqq.lifecycle.core.statemachine.StatePhase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collections;
import java.util.List;

/**
 * 선택된 전이를 하나의 원자 단위 안에서 실행.
 *
 * <p><strong>실행 순서 (고정):</strong></p>
 * <ol>
 *   <li>from 상태의 before_exit 콜백</li>
 *   <li>to 상태의 before_enter 콜백</li>
 *   <li>이벤트 before 콜백</li>
 *   <li>조건부 쓰기 ({@code expected = from}) 후 레코드 슬롯 갱신</li>
 *   <li>이력 추가 (recordChanges가 켜진 경우)</li>
 *   <li>from 상태의 after_exit 콜백</li>
 *   <li>to 상태의 after_enter 콜백</li>
 *   <li>이벤트 after 콜백</li>
 *   <li>커밋</li>
 * </ol>
 *
 * <p>어느 단계에서든 예외가 발생하면 원자 단위가 롤백되고 레코드의 상태 슬롯은 원래 값으로
 * 복원된 뒤 예외가 그대로 전파됩니다. 자기 전이(from == to)도 exit/enter 콜백을 모두 실행합니다.</p>
 *
 * <p>before 단계 콜백이 레코드의 다른 필드를 바꾼 경우, 그 변경의 지속 여부는 호스트가
 * 원자 단위에 참여시켰는지에 달려 있습니다. 상태 슬롯 외의 필드는 복원하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class TransitionExecutor {

    private static final Logger log = LoggerFactory.getLogger(TransitionExecutor.class);

    private final StateStore store;
    private final StateChangeRecorder recorder;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @param store 상태 저장소
     * @param recorder 이력 기록기 (recordChanges가 꺼진 타입에는 사용되지 않음)
     * @param clock 이력 시각 기준
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public TransitionExecutor(StateStore store, StateChangeRecorder recorder, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (recorder == null) {
            throw new IllegalArgumentException("recorder cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.store = store;
        this.recorder = recorder;
        this.clock = clock;
    }

    /**
     * 전이 실행.
     *
     * @param machine 레코드 타입의 상태 기계
     * @param record 대상 레코드
     * @param from 현재 상태
     * @param to 목표 상태
     * @param event 발생한 이벤트
     * @param args fire 호출 인자 (모든 콜백에 전달)
     * @param <R> 레코드 타입
     * @return 커밋된 전이 결과
     * @throws com.ryuqq.lifecycle.core.exception.ConcurrentTransitionConflictException 저장소의 상태가 from과 다른 경우
     * @throws RuntimeException 콜백이 던진 예외 (롤백 후 그대로 전파)
     */
    public <R extends StatefulRecord> Applied execute(StateMachine<R> machine, R record,
                                                     State<R> from, State<R> to, Event<R> event,
                                                     List<Object> args) {
        List<Object> callbackArgs = args == null ? Collections.emptyList() : args;
        StateName previous = record.currentState();

        try (AtomicUnit unit = store.begin()) {
            unit.onRollback(() -> record.assignState(previous));

            from.run(StatePhase.BEFORE_EXIT, record, callbackArgs);
            to.run(StatePhase.BEFORE_ENTER, record, callbackArgs);
            event.run(EventPhase.BEFORE, record, callbackArgs);

            store.compareAndSetState(unit, record, from.name(), to.name());
            record.assignState(to.name());
            recorderFor(machine).append(unit, record, StateChange.transition(
                record.recordId(), machine.ownerType(), from.name(), to.name(), event.name(), clock.instant()
            ));

            from.run(StatePhase.AFTER_EXIT, record, callbackArgs);
            to.run(StatePhase.AFTER_ENTER, record, callbackArgs);
            event.run(EventPhase.AFTER, record, callbackArgs);

            unit.commit();
        } catch (RuntimeException e) {
            log.warn("Transition {} {} -> {} rolled back for {}: {}",
                event.name(), from.name(), to.name(), record.recordId(), e.toString());
            throw e;
        }

        log.debug("Transition {} {} -> {} committed for {}", event.name(), from.name(), to.name(), record.recordId());
        return new Applied(record.recordId(), event.name(), from.name(), to.name());
    }

    /**
     * 초기 상태 진입 동작을 자체 원자 단위에서 실행.
     *
     * @param machine 레코드 타입의 상태 기계
     * @param record 방금 생성된 레코드
     * @param <R> 레코드 타입
     * @return 동작을 실행했으면 true, 이미 이력이 있어 건너뛰었으면 false
     */
    public <R extends StatefulRecord> boolean runInitialStateActions(StateMachine<R> machine, R record) {
        boolean ran;
        try (AtomicUnit unit = store.begin()) {
            ran = runInitialStateActions(machine, unit, record);
            unit.commit();
        }
        return ran;
    }

    /**
     * 초기 상태 진입 동작을 호출자의 원자 단위에서 실행.
     *
     * <p>레코드에 이력이 없을 때만 초기 상태의 after_enter 콜백을 실행하고
     * {@code (null, null, initial)} 항목을 추가합니다. 커밋은 호출자의 책임입니다.</p>
     *
     * @param machine 레코드 타입의 상태 기계
     * @param unit 호출자의 원자 단위
     * @param record 방금 생성된 레코드
     * @param <R> 레코드 타입
     * @return 동작을 실행했으면 true, 이미 이력이 있어 건너뛰었으면 false
     */
    public <R extends StatefulRecord> boolean runInitialStateActions(StateMachine<R> machine, AtomicUnit unit, R record) {
        if (unit == null) {
            throw new IllegalArgumentException("unit cannot be null");
        }
        StateChangeRecorder activeRecorder = recorderFor(machine);
        if (activeRecorder.hasHistory(record)) {
            log.debug("Skipping initial state actions for {}: history already present", record.recordId());
            return false;
        }

        State<R> initial = machine.initialStateFor(record);
        initial.run(StatePhase.AFTER_ENTER, record, Collections.emptyList());
        activeRecorder.append(unit, record, StateChange.initial(
            record.recordId(), machine.ownerType(), initial.name(), clock.instant()
        ));
        log.debug("Initial state actions ran for {} in {}", record.recordId(), initial.name());
        return true;
    }

    private StateChangeRecorder recorderFor(StateMachine<?> machine) {
        return machine.recordsChanges() ? recorder : NoOpStateChangeRecorder.INSTANCE;
    }
}
