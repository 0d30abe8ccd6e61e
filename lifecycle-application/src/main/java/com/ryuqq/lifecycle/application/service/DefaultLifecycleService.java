package com.ryuqq.lifecycle.application.service;

import com.ryuqq.lifecycle.core.engine.StateMachineEngine;
import com.ryuqq.lifecycle.core.exception.ConcurrentTransitionConflictException;
import com.ryuqq.lifecycle.core.model.StateChange;
import com.ryuqq.lifecycle.core.model.StateName;
import com.ryuqq.lifecycle.core.outcome.FireOutcome;
import com.ryuqq.lifecycle.core.spi.AtomicUnit;
import com.ryuqq.lifecycle.core.spi.StateChangeRecorder;
import com.ryuqq.lifecycle.core.spi.StateStore;
import com.ryuqq.lifecycle.core.spi.StatefulRecord;
import com.ryuqq.lifecycle.core.statemachine.StateMachine;
import com.ryuqq.lifecycle.core.statemachine.StateMachineRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * LifecycleService 기본 구현체.
 *
 * <p><strong>충돌 재시도 흐름:</strong></p>
 * <pre>
 * attempt 1: engine.fire()
 *   → ConcurrentTransitionConflictException
 *   → backoff 대기 → store.readCurrentState()로 슬롯 갱신
 * attempt 2: engine.fire()  (갱신된 상태 기준으로 전이 재선택)
 *   ...
 * attempt maxAttempts: 충돌이면 예외 전파
 * </pre>
 *
 * <p>재선택 결과 적용 가능한 전이가 없으면 NoMatch가 반환됩니다.
 * 저장된 적이 없는 레코드의 충돌은 재시도해도 해소되지 않으므로 즉시 전파됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class DefaultLifecycleService implements LifecycleService {

    private static final Logger log = LoggerFactory.getLogger(DefaultLifecycleService.class);

    private final StateMachineRegistry registry;
    private final StateMachineEngine engine;
    private final StateStore store;
    private final StateChangeRecorder recorder;
    private final ConflictRetryConfig retryConfig;
    private final BackoffCalculator backoffCalculator;

    /**
     * 저장소 구성 요소로 엔진까지 함께 구성하는 생성자.
     *
     * @param registry 상태 머신 레지스트리
     * @param store 상태 저장소
     * @param recorder 이력 기록기
     * @param clock 이력 시각 기준
     * @param retryConfig 충돌 재시도 설정
     */
    public DefaultLifecycleService(
        StateMachineRegistry registry,
        StateStore store,
        StateChangeRecorder recorder,
        Clock clock,
        ConflictRetryConfig retryConfig
    ) {
        this(registry, new StateMachineEngine(registry, store, recorder, clock), store, recorder, retryConfig);
    }

    /**
     * 이미 구성된 엔진을 사용하는 생성자.
     *
     * <p>engine은 같은 store/recorder로 구성되어 있어야 합니다.</p>
     *
     * @throws IllegalArgumentException 인자 중 null이 있는 경우
     */
    public DefaultLifecycleService(
        StateMachineRegistry registry,
        StateMachineEngine engine,
        StateStore store,
        StateChangeRecorder recorder,
        ConflictRetryConfig retryConfig
    ) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (engine == null) {
            throw new IllegalArgumentException("engine cannot be null");
        }
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (recorder == null) {
            throw new IllegalArgumentException("recorder cannot be null");
        }
        if (retryConfig == null) {
            throw new IllegalArgumentException("retryConfig cannot be null");
        }
        this.registry = registry;
        this.engine = engine;
        this.store = store;
        this.recorder = recorder;
        this.retryConfig = retryConfig;
        this.backoffCalculator = new BackoffCalculator(retryConfig);
    }

    @Override
    public StateName create(StatefulRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }

        StateName previous = record.currentState();
        try (AtomicUnit unit = store.begin()) {
            unit.onRollback(() -> record.assignState(previous));
            StateName initial = engine.assignInitialState(record);
            store.insert(unit, record);
            engine.runInitialStateActions(unit, record);
            unit.commit();

            log.info("Created {} {} in state {}",
                record.getClass().getSimpleName(), record.recordId().getValue(), initial.getValue());
            return initial;
        }
    }

    @Override
    public FireOutcome fire(StatefulRecord record, String eventName, Object... args) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }

        int maxAttempts = retryConfig.maxAttempts();
        for (int attempt = 1; ; attempt++) {
            try {
                return engine.fire(record, eventName, args);
            } catch (ConcurrentTransitionConflictException e) {
                if (e.getActual() == null) {
                    log.warn("Conflict firing {} on {}: record is not stored, not retrying",
                        eventName, record.recordId().getValue());
                    throw e;
                }
                if (attempt >= maxAttempts) {
                    log.warn("Conflict firing {} on {} not resolved after {} attempts",
                        eventName, record.recordId().getValue(), attempt);
                    throw e;
                }

                long delayMs = backoffCalculator.calculate(attempt);
                log.warn("Conflict firing {} on {} (attempt {}/{}, persisted: {}), retrying in {}ms",
                    eventName, record.recordId().getValue(), attempt, maxAttempts,
                    e.getActual().getValue(), delayMs);

                pause(delayMs, e);
                StateName persisted = store.readCurrentState(record);
                if (persisted == null) {
                    throw e;
                }
                record.assignState(persisted);
            }
        }
    }

    @Override
    public boolean isInState(StatefulRecord record, String stateName) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        StateMachine<StatefulRecord> machine = engine.machineOf(record);
        StateName state = machine.state(stateName).name();
        return state.equals(engine.stateOf(record));
    }

    @Override
    public long countInState(Class<? extends StatefulRecord> ownerType, String stateName) {
        if (ownerType == null) {
            throw new IllegalArgumentException("ownerType cannot be null");
        }
        StateName state = registry.machineFor(ownerType).state(stateName).name();
        return store.countInState(ownerType, state);
    }

    @Override
    public Optional<Instant> enteredAt(StatefulRecord record, String stateName, Occurrence occurrence) {
        if (occurrence == null) {
            throw new IllegalArgumentException("occurrence cannot be null");
        }
        List<Instant> entries = enteredAtAll(record, stateName);
        if (entries.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(occurrence == Occurrence.FIRST ? entries.get(0) : entries.get(entries.size() - 1));
    }

    @Override
    public List<Instant> enteredAtAll(StatefulRecord record, String stateName) {
        StateName state = StateName.of(stateName);
        return historyOf(record).stream()
            .filter(change -> change.toState().equals(state))
            .map(StateChange::occurredAt)
            .collect(Collectors.toList());
    }

    @Override
    public List<StateChange> historyOf(StatefulRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        if (!engine.machineOf(record).recordsChanges()) {
            return List.of();
        }
        return recorder.historyOf(record);
    }

    private void pause(long delayMs, ConcurrentTransitionConflictException conflict) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            conflict.addSuppressed(ie);
            throw conflict;
        }
    }
}
