package com.ryuqq.lifecycle.application.service;

import com.ryuqq.lifecycle.core.engine.StateMachineEngine;
import com.ryuqq.lifecycle.core.exception.ConcurrentTransitionConflictException;
import com.ryuqq.lifecycle.core.exception.EventNotActiveException;
import com.ryuqq.lifecycle.core.model.EventName;
import com.ryuqq.lifecycle.core.model.StateName;
import com.ryuqq.lifecycle.core.outcome.Applied;
import com.ryuqq.lifecycle.core.outcome.FireOutcome;
import com.ryuqq.lifecycle.core.spi.StateChangeRecorder;
import com.ryuqq.lifecycle.core.spi.StateStore;
import com.ryuqq.lifecycle.core.statemachine.StateMachineRegistry;
import com.ryuqq.lifecycle.testkit.fixture.Vehicle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * DefaultLifecycleService 충돌 재시도 유닛 테스트.
 *
 * <p>엔진과 저장소를 Mock으로 대체해 재시도 횟수와 순서를 검증합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("DefaultLifecycleService 재시도 테스트")
class DefaultLifecycleServiceRetryTest {

    private static final StateName PARKED = StateName.of("parked");
    private static final StateName IDLING = StateName.of("idling");

    @Mock
    private StateMachineRegistry registry;

    @Mock
    private StateMachineEngine engine;

    @Mock
    private StateStore store;

    @Mock
    private StateChangeRecorder recorder;

    private Vehicle vehicle;
    private ConcurrentTransitionConflictException conflict;

    @BeforeEach
    void setUp() {
        vehicle = new Vehicle("v-1");
        vehicle.assignState(PARKED);
        conflict = new ConcurrentTransitionConflictException(vehicle.recordId(), PARKED, IDLING);
    }

    private DefaultLifecycleService serviceWith(ConflictRetryConfig config) {
        return new DefaultLifecycleService(registry, engine, store, recorder, config);
    }

    private ConflictRetryConfig fastRetry(int maxAttempts) {
        return new ConflictRetryConfig(maxAttempts, 1, 2, 0.0);
    }

    @Test
    @DisplayName("재시도를 모두 소진하면 마지막 충돌을 전파한다")
    void 재시도소진_충돌전파() {
        // given
        when(engine.fire(vehicle, "ignite")).thenThrow(conflict);
        when(store.readCurrentState(vehicle)).thenReturn(IDLING);

        // when & then
        assertThatThrownBy(() -> serviceWith(fastRetry(3)).fire(vehicle, "ignite"))
            .isSameAs(conflict);

        verify(engine, times(3)).fire(vehicle, "ignite");
        verify(store, times(2)).readCurrentState(vehicle);
    }

    @Test
    @DisplayName("충돌 후 저장된 상태로 슬롯을 갱신하고 다시 발생시킨다")
    void 충돌후_갱신_재발생() {
        // given
        FireOutcome applied = new Applied(vehicle.recordId(), EventName.of("idle"), IDLING, IDLING);
        when(engine.fire(vehicle, "idle"))
            .thenThrow(conflict)
            .thenReturn(applied);
        when(store.readCurrentState(vehicle)).thenReturn(IDLING);

        // when
        FireOutcome outcome = serviceWith(fastRetry(3)).fire(vehicle, "idle");

        // then
        assertThat(outcome).isSameAs(applied);
        assertThat(vehicle.currentState()).isEqualTo(IDLING);

        InOrder inOrder = inOrder(engine, store);
        inOrder.verify(engine).fire(vehicle, "idle");
        inOrder.verify(store).readCurrentState(vehicle);
        inOrder.verify(engine).fire(vehicle, "idle");
    }

    @Test
    @DisplayName("maxAttempts=1 이면 재시도 없이 충돌을 전파한다")
    void 재시도없음_즉시전파() {
        // given
        when(engine.fire(vehicle, "ignite")).thenThrow(conflict);

        // when & then
        assertThatThrownBy(() -> serviceWith(ConflictRetryConfig.noRetry()).fire(vehicle, "ignite"))
            .isSameAs(conflict);

        verify(store, never()).readCurrentState(vehicle);
    }

    @Test
    @DisplayName("저장되지 않은 레코드의 충돌은 재시도 없이 전파한다")
    void 미저장레코드_충돌_즉시전파() {
        // given
        ConcurrentTransitionConflictException missing =
            new ConcurrentTransitionConflictException(vehicle.recordId(), PARKED, null);
        when(engine.fire(vehicle, "ignite")).thenThrow(missing);

        // when & then
        assertThatThrownBy(() -> serviceWith(fastRetry(3)).fire(vehicle, "ignite"))
            .isSameAs(missing);

        verify(engine, times(1)).fire(vehicle, "ignite");
        verify(store, never()).readCurrentState(vehicle);
        assertThat(vehicle.currentState()).isEqualTo(PARKED);
    }

    @Test
    @DisplayName("재조회한 상태가 없으면 슬롯을 비우지 않고 충돌을 전파한다")
    void 재조회결과없음_충돌전파() {
        // given
        when(engine.fire(vehicle, "ignite")).thenThrow(conflict);
        when(store.readCurrentState(vehicle)).thenReturn(null);

        // when & then
        assertThatThrownBy(() -> serviceWith(fastRetry(3)).fire(vehicle, "ignite"))
            .isSameAs(conflict);

        verify(engine, times(1)).fire(vehicle, "ignite");
        assertThat(vehicle.currentState()).isEqualTo(PARKED);
    }

    @Test
    @DisplayName("충돌이 아닌 예외는 재시도하지 않는다")
    void 충돌아닌예외_재시도안함() {
        // given
        EventNotActiveException notActive = new EventNotActiveException(Vehicle.class, "reverse");
        when(engine.fire(vehicle, "reverse")).thenThrow(notActive);

        // when & then
        assertThatThrownBy(() -> serviceWith(fastRetry(3)).fire(vehicle, "reverse"))
            .isSameAs(notActive);

        verify(engine, times(1)).fire(vehicle, "reverse");
        verify(store, never()).readCurrentState(vehicle);
    }

    @Test
    @DisplayName("생성자는 null 인자를 거부한다")
    void 생성자_null거부() {
        assertThatThrownBy(() -> new DefaultLifecycleService(registry, engine, store, recorder, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("retryConfig cannot be null");
        assertThatThrownBy(() -> new DefaultLifecycleService(registry, null, store, recorder, fastRetry(1)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("engine cannot be null");
    }
}
