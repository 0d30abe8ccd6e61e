package com.ryuqq.lifecycle.core.engine;

import com.ryuqq.lifecycle.core.exception.ConcurrentTransitionConflictException;
import com.ryuqq.lifecycle.core.exception.EventNotActiveException;
import com.ryuqq.lifecycle.core.exception.StateNotActiveException;
import com.ryuqq.lifecycle.core.model.EventName;
import com.ryuqq.lifecycle.core.model.StateName;
import com.ryuqq.lifecycle.core.outcome.Applied;
import com.ryuqq.lifecycle.core.outcome.FireOutcome;
import com.ryuqq.lifecycle.core.outcome.NoMatch;
import com.ryuqq.lifecycle.core.outcome.Rejected;
import com.ryuqq.lifecycle.core.spi.AtomicUnit;
import com.ryuqq.lifecycle.core.spi.StateChangeRecorder;
import com.ryuqq.lifecycle.core.spi.StateStore;
import com.ryuqq.lifecycle.core.statemachine.StateMachineRegistry;
import com.ryuqq.lifecycle.core.support.Door;
import com.ryuqq.lifecycle.core.support.DoorMachines;
import com.ryuqq.lifecycle.core.support.SlidingDoor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * StateMachineEngine 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("StateMachineEngine 테스트")
class StateMachineEngineTest {

    private static final StateName CLOSED = StateName.of("closed");
    private static final StateName OPEN = StateName.of("open");

    @Mock
    private StateStore store;

    @Mock
    private AtomicUnit unit;

    @Mock
    private StateChangeRecorder recorder;

    private StateMachineEngine engine;

    @BeforeEach
    void setUp() {
        StateMachineRegistry registry = new StateMachineRegistry();
        registry.register(DoorMachines.door());
        engine = new StateMachineEngine(registry, store, recorder,
            Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    @DisplayName("전이가 선택되면 Applied 를 돌려주고 슬롯을 갱신한다")
    void fire_selected_returnsApplied() {
        // given
        Door door = new Door("d-1", "closed");
        when(store.begin()).thenReturn(unit);

        // when
        FireOutcome outcome = engine.fire(door, "open");

        // then
        assertThat(outcome).isInstanceOf(Applied.class);
        assertThat(((Applied) outcome).to()).isEqualTo(OPEN);
        assertThat(door.currentState()).isEqualTo(OPEN);
        verify(store).compareAndSetState(unit, door, CLOSED, OPEN);
    }

    @Test
    @DisplayName("적용 가능한 전이가 없으면 NoMatch 이고 저장소를 건드리지 않는다")
    void fire_noMatch_touchesNothing() {
        // given
        Door door = new Door("d-2", "open");

        // when
        FireOutcome outcome = engine.fire(door, "lock");

        // then
        assertThat(outcome).isEqualTo(new NoMatch(door.recordId(), EventName.of("lock"), OPEN));
        assertThat(door.currentState()).isEqualTo(OPEN);
        verifyNoInteractions(store, recorder);
    }

    @Test
    @DisplayName("비활성 이벤트는 EventNotActiveException 을 그대로 던진다")
    void fire_inactiveEvent_throws() {
        Door door = new Door("d-3", "closed");

        assertThatThrownBy(() -> engine.fire(door, "kick"))
            .isInstanceOf(EventNotActiveException.class)
            .hasMessage("Couldn't find active Door event with name=\"kick\"");
        verifyNoInteractions(store);
    }

    @Test
    @DisplayName("현재 상태가 비활성이면 StateNotActiveException 을 그대로 던진다")
    void fire_inactiveCurrentState_throws() {
        Door door = new Door("d-4", "broken");

        assertThatThrownBy(() -> engine.fire(door, "open"))
            .isInstanceOf(StateNotActiveException.class);
        verifyNoInteractions(store);
    }

    @Test
    @DisplayName("attempt 는 오류를 Rejected 로 돌려준다")
    void attempt_error_returnsRejected() {
        // given
        Door door = new Door("d-5", "closed");
        when(store.begin()).thenReturn(unit);
        doThrow(new ConcurrentTransitionConflictException(door.recordId(), CLOSED, OPEN))
            .when(store).compareAndSetState(unit, door, CLOSED, OPEN);

        // when
        FireOutcome outcome = engine.attempt(door, "open");

        // then
        assertThat(outcome.isRejected()).isTrue();
        assertThat(((Rejected) outcome).isConflict()).isTrue();
        verify(unit).close();
    }

    @Test
    @DisplayName("형식이 잘못된 이벤트 이름은 EventNotActiveException 으로 거부된다")
    void fire_malformedEventName_throwsEventNotActive() {
        Door door = new Door("d-6", "closed");

        assertThatThrownBy(() -> engine.fire(door, "Open"))
            .isInstanceOf(EventNotActiveException.class)
            .hasMessage("Couldn't find active Door event with name=\"Open\"");
        verifyNoInteractions(store);
    }

    @Test
    @DisplayName("attempt 는 형식이 잘못된 이벤트 이름을 Rejected 로 돌려준다")
    void attempt_malformedEventName_returnsRejected() {
        // given
        Door door = new Door("d-6", "closed");

        // when
        FireOutcome outcome = engine.attempt(door, "Not An Event");

        // then
        assertThat(outcome.isRejected()).isTrue();
        Rejected rejected = (Rejected) outcome;
        assertThat(rejected.event()).isNull();
        assertThat(rejected.error()).isInstanceOf(EventNotActiveException.class);
        assertThat(door.currentState()).isEqualTo(CLOSED);
        verifyNoInteractions(store);
    }

    @Test
    @DisplayName("attempt 는 비활성 이벤트를 이벤트 이름과 함께 Rejected 로 돌려준다")
    void attempt_inactiveEvent_returnsRejectedWithName() {
        Door door = new Door("d-6", "closed");

        FireOutcome outcome = engine.attempt(door, "kick");

        assertThat(outcome.isRejected()).isTrue();
        assertThat(outcome.event()).isEqualTo(EventName.of("kick"));
    }

    @Test
    @DisplayName("슬롯이 비어 있으면 stateOf 는 초기 상태를 돌려주고 슬롯은 비워 둔다")
    void stateOf_emptySlot_returnsInitial() {
        Door door = new Door("d-7");

        assertThat(engine.stateOf(door)).isEqualTo(CLOSED);
        assertThat(door.currentState()).isNull();
    }

    @Test
    @DisplayName("assignInitialState 는 빈 슬롯에만 초기 상태를 대입한다")
    void assignInitialState_onlyWhenEmpty() {
        Door fresh = new Door("d-8");
        Door existing = new Door("d-9", "open");

        assertThat(engine.assignInitialState(fresh)).isEqualTo(CLOSED);
        assertThat(fresh.currentState()).isEqualTo(CLOSED);
        assertThat(engine.assignInitialState(existing)).isEqualTo(OPEN);
    }

    @Test
    @DisplayName("하위 타입 레코드는 상위 타입의 정의로 처리된다")
    void fire_subtypeWithoutOwnMachine_usesParentMachine() {
        // given
        SlidingDoor door = new SlidingDoor("s-1", "closed");
        when(store.begin()).thenReturn(unit);

        // when
        FireOutcome outcome = engine.fire(door, "open");

        // then
        assertThat(outcome.isApplied()).isTrue();
        assertThat(engine.machineOf(door).ownerType()).isEqualTo(Door.class);
    }

    @Test
    @DisplayName("등록되지 않은 타입은 IllegalStateException")
    void fire_unregisteredType_throws() {
        StateMachineEngine empty = new StateMachineEngine(new StateMachineRegistry(), store, recorder, Clock.systemUTC());

        assertThatThrownBy(() -> empty.fire(new Door("d-10", "closed"), "open"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("No state machine registered");
        verify(store, never()).begin();
        verify(recorder, never()).append(any(), any(), any());
    }
}
