package com.ryuqq.lifecycle.core.statemachine;

import com.ryuqq.lifecycle.core.callback.Action;
import com.ryuqq.lifecycle.core.support.Door;
import com.ryuqq.lifecycle.core.support.DoorMachines;
import com.ryuqq.lifecycle.core.support.SlidingDoor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * StateMachineRegistry 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@DisplayName("StateMachineRegistry 테스트")
class StateMachineRegistryTest {

    private StateMachineRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new StateMachineRegistry();
    }

    @Test
    @DisplayName("등록되지 않은 하위 타입은 가장 가까운 상위 타입의 정의를 사용한다")
    void machineFor_walksSuperclassChain() {
        // given
        StateMachine<Door> door = registry.register(DoorMachines.door());

        // when & then
        assertThat(registry.machineFor(SlidingDoor.class)).isSameAs(door);
        assertThat(registry.isRegistered(Door.class)).isTrue();
        assertThat(registry.isRegistered(SlidingDoor.class)).isFalse();
    }

    @Test
    @DisplayName("레코드 인스턴스로 조회하면 해당 타입에 적용될 정의를 돌려준다")
    void machineForRecord_resolvesByRuntimeType() {
        // given
        StateMachine<Door> door = registry.register(DoorMachines.door());

        // when & then
        assertThat(registry.machineForRecord(new SlidingDoor("s-1", "closed"))).isSameAs(door);
        assertThatThrownBy(() -> registry.machineForRecord(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("record cannot be null");
    }

    @Test
    @DisplayName("같은 타입을 두 번 등록하면 예외가 발생한다")
    void register_duplicate_throws() {
        registry.register(DoorMachines.door());

        assertThatThrownBy(() -> registry.register(DoorMachines.door()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("already registered");
    }

    @Test
    @DisplayName("정의가 없는 타입 조회는 예외가 발생한다")
    void machineFor_unknownType_throws() {
        assertThatThrownBy(() -> registry.machineFor(Door.class))
            .isInstanceOf(IllegalStateException.class);
        assertThat(registry.findMachine(Door.class)).isEmpty();
    }

    @Test
    @DisplayName("inherit 는 부모 정의를 하위 타입 소유로 복제하고, 하위 타입의 변경은 부모에 영향을 주지 않는다")
    void inherit_copiesDefinitionsIndependently() {
        // given
        StateMachine<Door> door = registry.register(DoorMachines.door());

        // when
        StateMachine<SlidingDoor> sliding = registry.register(registry.inherit(Door.class, SlidingDoor.class)
            .amendState("open", s -> s.afterEnter(Action.of(d -> { })))
            .amendEvent("open", e -> e.transitionTo("open").from("locked"))
            .build());

        // then
        assertThat(sliding.ownerType()).isEqualTo(SlidingDoor.class);
        assertThat(sliding.state("open").ownerType()).isEqualTo(SlidingDoor.class);
        assertThat(sliding.state("open").callbacks(StatePhase.AFTER_ENTER)).hasSize(1);
        assertThat(door.state("open").callbacks(StatePhase.AFTER_ENTER)).isEmpty();
        assertThat(sliding.event("open").transitions()).hasSize(2);
        assertThat(door.event("open").transitions()).hasSize(1);
        assertThat(sliding.recordsChanges()).isEqualTo(door.recordsChanges());
        assertThat(registry.machineFor(SlidingDoor.class)).isSameAs(sliding);
    }

    @Test
    @DisplayName("상속받은 상태를 다시 정의하면 StateAlreadyActiveException")
    void inherit_redefineState_throws() {
        registry.register(DoorMachines.door());
        StateMachine.Builder<SlidingDoor> builder = registry.inherit(Door.class, SlidingDoor.class);

        assertThatThrownBy(() -> builder.state("open"))
            .isInstanceOf(com.ryuqq.lifecycle.core.exception.StateAlreadyActiveException.class)
            .hasMessageContaining("SlidingDoor");
    }

    @Test
    @DisplayName("부모가 등록되지 않았으면 inherit 는 예외가 발생한다")
    void inherit_unknownParent_throws() {
        assertThatThrownBy(() -> registry.inherit(Door.class, SlidingDoor.class))
            .isInstanceOf(IllegalStateException.class);
    }
}
