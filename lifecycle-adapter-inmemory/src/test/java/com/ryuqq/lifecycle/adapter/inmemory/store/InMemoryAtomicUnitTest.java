package com.ryuqq.lifecycle.adapter.inmemory.store;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryAtomicUnit 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@DisplayName("InMemoryAtomicUnit 테스트")
class InMemoryAtomicUnitTest {

    @Test
    @DisplayName("rollback() 은 undo 동작을 등록 역순으로 실행한다")
    void rollback_runsUndoActionsInReverseOrder() {
        // given
        List<String> executed = new ArrayList<>();
        InMemoryAtomicUnit unit = new InMemoryAtomicUnit();
        unit.onRollback(() -> executed.add("first"));
        unit.onRollback(() -> executed.add("second"));
        unit.onRollback(() -> executed.add("third"));

        // when
        unit.rollback();

        // then
        assertThat(executed).containsExactly("third", "second", "first");
        assertThat(unit.isActive()).isFalse();
    }

    @Test
    @DisplayName("commit() 후 close() 는 undo 동작을 실행하지 않는다")
    void close_afterCommit_doesNotRollBack() {
        // given
        List<String> executed = new ArrayList<>();
        List<String> committed = new ArrayList<>();

        // when
        try (InMemoryAtomicUnit unit = new InMemoryAtomicUnit()) {
            unit.onRollback(() -> executed.add("undo"));
            unit.onCommit(() -> committed.add("commit"));
            unit.commit();
        }

        // then
        assertThat(executed).isEmpty();
        assertThat(committed).containsExactly("commit");
    }

    @Test
    @DisplayName("commit 없이 close() 하면 롤백된다")
    void close_withoutCommit_rollsBack() {
        // given
        List<String> executed = new ArrayList<>();
        List<String> committed = new ArrayList<>();

        // when
        try (InMemoryAtomicUnit unit = new InMemoryAtomicUnit()) {
            unit.onRollback(() -> executed.add("undo"));
            unit.onCommit(() -> committed.add("commit"));
        }

        // then
        assertThat(executed).containsExactly("undo");
        assertThat(committed).isEmpty();
    }

    @Test
    @DisplayName("undo 동작이 실패해도 나머지 동작은 실행되고 첫 예외에 나머지가 suppressed로 붙는다")
    void rollback_whenUndoFails_runsRemainingAndAggregates() {
        // given
        List<String> executed = new ArrayList<>();
        InMemoryAtomicUnit unit = new InMemoryAtomicUnit();
        unit.onRollback(() -> executed.add("first"));
        unit.onRollback(() -> {
            throw new IllegalStateException("second failed");
        });
        unit.onRollback(() -> {
            throw new IllegalStateException("third failed");
        });

        // when & then
        assertThatThrownBy(unit::rollback)
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("third failed")
            .satisfies(e -> assertThat(e.getSuppressed()).hasSize(1));
        assertThat(executed).containsExactly("first");
    }

    @Test
    @DisplayName("종료된 unit 에 동작을 등록하거나 다시 commit 하면 예외가 발생한다")
    void finishedUnit_rejectsFurtherUse() {
        // given
        InMemoryAtomicUnit unit = new InMemoryAtomicUnit();
        unit.commit();

        // when & then
        assertThatThrownBy(unit::commit).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> unit.onRollback(() -> { })).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(unit::rollback)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("already committed");
    }

    @Test
    @DisplayName("rollback() 은 두 번 호출해도 undo 동작을 한 번만 실행한다")
    void rollback_isIdempotent() {
        // given
        List<String> executed = new ArrayList<>();
        InMemoryAtomicUnit unit = new InMemoryAtomicUnit();
        unit.onRollback(() -> executed.add("undo"));

        // when
        unit.rollback();
        unit.rollback();

        // then
        assertThat(executed).containsExactly("undo");
        assertThat(unit.pendingUndoCount()).isZero();
    }
}
