package com.ryuqq.lifecycle.core.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * StateChange Record 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class StateChangeTest {

    private static final RecordId ID = RecordId.of("car-1");
    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void initial_HasNoFromStateAndNoEvent() {
        // When
        StateChange change = StateChange.initial(ID, Object.class, StateName.of("parked"), NOW);

        // Then
        assertTrue(change.isInitial());
        assertNull(change.fromState());
        assertNull(change.event());
        assertEquals(StateName.of("parked"), change.toState());
    }

    @Test
    void transition_CarriesFromToAndEvent() {
        // When
        StateChange change = StateChange.transition(ID, Object.class,
            StateName.of("parked"), StateName.of("idling"), EventName.of("ignite"), NOW);

        // Then
        assertFalse(change.isInitial());
        assertEquals(EventName.of("ignite"), change.event());
    }

    @Test
    void constructor_FromWithoutEvent_ThrowsException() {
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
            () -> new StateChange(ID, Object.class, StateName.of("parked"), StateName.of("idling"), null, NOW));
        assertTrue(exception.getMessage().contains("both"));
    }

    @Test
    void transition_NullEvent_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> StateChange.transition(ID, Object.class,
            StateName.of("parked"), StateName.of("idling"), null, NOW));
    }

    @Test
    void constructor_NullToState_ThrowsException() {
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
            () -> StateChange.initial(ID, Object.class, null, NOW));
        assertTrue(exception.getMessage().contains("toState cannot be null"));
    }
}
