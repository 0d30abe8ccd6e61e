package com.ryuqq.lifecycle.testkit.fixture;

import com.ryuqq.lifecycle.core.model.StateName;
import com.ryuqq.lifecycle.core.statemachine.StateMachine;
import com.ryuqq.lifecycle.core.statemachine.StateMachineRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Sanity checks for the fixture machines shared by the contract tests.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class VehicleMachinesTest {

    @Test
    void testRegisterAll_WhenCalled_AllFixtureTypesRegistered() {
        // Given
        StateMachineRegistry registry = new StateMachineRegistry();

        // When
        VehicleMachines.registerAll(registry);

        // Then
        assertTrue(registry.isRegistered(Vehicle.class));
        assertTrue(registry.isRegistered(Car.class));
        assertTrue(registry.isRegistered(Bicycle.class));
    }

    @Test
    void testCarMachine_WhenDerivedFromVehicle_AddsReverseAndKeepsParentEvents() {
        // Given
        StateMachineRegistry registry = new StateMachineRegistry();
        registry.register(VehicleMachines.vehicle());

        // When
        StateMachine<Car> car = VehicleMachines.car(registry);

        // Then
        assertTrue(car.isActiveEvent("reverse"));
        assertTrue(car.isActiveEvent("ignite"));
        assertTrue(car.isActiveState("backing_up"));
        assertFalse(VehicleMachines.vehicle().isActiveState("backing_up"));
    }

    @Test
    void testBicycleMachine_WhenComputedInitialState_FollowsDockedFlag() {
        // Given
        StateMachine<Bicycle> bicycle = VehicleMachines.bicycle();

        // When & Then
        assertEquals(StateName.of("docked"), bicycle.initialStateFor(new Bicycle("b-1", true)).name());
        assertEquals(StateName.of("riding"), bicycle.initialStateFor(new Bicycle("b-2", false)).name());
        assertFalse(bicycle.recordsChanges(), "Bicycle machine should not record history");
    }

    @Test
    void testCallbackTrace_WhenArmed_ThrowsAtLabelAfterRecordingEarlierOnes() {
        // Given
        CallbackTrace trace = new CallbackTrace();
        trace.failAt("after_enter:idling");

        // When
        trace.record("before_exit:parked", List.of());
        IllegalStateException error = assertThrows(IllegalStateException.class,
            () -> trace.record("after_enter:idling", List.of("arg")));

        // Then
        assertTrue(error.getMessage().contains("after_enter:idling"));
        assertEquals(List.of("before_exit:parked"), trace.labels());

        trace.clear();
        assertTrue(trace.labels().isEmpty());
    }
}
