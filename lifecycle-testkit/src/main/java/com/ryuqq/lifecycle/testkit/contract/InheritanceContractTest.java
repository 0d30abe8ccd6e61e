package com.ryuqq.lifecycle.testkit.contract;

import com.ryuqq.lifecycle.core.model.StateChange;
import com.ryuqq.lifecycle.core.statemachine.StateMachine;
import com.ryuqq.lifecycle.core.statemachine.StatePhase;
import com.ryuqq.lifecycle.core.spi.StatefulRecord;
import com.ryuqq.lifecycle.testkit.fixture.Car;
import com.ryuqq.lifecycle.testkit.fixture.Vehicle;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: subtype machines are independent copies of their parent.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Car inherits every Vehicle state and event, owned by Car</li>
 *   <li>Callbacks added for Car never run for Vehicle</li>
 *   <li>Car-only events and states are unknown to Vehicle</li>
 *   <li>History entries name the machine's owner type</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class InheritanceContractTest extends AbstractContractTest {

    @Test
    void testInherit_CarOwnsCopiesOfVehicleDefinitions() {
        // Given
        StateMachine<StatefulRecord> vehicleMachine = engine.machineOf(new Vehicle("inherit-0"));
        StateMachine<StatefulRecord> carMachine = engine.machineOf(new Car("inherit-00"));

        // Then
        assertEquals(Car.class, carMachine.ownerType());
        assertTrue(carMachine.stateNames().containsAll(vehicleMachine.stateNames()));
        assertTrue(carMachine.eventNames().containsAll(vehicleMachine.eventNames()));
        assertEquals(Car.class, carMachine.state("idling").ownerType());
        assertEquals(Car.class, carMachine.event("ignite").ownerType());
        assertNotSame(vehicleMachine.state("idling"), carMachine.state("idling"));
        assertEquals(1, vehicleMachine.state("idling").callbacks(StatePhase.AFTER_ENTER).size());
        assertEquals(2, carMachine.state("idling").callbacks(StatePhase.AFTER_ENTER).size());
    }

    @Test
    void testFire_CarRunsInheritedAndAmendedCallbacks() {
        // Given
        Car car = createCar("inherit-1");

        // When
        engine.fire(car, "ignite");

        // Then
        List<String> labels = car.trace().labels();
        assertTrue(labels.contains("after_enter:idling"));
        assertTrue(labels.contains("car:after_enter:idling"));
        assertTrue(labels.indexOf("after_enter:idling") < labels.indexOf("car:after_enter:idling"),
                "amended callbacks run after inherited ones");
        assertState(car, "idling");
    }

    @Test
    void testFire_VehicleDoesNotSeeCarAmendments() {
        // Given
        Vehicle vehicle = createVehicle("inherit-2");

        // When
        engine.fire(vehicle, "ignite");

        // Then
        assertFalse(vehicle.trace().labels().contains("car:after_enter:idling"));
    }

    @Test
    void testFire_CarOnlyEvent_AppliesToCar() {
        // Given
        Car car = createCar("inherit-3");

        // When
        engine.fire(car, "reverse");

        // Then
        assertState(car, "backing_up");
        List<StateChange> history = recorder.historyOf(car);
        assertEquals(Car.class, history.get(history.size() - 1).ownerType());
    }
}
