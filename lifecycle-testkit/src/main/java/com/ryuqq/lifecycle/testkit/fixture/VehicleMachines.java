package com.ryuqq.lifecycle.testkit.fixture;

import com.ryuqq.lifecycle.core.model.Catalog;
import com.ryuqq.lifecycle.core.statemachine.EventSpec;
import com.ryuqq.lifecycle.core.statemachine.StateMachine;
import com.ryuqq.lifecycle.core.statemachine.StateMachineRegistry;

import java.util.List;

/**
 * State machine definitions for the fixture records.
 *
 * <p>Every state and event of the vehicle machine writes to the record's {@link CallbackTrace}
 * with labels {@code before_exit:<state>}, {@code before_enter:<state>}, {@code before:<event>},
 * {@code after_exit:<state>}, {@code after_enter:<state>} and {@code after:<event>}.</p>
 *
 * <pre>
 * Vehicle (initial: parked)
 *   ignite      parked -&gt; idling
 *   shift_up    idling -&gt; first_gear, first_gear -&gt; second_gear
 *   shift_down  second_gear -&gt; first_gear, first_gear -&gt; idling
 *   park        idling, first_gear -&gt; parked
 *   crash       first_gear, second_gear -&gt; stalled   (only if insured)
 *   repair      stalled -&gt; parked                     (only if auto shop open)
 *               stalled -&gt; idling
 *   idle        any -&gt; idling
 *
 * Car extends Vehicle
 *   + state backing_up, event reverse (parked, idling -&gt; backing_up)
 *   + extra after_enter on idling: "car:after_enter:idling"
 *
 * Bicycle (initial: docked or riding, computed; no history)
 *   ride  docked -&gt; riding
 *   dock  riding -&gt; docked
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class VehicleMachines {

    public static final Catalog VEHICLE_CATALOG = Catalog.of(
        List.of("parked", "idling", "first_gear", "second_gear", "stalled"),
        List.of("ignite", "shift_up", "shift_down", "park", "crash", "repair", "idle")
    );

    public static final Catalog CAR_CATALOG = VEHICLE_CATALOG
        .withStates("backing_up")
        .withEvents("reverse");

    public static final Catalog BICYCLE_CATALOG = Catalog.of(
        List.of("docked", "riding"),
        List.of("ride", "dock")
    );

    private VehicleMachines() {
    }

    /**
     * Registers the Vehicle, Car and Bicycle machines.
     *
     * @param registry target registry
     */
    public static void registerAll(StateMachineRegistry registry) {
        registry.register(vehicle());
        registry.register(car(registry));
        registry.register(bicycle());
    }

    /**
     * Builds the traced Vehicle machine.
     *
     * @return vehicle machine
     */
    public static StateMachine<Vehicle> vehicle() {
        StateMachine.Builder<Vehicle> builder = StateMachine.builder(Vehicle.class, VEHICLE_CATALOG)
            .initialState("parked");
        for (String state : List.of("parked", "idling", "first_gear", "second_gear", "stalled")) {
            builder.state(state, s -> s
                .beforeExit((v, args) -> v.trace().record("before_exit:" + state, args))
                .beforeEnter((v, args) -> v.trace().record("before_enter:" + state, args))
                .afterExit((v, args) -> v.trace().record("after_exit:" + state, args))
                .afterEnter((v, args) -> v.trace().record("after_enter:" + state, args)));
        }
        return builder
            .event("ignite", e -> traced(e, "ignite").transitionTo("idling").from("parked"))
            .event("shift_up", e -> {
                traced(e, "shift_up");
                e.transitionTo("first_gear").from("idling");
                e.transitionTo("second_gear").from("first_gear");
            })
            .event("shift_down", e -> {
                traced(e, "shift_down");
                e.transitionTo("first_gear").from("second_gear");
                e.transitionTo("idling").from("first_gear");
            })
            .event("park", e -> traced(e, "park").transitionTo("parked").from("idling", "first_gear"))
            .event("crash", e -> traced(e, "crash")
                .transitionTo("stalled").from("first_gear", "second_gear").onlyIf(Vehicle::isInsured))
            .event("repair", e -> {
                traced(e, "repair");
                e.transitionTo("parked").from("stalled").onlyIf(Vehicle::isAutoShopOpen);
                e.transitionTo("idling").from("stalled");
            })
            .event("idle", e -> traced(e, "idle").transitionTo("idling"))
            .build();
    }

    /**
     * Builds the Car machine from the registered Vehicle machine.
     *
     * @param registry registry holding the Vehicle machine
     * @return car machine
     */
    public static StateMachine<Car> car(StateMachineRegistry registry) {
        return registry.inherit(Vehicle.class, Car.class, CAR_CATALOG)
            .amendState("idling", s -> s
                .afterEnter((car, args) -> car.trace().record("car:after_enter:idling", args)))
            .state("backing_up", s -> s
                .afterEnter((car, args) -> car.trace().record("after_enter:backing_up", args)))
            .event("reverse", e -> e.transitionTo("backing_up").from("parked", "idling"))
            .build();
    }

    /**
     * Builds the Bicycle machine.
     *
     * @return bicycle machine with a computed initial state and history disabled
     */
    public static StateMachine<Bicycle> bicycle() {
        return StateMachine.builder(Bicycle.class, BICYCLE_CATALOG)
            .initialState(bicycle -> bicycle.isDocked() ? "docked" : "riding")
            .recordChanges(false)
            .state("docked", s -> s
                .afterEnter((b, args) -> b.trace().record("after_enter:docked", args)))
            .state("riding", s -> s
                .afterEnter((b, args) -> b.trace().record("after_enter:riding", args)))
            .event("ride", e -> e.transitionTo("riding").from("docked"))
            .event("dock", e -> e.transitionTo("docked").from("riding"))
            .build();
    }

    private static EventSpec<Vehicle> traced(
            EventSpec<Vehicle> spec, String event) {
        return spec
            .before((v, args) -> v.trace().record("before:" + event, args))
            .after((v, args) -> v.trace().record("after:" + event, args));
    }
}
