package com.ryuqq.lifecycle.testkit.fixture;

/**
 * Fixture subtype of {@link Vehicle} that adds reversing.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class Car extends Vehicle {

    public Car(String id) {
        super(id);
    }
}
