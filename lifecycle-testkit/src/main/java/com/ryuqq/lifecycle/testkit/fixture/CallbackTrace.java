package com.ryuqq.lifecycle.testkit.fixture;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered log of callback invocations on a fixture record.
 *
 * <p>Callbacks registered by {@link VehicleMachines} write labels such as
 * {@code "before_exit:parked"} or {@code "after:ignite"}. A label can be armed with
 * {@link #failAt(String)} so that the callback producing it throws, which lets contracts
 * inject a failure at any step of the transition protocol.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CallbackTrace {

    private final List<String> labels = new ArrayList<>();
    private final List<List<Object>> arguments = new ArrayList<>();
    private String failingLabel;

    /**
     * Records a callback invocation.
     *
     * @param label callback label
     * @param args arguments passed to fire
     * @throws IllegalStateException if the label was armed with {@link #failAt(String)}
     */
    public synchronized void record(String label, List<Object> args) {
        if (label.equals(failingLabel)) {
            throw new IllegalStateException("Injected failure at " + label);
        }
        labels.add(label);
        arguments.add(List.copyOf(args));
    }

    /**
     * Arms a failure for the given label.
     *
     * @param label label whose callback must throw
     */
    public synchronized void failAt(String label) {
        this.failingLabel = label;
    }

    public synchronized List<String> labels() {
        return List.copyOf(labels);
    }

    /**
     * Returns the arguments seen by each recorded callback, in recording order.
     *
     * @return argument lists
     */
    public synchronized List<List<Object>> arguments() {
        return List.copyOf(arguments);
    }

    public synchronized void clear() {
        labels.clear();
        arguments.clear();
        failingLabel = null;
    }
}
