package com.ryuqq.lifecycle.core.support;

import com.ryuqq.lifecycle.core.model.Catalog;
import com.ryuqq.lifecycle.core.statemachine.StateMachine;

import java.util.List;

/**
 * 테스트용 Door 상태 기계.
 *
 * <pre>
 * open    closed -&gt; open
 * close   open -&gt; closed
 * lock    closed -&gt; locked (only if hasKey)
 * unlock  locked -&gt; closed (only if hasKey), locked -&gt; locked
 * </pre>
 */
public final class DoorMachines {

    public static final Catalog CATALOG = Catalog.of(
        List.of("closed", "open", "locked", "broken"),
        List.of("open", "close", "lock", "unlock", "kick")
    );

    private DoorMachines() {
    }

    public static StateMachine.Builder<Door> builder() {
        return StateMachine.builder(Door.class, CATALOG)
            .initialState("closed")
            .states("closed", "open", "locked")
            .event("open", e -> e.transitionTo("open").from("closed"))
            .event("close", e -> e.transitionTo("closed").from("open"))
            .event("lock", e -> e.transitionTo("locked").from("closed").onlyIf(Door::hasKey))
            .event("unlock", e -> {
                e.transitionTo("closed").from("locked").onlyIf(Door::hasKey);
                e.transitionTo("locked").from("locked");
            });
    }

    public static StateMachine<Door> door() {
        return builder().build();
    }
}
