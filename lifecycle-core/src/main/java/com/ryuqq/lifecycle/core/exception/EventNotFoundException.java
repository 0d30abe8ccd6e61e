package com.ryuqq.lifecycle.core.exception;

/**
 * Catalog에 선언되지 않은 이벤트 이름을 정의하려 한 경우.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class EventNotFoundException extends StateMachineException {

    public EventNotFoundException(Class<?> ownerType, String name) {
        super(String.format("Couldn't find %s event with name=\"%s\"", ownerName(ownerType), name));
    }
}
