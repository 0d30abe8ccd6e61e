package com.ryuqq.lifecycle.core.exception;

/**
 * 이름으로 조회한 이벤트가 해당 소유 타입에 활성화되어 있지 않은 경우.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class EventNotActiveException extends StateMachineException {

    public EventNotActiveException(Class<?> ownerType, String name) {
        super(String.format("Couldn't find active %s event with name=\"%s\"", ownerName(ownerType), name));
    }
}
