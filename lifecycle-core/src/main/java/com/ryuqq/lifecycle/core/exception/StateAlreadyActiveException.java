package com.ryuqq.lifecycle.core.exception;

/**
 * 같은 소유 타입에 이미 활성화된 상태 이름을 다시 정의한 경우.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StateAlreadyActiveException extends StateMachineException {

    public StateAlreadyActiveException(Class<?> ownerType, String name) {
        super(String.format("%s state with name=\"%s\" has already been defined", ownerName(ownerType), name));
    }
}
