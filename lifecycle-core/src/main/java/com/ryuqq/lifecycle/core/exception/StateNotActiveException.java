package com.ryuqq.lifecycle.core.exception;

/**
 * 이름으로 조회한 상태가 해당 소유 타입에 활성화되어 있지 않은 경우.
 *
 * <p>fire 시점에 발생하면 어떤 변경도 일어나기 전에 전이가 중단됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StateNotActiveException extends StateMachineException {

    public StateNotActiveException(Class<?> ownerType, String name) {
        super(String.format("Couldn't find active %s state with name=\"%s\"", ownerName(ownerType), name));
    }
}
