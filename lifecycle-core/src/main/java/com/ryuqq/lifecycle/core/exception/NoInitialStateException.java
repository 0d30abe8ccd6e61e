package com.ryuqq.lifecycle.core.exception;

/**
 * 초기 상태 규칙 없이 상태 머신을 정의한 경우.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class NoInitialStateException extends StateMachineException {

    public NoInitialStateException(Class<?> ownerType) {
        super(String.format("No initial state was specified for %s", ownerName(ownerType)));
    }
}
