package com.ryuqq.lifecycle.core.exception;

/**
 * Catalog에 선언되지 않은 상태 이름을 정의하려 한 경우.
 *
 * <p>설정 시점 오류이며, 상태 머신 구성을 중단시킵니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StateNotFoundException extends StateMachineException {

    public StateNotFoundException(Class<?> ownerType, String name) {
        super(String.format("Couldn't find %s state with name=\"%s\"", ownerName(ownerType), name));
    }
}
