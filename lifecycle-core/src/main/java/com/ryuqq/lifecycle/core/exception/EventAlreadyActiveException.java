package com.ryuqq.lifecycle.core.exception;

/**
 * 같은 소유 타입에 이미 활성화된 이벤트 이름을 다시 정의한 경우.
 *
 * <p>상속받은 이벤트에 전이나 콜백을 추가하려면
 * {@code amendEvent}를 사용해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class EventAlreadyActiveException extends StateMachineException {

    public EventAlreadyActiveException(Class<?> ownerType, String name) {
        super(String.format("%s event with name=\"%s\" has already been defined", ownerName(ownerType), name));
    }
}
