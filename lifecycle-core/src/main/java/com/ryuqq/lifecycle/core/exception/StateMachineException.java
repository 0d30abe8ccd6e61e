package com.ryuqq.lifecycle.core.exception;

/**
 * 상태 머신 예외의 최상위 타입.
 *
 * <p>모든 상태 머신 예외는 호출자에게 전달되는 로컬 실패 신호이며,
 * 엔진은 전이 실패를 조용히 무시하지 않습니다.</p>
 *
 * <p><strong>분류:</strong></p>
 * <ul>
 *   <li>설정 시점: {@link StateNotFoundException}, {@link EventNotFoundException},
 *       {@link StateAlreadyActiveException}, {@link EventAlreadyActiveException},
 *       {@link NoInitialStateException}</li>
 *   <li>실행 시점: {@link StateNotActiveException}, {@link EventNotActiveException},
 *       {@link ConcurrentTransitionConflictException}</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class StateMachineException extends RuntimeException {

    protected StateMachineException(String message) {
        super(message);
    }

    protected StateMachineException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 소유 타입 이름을 메시지용으로 변환.
     *
     * @param ownerType 소유 타입
     * @return 단순 클래스 이름
     */
    protected static String ownerName(Class<?> ownerType) {
        return ownerType == null ? "<unknown>" : ownerType.getSimpleName();
    }
}
