package com.ryuqq.lifecycle.core.callback;

import java.util.List;
import java.util.function.Consumer;

/**
 * 생명주기 콜백 동작.
 *
 * <p>상태의 enter/exit 콜백과 이벤트의 before/after 콜백이 실행하는 동작입니다.
 * {@code args}는 fire 호출자가 전달한 인자로, 엔진은 내용을 해석하지 않고 그대로 전달합니다.</p>
 *
 * <p>콜백이 던진 예외는 그대로 fire 호출자에게 전파되며, 진행 중인 원자적 작업 단위 전체가 롤백됩니다.</p>
 *
 * @param <R> 레코드 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Action<R> {

    /**
     * 콜백 실행.
     *
     * @param record 전이 대상 레코드
     * @param args fire 호출 인자 (불변, 비어 있을 수 있음)
     */
    void invoke(R record, List<Object> args);

    /**
     * 인자를 사용하지 않는 동작으로 Action 생성.
     *
     * <pre>
     * Action&lt;Car&gt; seatbelt = Action.of(Car::putOnSeatbelt);
     * </pre>
     *
     * @param consumer 레코드만 받는 동작
     * @param <R> 레코드 타입
     * @return Action 인스턴스
     * @throws IllegalArgumentException consumer가 null인 경우
     */
    static <R> Action<R> of(Consumer<? super R> consumer) {
        if (consumer == null) {
            throw new IllegalArgumentException("consumer cannot be null");
        }
        return (record, args) -> consumer.accept(record);
    }
}
