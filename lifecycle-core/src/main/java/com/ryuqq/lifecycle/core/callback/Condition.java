package com.ryuqq.lifecycle.core.callback;

/**
 * 레코드에 대한 조건 (predicate).
 *
 * <p>전이 가드({@code onlyIf}/{@code unless})와 조건부 콜백의 조건은 모두 이 하나의 타입으로 표현됩니다.
 * 메서드 참조({@code Car::isSeatbeltOn})와 인라인 람다({@code car -> car.speed() == 0})
 * 모두 동일하게 Condition을 만족합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Condition&lt;Car&gt; seatbelt = Car::isSeatbeltOn;
 * Condition&lt;Car&gt; stopped = car -&gt; car.speed() == 0;
 *
 * Condition&lt;Car&gt; readyToPark = seatbelt.and(stopped);
 * </pre>
 *
 * @param <R> 레코드 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Condition<R> {

    /**
     * 조건 평가.
     *
     * @param record 평가 대상 레코드
     * @return 조건을 만족하면 true
     */
    boolean evaluate(R record);

    /**
     * 논리 부정.
     *
     * @return 이 조건의 부정
     */
    default Condition<R> negate() {
        return record -> !evaluate(record);
    }

    /**
     * 논리곱 (short-circuit).
     *
     * @param other 함께 만족해야 하는 조건
     * @return 두 조건의 논리곱
     * @throws IllegalArgumentException other가 null인 경우
     */
    default Condition<R> and(Condition<? super R> other) {
        if (other == null) {
            throw new IllegalArgumentException("other cannot be null");
        }
        return record -> evaluate(record) && other.evaluate(record);
    }

    /**
     * 항상 만족하는 조건.
     *
     * @param <R> 레코드 타입
     * @return 항상 true를 반환하는 조건
     */
    static <R> Condition<R> always() {
        return record -> true;
    }

    /**
     * 절대 만족하지 않는 조건.
     *
     * @param <R> 레코드 타입
     * @return 항상 false를 반환하는 조건
     */
    static <R> Condition<R> never() {
        return record -> false;
    }
}
