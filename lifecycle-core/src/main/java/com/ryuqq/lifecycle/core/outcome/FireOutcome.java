package com.ryuqq.lifecycle.core.outcome;

import com.ryuqq.lifecycle.core.model.EventName;
import com.ryuqq.lifecycle.core.model.RecordId;

/**
 * 이벤트 발생(fire) 결과.
 *
 * <p>FireOutcome은 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Applied}: 전이가 선택되어 커밋됨</li>
 *   <li>{@link NoMatch}: 현재 상태에서 적용 가능한 전이가 없음 (오류 아님, 레코드와 이력 변경 없음)</li>
 *   <li>{@link Rejected}: 오류로 전이가 중단되고 롤백됨</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 허용되는 구현이 컴파일 타임에 고정됩니다.</p>
 *
 * <pre>
 * FireOutcome outcome = engine.attempt(car, "ignite");
 * if (outcome.isApplied()) {
 *     Applied applied = (Applied) outcome;
 *     log.info("{} -&gt; {}", applied.from(), applied.to());
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface FireOutcome permits Applied, NoMatch, Rejected {

    /**
     * 대상 레코드 식별자.
     *
     * @return RecordId
     */
    RecordId recordId();

    /**
     * 발생시킨 이벤트.
     *
     * @return EventName
     */
    EventName event();

    /**
     * 전이가 적용되었는지 확인.
     *
     * @return 적용 여부
     */
    default boolean isApplied() {
        return this instanceof Applied;
    }

    /**
     * 적용 가능한 전이가 없었는지 확인.
     *
     * @return 미적용 여부
     */
    default boolean isNoMatch() {
        return this instanceof NoMatch;
    }

    /**
     * 오류로 거부되었는지 확인.
     *
     * @return 거부 여부
     */
    default boolean isRejected() {
        return this instanceof Rejected;
    }
}
