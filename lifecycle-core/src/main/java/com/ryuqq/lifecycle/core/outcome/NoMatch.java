package com.ryuqq.lifecycle.core.outcome;

import com.ryuqq.lifecycle.core.model.EventName;
import com.ryuqq.lifecycle.core.model.RecordId;
import com.ryuqq.lifecycle.core.model.StateName;

/**
 * 미적용 결과.
 *
 * <p>현재 상태에서 적격이며 가드를 통과하는 전이가 없었음을 나타냅니다.
 * 콜백은 실행되지 않았고 상태와 이력은 변경되지 않았습니다.</p>
 *
 * @param recordId 레코드 식별자
 * @param event 이벤트
 * @param currentState 평가 시점의 현재 상태
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record NoMatch(
    RecordId recordId,
    EventName event,
    StateName currentState
) implements FireOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필드가 null인 경우
     */
    public NoMatch {
        if (recordId == null) {
            throw new IllegalArgumentException("recordId cannot be null");
        }
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        if (currentState == null) {
            throw new IllegalArgumentException("currentState cannot be null");
        }
    }
}
