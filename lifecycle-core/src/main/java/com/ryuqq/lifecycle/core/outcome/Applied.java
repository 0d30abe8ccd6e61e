package com.ryuqq.lifecycle.core.outcome;

import com.ryuqq.lifecycle.core.model.EventName;
import com.ryuqq.lifecycle.core.model.RecordId;
import com.ryuqq.lifecycle.core.model.StateName;

/**
 * 전이 적용 결과.
 *
 * @param recordId 레코드 식별자
 * @param event 이벤트
 * @param from 이전 상태
 * @param to 새 상태 (자기 전이면 from과 같음)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Applied(
    RecordId recordId,
    EventName event,
    StateName from,
    StateName to
) implements FireOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필드가 null인 경우
     */
    public Applied {
        if (recordId == null) {
            throw new IllegalArgumentException("recordId cannot be null");
        }
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        if (from == null) {
            throw new IllegalArgumentException("from cannot be null");
        }
        if (to == null) {
            throw new IllegalArgumentException("to cannot be null");
        }
    }

    /**
     * 자기 전이인지 확인.
     *
     * @return from과 to가 같으면 true
     */
    public boolean isSelfTransition() {
        return from.equals(to);
    }
}
