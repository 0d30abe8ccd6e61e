package com.ryuqq.lifecycle.core.outcome;

import com.ryuqq.lifecycle.core.exception.ConcurrentTransitionConflictException;
import com.ryuqq.lifecycle.core.model.EventName;
import com.ryuqq.lifecycle.core.model.RecordId;

/**
 * 거부 결과.
 *
 * <p>조회 실패, 콜백 예외, 동시 전이 충돌 등으로 전이가 중단되었음을 나타냅니다.
 * 원자 단위는 롤백되었고 레코드의 상태 슬롯은 복원되었습니다.</p>
 *
 * @param recordId 레코드 식별자
 * @param event 이벤트 (이름 형식이 잘못되어 거부된 경우 null)
 * @param error 원인 예외
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Rejected(
    RecordId recordId,
    EventName event,
    RuntimeException error
) implements FireOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException recordId 또는 error가 null인 경우
     */
    public Rejected {
        if (recordId == null) {
            throw new IllegalArgumentException("recordId cannot be null");
        }
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
    }

    /**
     * 동시 전이 충돌로 거부되었는지 확인.
     *
     * @return 재조회 후 재시도할 수 있는 충돌이면 true
     */
    public boolean isConflict() {
        return error instanceof ConcurrentTransitionConflictException;
    }
}
