package com.ryuqq.lifecycle.core.exception;

import com.ryuqq.lifecycle.core.model.RecordId;
import com.ryuqq.lifecycle.core.model.StateName;

/**
 * 조건부 쓰기(compare-and-swap)가 오래된 from 상태를 감지한 경우.
 *
 * <p>저장소에 영속된 현재 상태가 전이 선택 시점에 관찰한 from 상태와 달라졌음을 의미합니다.
 * 원자적 작업 단위는 전부 롤백되며, 호출자는 현재 상태를 다시 읽고 재시도할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ConcurrentTransitionConflictException extends StateMachineException {

    private final RecordId recordId;
    private final StateName expected;
    private final StateName actual;

    public ConcurrentTransitionConflictException(RecordId recordId, StateName expected, StateName actual) {
        super(String.format("Concurrent transition conflict on %s: expected state %s but was %s", recordId, expected, actual));
        this.recordId = recordId;
        this.expected = expected;
        this.actual = actual;
    }

    public RecordId getRecordId() {
        return recordId;
    }

    public StateName getExpected() {
        return expected;
    }

    /**
     * 충돌 시점에 저장소에 있던 상태.
     *
     * @return 실제 상태 (레코드가 저장소에 없으면 null)
     */
    public StateName getActual() {
        return actual;
    }
}
