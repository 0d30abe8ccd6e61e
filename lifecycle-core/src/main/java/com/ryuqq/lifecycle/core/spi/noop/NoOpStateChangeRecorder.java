package com.ryuqq.lifecycle.core.spi.noop;

import com.ryuqq.lifecycle.core.model.StateChange;
import com.ryuqq.lifecycle.core.spi.AtomicUnit;
import com.ryuqq.lifecycle.core.spi.StateChangeRecorder;
import com.ryuqq.lifecycle.core.spi.StatefulRecord;

import java.util.Collections;
import java.util.List;

/**
 * StateChangeRecorder NoOp 구현.
 *
 * <p>상태 변경 기록을 선택하지 않은(recordChanges=false) 소유 타입에 사용됩니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>append(): 아무 동작 안 함</li>
 *   <li>historyOf(): 항상 빈 목록 반환</li>
 *   <li>hasHistory(): 항상 false 반환</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class NoOpStateChangeRecorder implements StateChangeRecorder {

    /**
     * 공유 인스턴스 (상태 없음).
     */
    public static final NoOpStateChangeRecorder INSTANCE = new NoOpStateChangeRecorder();

    @Override
    public void append(AtomicUnit unit, StatefulRecord record, StateChange change) {
        // NoOp
    }

    @Override
    public List<StateChange> historyOf(StatefulRecord record) {
        return Collections.emptyList();
    }

    @Override
    public boolean hasHistory(StatefulRecord record) {
        return false;
    }
}
