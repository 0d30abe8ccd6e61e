package com.ryuqq.lifecycle.application.service;

import com.ryuqq.lifecycle.core.model.StateChange;
import com.ryuqq.lifecycle.core.model.StateName;
import com.ryuqq.lifecycle.core.outcome.FireOutcome;
import com.ryuqq.lifecycle.core.spi.StatefulRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 레코드 생명주기 서비스 (호스트 진입점).
 *
 * <p>호스트 애플리케이션은 엔진을 직접 다루지 않고 이 인터페이스로
 * 레코드를 생성하고 이벤트를 발생시키며 상태를 조회합니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>생성: 초기 상태 할당, 저장, 초기 상태 액션 실행을 하나의 원자 단위로 처리</li>
 *   <li>이벤트 발생: 동시 전이 충돌 시 저장된 상태로 갱신 후 backoff 재시도</li>
 *   <li>조회: 현재 상태 확인, 상태별 개수, 상태 진입 시각, 전이 이력</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface LifecycleService {

    /**
     * 레코드를 생성합니다.
     *
     * <p>초기 상태가 비어 있으면 할당하고, 저장소에 insert한 뒤,
     * 이력이 없는 경우 초기 상태의 after_enter 콜백과 초기 이력 항목을 기록합니다.
     * 실패하면 전체가 롤백되고 레코드의 상태 슬롯도 복원됩니다.</p>
     *
     * @param record 생성할 레코드
     * @return 할당된 초기 상태
     * @throws IllegalArgumentException record가 null인 경우
     * @throws IllegalStateException 같은 레코드가 이미 저장되어 있는 경우
     */
    StateName create(StatefulRecord record);

    /**
     * 이벤트를 발생시킵니다.
     *
     * <p>동시 전이 충돌이 발생하면 저장된 현재 상태로 레코드를 갱신하고
     * 설정된 횟수까지 다시 시도합니다. 그 외 예외는 그대로 전파됩니다.</p>
     *
     * @param record 대상 레코드
     * @param eventName 이벤트 이름
     * @param args 콜백에 전달할 인자
     * @return 적용 결과 (Applied 또는 NoMatch)
     * @throws com.ryuqq.lifecycle.core.exception.ConcurrentTransitionConflictException 재시도를 모두 소진한 경우
     */
    FireOutcome fire(StatefulRecord record, String eventName, Object... args);

    /**
     * 레코드가 지정한 상태에 있는지 확인합니다.
     *
     * @param record 대상 레코드
     * @param stateName 상태 이름
     * @return 현재 상태가 stateName이면 true
     * @throws com.ryuqq.lifecycle.core.exception.StateNotActiveException 활성 상태가 아닌 경우
     */
    boolean isInState(StatefulRecord record, String stateName);

    /**
     * 지정한 타입(하위 타입 포함) 중 해당 상태에 있는 레코드 수.
     *
     * @param ownerType 레코드 타입
     * @param stateName 상태 이름
     * @return 레코드 수
     * @throws com.ryuqq.lifecycle.core.exception.StateNotActiveException 활성 상태가 아닌 경우
     */
    long countInState(Class<? extends StatefulRecord> ownerType, String stateName);

    /**
     * 레코드가 해당 상태에 진입한 시각.
     *
     * @param record 대상 레코드
     * @param stateName 상태 이름
     * @param occurrence 첫 진입 또는 마지막 진입
     * @return 진입 시각 (진입한 적이 없으면 empty)
     */
    Optional<Instant> enteredAt(StatefulRecord record, String stateName, Occurrence occurrence);

    /**
     * 레코드가 해당 상태에 진입한 모든 시각 (오래된 순).
     *
     * @param record 대상 레코드
     * @param stateName 상태 이름
     * @return 진입 시각 목록
     */
    List<Instant> enteredAtAll(StatefulRecord record, String stateName);

    /**
     * 레코드의 커밋된 전이 이력 (오래된 순).
     *
     * @param record 대상 레코드
     * @return 이력 (기록하지 않는 타입이면 비어 있음)
     */
    List<StateChange> historyOf(StatefulRecord record);
}
