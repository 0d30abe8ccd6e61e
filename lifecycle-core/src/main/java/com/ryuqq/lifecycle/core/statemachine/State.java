package com.ryuqq.lifecycle.core.statemachine;

import com.ryuqq.lifecycle.core.callback.ConditionalCallback;
import com.ryuqq.lifecycle.core.model.StateName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 활성화된 상태 정의.
 *
 * <p>State는 {@code (ownerType, name)}으로 식별되며, 단계별 조건부 콜백 목록을 가집니다.
 * 생성 후 변경되지 않으며, 하위 타입에 상속될 때는 공유되지 않고 복제됩니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>콜백은 선언 순서대로 실행됩니다.</li>
 *   <li>{@link #reownedBy(Class)}와 {@link #withCallbacks(StateCallbacks)}는 새 인스턴스를 반환하며
 *       원본의 콜백 목록에 영향을 주지 않습니다.</li>
 * </ul>
 *
 * @param <R> 소유 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class State<R> {

    private final Class<R> ownerType;
    private final StateName name;
    private final Map<StatePhase, List<ConditionalCallback<? super R>>> callbacks;

    State(Class<R> ownerType, StateName name, Map<StatePhase, List<ConditionalCallback<? super R>>> callbacks) {
        if (ownerType == null) {
            throw new IllegalArgumentException("ownerType cannot be null");
        }
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        this.ownerType = ownerType;
        this.name = name;
        this.callbacks = copyOf(callbacks);
    }

    /**
     * 소유 타입 조회.
     *
     * @return 소유 타입
     */
    public Class<R> ownerType() {
        return ownerType;
    }

    /**
     * 상태 이름 조회.
     *
     * @return 상태 이름
     */
    public StateName name() {
        return name;
    }

    /**
     * 단계별 콜백 목록 조회.
     *
     * @param phase 콜백 단계
     * @return 선언 순서의 불변 목록 (없으면 빈 목록)
     */
    public List<ConditionalCallback<? super R>> callbacks(StatePhase phase) {
        return callbacks.get(phase);
    }

    /**
     * 단계의 콜백 중 조건을 만족하는 것을 선언 순서대로 실행.
     *
     * @param phase 콜백 단계
     * @param record 대상 레코드
     * @param args fire 호출 인자
     */
    public void run(StatePhase phase, R record, List<Object> args) {
        for (ConditionalCallback<? super R> callback : callbacks.get(phase)) {
            callback.runIfApplicable(record, args);
        }
    }

    /**
     * 하위 타입 소유로 복제.
     *
     * @param subclass 새 소유 타입
     * @param <S> 하위 타입
     * @return 콜백 목록을 복사한 새 State
     */
    public <S extends R> State<S> reownedBy(Class<S> subclass) {
        Map<StatePhase, List<ConditionalCallback<? super S>>> copied = new EnumMap<>(StatePhase.class);
        for (StatePhase phase : StatePhase.values()) {
            copied.put(phase, new ArrayList<>(callbacks.get(phase)));
        }
        return new State<>(subclass, name, copied);
    }

    /**
     * 콜백을 추가한 새 State 생성.
     *
     * @param additions 추가할 콜백
     * @return 기존 콜백 뒤에 추가 콜백이 붙은 새 State
     */
    public State<R> withCallbacks(StateCallbacks<R> additions) {
        Map<StatePhase, List<ConditionalCallback<? super R>>> merged = new EnumMap<>(StatePhase.class);
        for (StatePhase phase : StatePhase.values()) {
            List<ConditionalCallback<? super R>> list = new ArrayList<>(callbacks.get(phase));
            list.addAll(additions.callbacks(phase));
            merged.put(phase, list);
        }
        return new State<>(ownerType, name, merged);
    }

    private static <R> Map<StatePhase, List<ConditionalCallback<? super R>>> copyOf(
            Map<StatePhase, List<ConditionalCallback<? super R>>> source) {
        Map<StatePhase, List<ConditionalCallback<? super R>>> copy = new EnumMap<>(StatePhase.class);
        for (StatePhase phase : StatePhase.values()) {
            List<ConditionalCallback<? super R>> list = source == null ? null : source.get(phase);
            if (list == null) {
                copy.put(phase, Collections.emptyList());
            } else {
                copy.put(phase, Collections.unmodifiableList(new ArrayList<>(list)));
            }
        }
        return Collections.unmodifiableMap(copy);
    }

    @Override
    public String toString() {
        return "State{" + ownerType.getSimpleName() + "#" + name + '}';
    }
}
