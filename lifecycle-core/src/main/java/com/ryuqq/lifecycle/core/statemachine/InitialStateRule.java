package com.ryuqq.lifecycle.core.statemachine;

import com.ryuqq.lifecycle.core.model.StateName;

import java.util.Optional;
import java.util.function.Function;

/**
 * 초기 상태 결정 규칙.
 *
 * <p>고정된 상태 이름이거나 레코드를 보고 이름을 계산하는 함수입니다.</p>
 *
 * @param <R> 소유 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class InitialStateRule<R> {

    private final StateName fixed;
    private final Function<? super R, String> resolver;

    private InitialStateRule(StateName fixed, Function<? super R, String> resolver) {
        this.fixed = fixed;
        this.resolver = resolver;
    }

    /**
     * 고정 초기 상태.
     *
     * @param state 상태 이름
     * @param <R> 소유 타입
     * @return InitialStateRule
     * @throws IllegalArgumentException state가 null인 경우
     */
    public static <R> InitialStateRule<R> fixed(StateName state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        return new InitialStateRule<>(state, null);
    }

    /**
     * 레코드별로 계산되는 초기 상태.
     *
     * @param resolver 레코드 → 상태 이름 함수
     * @param <R> 소유 타입
     * @return InitialStateRule
     * @throws IllegalArgumentException resolver가 null인 경우
     */
    public static <R> InitialStateRule<R> computed(Function<? super R, String> resolver) {
        if (resolver == null) {
            throw new IllegalArgumentException("resolver cannot be null");
        }
        return new InitialStateRule<>(null, resolver);
    }

    /**
     * 고정 초기 상태 조회 (빌드 시점 검증용).
     *
     * @return 고정 상태 (계산형이면 empty)
     */
    public Optional<StateName> fixedState() {
        return Optional.ofNullable(fixed);
    }

    /**
     * 레코드의 초기 상태 이름 결정.
     *
     * @param record 대상 레코드
     * @return 초기 상태 이름
     * @throws IllegalStateException 계산 함수가 null을 반환한 경우
     */
    public StateName resolve(R record) {
        if (fixed != null) {
            return fixed;
        }
        String name = resolver.apply(record);
        if (name == null) {
            throw new IllegalStateException("initial state resolver returned null for " + record);
        }
        return StateName.of(name);
    }

    /**
     * 하위 타입용으로 재타입.
     *
     * @param <S> 하위 타입
     * @return 같은 규칙
     */
    <S extends R> InitialStateRule<S> narrow() {
        return new InitialStateRule<S>(fixed, resolver);
    }
}
