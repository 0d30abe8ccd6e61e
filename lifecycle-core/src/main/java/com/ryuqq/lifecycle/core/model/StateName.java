package com.ryuqq.lifecycle.core.model;

import java.util.regex.Pattern;

/**
 * 상태 이름.
 *
 * <p>StateName은 소유 타입 내에서 State를 식별하며,
 * 레코드의 현재 상태 슬롯에 저장되는 값이기도 합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>StateName.of("parked")</li>
 *   <li>StateName.of("first_gear")</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~64자</li>
 *   <li>패턴: 소문자로 시작, 소문자/숫자/언더스코어만 허용 (예: parked, first_gear)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StateName {

    private static final Pattern VALID_PATTERN = Pattern.compile("^[a-z][a-z0-9_]*$");

    private final String value;

    private StateName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("StateName cannot be null or blank");
        }
        if (value.length() > 64) {
            throw new IllegalArgumentException("StateName length cannot exceed 64 characters");
        }
        if (!VALID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException(
                "StateName must start with a lowercase letter and contain only lowercase letters, digits and underscores: " + value
            );
        }
        this.value = value;
    }

    /**
     * StateName 생성.
     *
     * @param value 상태 이름 (예: parked, idling)
     * @return StateName 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static StateName of(String value) {
        return new StateName(value);
    }

    /**
     * StateName 값 조회.
     *
     * @return StateName 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StateName stateName = (StateName) o;
        return value.equals(stateName.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
