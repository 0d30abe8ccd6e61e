package com.ryuqq.lifecycle.core.model;

import java.util.regex.Pattern;

/**
 * 이벤트 이름.
 *
 * <p>EventName은 소유 타입 내에서 Event를 식별합니다.
 * 레코드에 이벤트를 발생(fire)시킬 때 이 이름으로 Event를 조회합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>EventName.of("park")</li>
 *   <li>EventName.of("shift_up")</li>
 * </ul>
 *
 * <p><strong>유효성 검증:</strong> {@link StateName}과 동일한 규칙 (소문자 식별자, 1~64자)</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class EventName {

    private static final Pattern VALID_PATTERN = Pattern.compile("^[a-z][a-z0-9_]*$");

    private final String value;

    private EventName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("EventName cannot be null or blank");
        }
        if (value.length() > 64) {
            throw new IllegalArgumentException("EventName length cannot exceed 64 characters");
        }
        if (!VALID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException(
                "EventName must start with a lowercase letter and contain only lowercase letters, digits and underscores: " + value
            );
        }
        this.value = value;
    }

    /**
     * EventName 생성.
     *
     * @param value 이벤트 이름 (예: park, ignite)
     * @return EventName 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static EventName of(String value) {
        return new EventName(value);
    }

    /**
     * 문자열이 EventName 형식을 만족하는지 확인.
     *
     * @param value 검사할 값
     * @return {@link #of(String)}가 성공할 값이면 true
     */
    public static boolean isValid(String value) {
        return value != null && !value.isBlank() && value.length() <= 64 && VALID_PATTERN.matcher(value).matches();
    }

    /**
     * EventName 값 조회.
     *
     * @return EventName 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EventName eventName = (EventName) o;
        return value.equals(eventName.value);
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
