package com.ryuqq.lifecycle.core.model;

/**
 * 상태를 가진 레코드의 식별자.
 *
 * <p>RecordId는 저장소가 레코드를 구분하는 키이며,
 * 감사 로그(StateChange)가 어떤 레코드의 전이인지 연결하는 데 사용됩니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RecordId {

    private final String value;

    private RecordId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("RecordId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("RecordId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("RecordId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * RecordId 생성.
     *
     * @param value RecordId 값
     * @return RecordId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static RecordId of(String value) {
        return new RecordId(value);
    }

    /**
     * RecordId 값 조회.
     *
     * @return RecordId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RecordId recordId = (RecordId) o;
        return value.equals(recordId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "RecordId{" + value + '}';
    }
}
