package com.ryuqq.discovery.core.model;

/**
 * 연구 세션(Session)의 전역 고유 식별자.
 *
 * <p>SessionId는 생성 시각 순으로 정렬되는 문자열이며, 운영자가 대시보드나
 * 실행 스크립트에서 세션을 지정할 때 그대로 사용됩니다.</p>
 *
 * <p><strong>형식:</strong> {@code session_yyyyMMdd_HHmmss_SSS_NNNN}
 * (생성은 {@link SessionIdGenerator} 담당)</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~128자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Discovery Team
 * @since 1.0.0
 */
public final class SessionId implements Comparable<SessionId> {

    private final String value;

    private SessionId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("SessionId cannot be null or blank");
        }
        if (value.length() > 128) {
            throw new IllegalArgumentException("SessionId length cannot exceed 128 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException(
                "SessionId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * SessionId 생성.
     *
     * @param value SessionId 값
     * @return SessionId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static SessionId of(String value) {
        return new SessionId(value);
    }

    /**
     * SessionId 값 조회.
     *
     * @return SessionId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(SessionId other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SessionId that = (SessionId) o;
        return value.equals(that.value);
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
