package com.ryuqq.discovery.core.guard;

/**
 * 외부 호출 실패 분류.
 *
 * <ul>
 *   <li>{@link #RATE_LIMITED}: 자격 증명에 쿨다운 설정 후 다른 자격 증명으로 교체</li>
 *   <li>{@link #TRANSIENT}: 연속 오류 카운트 증가, 백오프 후 재시도</li>
 *   <li>{@link #NON_RETRYABLE}: 즉시 전파, 자격 증명 상태 변경 없음</li>
 * </ul>
 *
 * @author Discovery Team
 * @since 1.0.0
 */
public enum FailureKind {

    RATE_LIMITED,

    TRANSIENT,

    NON_RETRYABLE;

    /**
     * 자격 증명 상태에 기록해야 하는 실패인지 확인.
     *
     * @return RATE_LIMITED 또는 TRANSIENT인 경우 true
     */
    public boolean isRecordable() {
        return this != NON_RETRYABLE;
    }
}
