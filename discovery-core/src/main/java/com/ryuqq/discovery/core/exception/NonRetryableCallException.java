package com.ryuqq.discovery.core.exception;

import com.ryuqq.discovery.core.guard.FailureKind;

/**
 * 재시도해도 성공할 수 없는 실패 (잘못된 요청, 레이트 리밋 이외의 권한 거부).
 *
 * <p>ExecutionGuard는 이 실패를 재시도 없이 그대로 전파합니다.</p>
 *
 * @author Discovery Team
 * @since 1.0.0
 */
public class NonRetryableCallException extends ServiceCallException {

    public NonRetryableCallException(String message) {
        super(message, null);
    }

    public NonRetryableCallException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.NON_RETRYABLE;
    }
}
