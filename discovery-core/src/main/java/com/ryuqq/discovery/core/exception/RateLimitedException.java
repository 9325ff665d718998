package com.ryuqq.discovery.core.exception;

import com.ryuqq.discovery.core.guard.FailureKind;

/**
 * 서비스가 레이트 리밋 응답(예: 429)을 반환함.
 *
 * @author Discovery Team
 * @since 1.0.0
 */
public class RateLimitedException extends ServiceCallException {

    public RateLimitedException(String message) {
        super(message, null);
    }

    public RateLimitedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.RATE_LIMITED;
    }
}
