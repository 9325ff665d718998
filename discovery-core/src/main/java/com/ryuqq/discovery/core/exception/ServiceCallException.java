package com.ryuqq.discovery.core.exception;

import com.ryuqq.discovery.core.guard.FailureKind;

/**
 * 외부 서비스 호출 실패를 분류와 함께 알리는 예외.
 *
 * <p>협력자가 HTTP 응답 코드 등을 보고 적절한 하위 타입을 던지면
 * ExecutionGuard가 분류 없이 바로 처리합니다.</p>
 *
 * @author Discovery Team
 * @since 1.0.0
 * @see RateLimitedException
 * @see TransientCallException
 * @see NonRetryableCallException
 */
public abstract class ServiceCallException extends DiscoveryException {

    protected ServiceCallException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 실패 분류.
     *
     * @return FailureKind
     */
    public abstract FailureKind kind();
}
