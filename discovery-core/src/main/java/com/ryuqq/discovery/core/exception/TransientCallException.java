package com.ryuqq.discovery.core.exception;

import com.ryuqq.discovery.core.guard.FailureKind;

/**
 * 일시적 실패 (타임아웃, 5xx 서버 오류 등). 백오프 후 재시도합니다.
 *
 * @author Discovery Team
 * @since 1.0.0
 */
public class TransientCallException extends ServiceCallException {

    public TransientCallException(String message) {
        super(message, null);
    }

    public TransientCallException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.TRANSIENT;
    }
}
