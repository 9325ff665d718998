package com.ryuqq.discovery.core.exception;

/**
 * 파이프라인 런타임 예외의 공통 상위 타입.
 *
 * @author Discovery Team
 * @since 1.0.0
 */
public class DiscoveryException extends RuntimeException {

    public DiscoveryException(String message) {
        super(message);
    }

    public DiscoveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
