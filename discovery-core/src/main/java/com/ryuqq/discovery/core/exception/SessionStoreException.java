package com.ryuqq.discovery.core.exception;

/**
 * 세션 저장소 I/O 실패 (예: SQLException).
 *
 * @author Discovery Team
 * @since 1.0.0
 */
public class SessionStoreException extends DiscoveryException {

    public SessionStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
