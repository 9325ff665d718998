package com.ryuqq.discovery.core.exception;

/**
 * 현재 세션 상태에서 허용되지 않는 연산 (종료된 세션 갱신, 잘못된 상태 전이).
 *
 * @author Discovery Team
 * @since 1.0.0
 */
public class InvalidSessionStateException extends IllegalStateException {

    public InvalidSessionStateException(String message) {
        super(message);
    }
}
