package com.ryuqq.discovery.core.exception;

import com.ryuqq.discovery.core.model.ServiceName;

/**
 * 재시도와 자격 증명 교체를 모두 소진한 호출 실패.
 *
 * <p>마지막 실패 원인은 {@link #getCause()}로 조회합니다.
 * 관측 목적상 {@link PoolExhaustedException}과 구분됩니다.</p>
 *
 * @author Discovery Team
 * @since 1.0.0
 */
public class ExhaustedException extends DiscoveryException {

    private final ServiceName service;
    private final int attempts;

    public ExhaustedException(ServiceName service, int attempts, Throwable lastCause) {
        super("Call to service '" + service + "' failed after " + attempts + " attempts"
            + (lastCause != null ? ": " + lastCause.getMessage() : ""), lastCause);
        this.service = service;
        this.attempts = attempts;
    }

    public ServiceName getService() {
        return service;
    }

    public int getAttempts() {
        return attempts;
    }
}
