package com.ryuqq.discovery.core.exception;

import com.ryuqq.discovery.core.model.ServiceName;

/**
 * 서비스의 모든 자격 증명이 비활성화되었거나 레이트 리밋 대기 중.
 *
 * @author Discovery Team
 * @since 1.0.0
 */
public class PoolExhaustedException extends DiscoveryException {

    private final ServiceName service;

    public PoolExhaustedException(ServiceName service) {
        super("All credentials for service '" + service + "' are disabled or rate-limited");
        this.service = service;
    }

    public ServiceName getService() {
        return service;
    }
}
