package com.ryuqq.discovery.core.protection.noop;

import com.ryuqq.discovery.core.model.ServiceName;
import com.ryuqq.discovery.core.protection.RateLimiter;
import com.ryuqq.discovery.core.protection.RateLimiterConfig;

/**
 * Rate Limiter NoOp 구현.
 *
 * <p>모든 요청을 항상 허용합니다. 클라이언트 쪽 제한 없이 자격 증명 교체만으로
 * 쿼터를 관리할 때 사용합니다.</p>
 *
 * @author Discovery Team
 * @since 1.0.0
 */
public final class NoOpRateLimiter implements RateLimiter {

    private static final RateLimiterConfig UNLIMITED_CONFIG = new RateLimiterConfig(Integer.MAX_VALUE, 0);

    @Override
    public boolean tryAcquire(ServiceName service, long timeoutMs) {
        return true;
    }

    @Override
    public RateLimiterConfig getConfig(ServiceName service) {
        return UNLIMITED_CONFIG;
    }
}
