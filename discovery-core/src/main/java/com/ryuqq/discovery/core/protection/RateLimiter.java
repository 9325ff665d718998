package com.ryuqq.discovery.core.protection;

import com.ryuqq.discovery.core.model.ServiceName;

/**
 * Client-side Rate Limiter SPI.
 *
 * <p>서비스별 분당 호출 수를 클라이언트 쪽에서 먼저 제한하여 서버의 429 응답
 * 자체를 줄입니다. 자격 증명 교체와는 별개로 동작합니다.</p>
 *
 * @author Discovery Team
 * @since 1.0.0
 */
public interface RateLimiter {

    /**
     * 허용될 때까지 최대 timeoutMs 동안 대기.
     *
     * @param service 대상 서비스
     * @param timeoutMs 최대 대기 시간 (밀리초)
     * @return true: 허용, false: 시간 내 허용되지 않음
     * @throws InterruptedException 대기 중 인터럽트 발생
     */
    boolean tryAcquire(ServiceName service, long timeoutMs) throws InterruptedException;

    /**
     * 서비스에 적용되는 설정 조회.
     *
     * @param service 대상 서비스
     * @return Rate Limiter 설정
     */
    RateLimiterConfig getConfig(ServiceName service);
}
