package com.ryuqq.discovery.core.protection;

import com.ryuqq.discovery.core.model.ServiceName;

/**
 * Timeout Policy SPI.
 *
 * <p>외부 API 호출의 최대 허용 시간을 서비스별로 정해 무한 대기를 방지합니다.
 * 시간 초과는 TRANSIENT 실패로 분류됩니다.</p>
 *
 * @author Discovery Team
 * @since 1.0.0
 */
public interface TimeoutPolicy {

    /**
     * 시도당(per-attempt) 타임아웃 시간 조회.
     *
     * @param service 대상 서비스
     * @return 타임아웃 시간 (밀리초, 양수)
     */
    long getPerAttemptTimeoutMs(ServiceName service);

    /**
     * 타임아웃 발생 기록.
     *
     * @param service 대상 서비스
     * @param elapsedMs 실제 경과 시간 (밀리초)
     */
    void recordTimeout(ServiceName service, long elapsedMs);
}
