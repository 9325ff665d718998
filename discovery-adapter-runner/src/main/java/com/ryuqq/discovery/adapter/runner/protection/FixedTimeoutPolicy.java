package com.ryuqq.discovery.adapter.runner.protection;

import com.ryuqq.discovery.core.model.ServiceName;
import com.ryuqq.discovery.core.protection.TimeoutPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 서비스별 고정 타임아웃 정책.
 *
 * <p>기본 30초, 서비스별로 덮어쓸 수 있습니다. 타임아웃 발생 횟수를 서비스별로 집계합니다.</p>
 *
 * @author Discovery Team
 * @since 1.0.0
 */
public final class FixedTimeoutPolicy implements TimeoutPolicy {

    private static final Logger log = LoggerFactory.getLogger(FixedTimeoutPolicy.class);

    public static final long DEFAULT_TIMEOUT_MS = 30_000;

    private final long defaultTimeoutMs;
    private final Map<ServiceName, Long> overrides;
    private final ConcurrentHashMap<ServiceName, AtomicLong> timeouts = new ConcurrentHashMap<>();

    public FixedTimeoutPolicy() {
        this(DEFAULT_TIMEOUT_MS, Map.of());
    }

    public FixedTimeoutPolicy(long defaultTimeoutMs) {
        this(defaultTimeoutMs, Map.of());
    }

    /**
     * 생성자.
     *
     * @param defaultTimeoutMs 기본 시도당 타임아웃 (밀리초, 양수)
     * @param overrides 서비스별 타임아웃 (밀리초, 양수)
     * @throws IllegalArgumentException 타임아웃이 양수가 아닌 경우
     */
    public FixedTimeoutPolicy(long defaultTimeoutMs, Map<ServiceName, Long> overrides) {
        if (defaultTimeoutMs <= 0) {
            throw new IllegalArgumentException("defaultTimeoutMs must be positive (current: " + defaultTimeoutMs + ")");
        }
        if (overrides == null) {
            throw new IllegalArgumentException("overrides cannot be null");
        }
        for (Map.Entry<ServiceName, Long> entry : overrides.entrySet()) {
            if (entry.getValue() == null || entry.getValue() <= 0) {
                throw new IllegalArgumentException(
                    "timeout for " + entry.getKey() + " must be positive (current: " + entry.getValue() + ")");
            }
        }
        this.defaultTimeoutMs = defaultTimeoutMs;
        this.overrides = Map.copyOf(overrides);
    }

    @Override
    public long getPerAttemptTimeoutMs(ServiceName service) {
        return overrides.getOrDefault(service, defaultTimeoutMs);
    }

    @Override
    public void recordTimeout(ServiceName service, long elapsedMs) {
        long count = timeouts.computeIfAbsent(service, s -> new AtomicLong()).incrementAndGet();
        log.warn("Call to service {} timed out after {}ms (timeouts so far: {})", service, elapsedMs, count);
    }

    /**
     * 서비스별 타임아웃 발생 횟수.
     *
     * @param service 서비스
     * @return 누적 타임아웃 횟수
     */
    public long getTimeoutCount(ServiceName service) {
        AtomicLong count = timeouts.get(service);
        return count == null ? 0 : count.get();
    }
}
