package com.ryuqq.discovery.adapter.runner.protection;

import com.ryuqq.discovery.core.model.ServiceName;
import com.ryuqq.discovery.core.protection.RateLimiter;
import com.ryuqq.discovery.core.protection.RateLimiterConfig;
import com.ryuqq.discovery.core.time.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 서비스별 슬라이딩 윈도 Rate Limiter.
 *
 * <p>최근 1분(및 설정 시 최근 1초) 동안 허용한 호출 시각을 보관하고,
 * 한도에 도달하면 가장 오래된 호출이 윈도를 벗어날 때까지 기다립니다.
 * 설정되지 않은 서비스는 제한하지 않습니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>윈도를 벗어난 호출 시각 제거</li>
 *   <li>분/초 한도 모두 여유가 있으면 now 기록 후 허용</li>
 *   <li>아니면 필요한 대기 시간 계산, timeout 안이면 Sleeper로 대기 후 재확인</li>
 *   <li>timeout을 넘기게 되면 false (호출하지 않음)</li>
 * </ol>
 *
 * @author Discovery Team
 * @since 1.0.0
 */
public final class SlidingWindowRateLimiter implements RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(SlidingWindowRateLimiter.class);

    private static final Duration MINUTE = Duration.ofMinutes(1);
    private static final Duration SECOND = Duration.ofSeconds(1);
    private static final RateLimiterConfig UNLIMITED = new RateLimiterConfig(Integer.MAX_VALUE, 0);

    private final Map<ServiceName, RateLimiterConfig> configs;
    private final ConcurrentHashMap<ServiceName, Window> windows = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Sleeper sleeper;

    public SlidingWindowRateLimiter(Map<ServiceName, RateLimiterConfig> configs) {
        this(configs, Clock.systemUTC(), Sleeper.SYSTEM);
    }

    /**
     * 생성자.
     *
     * @param configs 서비스별 한도
     * @param clock 시계
     * @param sleeper 대기 수단
     */
    public SlidingWindowRateLimiter(Map<ServiceName, RateLimiterConfig> configs, Clock clock, Sleeper sleeper) {
        if (configs == null) {
            throw new IllegalArgumentException("configs cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.configs = Map.copyOf(configs);
        this.clock = clock;
        this.sleeper = sleeper;
    }

    @Override
    public boolean tryAcquire(ServiceName service, long timeoutMs) throws InterruptedException {
        RateLimiterConfig config = configs.get(service);
        if (config == null) {
            return true;
        }
        Window window = windows.computeIfAbsent(service, s -> new Window());
        Instant deadline = clock.instant().plusMillis(Math.max(0, timeoutMs));

        while (true) {
            long waitMs;
            synchronized (window) {
                Instant now = clock.instant();
                window.evict(now);
                waitMs = window.waitMillis(now, config);
                if (waitMs <= 0) {
                    window.record(now, config);
                    return true;
                }
                if (now.plusMillis(waitMs).isAfter(deadline)) {
                    log.warn("Rate limit for service {} reached ({} calls/min), permit refused", service,
                        config.callsPerMinute());
                    return false;
                }
            }
            log.debug("Rate limit for service {} reached, waiting {}ms", service, waitMs);
            sleeper.sleep(waitMs);
        }
    }

    @Override
    public RateLimiterConfig getConfig(ServiceName service) {
        return configs.getOrDefault(service, UNLIMITED);
    }

    private static final class Window {
        private final Deque<Instant> minute = new ArrayDeque<>();
        private final Deque<Instant> second = new ArrayDeque<>();

        private void evict(Instant now) {
            Instant minuteStart = now.minus(MINUTE);
            while (!minute.isEmpty() && !minute.peekFirst().isAfter(minuteStart)) {
                minute.pollFirst();
            }
            Instant secondStart = now.minus(SECOND);
            while (!second.isEmpty() && !second.peekFirst().isAfter(secondStart)) {
                second.pollFirst();
            }
        }

        private long waitMillis(Instant now, RateLimiterConfig config) {
            long wait = 0;
            if (minute.size() >= config.callsPerMinute()) {
                wait = Math.max(wait, Duration.between(now, minute.peekFirst().plus(MINUTE)).toMillis());
            }
            if (config.callsPerSecond() > 0 && second.size() >= config.callsPerSecond()) {
                wait = Math.max(wait, Duration.between(now, second.peekFirst().plus(SECOND)).toMillis());
            }
            // 경계에서 0ms로 계산되면 같은 시각에 다시 막히므로 최소 1ms
            return wait == 0 && isFull(config) ? 1 : wait;
        }

        private boolean isFull(RateLimiterConfig config) {
            return minute.size() >= config.callsPerMinute()
                || (config.callsPerSecond() > 0 && second.size() >= config.callsPerSecond());
        }

        private void record(Instant now, RateLimiterConfig config) {
            minute.addLast(now);
            if (config.callsPerSecond() > 0) {
                second.addLast(now);
            }
        }
    }
}
