package com.ryuqq.discovery.core.protection;

/**
 * Rate Limiter 설정.
 *
 * @param callsPerMinute 분당 허용 호출 수
 * @param callsPerSecond 초당 허용 호출 수 (0이면 제한 없음)
 * @author Discovery Team
 * @since 1.0.0
 */
public record RateLimiterConfig(int callsPerMinute, int callsPerSecond) {

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if callsPerMinute is not positive or callsPerSecond is negative
     */
    public RateLimiterConfig {
        if (callsPerMinute <= 0) {
            throw new IllegalArgumentException("callsPerMinute must be positive (current: " + callsPerMinute + ")");
        }
        if (callsPerSecond < 0) {
            throw new IllegalArgumentException("callsPerSecond must be non-negative (current: " + callsPerSecond + ")");
        }
    }

    /**
     * 분당 제한만 두는 설정.
     *
     * @param callsPerMinute 분당 허용 호출 수
     * @return RateLimiterConfig
     */
    public static RateLimiterConfig perMinute(int callsPerMinute) {
        return new RateLimiterConfig(callsPerMinute, 0);
    }
}
