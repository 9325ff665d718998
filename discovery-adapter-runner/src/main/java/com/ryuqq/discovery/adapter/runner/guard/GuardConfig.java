package com.ryuqq.discovery.adapter.runner.guard;

/**
 * RetryingExecutionGuard 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxAttempts: 호출 한 건당 최대 시도 횟수 (기본 3)</li>
 *   <li>baseBackoffMs: 첫 실패 후 대기 시간 (기본 2000ms, 이후 두 배씩)</li>
 *   <li>maxBackoffMs: 대기 시간 상한 (기본 60000ms)</li>
 *   <li>jitterFactor: Jitter 비율 (기본 0, Jitter 없음)</li>
 *   <li>rateLimitAcquireTimeoutMs: 클라이언트 측 레이트 리미터 permit 대기 상한 (기본 60000ms)</li>
 * </ul>
 *
 * @author Discovery Team
 * @since 1.0.0
 * @param maxAttempts 최대 시도 횟수 (1 이상)
 * @param baseBackoffMs 기본 백오프 (밀리초, 양수)
 * @param maxBackoffMs 최대 백오프 (밀리초, baseBackoffMs 이상)
 * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
 * @param rateLimitAcquireTimeoutMs permit 대기 상한 (밀리초, 0 이상)
 */
public record GuardConfig(
    int maxAttempts,
    long baseBackoffMs,
    long maxBackoffMs,
    double jitterFactor,
    long rateLimitAcquireTimeoutMs
) {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_BASE_BACKOFF_MS = 2_000;
    public static final long DEFAULT_MAX_BACKOFF_MS = 60_000;
    public static final long DEFAULT_RATE_LIMIT_ACQUIRE_TIMEOUT_MS = 60_000;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxAttempts=3, baseBackoffMs=2000, maxBackoffMs=60000, jitterFactor=0,
     * rateLimitAcquireTimeoutMs=60000</p>
     */
    public GuardConfig() {
        this(DEFAULT_MAX_ATTEMPTS, DEFAULT_BASE_BACKOFF_MS, DEFAULT_MAX_BACKOFF_MS, 0.0,
            DEFAULT_RATE_LIMIT_ACQUIRE_TIMEOUT_MS);
    }

    public GuardConfig {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        if (baseBackoffMs <= 0) {
            throw new IllegalArgumentException(
                "baseBackoffMs must be positive (current: " + baseBackoffMs + ")"
            );
        }
        if (maxBackoffMs < baseBackoffMs) {
            throw new IllegalArgumentException(
                "maxBackoffMs must be >= baseBackoffMs (base: " + baseBackoffMs + ", max: " + maxBackoffMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
        if (rateLimitAcquireTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "rateLimitAcquireTimeoutMs must be non-negative (current: " + rateLimitAcquireTimeoutMs + ")"
            );
        }
    }

    public GuardConfig withMaxAttempts(int maxAttempts) {
        return new GuardConfig(maxAttempts, baseBackoffMs, maxBackoffMs, jitterFactor, rateLimitAcquireTimeoutMs);
    }

    public GuardConfig withBaseBackoffMs(long baseBackoffMs) {
        return new GuardConfig(maxAttempts, baseBackoffMs, maxBackoffMs, jitterFactor, rateLimitAcquireTimeoutMs);
    }

    public GuardConfig withMaxBackoffMs(long maxBackoffMs) {
        return new GuardConfig(maxAttempts, baseBackoffMs, maxBackoffMs, jitterFactor, rateLimitAcquireTimeoutMs);
    }

    public GuardConfig withJitterFactor(double jitterFactor) {
        return new GuardConfig(maxAttempts, baseBackoffMs, maxBackoffMs, jitterFactor, rateLimitAcquireTimeoutMs);
    }

    public GuardConfig withRateLimitAcquireTimeoutMs(long rateLimitAcquireTimeoutMs) {
        return new GuardConfig(maxAttempts, baseBackoffMs, maxBackoffMs, jitterFactor, rateLimitAcquireTimeoutMs);
    }
}
