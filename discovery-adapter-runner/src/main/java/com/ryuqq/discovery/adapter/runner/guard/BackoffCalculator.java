package com.ryuqq.discovery.adapter.runner.guard;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential Backoff with Jitter 계산기.
 *
 * <p>재시도 간격을 지수적으로 늘리고, 필요하면 Jitter를 더해 여러 배치 워커가
 * 같은 순간에 다시 몰리지 않게 합니다. 기본 설정은 Jitter 없이 2초부터 두 배씩입니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay = min(baseDelay * 2^(attempt-1) + jitter, maxDelay)
 * jitter = random(0, exponential * jitterFactor)
 * </pre>
 *
 * <p><strong>예시 (baseDelay=2000ms, jitterFactor=0):</strong></p>
 * <ul>
 *   <li>attempt=1: 2000ms</li>
 *   <li>attempt=2: 4000ms</li>
 *   <li>attempt=3: 8000ms</li>
 * </ul>
 *
 * @author Discovery Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final DoubleSupplier random;

    /**
     * 기본 설정으로 생성.
     *
     * <p>기본값: baseDelay=2000ms, maxDelay=60000ms, jitterFactor=0</p>
     */
    public BackoffCalculator() {
        this(GuardConfig.DEFAULT_BASE_BACKOFF_MS, GuardConfig.DEFAULT_MAX_BACKOFF_MS, 0.0);
    }

    /**
     * GuardConfig의 백오프 설정으로 생성.
     *
     * @param config 가드 설정
     */
    public BackoffCalculator(GuardConfig config) {
        this(config.baseBackoffMs(), config.maxBackoffMs(), config.jitterFactor());
    }

    /**
     * 커스텀 설정으로 생성.
     *
     * @param baseDelayMs 기본 지연 시간 (밀리초, 양수여야 함)
     * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상이어야 함)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        this(baseDelayMs, maxDelayMs, jitterFactor, () -> ThreadLocalRandom.current().nextDouble());
    }

    BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor, DoubleSupplier random) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must be positive (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }

        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
        this.random = random;
    }

    /**
     * 재시도 지연 시간 계산.
     *
     * @param attempt 실패한 시도 번호 (1부터 시작)
     * @return 다음 시도 전 대기 시간 (밀리초)
     * @throws IllegalArgumentException attempt가 양수가 아닌 경우
     */
    public long calculate(int attempt) {
        if (attempt <= 0) {
            throw new IllegalArgumentException(
                "attempt must be positive (current: " + attempt + ")"
            );
        }

        // 시프트 오버플로 방지
        int shift = Math.min(attempt - 1, 30);
        long exponential = Math.min(baseDelayMs * (1L << shift), maxDelayMs);

        long jitter = jitterFactor == 0.0 ? 0L : (long) (exponential * jitterFactor * random.getAsDouble());

        return Math.min(exponential + jitter, maxDelayMs);
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }
}
