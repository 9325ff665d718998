package com.ryuqq.discovery.adapter.runner.batch;

/**
 * BatchExecutor 설정 (불변 record).
 *
 * @author Discovery Team
 * @since 1.0.0
 * @param concurrency 동시에 처리할 아이템 수 (1 이상, 기본 4)
 */
public record BatchConfig(int concurrency) {

    public static final int DEFAULT_CONCURRENCY = 4;

    public BatchConfig() {
        this(DEFAULT_CONCURRENCY);
    }

    public BatchConfig {
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
        }
    }

    public BatchConfig withConcurrency(int concurrency) {
        return new BatchConfig(concurrency);
    }
}
