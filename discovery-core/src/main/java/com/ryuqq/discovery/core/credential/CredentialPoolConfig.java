package com.ryuqq.discovery.core.credential;

import java.time.Duration;

/**
 * 자격 증명 풀 설정.
 *
 * @param cooldown 레이트 리밋 대기 시간이자 비활성화 후 재활성화 대기 시간 (기본 60분)
 * @param maxConsecutiveErrors 비활성화까지 허용하는 연속 일시적 실패 수 (기본 3)
 * @author Discovery Team
 * @since 1.0.0
 */
public record CredentialPoolConfig(Duration cooldown, int maxConsecutiveErrors) {

    public static final Duration DEFAULT_COOLDOWN = Duration.ofMinutes(60);
    public static final int DEFAULT_MAX_CONSECUTIVE_ERRORS = 3;

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CredentialPoolConfig {
        if (cooldown == null || cooldown.isNegative() || cooldown.isZero()) {
            throw new IllegalArgumentException("cooldown must be positive (current: " + cooldown + ")");
        }
        if (maxConsecutiveErrors <= 0) {
            throw new IllegalArgumentException(
                "maxConsecutiveErrors must be positive (current: " + maxConsecutiveErrors + ")");
        }
    }

    /**
     * 기본 설정 생성자 (cooldown=60분, maxConsecutiveErrors=3).
     */
    public CredentialPoolConfig() {
        this(DEFAULT_COOLDOWN, DEFAULT_MAX_CONSECUTIVE_ERRORS);
    }

    public CredentialPoolConfig withCooldown(Duration cooldown) {
        return new CredentialPoolConfig(cooldown, maxConsecutiveErrors);
    }

    public CredentialPoolConfig withMaxConsecutiveErrors(int maxConsecutiveErrors) {
        return new CredentialPoolConfig(cooldown, maxConsecutiveErrors);
    }
}
