package com.ryuqq.discovery.core.credential;

import com.ryuqq.discovery.core.model.ServiceName;

import java.time.Duration;
import java.time.Instant;

/**
 * 특정 서비스를 호출할 수 있는 비밀 값 하나와 그 건강 상태.
 *
 * <p>상태 변경 메서드는 모두 이 인스턴스의 모니터로 동기화되어, 여러 호출자가 같은
 * 자격 증명에 동시에 결과를 기록해도 카운터가 손상되지 않습니다.
 * 선택과 {@code lastUsedAt} 갱신을 묶는 원자성은 {@link CredentialPool} 구현이 담당합니다.</p>
 *
 * <p><strong>상태 규칙:</strong></p>
 * <ul>
 *   <li>성공: usageCount + 1, consecutiveErrorCount = 0</li>
 *   <li>레이트 리밋: rateLimitedUntil = now + cooldown</li>
 *   <li>일시적 실패: consecutiveErrorCount + 1, 임계치 도달 시 disabled</li>
 *   <li>재활성화: 마지막 실패 후 cooldown 경과 시 disabled 해제 + 오류 카운트 초기화</li>
 * </ul>
 *
 * @author Discovery Team
 * @since 1.0.0
 */
public final class Credential {

    private final String id;
    private final ServiceName service;
    private final String secret;
    private final int order;

    private long usageCount;
    private int consecutiveErrorCount;
    private Instant rateLimitedUntil;
    private boolean disabled;
    private Instant lastUsedAt;
    private Instant lastFailureAt;

    /**
     * 생성자.
     *
     * @param service 서비스
     * @param order 설정 내 순서 (0부터, 동률 선택 시 우선순위)
     * @param secret 비밀 값 (불투명)
     * @throws IllegalArgumentException 값이 유효하지 않은 경우
     */
    public Credential(ServiceName service, int order, String secret) {
        if (service == null) {
            throw new IllegalArgumentException("service cannot be null");
        }
        if (order < 0) {
            throw new IllegalArgumentException("order must be non-negative (current: " + order + ")");
        }
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("secret cannot be null or blank");
        }
        this.service = service;
        this.order = order;
        this.secret = secret;
        this.id = service.value() + "-" + (order + 1);
    }

    public String getId() {
        return id;
    }

    public ServiceName getService() {
        return service;
    }

    public String getSecret() {
        return secret;
    }

    public int getOrder() {
        return order;
    }

    public synchronized long getUsageCount() {
        return usageCount;
    }

    public synchronized int getConsecutiveErrorCount() {
        return consecutiveErrorCount;
    }

    public synchronized Instant getRateLimitedUntil() {
        return rateLimitedUntil;
    }

    public synchronized boolean isDisabled() {
        return disabled;
    }

    public synchronized Instant getLastUsedAt() {
        return lastUsedAt;
    }

    public synchronized Instant getLastFailureAt() {
        return lastFailureAt;
    }

    /**
     * 만료된 쿨다운을 정리하고, 지금 선택 가능한지 반환.
     *
     * @param now 현재 시각
     * @param cooldown 비활성화 후 재활성화까지의 대기 시간
     * @return disabled도 아니고 레이트 리밋 대기 중도 아니면 true
     */
    public synchronized boolean refreshAndCheckSelectable(Instant now, Duration cooldown) {
        if (rateLimitedUntil != null && !now.isBefore(rateLimitedUntil)) {
            rateLimitedUntil = null;
        }
        if (disabled && lastFailureAt != null && !now.isBefore(lastFailureAt.plus(cooldown))) {
            disabled = false;
            consecutiveErrorCount = 0;
        }
        return !disabled && rateLimitedUntil == null;
    }

    public synchronized void markUsed(Instant now) {
        this.lastUsedAt = now;
    }

    public synchronized void recordSuccess() {
        usageCount++;
        consecutiveErrorCount = 0;
    }

    public synchronized void recordRateLimited(Instant now, Duration cooldown) {
        rateLimitedUntil = now.plus(cooldown);
        lastFailureAt = now;
    }

    /**
     * 일시적 실패 기록.
     *
     * @param now 현재 시각
     * @param maxConsecutiveErrors 비활성화 임계치
     * @return 이번 기록으로 비활성화되었으면 true
     */
    public synchronized boolean recordTransientFailure(Instant now, int maxConsecutiveErrors) {
        consecutiveErrorCount++;
        lastFailureAt = now;
        if (!disabled && consecutiveErrorCount >= maxConsecutiveErrors) {
            disabled = true;
            return true;
        }
        return false;
    }

    /**
     * 운영자 명시적 초기화.
     */
    public synchronized void reset() {
        disabled = false;
        consecutiveErrorCount = 0;
        rateLimitedUntil = null;
    }

    /**
     * 모니터링용 스냅샷 (비밀 값 제외).
     *
     * @param now 현재 시각 (레이트 리밋 여부 판정용)
     * @return CredentialStatus
     */
    public synchronized CredentialStatus snapshot(Instant now) {
        boolean rateLimited = rateLimitedUntil != null && now.isBefore(rateLimitedUntil);
        return new CredentialStatus(id, service, usageCount, consecutiveErrorCount,
            rateLimited ? rateLimitedUntil : null, disabled, lastUsedAt);
    }

    @Override
    public String toString() {
        return "Credential{" + id + '}';
    }
}
