package com.ryuqq.discovery.core.credential;

import com.ryuqq.discovery.core.model.ServiceName;

import java.time.Instant;

/**
 * 자격 증명 상태 스냅샷 (모니터링용, 비밀 값 미포함).
 *
 * @param id 자격 증명 ID (예: gemini-2)
 * @param service 서비스
 * @param usageCount 성공 호출 수
 * @param consecutiveErrorCount 연속 일시적 실패 수
 * @param rateLimitedUntil 레이트 리밋 해제 시각 (대기 중이 아니면 null)
 * @param disabled 비활성화 여부
 * @param lastUsedAt 마지막 선택 시각 (null 허용)
 * @author Discovery Team
 * @since 1.0.0
 */
public record CredentialStatus(
    String id,
    ServiceName service,
    long usageCount,
    int consecutiveErrorCount,
    Instant rateLimitedUntil,
    boolean disabled,
    Instant lastUsedAt
) {

    public boolean isRateLimited() {
        return rateLimitedUntil != null;
    }

    public boolean isSelectable() {
        return !disabled && rateLimitedUntil == null;
    }
}
