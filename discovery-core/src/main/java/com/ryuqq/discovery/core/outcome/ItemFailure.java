package com.ryuqq.discovery.core.outcome;

/**
 * 배치의 한 항목에 한정된 실패. 배치 전체에는 치명적이지 않습니다.
 *
 * @param itemKey 항목 식별자 (예: 논문 ID)
 * @param reason 실패 사유
 * @author Discovery Team
 * @since 1.0.0
 */
public record ItemFailure(String itemKey, String reason) {

    public ItemFailure {
        if (itemKey == null || itemKey.isBlank()) {
            throw new IllegalArgumentException("itemKey cannot be null or blank");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
    }
}
