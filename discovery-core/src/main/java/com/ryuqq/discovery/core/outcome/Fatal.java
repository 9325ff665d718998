package com.ryuqq.discovery.core.outcome;

/**
 * 치명적 실패 (단계 전체 진행 불가).
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>배치 전체에서 사용 가능한 결과가 0건</li>
 *   <li>검색 결과가 없어 분석할 논문이 없음</li>
 * </ul>
 *
 * @param errorCode 오류 코드 (예: EMPTY_BATCH)
 * @param message 진단 메시지
 * @param cause 원인 (선택, null 가능)
 * @author Discovery Team
 * @since 1.0.0
 */
public record Fatal(String errorCode, String message, String cause) implements CollaboratorOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException errorCode 또는 message가 null이거나 빈 문자열인 경우
     */
    public Fatal {
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    public static Fatal of(String errorCode, String message) {
        return new Fatal(errorCode, message, null);
    }

    public static Fatal of(String errorCode, String message, String cause) {
        return new Fatal(errorCode, message, cause);
    }
}
