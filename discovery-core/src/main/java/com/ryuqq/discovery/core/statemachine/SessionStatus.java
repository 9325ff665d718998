package com.ryuqq.discovery.core.statemachine;

import java.util.Locale;

/**
 * 세션의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>PENDING → RUNNING (첫 단계 시작)</li>
 *   <li>RUNNING → COMPLETED (모든 단계 성공)</li>
 *   <li>RUNNING → FAILED (치명적 실패)</li>
 *   <li><strong>종료 상태는 정확히 한 번만 설정 (불변식)</strong></li>
 * </ul>
 *
 * <pre>
 * PENDING
 *    │
 *    ▼
 * RUNNING
 *    ├─► COMPLETED
 *    └─► FAILED
 * </pre>
 *
 * @author Discovery Team
 * @since 1.0.0
 */
public enum SessionStatus {

    /**
     * 생성됨, 아직 실행 안 됨.
     */
    PENDING,

    /**
     * 오케스트레이터가 단계를 진행 중.
     */
    RUNNING,

    /**
     * 완료 (성공).
     */
    COMPLETED,

    /**
     * 실패 (영구).
     */
    FAILED;

    /**
     * 종료 상태인지 확인.
     *
     * @return COMPLETED 또는 FAILED인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * 저장소/대시보드에서 쓰는 소문자 코드.
     *
     * @return 예: "running"
     */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * 소문자 코드로부터 상태 복원.
     *
     * @param code 상태 코드 (대소문자 무시)
     * @return SessionStatus
     * @throws IllegalArgumentException 알 수 없는 코드인 경우
     */
    public static SessionStatus fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("status code cannot be null");
        }
        return SessionStatus.valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
