package com.ryuqq.discovery.core.model;

import com.ryuqq.discovery.core.statemachine.Phase;
import com.ryuqq.discovery.core.statemachine.SessionStatus;

import java.time.Instant;
import java.util.Optional;

/**
 * 세션의 불변 스냅샷.
 *
 * <p>저장소는 갱신할 때마다 새 스냅샷으로 통째로 교체하므로, 조회자는 부분적으로
 * 갱신된 행을 볼 수 없습니다.</p>
 *
 * @param id 세션 ID
 * @param topic 연구 주제
 * @param params 실행 파라미터
 * @param status 현재 상태
 * @param progress 진행률 (0~100)
 * @param phase 현재 단계
 * @param message 마지막 메시지 (null 허용)
 * @param createdAt 생성 시각
 * @param updatedAt 마지막 갱신 시각
 * @param completedAt 완료 시각 (COMPLETED일 때만, null 허용)
 * @param resultLocation 결과 저장 위치 (null 허용)
 * @author Discovery Team
 * @since 1.0.0
 */
public record Session(
    SessionId id,
    String topic,
    SessionParams params,
    SessionStatus status,
    int progress,
    Phase phase,
    String message,
    Instant createdAt,
    Instant updatedAt,
    Instant completedAt,
    String resultLocation
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 값이 없거나 progress가 범위를 벗어난 경우
     */
    public Session {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic cannot be null or blank");
        }
        if (params == null) {
            throw new IllegalArgumentException("params cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (progress < 0 || progress > 100) {
            throw new IllegalArgumentException("progress must be between 0 and 100 (current: " + progress + ")");
        }
        if (phase == null) {
            throw new IllegalArgumentException("phase cannot be null");
        }
        if (createdAt == null || updatedAt == null) {
            throw new IllegalArgumentException("timestamps cannot be null");
        }
    }

    /**
     * 새로 생성된 PENDING 세션.
     *
     * @param id 세션 ID
     * @param topic 연구 주제
     * @param params 실행 파라미터
     * @param now 생성 시각
     * @return progress=0, phase=STARTING인 세션
     */
    public static Session pending(SessionId id, String topic, SessionParams params, Instant now) {
        return new Session(id, topic, params, SessionStatus.PENDING, 0, Phase.STARTING,
            null, now, now, null, null);
    }

    public Session withProgress(int progress, Phase phase, String message, Instant now) {
        return new Session(id, topic, params, status, progress, phase, message, createdAt, now,
            completedAt, resultLocation);
    }

    public Session withStatus(SessionStatus status, String message, Instant now) {
        Instant completed = status == SessionStatus.COMPLETED ? now : completedAt;
        int nextProgress = status == SessionStatus.COMPLETED ? 100 : progress;
        Phase nextPhase = status == SessionStatus.COMPLETED ? Phase.COMPLETED : phase;
        String nextMessage = message != null ? message : this.message;
        return new Session(id, topic, params, status, nextProgress, nextPhase, nextMessage, createdAt, now,
            completed, resultLocation);
    }

    public Session withResultLocation(String resultLocation, Instant now) {
        return new Session(id, topic, params, status, progress, phase, message, createdAt, now,
            completedAt, resultLocation);
    }

    public Optional<String> messageIfPresent() {
        return Optional.ofNullable(message);
    }

    public Optional<String> resultLocationIfPresent() {
        return Optional.ofNullable(resultLocation);
    }
}
