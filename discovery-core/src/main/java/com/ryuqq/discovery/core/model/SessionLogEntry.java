package com.ryuqq.discovery.core.model;

import com.ryuqq.discovery.core.statemachine.Phase;

import java.time.Instant;

/**
 * 세션 로그 한 줄 (추가 전용).
 *
 * @param sessionId 세션 ID
 * @param timestamp 기록 시각
 * @param phase 기록 당시 단계
 * @param message 메시지
 * @author Discovery Team
 * @since 1.0.0
 */
public record SessionLogEntry(SessionId sessionId, Instant timestamp, Phase phase, String message) {

    public SessionLogEntry {
        if (sessionId == null) {
            throw new IllegalArgumentException("sessionId cannot be null");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        if (phase == null) {
            throw new IllegalArgumentException("phase cannot be null");
        }
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
    }
}
