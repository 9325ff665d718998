package com.ryuqq.discovery.core.statemachine;

import com.ryuqq.discovery.core.exception.InvalidSessionStateException;

/**
 * 세션 상태 전이 검증.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>PENDING → RUNNING</li>
 *   <li>RUNNING → COMPLETED</li>
 *   <li>RUNNING → FAILED</li>
 * </ul>
 *
 * <p>종료 상태(COMPLETED, FAILED)에서는 어떤 상태로도 전이할 수 없습니다.
 * 같은 종료 상태를 다시 설정하는 것도 허용되지 않습니다.</p>
 *
 * @author Discovery Team
 * @since 1.0.0
 */
public final class StatusTransition {

    private StatusTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws InvalidSessionStateException 유효하지 않은 전이인 경우
     */
    public static void validate(SessionStatus from, SessionStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new InvalidSessionStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case PENDING -> to == SessionStatus.RUNNING;
            case RUNNING -> to.isTerminal();
            case COMPLETED, FAILED -> false;
        };

        if (!valid) {
            throw new InvalidSessionStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 검증 후 다음 상태 반환.
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return next
     * @throws InvalidSessionStateException 유효하지 않은 전이인 경우
     */
    public static SessionStatus transition(SessionStatus current, SessionStatus next) {
        validate(current, next);
        return next;
    }
}
