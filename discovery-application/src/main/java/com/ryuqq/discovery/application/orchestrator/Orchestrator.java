package com.ryuqq.discovery.application.orchestrator;

import com.ryuqq.discovery.core.exception.InvalidSessionStateException;
import com.ryuqq.discovery.core.exception.SessionNotFoundException;
import com.ryuqq.discovery.core.model.Session;
import com.ryuqq.discovery.core.model.SessionId;

/**
 * 세션 하나의 고정 단계 순서를 실행하는 조정자.
 *
 * <p>각 단계의 협력자를 ExecutionGuard를 통해 호출하고, 진행률을 SessionStore에
 * 기록하며, 실패가 치명적인지 판단합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * SessionId id = store.create("solid-state electrolytes", new SessionParams());
 * Session result = orchestrator.run(id);
 *
 * if (result.status() == SessionStatus.FAILED) {
 *     // result.message(): 진단 메시지
 *     // store.logs(id): 실패 시점까지의 전체 로그
 * }
 * </pre>
 *
 * @author Discovery Team
 * @since 1.0.0
 */
public interface Orchestrator {

    /**
     * PENDING 세션을 끝까지(또는 치명적 실패까지) 실행.
     *
     * <p>이 메서드는 호출 스레드에서 동기적으로 실행되며, 단계 실패는 예외가 아니라
     * FAILED 상태의 세션으로 반환됩니다.</p>
     *
     * @param sessionId 실행할 세션
     * @return 종료 상태(COMPLETED 또는 FAILED)의 세션 스냅샷
     * @throws SessionNotFoundException 세션이 없는 경우
     * @throws InvalidSessionStateException 세션이 PENDING이 아닌 경우
     */
    Session run(SessionId sessionId);

    /**
     * 협조적 취소 요청.
     *
     * <p>실행 중인 세션은 다음 단계 경계에서 FAILED("cancelled by operator")로 종료됩니다.
     * RUNNING이 아닌 세션(없는 세션 포함)에 대한 요청은 무시됩니다.</p>
     *
     * @param sessionId 취소할 세션
     */
    void cancel(SessionId sessionId);
}
