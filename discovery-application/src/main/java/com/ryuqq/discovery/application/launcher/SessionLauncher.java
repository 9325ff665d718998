package com.ryuqq.discovery.application.launcher;

import com.ryuqq.discovery.application.orchestrator.Orchestrator;
import com.ryuqq.discovery.core.model.Session;
import com.ryuqq.discovery.core.model.SessionId;
import com.ryuqq.discovery.core.model.SessionParams;
import com.ryuqq.discovery.core.spi.SessionStore;
import com.ryuqq.discovery.core.statemachine.SessionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * 세션 실행 진입점.
 *
 * <p>운영자가 대시보드에서 만든 세션 ID를 넘기면 그 세션을 실행하고,
 * ID 없이 호출하면 주제와 파라미터로 임시 세션을 만들어 실행합니다.</p>
 *
 * <p>오케스트레이터 밖으로 예기치 않은 예외가 빠져나오면 세션이 RUNNING으로
 * 남지 않도록 FAILED로 기록한 뒤 예외를 다시 던집니다.</p>
 *
 * @author Discovery Team
 * @since 1.0.0
 */
public final class SessionLauncher {

    private static final Logger log = LoggerFactory.getLogger(SessionLauncher.class);

    private final SessionStore store;
    private final Orchestrator orchestrator;

    /**
     * 생성자.
     *
     * @param store 세션 저장소
     * @param orchestrator 오케스트레이터
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public SessionLauncher(SessionStore store, Orchestrator orchestrator) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (orchestrator == null) {
            throw new IllegalArgumentException("orchestrator cannot be null");
        }
        this.store = store;
        this.orchestrator = orchestrator;
    }

    /**
     * 기존 세션 실행, 또는 임시 세션 생성 후 실행.
     *
     * @param sessionId 실행할 세션 (없으면 임시 세션 생성)
     * @param topic 임시 세션의 연구 주제
     * @param params 임시 세션의 파라미터
     * @return 종료된 세션 스냅샷
     */
    public Session launch(Optional<SessionId> sessionId, String topic, SessionParams params) {
        SessionId target = sessionId.orElseGet(() -> createAdHoc(topic, params));
        return launch(target);
    }

    /**
     * 기존 세션 실행.
     *
     * @param sessionId 실행할 세션
     * @return 종료된 세션 스냅샷
     */
    public Session launch(SessionId sessionId) {
        log.info("Launching session {}", sessionId);
        try {
            Session result = orchestrator.run(sessionId);
            log.info("Session {} finished with status {}", sessionId, result.status());
            return result;
        } catch (RuntimeException e) {
            markFailedIfRunning(sessionId, e);
            throw e;
        }
    }

    /**
     * 별도 스레드에서 실행 (모니터가 진행 상황을 폴링할 수 있도록).
     *
     * @param sessionId 실행할 세션 (없으면 임시 세션 생성)
     * @param topic 임시 세션의 연구 주제
     * @param params 임시 세션의 파라미터
     * @param executor 실행 스레드
     * @return 종료된 세션 스냅샷의 future
     */
    public CompletableFuture<Session> launchAsync(Optional<SessionId> sessionId, String topic,
                                                  SessionParams params, Executor executor) {
        SessionId target = sessionId.orElseGet(() -> createAdHoc(topic, params));
        return CompletableFuture.supplyAsync(() -> launch(target), executor);
    }

    private SessionId createAdHoc(String topic, SessionParams params) {
        SessionId created = store.create(topic, params);
        log.info("Created ad-hoc session {} for topic: {}", created, topic);
        return created;
    }

    private void markFailedIfRunning(SessionId sessionId, RuntimeException cause) {
        try {
            Optional<Session> current = store.get(sessionId);
            if (current.isPresent() && current.get().status() == SessionStatus.RUNNING) {
                store.setStatus(sessionId, SessionStatus.FAILED, "Unexpected failure: " + cause.getMessage());
            }
        } catch (RuntimeException statusError) {
            log.error("Could not update status of session {}", sessionId, statusError);
            cause.addSuppressed(statusError);
        }
    }
}
