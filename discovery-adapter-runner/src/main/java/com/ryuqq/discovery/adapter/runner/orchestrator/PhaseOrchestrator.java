package com.ryuqq.discovery.adapter.runner.orchestrator;

import com.ryuqq.discovery.application.orchestrator.Orchestrator;
import com.ryuqq.discovery.core.exception.InvalidSessionStateException;
import com.ryuqq.discovery.core.exception.PoolExhaustedException;
import com.ryuqq.discovery.core.exception.SessionNotFoundException;
import com.ryuqq.discovery.core.guard.ExecutionGuard;
import com.ryuqq.discovery.core.model.Payload;
import com.ryuqq.discovery.core.model.Session;
import com.ryuqq.discovery.core.model.SessionId;
import com.ryuqq.discovery.core.outcome.CollaboratorOutcome;
import com.ryuqq.discovery.core.outcome.Fatal;
import com.ryuqq.discovery.core.outcome.ItemFailure;
import com.ryuqq.discovery.core.spi.ResultWriter;
import com.ryuqq.discovery.core.spi.SessionStore;
import com.ryuqq.discovery.core.spi.StageInput;
import com.ryuqq.discovery.core.statemachine.Phase;
import com.ryuqq.discovery.core.statemachine.SessionStatus;
import com.ryuqq.discovery.core.statemachine.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 고정 단계 순서를 실행하는 {@link Orchestrator} 구현체.
 *
 * <p><strong>실행 순서:</strong></p>
 * <pre>
 * Starting(0)
 *   → [반복 i = 1..N]
 *       CollectingPapers → PapersCollected
 *       AnalyzingPapers → AnalysisComplete
 *       GeneratingHypotheses → HypothesesGenerated
 *       TestingHypotheses → TestingComplete
 *       EvaluatingResults → DiscoveriesFound
 *   → (ResultWriter) → Completed(100)
 * </pre>
 *
 * <p>각 페이즈는 반복 회차와 무관하게 자신의 진행률 하한을 보고합니다. 두 번째 반복부터의
 * 낮은 값은 저장소의 clamp 정책에 따라 무시되고 페이즈와 메시지만 갱신되므로, 저장된 진행률은
 * 단조 증가하며 100은 Completed에서만 기록됩니다.</p>
 *
 * <p><strong>결과 처리:</strong></p>
 * <ul>
 *   <li>Success: 완료 페이즈 기록 후 다음 단계</li>
 *   <li>Partial: ItemFailure마다 로그 한 줄, 완료 페이즈 기록 후 다음 단계</li>
 *   <li>Fatal 또는 협력자 밖으로 나온 예외: FAILED("&lt;Phase&gt; failed: ..."), 이후 단계 없음</li>
 * </ul>
 *
 * <p>단계 출력 페이로드는 다음 단계의 입력이 되고, 평가 단계 출력은 다음 반복의 수집 단계
 * 입력이 됩니다. 취소 요청은 단계 경계마다 확인합니다.</p>
 *
 * @author Discovery Team
 * @since 1.0.0
 */
public final class PhaseOrchestrator implements Orchestrator {

    private static final Logger log = LoggerFactory.getLogger(PhaseOrchestrator.class);

    private final SessionStore store;
    private final ExecutionGuard guard;
    private final PipelineCollaborators collaborators;
    private final ResultWriter resultWriter;
    private final OrchestratorConfig config;
    private final Set<SessionId> cancelled = ConcurrentHashMap.newKeySet();

    /**
     * 결과 저장 없이 생성.
     *
     * @param store 세션 저장소
     * @param guard 실행 가드
     * @param collaborators 단계별 협력자
     */
    public PhaseOrchestrator(SessionStore store, ExecutionGuard guard, PipelineCollaborators collaborators) {
        this(store, guard, collaborators, null, new OrchestratorConfig());
    }

    /**
     * 생성자.
     *
     * @param store 세션 저장소
     * @param guard 실행 가드
     * @param collaborators 단계별 협력자
     * @param resultWriter 최종 결과 저장 (null이면 저장하지 않음)
     * @param config 설정
     * @throws IllegalArgumentException 필수 인자가 null인 경우
     */
    public PhaseOrchestrator(SessionStore store, ExecutionGuard guard, PipelineCollaborators collaborators,
                             ResultWriter resultWriter, OrchestratorConfig config) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (guard == null) {
            throw new IllegalArgumentException("guard cannot be null");
        }
        if (collaborators == null) {
            throw new IllegalArgumentException("collaborators cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.store = store;
        this.guard = guard;
        this.collaborators = collaborators;
        this.resultWriter = resultWriter;
        this.config = config;
    }

    @Override
    public Session run(SessionId sessionId) {
        if (sessionId == null) {
            throw new IllegalArgumentException("sessionId cannot be null");
        }
        Session session = store.get(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
        if (session.status() != SessionStatus.PENDING) {
            throw new InvalidSessionStateException(
                "Session " + sessionId + " cannot be run from state " + session.status());
        }

        store.setStatus(sessionId, SessionStatus.RUNNING);
        store.updateProgress(sessionId, 0, Phase.STARTING, "Starting discovery for topic: " + session.topic());
        log.info("Session {} started: topic={}, iterations={}", sessionId, session.topic(),
            session.params().iterations());

        try {
            Payload finalOutput = runIterations(session);
            checkCancelled(sessionId, Phase.COMPLETED.displayName());
            saveResults(sessionId, finalOutput);
            store.updateProgress(sessionId, 100, Phase.COMPLETED, "Discovery completed");
            store.setStatus(sessionId, SessionStatus.COMPLETED);
            log.info("Session {} completed", sessionId);
        } catch (PhaseFailure failure) {
            log.error("Session {} failed: {}", sessionId, failure.getMessage());
            store.setStatus(sessionId, SessionStatus.FAILED, failure.getMessage());
        } finally {
            cancelled.remove(sessionId);
        }

        return store.get(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    @Override
    public void cancel(SessionId sessionId) {
        if (sessionId == null) {
            throw new IllegalArgumentException("sessionId cannot be null");
        }
        Optional<SessionStatus> status = store.get(sessionId).map(Session::status);
        if (status.orElse(null) != SessionStatus.RUNNING) {
            log.info("Ignoring cancellation for session {} (status: {})", sessionId, status.orElse(null));
            return;
        }
        cancelled.add(sessionId);
        // run()이 그 사이 끝났다면 플래그를 남기지 않음
        if (store.get(sessionId).map(session -> session.status().isTerminal()).orElse(true)) {
            cancelled.remove(sessionId);
            return;
        }
        log.info("Cancellation requested for session {}", sessionId);
    }

    // 아직 run()이 확인하지 않은 취소 요청 여부
    boolean isCancellationPending(SessionId sessionId) {
        return cancelled.contains(sessionId);
    }

    private Payload runIterations(Session session) {
        SessionId sessionId = session.id();
        int total = session.params().iterations();
        Payload carry = Payload.empty();

        for (int iteration = 1; iteration <= total; iteration++) {
            for (Stage stage : Stage.values()) {
                carry = runStage(session, stage, iteration, total, carry);
            }
            log.info("Session {} finished iteration {}/{}", sessionId, iteration, total);
        }
        return carry;
    }

    private Payload runStage(Session session, Stage stage, int iteration, int total, Payload upstream) {
        SessionId sessionId = session.id();
        Phase inProgress = stage.inProgress();
        checkCancelled(sessionId, inProgress.displayName());

        store.updateProgress(sessionId, inProgress.progressFloor(), inProgress,
            label(iteration, total) + inProgress.displayName());

        CollaboratorOutcome outcome;
        try {
            StageInput input = new StageInput(sessionId, session.topic(), session.params(), iteration, upstream);
            outcome = collaborators.forStage(stage).invoke(input, guard);
        } catch (RuntimeException e) {
            throw new PhaseFailure(inProgress.displayName() + " failed: " + describe(e), e);
        }
        if (outcome == null) {
            throw new PhaseFailure(inProgress.displayName() + " failed: collaborator returned no outcome", null);
        }

        if (outcome instanceof Fatal) {
            Fatal fatal = (Fatal) outcome;
            throw new PhaseFailure(inProgress.displayName() + " failed: [" + fatal.errorCode() + "] "
                + fatal.message() + (fatal.cause() != null ? " (" + fatal.cause() + ")" : ""), null);
        }

        List<ItemFailure> failures = outcome.itemFailures();
        for (ItemFailure failure : failures) {
            store.appendLog(sessionId, inProgress, "Item " + failure.itemKey() + " failed: " + failure.reason());
        }

        Phase done = stage.done();
        String doneMessage = label(iteration, total) + done.displayName()
            + (failures.isEmpty() ? "" : " (" + failures.size() + " item failure(s))");
        store.updateProgress(sessionId, done.progressFloor(), done, doneMessage);

        return outcome.output().orElse(Payload.empty());
    }

    private void saveResults(SessionId sessionId, Payload finalOutput) {
        if (resultWriter == null) {
            return;
        }
        try {
            Session current = store.get(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
            String location = resultWriter.write(current, finalOutput);
            store.setResultLocation(sessionId, location);
            log.info("Session {} results saved to {}", sessionId, location);
        } catch (RuntimeException e) {
            throw new PhaseFailure(config.resultFailurePhaseLabel() + " failed: " + describe(e), e);
        }
    }

    private void checkCancelled(SessionId sessionId, String phaseName) {
        if (cancelled.contains(sessionId)) {
            log.warn("Session {} cancelled before {}", sessionId, phaseName);
            throw new PhaseFailure(config.cancellationMessage(), null);
        }
    }

    private static String label(int iteration, int total) {
        return total > 1 ? "Iteration " + iteration + "/" + total + ": " : "";
    }

    // 풀 고갈이 감싸져 올라와도 진단 메시지에 서비스 이름이 남도록 원인 체인을 확인
    private static String describe(Throwable failure) {
        String message = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
        for (Throwable cause = failure; cause != null; cause = cause.getCause()) {
            if (cause instanceof PoolExhaustedException) {
                String service = ((PoolExhaustedException) cause).getService().value();
                if (!message.contains(service)) {
                    return message + " (service '" + service + "' has no usable credentials)";
                }
                break;
            }
        }
        return message;
    }

    private static final class PhaseFailure extends RuntimeException {
        private PhaseFailure(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
