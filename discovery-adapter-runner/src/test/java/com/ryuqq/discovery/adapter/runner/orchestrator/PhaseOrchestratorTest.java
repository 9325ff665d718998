package com.ryuqq.discovery.adapter.runner.orchestrator;

import com.ryuqq.discovery.adapter.inmemory.store.InMemorySessionStore;
import com.ryuqq.discovery.adapter.runner.batch.BatchExecutor;
import com.ryuqq.discovery.adapter.runner.batch.BatchResult;
import com.ryuqq.discovery.adapter.runner.credential.RotatingCredentialPool;
import com.ryuqq.discovery.adapter.runner.guard.GuardConfig;
import com.ryuqq.discovery.adapter.runner.guard.RetryingExecutionGuard;
import com.ryuqq.discovery.core.credential.Credential;
import com.ryuqq.discovery.core.credential.CredentialPoolConfig;
import com.ryuqq.discovery.core.exception.DiscoveryException;
import com.ryuqq.discovery.core.exception.InvalidSessionStateException;
import com.ryuqq.discovery.core.exception.NonRetryableCallException;
import com.ryuqq.discovery.core.exception.SessionNotFoundException;
import com.ryuqq.discovery.core.guard.FailureKind;
import com.ryuqq.discovery.core.model.Payload;
import com.ryuqq.discovery.core.model.ServiceName;
import com.ryuqq.discovery.core.model.Session;
import com.ryuqq.discovery.core.model.SessionId;
import com.ryuqq.discovery.core.model.SessionLogEntry;
import com.ryuqq.discovery.core.model.SessionParams;
import com.ryuqq.discovery.core.outcome.Fatal;
import com.ryuqq.discovery.core.outcome.Success;
import com.ryuqq.discovery.core.spi.StageInput;
import com.ryuqq.discovery.core.statemachine.Phase;
import com.ryuqq.discovery.core.statemachine.SessionStatus;
import com.ryuqq.discovery.testkit.collaborator.ScriptedCollaborator;
import com.ryuqq.discovery.testkit.time.ManualClock;
import com.ryuqq.discovery.testkit.time.RecordingSleeper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * PhaseOrchestrator 통합 테스트.
 *
 * <p>InMemorySessionStore, 실제 RotatingCredentialPool/RetryingExecutionGuard와
 * ScriptedCollaborator로 세션 하나를 처음부터 끝까지 실행합니다.</p>
 *
 * <ul>
 *   <li>정상 완료 시 페이즈 로그 순서와 최종 상태</li>
 *   <li>Partial 결과는 아이템 실패 로그 후 계속 진행</li>
 *   <li>풀 고갈, Fatal, 예외 시 FAILED와 이후 단계 미실행</li>
 *   <li>반복 실행 시 페이즈 하한 보고, 저장된 진행률 단조 증가, 페이로드 전달</li>
 *   <li>취소, 결과 저장</li>
 * </ul>
 *
 * @author Discovery Team
 * @since 1.0.0
 */
class PhaseOrchestratorTest {

    private static final ServiceName GEMINI = ServiceName.of("gemini");
    private static final ServiceName ARXIV = ServiceName.of("arxiv");
    private static final String TOPIC = "room-temperature superconductors";

    private ManualClock clock;
    private InMemorySessionStore store;
    private RotatingCredentialPool pool;
    private RecordingSleeper sleeper;
    private RetryingExecutionGuard guard;

    private ScriptedCollaborator collection;
    private ScriptedCollaborator analysis;
    private ScriptedCollaborator hypothesis;
    private ScriptedCollaborator testing;
    private ScriptedCollaborator evaluation;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(Instant.parse("2024-05-01T09:00:00Z"));
        store = new InMemorySessionStore(clock);
        pool = new RotatingCredentialPool(clock, new CredentialPoolConfig());
        pool.load(GEMINI, List.of("gemini-key-a", "gemini-key-b", "gemini-key-c"));
        pool.load(ARXIV, List.of("arxiv-key"));
        sleeper = new RecordingSleeper(clock);
        guard = new RetryingExecutionGuard(pool, new GuardConfig(), sleeper);

        collection = ScriptedCollaborator.named("collection");
        analysis = ScriptedCollaborator.named("analysis");
        hypothesis = ScriptedCollaborator.named("hypothesis");
        testing = ScriptedCollaborator.named("testing");
        evaluation = ScriptedCollaborator.named("evaluation");
    }

    @AfterEach
    void tearDown() {
        guard.close();
    }

    // ============================================================
    // 1. 정상 완료
    // ============================================================

    @Test
    void run_모든_단계가_성공하면_COMPLETED와_페이즈_로그() {
        // given
        SessionId id = store.create(TOPIC, new SessionParams().withIterations(1));

        // when
        Session result = orchestrator().run(id);

        // then
        assertThat(result.status()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(result.progress()).isEqualTo(100);
        assertThat(result.phase()).isEqualTo(Phase.COMPLETED);
        assertThat(result.completedAt()).isNotNull();
        assertThat(messages(id)).containsExactly(
            "Starting discovery for topic: " + TOPIC,
            "CollectingPapers",
            "PapersCollected",
            "AnalyzingPapers",
            "AnalysisComplete",
            "GeneratingHypotheses",
            "HypothesesGenerated",
            "TestingHypotheses",
            "TestingComplete",
            "EvaluatingResults",
            "DiscoveriesFound",
            "Discovery completed");
        assertThat(phases(id)).containsSubsequence(Phase.STARTING, Phase.COLLECTING_PAPERS, Phase.DISCOVERIES_FOUND,
            Phase.COMPLETED);
    }

    @Test
    void run_일부_아이템이_실패해도_계속_진행한다() {
        // given
        SessionId id = store.create(TOPIC, new SessionParams().withIterations(1));
        List<String> papers = new ArrayList<>();
        for (int i = 1; i <= 20; i++) {
            papers.add("paper-" + i);
        }

        try (BatchExecutor batch = new BatchExecutor(guard)) {
            collection.thenAnswer((input, g) -> {
                BatchResult<String> fetched = batch.run(papers, p -> p, ARXIV, (paper, credential) -> {
                    if (paper.equals("paper-4") || paper.equals("paper-11")) {
                        throw new NonRetryableCallException(paper + " not found");
                    }
                    return paper;
                });
                return fetched.toOutcome(results -> Payload.of("{\"papers\":" + results.size() + "}"));
            });
            AtomicReference<Session> duringAnalysis = new AtomicReference<>();
            analysis.thenAnswer((input, g) -> {
                duringAnalysis.set(store.get(input.sessionId()).orElseThrow());
                return Success.of(Payload.of("{}"));
            });

            // when
            Session result = orchestrator().run(id);

            // then
            assertThat(result.status()).isEqualTo(SessionStatus.COMPLETED);
            assertThat(messages(id))
                .contains("Item paper-4 failed: paper-4 not found", "Item paper-11 failed: paper-11 not found")
                .contains("PapersCollected (2 item failure(s))");
            assertThat(analysis.inputs().get(0).upstream()).isEqualTo(Payload.of("{\"papers\":18}"));
            assertThat(store.logs(id).stream().filter(e -> e.message().startsWith("Item "))).hasSize(2);

            // 수집 단계 직후 상태: PapersCollected(20) 이후 분석 단계 진입, 여전히 RUNNING
            Session snapshot = duringAnalysis.get();
            assertThat(snapshot.status()).isEqualTo(SessionStatus.RUNNING);
            assertThat(snapshot.phase()).isEqualTo(Phase.ANALYZING_PAPERS);
            assertThat(logsBefore(id, "AnalyzingPapers")).endsWith("PapersCollected (2 item failure(s))");
        }
    }

    // ============================================================
    // 2. 실패
    // ============================================================

    @Test
    void run_모든_자격_증명이_비활성화면_FAILED_이후_단계_미실행() {
        // given
        SessionId id = store.create(TOPIC, new SessionParams().withIterations(1));
        disableAll(GEMINI);
        analysis.thenAnswer((input, g) -> {
            String summary = g.execute(GEMINI, credential -> "analysis of " + input.upstream().json());
            return Success.of(Payload.of(summary));
        });

        // when
        Session result = orchestrator().run(id);

        // then
        assertThat(result.status()).isEqualTo(SessionStatus.FAILED);
        assertThat(result.message()).startsWith("AnalyzingPapers failed:").contains("gemini");
        assertThat(result.completedAt()).isNull();
        assertThat(result.progress()).isLessThan(100);
        assertThat(hypothesis.invocationCount()).isZero();
        assertThat(testing.invocationCount()).isZero();
        assertThat(sleeper.sleeps()).containsExactly(2_000L, 4_000L, 8_000L);
        List<String> messages = messages(id);
        assertThat(messages.get(messages.size() - 1)).isEqualTo(result.message());
    }

    @Test
    void run_Fatal_결과면_원인을_담아_FAILED() {
        // given
        SessionId id = store.create(TOPIC, new SessionParams().withIterations(1));
        testing.thenReturn(Fatal.of("NO_EXPERIMENTS", "No experiment could run", "sandbox offline"));

        // when
        Session result = orchestrator().run(id);

        // then
        assertThat(result.status()).isEqualTo(SessionStatus.FAILED);
        assertThat(result.message())
            .isEqualTo("TestingHypotheses failed: [NO_EXPERIMENTS] No experiment could run (sandbox offline)");
        assertThat(evaluation.invocationCount()).isZero();
        assertThat(result.phase()).isEqualTo(Phase.TESTING_HYPOTHESES);
    }

    @Test
    void run_협력자가_예외를_던지면_FAILED() {
        // given
        SessionId id = store.create(TOPIC, new SessionParams().withIterations(1));
        collection.thenThrow(new IllegalStateException("arXiv response could not be parsed"));

        // when
        Session result = orchestrator().run(id);

        // then
        assertThat(result.status()).isEqualTo(SessionStatus.FAILED);
        assertThat(result.message()).isEqualTo("CollectingPapers failed: arXiv response could not be parsed");
        assertThat(analysis.invocationCount()).isZero();
    }

    @Test
    void run_PENDING이_아니면_실행할_수_없다() {
        // given
        SessionId id = store.create(TOPIC, new SessionParams().withIterations(1));
        PhaseOrchestrator orchestrator = orchestrator();
        orchestrator.run(id);

        // when & then
        assertThatThrownBy(() -> orchestrator.run(id)).isInstanceOf(InvalidSessionStateException.class);
        assertThat(collection.invocationCount()).isEqualTo(1);
    }

    @Test
    void run_없는_세션이면_SessionNotFoundException() {
        assertThatThrownBy(() -> orchestrator().run(SessionId.of("session_missing")))
            .isInstanceOf(SessionNotFoundException.class);
    }

    // ============================================================
    // 3. 반복 실행
    // ============================================================

    @Test
    void run_반복마다_페이즈_하한을_보고하고_저장된_진행률은_줄지_않는다() {
        // given
        InMemorySessionStore spyStore = spy(store);
        SessionId id = spyStore.create(TOPIC, new SessionParams().withIterations(3));
        List<Integer> stored = recordStoredProgress(spyStore, id);
        PhaseOrchestrator orchestrator = new PhaseOrchestrator(spyStore, guard, collaborators());

        // when
        Session result = orchestrator.run(id);

        // then
        ArgumentCaptor<Integer> progress = ArgumentCaptor.forClass(Integer.class);
        verify(spyStore, times(32)).updateProgress(eq(id), progress.capture(), any(), anyString());
        List<Integer> requested = progress.getAllValues();
        assertThat(requested.get(0)).isZero();
        assertThat(requested.subList(1, 11)).containsExactly(10, 20, 30, 45, 55, 65, 75, 85, 90, 95);
        assertThat(requested.subList(11, 21)).containsExactly(10, 20, 30, 45, 55, 65, 75, 85, 90, 95);
        assertThat(requested.get(31)).isEqualTo(100);

        // 두 번째 반복부터는 clamp되어 95 유지, 100은 마지막에 한 번
        assertThat(stored).hasSize(32).isSorted();
        assertThat(stored.subList(11, 31)).containsOnly(95);
        assertThat(stored.stream().filter(v -> v == 100).count()).isEqualTo(1);
        assertThat(result.status()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(spyStore.logs(id).stream().map(SessionLogEntry::message))
            .contains("Iteration 1/3: CollectingPapers", "Iteration 3/3: DiscoveriesFound");
    }

    @Test
    void run_기본_파라미터에서도_PapersCollected_진행률은_20() {
        // given
        InMemorySessionStore spyStore = spy(store);
        SessionId id = spyStore.create("X", new SessionParams().withMaxPapers(20));
        AtomicReference<Session> afterCollection = new AtomicReference<>();
        doAnswer(invocation -> {
            invocation.callRealMethod();
            if (invocation.getArgument(2) == Phase.PAPERS_COLLECTED && afterCollection.get() == null) {
                afterCollection.set(spyStore.get(id).orElseThrow());
            }
            return null;
        }).when(spyStore).updateProgress(eq(id), anyInt(), any(), any());

        try (BatchExecutor batch = new BatchExecutor(guard)) {
            collection.thenAnswer((input, g) -> {
                List<String> papers = new ArrayList<>();
                for (int i = 1; i <= input.params().maxPapers(); i++) {
                    papers.add("paper-" + i);
                }
                BatchResult<String> fetched = batch.run(papers, p -> p, ARXIV, (paper, credential) -> {
                    if (paper.equals("paper-7") || paper.equals("paper-13")) {
                        throw new NonRetryableCallException(paper + " not found");
                    }
                    return paper;
                });
                return fetched.toOutcome(results -> Payload.of("{\"papers\":" + results.size() + "}"));
            });

            // when
            Session result = new PhaseOrchestrator(spyStore, guard, collaborators()).run(id);

            // then
            assertThat(result.params().iterations()).isEqualTo(SessionParams.DEFAULT_ITERATIONS);
            Session snapshot = afterCollection.get();
            assertThat(snapshot.progress()).isEqualTo(20);
            assertThat(snapshot.status()).isEqualTo(SessionStatus.RUNNING);
            assertThat(snapshot.phase()).isEqualTo(Phase.PAPERS_COLLECTED);
            assertThat(spyStore.logs(id).stream().filter(e -> e.message().startsWith("Item "))).hasSize(2);
            assertThat(analysis.inputs().get(0).upstream()).isEqualTo(Payload.of("{\"papers\":18}"));
        }
    }

    @Test
    void run_단계_출력이_다음_단계와_다음_반복으로_전달된다() {
        // given
        SessionId id = store.create(TOPIC, new SessionParams().withIterations(2));

        // when
        orchestrator().run(id);

        // then
        List<StageInput> collected = collection.inputs();
        assertThat(collected).hasSize(2);
        assertThat(collected.get(0).upstream().isEmpty()).isTrue();
        assertThat(collected.get(1).upstream()).isEqualTo(Payload.of("{\"stage\":\"evaluation\",\"iteration\":1}"));
        assertThat(collected.get(1).iteration()).isEqualTo(2);
        assertThat(analysis.inputs().get(0).upstream())
            .isEqualTo(Payload.of("{\"stage\":\"collection\",\"iteration\":1}"));
        assertThat(evaluation.inputs()).extracting(StageInput::topic).containsOnly(TOPIC);
    }

    // ============================================================
    // 4. 취소 / 결과 저장
    // ============================================================

    @Test
    void cancel_다음_단계_경계에서_FAILED로_끝난다() {
        // given
        SessionId id = store.create(TOPIC, new SessionParams().withIterations(1));
        PhaseOrchestrator orchestrator = orchestrator();
        collection.thenAnswer((input, g) -> {
            orchestrator.cancel(input.sessionId());
            return Success.of(Payload.of("{}"));
        });

        // when
        Session result = orchestrator.run(id);

        // then
        assertThat(result.status()).isEqualTo(SessionStatus.FAILED);
        assertThat(result.message()).isEqualTo(OrchestratorConfig.DEFAULT_CANCELLATION_MESSAGE);
        assertThat(analysis.invocationCount()).isZero();
        assertThat(orchestrator.isCancellationPending(id)).isFalse();
    }

    @Test
    void cancel_실행_전_세션이면_무시하고_이후_실행은_완료된다() {
        // given
        SessionId id = store.create(TOPIC, new SessionParams().withIterations(1));
        PhaseOrchestrator orchestrator = orchestrator();

        // when
        orchestrator.cancel(id);
        Session result = orchestrator.run(id);

        // then
        assertThat(result.status()).isEqualTo(SessionStatus.COMPLETED);
    }

    @Test
    void cancel_종료된_세션이나_없는_세션이면_플래그를_남기지_않는다() {
        // given
        SessionId id = store.create(TOPIC, new SessionParams().withIterations(1));
        SessionId unknown = SessionId.of("session_20240501_090000_000_9999");
        PhaseOrchestrator orchestrator = orchestrator();
        orchestrator.run(id);

        // when
        orchestrator.cancel(id);
        orchestrator.cancel(unknown);

        // then
        assertThat(orchestrator.isCancellationPending(id)).isFalse();
        assertThat(orchestrator.isCancellationPending(unknown)).isFalse();
        assertThat(store.get(id)).map(Session::status).contains(SessionStatus.COMPLETED);
    }

    @Test
    void run_결과_저장_위치를_기록한다() {
        // given
        SessionId id = store.create(TOPIC, new SessionParams().withIterations(1));
        AtomicReference<Payload> written = new AtomicReference<>();
        PhaseOrchestrator orchestrator = new PhaseOrchestrator(store, guard, collaborators(),
            (session, output) -> {
                written.set(output);
                return "results/" + session.id() + "/summary.json";
            }, new OrchestratorConfig());

        // when
        Session result = orchestrator.run(id);

        // then
        assertThat(result.status()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(result.resultLocation()).isEqualTo("results/" + id + "/summary.json");
        assertThat(written.get()).isEqualTo(Payload.of("{\"stage\":\"evaluation\",\"iteration\":1}"));
    }

    @Test
    void run_결과_저장이_실패하면_FAILED() {
        // given
        SessionId id = store.create(TOPIC, new SessionParams().withIterations(1));
        PhaseOrchestrator orchestrator = new PhaseOrchestrator(store, guard, collaborators(),
            (session, output) -> {
                throw new DiscoveryException("disk full");
            }, new OrchestratorConfig());

        // when
        Session result = orchestrator.run(id);

        // then
        assertThat(result.status()).isEqualTo(SessionStatus.FAILED);
        assertThat(result.message()).isEqualTo("SavingResults failed: disk full");
        assertThat(result.resultLocation()).isNull();
    }

    private PhaseOrchestrator orchestrator() {
        return new PhaseOrchestrator(store, guard, collaborators());
    }

    private PipelineCollaborators collaborators() {
        return new PipelineCollaborators(collection, analysis, hypothesis, testing, evaluation);
    }

    private void disableAll(ServiceName service) {
        for (int i = 0; i < pool.status(service).size(); i++) {
            Credential credential = pool.select(service);
            for (int j = 0; j < 3; j++) {
                pool.recordFailure(credential, FailureKind.TRANSIENT);
            }
        }
        assertThat(pool.availableCount(service)).isZero();
    }

    private List<Integer> recordStoredProgress(InMemorySessionStore spyStore, SessionId id) {
        List<Integer> stored = new ArrayList<>();
        doAnswer(invocation -> {
            invocation.callRealMethod();
            stored.add(spyStore.get(id).orElseThrow().progress());
            return null;
        }).when(spyStore).updateProgress(eq(id), anyInt(), any(), any());
        return stored;
    }

    private List<String> messages(SessionId id) {
        return store.logs(id).stream().map(SessionLogEntry::message).collect(Collectors.toList());
    }

    private List<String> logsBefore(SessionId id, String message) {
        List<String> all = messages(id);
        return all.subList(0, all.indexOf(message));
    }

    private List<Phase> phases(SessionId id) {
        return store.logs(id).stream().map(SessionLogEntry::phase).collect(Collectors.toList());
    }
}
