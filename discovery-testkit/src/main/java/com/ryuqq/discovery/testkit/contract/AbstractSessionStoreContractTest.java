package com.ryuqq.discovery.testkit.contract;

import com.ryuqq.discovery.core.exception.InvalidSessionStateException;
import com.ryuqq.discovery.core.exception.SessionNotFoundException;
import com.ryuqq.discovery.core.model.Session;
import com.ryuqq.discovery.core.model.SessionId;
import com.ryuqq.discovery.core.model.SessionLogEntry;
import com.ryuqq.discovery.core.model.SessionParams;
import com.ryuqq.discovery.core.spi.SessionStore;
import com.ryuqq.discovery.core.statemachine.Phase;
import com.ryuqq.discovery.core.statemachine.SessionStatus;
import com.ryuqq.discovery.testkit.time.ManualClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Abstract base class for SessionStore Contract Tests.
 *
 * <p>Every adapter subclasses this and supplies a fresh store bound to the given clock.
 * The clock starts at {@link #START} and only moves when a test advances it.</p>
 *
 * <p><strong>Contract Coverage:</strong></p>
 * <ul>
 *   <li>Creation: PENDING, progress 0, empty log</li>
 *   <li>Progress: clamp policy, log entry per update, rejection after terminal status</li>
 *   <li>Status: PENDING → RUNNING → {COMPLETED, FAILED}, terminal set exactly once</li>
 *   <li>Queries: newest-first listing, status filter, log ordering</li>
 *   <li>Deletion: session and log removed together</li>
 * </ul>
 *
 * @author Discovery Team
 * @since 1.0.0
 */
public abstract class AbstractSessionStoreContractTest {

    protected static final Instant START = Instant.parse("2024-05-01T09:00:00Z");

    protected ManualClock clock;
    protected SessionStore store;

    /**
     * Creates the store under test.
     *
     * @param clock clock the store must use for every timestamp
     * @return a fresh, empty store
     */
    protected abstract SessionStore createStore(ManualClock clock);

    @BeforeEach
    void setUpStore() {
        clock = new ManualClock(START);
        store = createStore(clock);
    }

    @Test
    void create_startsPendingWithZeroProgress() {
        // given
        SessionParams params = new SessionParams().withIterations(2).withMaxPapers(5);

        // when
        SessionId id = store.create("perovskite solar cells", params);

        // then
        Session session = requireSession(id);
        assertEquals(SessionStatus.PENDING, session.status());
        assertEquals(0, session.progress());
        assertEquals(Phase.STARTING, session.phase());
        assertEquals("perovskite solar cells", session.topic());
        assertEquals(params, session.params());
        assertEquals(START, session.createdAt());
        assertNull(session.completedAt());
        assertTrue(session.resultLocationIfPresent().isEmpty());
        assertTrue(store.logs(id).isEmpty());
    }

    @Test
    void create_generatesDistinctIds() {
        SessionId first = store.create("topic a", new SessionParams());
        SessionId second = store.create("topic b", new SessionParams());

        assertNotEquals(first, second);
    }

    @Test
    void create_rejectsBlankTopic() {
        assertThrows(IllegalArgumentException.class, () -> store.create("  ", new SessionParams()));
        assertThrows(IllegalArgumentException.class, () -> store.create("topic", null));
    }

    @Test
    void updateProgress_storesProgressAndAppendsLog() {
        // given
        SessionId id = runningSession();
        clock.advance(Duration.ofSeconds(5));

        // when
        store.updateProgress(id, 10, Phase.COLLECTING_PAPERS, "Collecting papers");

        // then
        Session session = requireSession(id);
        assertEquals(10, session.progress());
        assertEquals(Phase.COLLECTING_PAPERS, session.phase());
        assertEquals("Collecting papers", session.message());
        assertEquals(START.plusSeconds(5), session.updatedAt());

        List<SessionLogEntry> logs = store.logs(id);
        assertEquals(1, logs.size());
        assertEquals(Phase.COLLECTING_PAPERS, logs.get(0).phase());
        assertEquals("Collecting papers", logs.get(0).message());
        assertEquals(START.plusSeconds(5), logs.get(0).timestamp());
    }

    @Test
    void updateProgress_clampsLowerProgress() {
        // given
        SessionId id = runningSession();
        store.updateProgress(id, 45, Phase.ANALYSIS_COMPLETE, "Analysis done");

        // when: lower value is not an error
        store.updateProgress(id, 30, Phase.ANALYZING_PAPERS, "Re-analyzing");

        // then: progress keeps the maximum, phase and message follow the request
        Session session = requireSession(id);
        assertEquals(45, session.progress());
        assertEquals(Phase.ANALYZING_PAPERS, session.phase());
        assertEquals("Re-analyzing", session.message());
        assertEquals(2, store.logs(id).size());
    }

    @Test
    void updateProgress_rejectsOutOfRangeProgress() {
        SessionId id = runningSession();

        assertThrows(IllegalArgumentException.class,
            () -> store.updateProgress(id, 101, Phase.COMPLETED, "too far"));
        assertThrows(IllegalArgumentException.class,
            () -> store.updateProgress(id, -1, Phase.STARTING, "negative"));
        assertEquals(0, requireSession(id).progress());
    }

    @Test
    void updateProgress_unknownSession_throwsNotFound() {
        SessionId unknown = SessionId.of("session_missing");

        assertThrows(SessionNotFoundException.class,
            () -> store.updateProgress(unknown, 10, Phase.COLLECTING_PAPERS, "x"));
    }

    @Test
    void updateProgress_afterTerminal_throwsInvalidState() {
        // given
        SessionId id = runningSession();
        store.setStatus(id, SessionStatus.FAILED, "boom");

        // when / then
        assertThrows(InvalidSessionStateException.class,
            () -> store.updateProgress(id, 50, Phase.TESTING_HYPOTHESES, "late"));
        assertEquals(SessionStatus.FAILED, requireSession(id).status());
    }

    @Test
    void setStatus_completedForcesFullProgress() {
        // given
        SessionId id = runningSession();
        store.updateProgress(id, 95, Phase.DISCOVERIES_FOUND, "Found 3 discoveries");
        clock.advance(Duration.ofMinutes(2));

        // when
        store.setStatus(id, SessionStatus.COMPLETED);

        // then
        Session session = requireSession(id);
        assertEquals(SessionStatus.COMPLETED, session.status());
        assertEquals(100, session.progress());
        assertEquals(Phase.COMPLETED, session.phase());
        assertEquals(START.plus(Duration.ofMinutes(2)), session.completedAt());
    }

    @Test
    void setStatus_failedStoresAndLogsMessage() {
        // given
        SessionId id = runningSession();
        store.updateProgress(id, 30, Phase.ANALYZING_PAPERS, "Analyzing 20 papers");

        // when
        store.setStatus(id, SessionStatus.FAILED, "AnalyzingPapers failed: quota");

        // then
        Session session = requireSession(id);
        assertEquals(SessionStatus.FAILED, session.status());
        assertEquals(30, session.progress());
        assertEquals("AnalyzingPapers failed: quota", session.message());
        assertNull(session.completedAt());

        List<String> messages = messages(id);
        assertEquals("AnalyzingPapers failed: quota", messages.get(messages.size() - 1));
    }

    @Test
    void setStatus_terminalIsSetExactlyOnce() {
        // given
        SessionId id = runningSession();
        store.setStatus(id, SessionStatus.COMPLETED);

        // when / then
        assertThrows(InvalidSessionStateException.class,
            () -> store.setStatus(id, SessionStatus.FAILED, "late failure"));
        assertThrows(InvalidSessionStateException.class,
            () -> store.setStatus(id, SessionStatus.COMPLETED));
        assertEquals(SessionStatus.COMPLETED, requireSession(id).status());
    }

    @Test
    void setStatus_pendingCannotSkipRunning() {
        SessionId id = store.create("topic", new SessionParams());

        assertThrows(InvalidSessionStateException.class, () -> store.setStatus(id, SessionStatus.COMPLETED));
        assertThrows(InvalidSessionStateException.class, () -> store.setStatus(id, SessionStatus.FAILED));
        assertEquals(SessionStatus.PENDING, requireSession(id).status());
    }

    @Test
    void setStatus_unknownSession_throwsNotFound() {
        assertThrows(SessionNotFoundException.class,
            () -> store.setStatus(SessionId.of("session_missing"), SessionStatus.RUNNING));
    }

    @Test
    void appendLog_allowedAfterTerminal() {
        // given
        SessionId id = runningSession();
        store.setStatus(id, SessionStatus.FAILED, "stopped");
        int before = store.logs(id).size();

        // when
        store.appendLog(id, Phase.ANALYZING_PAPERS, "paper-7: parse error");

        // then
        assertEquals(before + 1, store.logs(id).size());
        assertEquals(SessionStatus.FAILED, requireSession(id).status());
    }

    @Test
    void appendLog_unknownSession_throwsNotFound() {
        assertThrows(SessionNotFoundException.class,
            () -> store.appendLog(SessionId.of("session_missing"), Phase.STARTING, "x"));
    }

    @Test
    void logs_keepInsertionOrderForEqualTimestamps() {
        // given: clock does not move between writes
        SessionId id = runningSession();

        // when
        store.updateProgress(id, 10, Phase.COLLECTING_PAPERS, "first");
        store.appendLog(id, Phase.COLLECTING_PAPERS, "second");
        store.updateProgress(id, 20, Phase.PAPERS_COLLECTED, "third");

        // then
        assertEquals(List.of("first", "second", "third"), messages(id));
    }

    @Test
    void setResultLocation_isStored() {
        SessionId id = runningSession();

        store.setResultLocation(id, "results/" + id + "/summary.json");

        assertEquals("results/" + id + "/summary.json", requireSession(id).resultLocation());
    }

    @Test
    void list_returnsNewestFirst() {
        // given
        SessionId oldest = store.create("one", new SessionParams());
        clock.advance(Duration.ofSeconds(1));
        SessionId middle = store.create("two", new SessionParams());
        clock.advance(Duration.ofSeconds(1));
        SessionId newest = store.create("three", new SessionParams());

        // when
        List<SessionId> ids = store.list().stream().map(Session::id).collect(Collectors.toList());

        // then
        assertEquals(List.of(newest, middle, oldest), ids);
    }

    @Test
    void list_filtersByStatus() {
        // given
        SessionId pending = store.create("pending", new SessionParams());
        clock.advance(Duration.ofSeconds(1));
        SessionId running = runningSession();

        // when
        List<Session> runningSessions = store.list(SessionStatus.RUNNING);
        List<Session> pendingSessions = store.list(SessionStatus.PENDING);

        // then
        assertEquals(1, runningSessions.size());
        assertEquals(running, runningSessions.get(0).id());
        assertEquals(1, pendingSessions.size());
        assertEquals(pending, pendingSessions.get(0).id());
        assertTrue(store.list(SessionStatus.COMPLETED).isEmpty());
    }

    @Test
    void remove_deletesSessionAndLogs() {
        // given
        SessionId id = runningSession();
        store.updateProgress(id, 10, Phase.COLLECTING_PAPERS, "Collecting");

        // when
        boolean removed = store.remove(id);

        // then
        assertTrue(removed);
        assertTrue(store.get(id).isEmpty());
        assertTrue(store.logs(id).isEmpty());
        assertFalse(store.remove(id));
    }

    @Test
    void get_unknownSession_isEmpty() {
        assertTrue(store.get(SessionId.of("session_missing")).isEmpty());
        assertTrue(store.logs(SessionId.of("session_missing")).isEmpty());
    }

    /**
     * Creates a session and moves it to RUNNING.
     *
     * @return id of the running session
     */
    protected SessionId runningSession() {
        SessionId id = store.create("solid-state electrolytes", new SessionParams());
        store.setStatus(id, SessionStatus.RUNNING);
        return id;
    }

    /**
     * Reads a session that must exist.
     *
     * @param id the session id
     * @return the session snapshot
     */
    protected Session requireSession(SessionId id) {
        return store.get(id).orElseThrow(() -> new AssertionError("Session not found: " + id));
    }

    /**
     * Log messages of a session in stored order.
     *
     * @param id the session id
     * @return messages
     */
    protected List<String> messages(SessionId id) {
        return store.logs(id).stream().map(SessionLogEntry::message).collect(Collectors.toList());
    }
}
