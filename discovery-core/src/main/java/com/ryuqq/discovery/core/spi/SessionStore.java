package com.ryuqq.discovery.core.spi;

import com.ryuqq.discovery.core.exception.InvalidSessionStateException;
import com.ryuqq.discovery.core.exception.SessionNotFoundException;
import com.ryuqq.discovery.core.model.Session;
import com.ryuqq.discovery.core.model.SessionId;
import com.ryuqq.discovery.core.model.SessionLogEntry;
import com.ryuqq.discovery.core.model.SessionParams;
import com.ryuqq.discovery.core.statemachine.Phase;
import com.ryuqq.discovery.core.statemachine.SessionStatus;

import java.util.List;
import java.util.Optional;

/**
 * Durable record of pipeline runs: one row per session plus an append-only log.
 *
 * <p><strong>Concurrency model:</strong></p>
 * <ul>
 *   <li>One writer per session (the orchestrator driving it)</li>
 *   <li>Any number of concurrent readers (monitoring view)</li>
 *   <li>Every mutation is atomic: readers never observe a partially updated row</li>
 * </ul>
 *
 * <p><strong>Progress policy (clamp):</strong> a progress value lower than the stored one
 * is not an error. The stored value becomes {@code max(stored, requested)} while phase,
 * message and the log entry are still recorded.</p>
 *
 * <p><strong>Status policy:</strong> transitions are validated by
 * {@link com.ryuqq.discovery.core.statemachine.StatusTransition}; COMPLETED and FAILED are
 * terminal and can be set exactly once. COMPLETED also forces progress to 100.</p>
 *
 * <p><strong>Persistent layout:</strong></p>
 * <pre>
 * sessions(session_id, topic, params, status, progress, phase, message,
 *          created_at, updated_at, completed_at, result_location)
 * session_logs(id, session_id, timestamp, phase, message)
 * </pre>
 *
 * @author Discovery Team
 * @since 1.0.0
 */
public interface SessionStore {

    /**
     * Creates a PENDING session with progress 0 and an empty log.
     *
     * @param topic research topic (non-blank)
     * @param params run parameters
     * @return the new session id
     * @throws IllegalArgumentException if topic is blank or params is null
     */
    SessionId create(String topic, SessionParams params);

    /**
     * Records progress and appends a log entry with the same phase and message.
     *
     * @param sessionId the session
     * @param progress requested progress, 0..100 (clamped to never decrease)
     * @param phase current phase
     * @param message progress message
     * @throws SessionNotFoundException if the session does not exist
     * @throws InvalidSessionStateException if the session is already terminal
     * @throws IllegalArgumentException if progress is outside 0..100
     */
    void updateProgress(SessionId sessionId, int progress, Phase phase, String message);

    /**
     * Changes the status.
     *
     * @param sessionId the session
     * @param status target status
     * @throws SessionNotFoundException if the session does not exist
     * @throws InvalidSessionStateException if the transition is not allowed
     */
    default void setStatus(SessionId sessionId, SessionStatus status) {
        setStatus(sessionId, status, null);
    }

    /**
     * Changes the status, storing and logging a message (e.g. a failure diagnostic).
     *
     * @param sessionId the session
     * @param status target status
     * @param message message to store, or null to keep the current one
     * @throws SessionNotFoundException if the session does not exist
     * @throws InvalidSessionStateException if the transition is not allowed
     */
    void setStatus(SessionId sessionId, SessionStatus status, String message);

    /**
     * Appends a log entry without touching progress. Allowed in any status.
     *
     * @param sessionId the session
     * @param phase phase the entry belongs to
     * @param message log message
     * @throws SessionNotFoundException if the session does not exist
     */
    void appendLog(SessionId sessionId, Phase phase, String message);

    /**
     * Records where the results of the session were written.
     *
     * @param sessionId the session
     * @param location result location
     * @throws SessionNotFoundException if the session does not exist
     */
    void setResultLocation(SessionId sessionId, String location);

    /**
     * Reads one session.
     *
     * @param sessionId the session
     * @return snapshot, or empty if unknown
     */
    Optional<Session> get(SessionId sessionId);

    /**
     * Lists every session, newest first.
     *
     * @return sessions ordered by created_at descending
     */
    List<Session> list();

    /**
     * Lists sessions in one status, newest first.
     *
     * @param status status filter
     * @return matching sessions ordered by created_at descending
     */
    List<Session> list(SessionStatus status);

    /**
     * Deletes a session and its log. Explicit operator action only.
     *
     * @param sessionId the session
     * @return true if the session existed
     */
    boolean remove(SessionId sessionId);

    /**
     * Reads the log of a session.
     *
     * @param sessionId the session
     * @return entries in timestamp order (insertion order for equal timestamps);
     *         empty for an unknown session
     */
    List<SessionLogEntry> logs(SessionId sessionId);
}
