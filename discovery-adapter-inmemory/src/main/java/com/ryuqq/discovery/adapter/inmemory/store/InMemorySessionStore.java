package com.ryuqq.discovery.adapter.inmemory.store;

import com.ryuqq.discovery.core.exception.InvalidSessionStateException;
import com.ryuqq.discovery.core.exception.SessionNotFoundException;
import com.ryuqq.discovery.core.model.Session;
import com.ryuqq.discovery.core.model.SessionId;
import com.ryuqq.discovery.core.model.SessionIdGenerator;
import com.ryuqq.discovery.core.model.SessionLogEntry;
import com.ryuqq.discovery.core.model.SessionParams;
import com.ryuqq.discovery.core.spi.SessionStore;
import com.ryuqq.discovery.core.statemachine.Phase;
import com.ryuqq.discovery.core.statemachine.SessionStatus;
import com.ryuqq.discovery.core.statemachine.StatusTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link SessionStore} SPI for testing and reference purposes.
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>sessions:</strong> ConcurrentHashMap&lt;SessionId, Session&gt; - immutable snapshots,
 *       replaced atomically with {@link ConcurrentHashMap#compute}</li>
 *   <li><strong>logs:</strong> ConcurrentHashMap&lt;SessionId, CopyOnWriteArrayList&gt; - append-only log
 *       per session, appended inside the same compute call as the row update</li>
 * </ul>
 *
 * <p>Readers always see a whole snapshot, never a half-applied update.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @author Discovery Team
 * @since 1.0.0
 */
public class InMemorySessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(InMemorySessionStore.class);

    private static final Comparator<Session> NEWEST_FIRST =
        Comparator.comparing(Session::createdAt).thenComparing(Session::id).reversed();

    private final ConcurrentHashMap<SessionId, Session> sessions = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<SessionId, CopyOnWriteArrayList<SessionLogEntry>> logs = new ConcurrentHashMap<>();
    private final Clock clock;
    private final SessionIdGenerator idGenerator;

    /**
     * Creates a store using the system UTC clock.
     */
    public InMemorySessionStore() {
        this(Clock.systemUTC());
    }

    /**
     * Creates a store with an explicit clock.
     *
     * @param clock clock for every timestamp
     */
    public InMemorySessionStore(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
        this.idGenerator = new SessionIdGenerator(clock);
    }

    @Override
    public SessionId create(String topic, SessionParams params) {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic cannot be null or blank");
        }
        if (params == null) {
            throw new IllegalArgumentException("params cannot be null");
        }

        SessionId id = idGenerator.next();
        logs.put(id, new CopyOnWriteArrayList<>());
        sessions.put(id, Session.pending(id, topic, params, clock.instant()));
        log.debug("Created session {} for topic: {}", id, topic);
        return id;
    }

    @Override
    public void updateProgress(SessionId sessionId, int progress, Phase phase, String message) {
        if (progress < 0 || progress > 100) {
            throw new IllegalArgumentException("progress must be between 0 and 100 (current: " + progress + ")");
        }
        if (phase == null) {
            throw new IllegalArgumentException("phase cannot be null");
        }

        mutate(sessionId, current -> {
            if (current.status().isTerminal()) {
                throw new InvalidSessionStateException(
                    "Cannot update progress of session " + sessionId + " in terminal state " + current.status());
            }
            Instant now = clock.instant();
            Session updated = current.withProgress(Math.max(current.progress(), progress), phase, message, now);
            appendEntry(sessionId, now, phase, message);
            return updated;
        });
    }

    @Override
    public void setStatus(SessionId sessionId, SessionStatus status, String message) {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }

        mutate(sessionId, current -> {
            StatusTransition.validate(current.status(), status);
            Instant now = clock.instant();
            Session updated = current.withStatus(status, message, now);
            if (message != null) {
                appendEntry(sessionId, now, updated.phase(), message);
            }
            return updated;
        });
        log.debug("Session {} status → {}", sessionId, status);
    }

    @Override
    public void appendLog(SessionId sessionId, Phase phase, String message) {
        if (phase == null) {
            throw new IllegalArgumentException("phase cannot be null");
        }
        mutate(sessionId, current -> {
            appendEntry(sessionId, clock.instant(), phase, message);
            return current;
        });
    }

    @Override
    public void setResultLocation(SessionId sessionId, String location) {
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("location cannot be null or blank");
        }
        mutate(sessionId, current -> current.withResultLocation(location, clock.instant()));
    }

    @Override
    public Optional<Session> get(SessionId sessionId) {
        if (sessionId == null) {
            throw new IllegalArgumentException("sessionId cannot be null");
        }
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public List<Session> list() {
        return sessions.values().stream()
            .sorted(NEWEST_FIRST)
            .collect(Collectors.toList());
    }

    @Override
    public List<Session> list(SessionStatus status) {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        return sessions.values().stream()
            .filter(session -> session.status() == status)
            .sorted(NEWEST_FIRST)
            .collect(Collectors.toList());
    }

    @Override
    public boolean remove(SessionId sessionId) {
        if (sessionId == null) {
            throw new IllegalArgumentException("sessionId cannot be null");
        }
        boolean existed = sessions.remove(sessionId) != null;
        logs.remove(sessionId);
        if (existed) {
            log.info("Removed session {}", sessionId);
        }
        return existed;
    }

    @Override
    public List<SessionLogEntry> logs(SessionId sessionId) {
        if (sessionId == null) {
            throw new IllegalArgumentException("sessionId cannot be null");
        }
        List<SessionLogEntry> entries = logs.get(sessionId);
        return entries == null ? List.of() : List.copyOf(entries);
    }

    /**
     * Clears all sessions and logs.
     */
    public void clear() {
        sessions.clear();
        logs.clear();
    }

    private void mutate(SessionId sessionId, UnaryOperator<Session> update) {
        if (sessionId == null) {
            throw new IllegalArgumentException("sessionId cannot be null");
        }
        sessions.compute(sessionId, (id, current) -> {
            if (current == null) {
                throw new SessionNotFoundException(sessionId);
            }
            return update.apply(current);
        });
    }

    // Called inside compute(), so it is ordered with the row update of the same session.
    private void appendEntry(SessionId sessionId, Instant timestamp, Phase phase, String message) {
        logs.computeIfAbsent(sessionId, id -> new CopyOnWriteArrayList<>())
            .add(new SessionLogEntry(sessionId, timestamp, phase, message == null ? "" : message));
    }
}
