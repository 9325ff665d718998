package com.ryuqq.discovery.adapter.sqlite.store;

import com.ryuqq.discovery.core.exception.InvalidSessionStateException;
import com.ryuqq.discovery.core.exception.SessionNotFoundException;
import com.ryuqq.discovery.core.exception.SessionStoreException;
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
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;
import org.sqlite.SQLiteOpenMode;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * SQLite 기반 {@link SessionStore} 구현.
 *
 * <p>세션 한 건은 {@code sessions} 테이블의 한 행, 로그는 {@code session_logs} 테이블에
 * 추가 전용으로 저장됩니다. 행 갱신과 로그 추가는 {@code BEGIN IMMEDIATE} 트랜잭션 하나로
 * 묶여, 모니터 프로세스가 같은 파일을 읽어도 반쯤 적용된 상태를 보지 않습니다.</p>
 *
 * <p><strong>연결 설정:</strong></p>
 * <ul>
 *   <li>FULLMUTEX, WAL 저널, synchronous=NORMAL</li>
 *   <li>busy timeout 5초 + SQLITE_BUSY/LOCKED 시 선형 백오프 재시도</li>
 * </ul>
 *
 * <p>시각은 마이크로초 고정 폭 UTC 문자열로 저장하여 문자열 정렬이 시간 정렬과 같습니다.
 * {@link SQLException}은 {@link SessionStoreException}으로 감싸 전파합니다.</p>
 *
 * <p>다른 프로세스가 같은 세션 ID를 먼저 넣은 경우 기본 키 충돌을 감지하고 ID를 다시 발급합니다.</p>
 *
 * @author Discovery Team
 * @since 1.0.0
 */
public final class SqliteSessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(SqliteSessionStore.class);

    private static final int DEFAULT_BUSY_RETRIES = 8;
    private static final long DEFAULT_RETRY_BACKOFF_MS = 40L;
    private static final int SQLITE_BUSY_TIMEOUT_MS = 5_000;
    private static final int MAX_ID_ATTEMPTS = 5;

    private static final DateTimeFormatter TIMESTAMP =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSS'Z'").withZone(ZoneOffset.UTC);

    private static final String SELECT_SESSION = """
        SELECT session_id,
               topic,
               params,
               status,
               progress,
               phase,
               message,
               created_at,
               updated_at,
               completed_at,
               result_location
        FROM sessions
        """;

    private final DataSource dataSource;
    private final Clock clock;
    private final SessionIdGenerator idGenerator;
    private final SessionParamsCodec paramsCodec = new SessionParamsCodec();
    private final int busyRetries;
    private final long retryBackoffMs;

    /**
     * 파일 경로로 생성.
     *
     * @param dbPath 데이터베이스 파일
     * @param clock 타임스탬프용 시계
     */
    public SqliteSessionStore(Path dbPath, Clock clock) {
        this("jdbc:sqlite:" + dbPath.toAbsolutePath(), clock, DEFAULT_BUSY_RETRIES, DEFAULT_RETRY_BACKOFF_MS);
    }

    /**
     * JDBC URL로 생성.
     *
     * @param jdbcUrl SQLite JDBC URL
     * @param clock 타임스탬프용 시계
     * @param busyRetries SQLITE_BUSY 재시도 횟수
     * @param retryBackoffMs 재시도 간 기본 대기 시간
     */
    public SqliteSessionStore(String jdbcUrl, Clock clock, int busyRetries, long retryBackoffMs) {
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            throw new IllegalArgumentException("jdbcUrl cannot be null or blank");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (busyRetries < 0) {
            throw new IllegalArgumentException("busyRetries must be non-negative (current: " + busyRetries + ")");
        }
        this.dataSource = createDataSource(jdbcUrl);
        this.clock = clock;
        this.idGenerator = new SessionIdGenerator(clock);
        this.busyRetries = busyRetries;
        this.retryBackoffMs = retryBackoffMs;
    }

    /**
     * 파일을 열고 스키마를 준비한 저장소를 반환.
     *
     * @param dbPath 데이터베이스 파일
     * @param clock 타임스탬프용 시계
     * @return 초기화된 저장소
     */
    public static SqliteSessionStore open(Path dbPath, Clock clock) {
        SqliteSessionStore store = new SqliteSessionStore(dbPath, clock);
        store.initialize();
        return store;
    }

    /**
     * 테이블과 인덱스 생성 (이미 있으면 유지).
     */
    public void initialize() {
        run("initialize schema", () -> {
            try (Connection connection = openConnection(); Statement statement = connection.createStatement()) {
                statement.execute("""
                    CREATE TABLE IF NOT EXISTS sessions (
                        session_id TEXT PRIMARY KEY,
                        topic TEXT NOT NULL,
                        params TEXT NOT NULL,
                        status TEXT NOT NULL,
                        progress INTEGER NOT NULL DEFAULT 0,
                        phase TEXT NOT NULL,
                        message TEXT,
                        created_at TEXT NOT NULL,
                        updated_at TEXT NOT NULL,
                        completed_at TEXT,
                        result_location TEXT
                    )
                    """);
                statement.execute("""
                    CREATE TABLE IF NOT EXISTS session_logs (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        session_id TEXT NOT NULL,
                        timestamp TEXT NOT NULL,
                        phase TEXT NOT NULL,
                        message TEXT NOT NULL,
                        FOREIGN KEY (session_id) REFERENCES sessions (session_id)
                    )
                    """);
                statement.execute("""
                    CREATE INDEX IF NOT EXISTS idx_session_logs_session
                    ON session_logs (session_id, timestamp, id)
                    """);
                statement.execute("""
                    CREATE INDEX IF NOT EXISTS idx_sessions_status_created
                    ON sessions (status, created_at)
                    """);
            }
            return null;
        });
        log.info("SQLite session store initialized");
    }

    @Override
    public SessionId create(String topic, SessionParams params) {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic cannot be null or blank");
        }
        if (params == null) {
            throw new IllegalArgumentException("params cannot be null");
        }

        SessionId id = null;
        for (int attempt = 1; id == null; attempt++) {
            Session session = Session.pending(idGenerator.next(), topic, params, clock.instant());
            if (run("create session", () -> insertSession(session))) {
                id = session.id();
            } else if (attempt >= MAX_ID_ATTEMPTS) {
                throw new SessionStoreException(
                    "Could not allocate a unique session id after " + attempt + " attempts", null);
            } else {
                log.debug("Session id {} already taken, regenerating", session.id());
            }
        }
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

        inTransaction("update progress", sessionId, connection -> {
            Session current = requireSession(connection, sessionId);
            if (current.status().isTerminal()) {
                throw new InvalidSessionStateException(
                    "Cannot update progress of session " + sessionId + " in terminal state " + current.status());
            }
            Instant now = clock.instant();
            writeRow(connection, current.withProgress(Math.max(current.progress(), progress), phase, message, now));
            insertLog(connection, sessionId, now, phase, message);
        });
    }

    @Override
    public void setStatus(SessionId sessionId, SessionStatus status, String message) {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }

        inTransaction("set status", sessionId, connection -> {
            Session current = requireSession(connection, sessionId);
            StatusTransition.validate(current.status(), status);
            Instant now = clock.instant();
            Session updated = current.withStatus(status, message, now);
            writeRow(connection, updated);
            if (message != null) {
                insertLog(connection, sessionId, now, updated.phase(), message);
            }
        });
        log.debug("Session {} status → {}", sessionId, status);
    }

    @Override
    public void appendLog(SessionId sessionId, Phase phase, String message) {
        if (phase == null) {
            throw new IllegalArgumentException("phase cannot be null");
        }
        inTransaction("append log", sessionId, connection -> {
            requireSession(connection, sessionId);
            insertLog(connection, sessionId, clock.instant(), phase, message);
        });
    }

    @Override
    public void setResultLocation(SessionId sessionId, String location) {
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("location cannot be null or blank");
        }
        inTransaction("set result location", sessionId, connection -> {
            Session current = requireSession(connection, sessionId);
            writeRow(connection, current.withResultLocation(location, clock.instant()));
        });
    }

    @Override
    public Optional<Session> get(SessionId sessionId) {
        if (sessionId == null) {
            throw new IllegalArgumentException("sessionId cannot be null");
        }
        return run("get session", () -> {
            try (Connection connection = openConnection()) {
                return Optional.ofNullable(selectSession(connection, sessionId));
            }
        });
    }

    @Override
    public List<Session> list() {
        return run("list sessions", () -> {
            try (Connection connection = openConnection();
                 PreparedStatement statement = connection.prepareStatement(
                     SELECT_SESSION + "ORDER BY created_at DESC, session_id DESC")) {
                return mapSessions(statement);
            }
        });
    }

    @Override
    public List<Session> list(SessionStatus status) {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        return run("list sessions by status", () -> {
            try (Connection connection = openConnection();
                 PreparedStatement statement = connection.prepareStatement(
                     SELECT_SESSION + "WHERE status = ? ORDER BY created_at DESC, session_id DESC")) {
                statement.setString(1, status.code());
                return mapSessions(statement);
            }
        });
    }

    @Override
    public boolean remove(SessionId sessionId) {
        if (sessionId == null) {
            throw new IllegalArgumentException("sessionId cannot be null");
        }
        boolean removed = run("remove session", () -> {
            try (Connection connection = openConnection()) {
                beginImmediate(connection);
                try {
                    try (PreparedStatement logs = connection.prepareStatement(
                        "DELETE FROM session_logs WHERE session_id = ?")) {
                        logs.setString(1, sessionId.getValue());
                        logs.executeUpdate();
                    }
                    int changed;
                    try (PreparedStatement sessions = connection.prepareStatement(
                        "DELETE FROM sessions WHERE session_id = ?")) {
                        sessions.setString(1, sessionId.getValue());
                        changed = sessions.executeUpdate();
                    }
                    commit(connection);
                    return changed > 0;
                } catch (SQLException | RuntimeException e) {
                    rollbackQuietly(connection);
                    throw e;
                }
            }
        });
        if (removed) {
            log.info("Removed session {}", sessionId);
        }
        return removed;
    }

    @Override
    public List<SessionLogEntry> logs(SessionId sessionId) {
        if (sessionId == null) {
            throw new IllegalArgumentException("sessionId cannot be null");
        }
        return run("read logs", () -> {
            try (Connection connection = openConnection();
                 PreparedStatement statement = connection.prepareStatement("""
                     SELECT timestamp,
                            phase,
                            message
                     FROM session_logs
                     WHERE session_id = ?
                     ORDER BY timestamp, id
                     """)) {
                statement.setString(1, sessionId.getValue());
                List<SessionLogEntry> entries = new ArrayList<>();
                try (ResultSet rs = statement.executeQuery()) {
                    while (rs.next()) {
                        entries.add(new SessionLogEntry(
                            sessionId,
                            parse(rs.getString("timestamp")),
                            Phase.fromDisplayName(rs.getString("phase")),
                            rs.getString("message")));
                    }
                }
                return entries;
            }
        });
    }

    // 다른 프로세스가 같은 ID를 먼저 넣었으면 false
    private boolean insertSession(Session session) throws SQLException {
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement("""
                 INSERT INTO sessions (
                     session_id,
                     topic,
                     params,
                     status,
                     progress,
                     phase,
                     created_at,
                     updated_at
                 ) VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                 """)) {
            statement.setString(1, session.id().getValue());
            statement.setString(2, session.topic());
            statement.setString(3, paramsCodec.toJson(session.params()));
            statement.setString(4, session.status().code());
            statement.setInt(5, session.progress());
            statement.setString(6, session.phase().displayName());
            statement.setString(7, format(session.createdAt()));
            statement.setString(8, format(session.updatedAt()));
            statement.executeUpdate();
            return true;
        } catch (SQLException e) {
            if (isDuplicateId(e)) {
                return false;
            }
            throw e;
        }
    }

    private Session requireSession(Connection connection, SessionId sessionId) throws SQLException {
        Session session = selectSession(connection, sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return session;
    }

    private Session selectSession(Connection connection, SessionId sessionId) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(SELECT_SESSION + "WHERE session_id = ?")) {
            statement.setString(1, sessionId.getValue());
            try (ResultSet rs = statement.executeQuery()) {
                if (!rs.next()) {
                    return null;
                }
                return mapSession(rs);
            }
        }
    }

    private List<Session> mapSessions(PreparedStatement statement) throws SQLException {
        List<Session> sessions = new ArrayList<>();
        try (ResultSet rs = statement.executeQuery()) {
            while (rs.next()) {
                sessions.add(mapSession(rs));
            }
        }
        return sessions;
    }

    private Session mapSession(ResultSet rs) throws SQLException {
        String completedAt = rs.getString("completed_at");
        return new Session(
            SessionId.of(rs.getString("session_id")),
            rs.getString("topic"),
            paramsCodec.fromJson(rs.getString("params")),
            SessionStatus.fromCode(rs.getString("status")),
            rs.getInt("progress"),
            Phase.fromDisplayName(rs.getString("phase")),
            rs.getString("message"),
            parse(rs.getString("created_at")),
            parse(rs.getString("updated_at")),
            completedAt == null ? null : parse(completedAt),
            rs.getString("result_location"));
    }

    private void writeRow(Connection connection, Session session) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("""
                UPDATE sessions
                SET status = ?,
                    progress = ?,
                    phase = ?,
                    message = ?,
                    updated_at = ?,
                    completed_at = ?,
                    result_location = ?
                WHERE session_id = ?
                """)) {
            statement.setString(1, session.status().code());
            statement.setInt(2, session.progress());
            statement.setString(3, session.phase().displayName());
            statement.setString(4, session.message());
            statement.setString(5, format(session.updatedAt()));
            statement.setString(6, session.completedAt() == null ? null : format(session.completedAt()));
            statement.setString(7, session.resultLocation());
            statement.setString(8, session.id().getValue());
            statement.executeUpdate();
        }
    }

    private void insertLog(Connection connection, SessionId sessionId, Instant timestamp, Phase phase,
                           String message) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("""
                INSERT INTO session_logs (
                    session_id,
                    timestamp,
                    phase,
                    message
                ) VALUES (?, ?, ?, ?)
                """)) {
            statement.setString(1, sessionId.getValue());
            statement.setString(2, format(timestamp));
            statement.setString(3, phase.displayName());
            statement.setString(4, message == null ? "" : message);
            statement.executeUpdate();
        }
    }

    private void inTransaction(String action, SessionId sessionId, SqlWork work) {
        if (sessionId == null) {
            throw new IllegalArgumentException("sessionId cannot be null");
        }
        run(action, () -> {
            try (Connection connection = openConnection()) {
                beginImmediate(connection);
                try {
                    work.apply(connection);
                    commit(connection);
                    return null;
                } catch (SQLException | RuntimeException e) {
                    rollbackQuietly(connection);
                    throw e;
                }
            }
        });
    }

    private <T> T run(String action, SqlSupplier<T> supplier) {
        try {
            return executeWithBusyRetry(supplier);
        } catch (SQLException e) {
            throw new SessionStoreException("SQLite session store failed to " + action, e);
        }
    }

    private <T> T executeWithBusyRetry(SqlSupplier<T> supplier) throws SQLException {
        SQLException last = null;
        for (int attempt = 0; attempt <= busyRetries; attempt++) {
            try {
                return supplier.get();
            } catch (SQLException e) {
                if (!isBusy(e) || attempt == busyRetries) {
                    throw e;
                }
                last = e;
                log.debug("SQLite busy, retrying (attempt {}/{})", attempt + 1, busyRetries);
                sleep(retryBackoffMs * (attempt + 1));
            }
        }
        throw last;
    }

    private static boolean isBusy(SQLException e) {
        if (e instanceof SQLiteException) {
            SQLiteErrorCode resultCode = ((SQLiteException) e).getResultCode();
            if (resultCode == SQLiteErrorCode.SQLITE_BUSY || resultCode == SQLiteErrorCode.SQLITE_LOCKED) {
                return true;
            }
        }
        String message = e.getMessage();
        return e.getErrorCode() == 5
            || (message != null
            && (message.contains("SQLITE_BUSY")
            || message.contains("SQLITE_LOCKED")
            || message.contains("database is locked")));
    }

    private static boolean isDuplicateId(SQLException e) {
        if (e instanceof SQLiteException
            && ((SQLiteException) e).getResultCode() == SQLiteErrorCode.SQLITE_CONSTRAINT_PRIMARYKEY) {
            return true;
        }
        String message = e.getMessage();
        return message != null && message.contains("UNIQUE constraint failed: sessions.session_id");
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw new SessionStoreException("Interrupted while retrying SQLite busy operation", interrupted);
        }
    }

    private Connection openConnection() throws SQLException {
        return dataSource.getConnection();
    }

    private static void beginImmediate(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute("BEGIN IMMEDIATE");
        }
    }

    private static void commit(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute("COMMIT");
        }
    }

    private static void rollbackQuietly(Connection connection) {
        try (Statement statement = connection.createStatement()) {
            statement.execute("ROLLBACK");
        } catch (SQLException e) {
            log.warn("Rollback failed, connection will be discarded", e);
        }
    }

    private static String format(Instant instant) {
        return TIMESTAMP.format(instant);
    }

    private static Instant parse(String text) {
        return Instant.from(TIMESTAMP.parse(text));
    }

    @FunctionalInterface
    private interface SqlSupplier<T> {
        T get() throws SQLException;
    }

    @FunctionalInterface
    private interface SqlWork {
        void apply(Connection connection) throws SQLException;
    }

    private static DataSource createDataSource(String jdbcUrl) {
        SQLiteConfig config = new SQLiteConfig();
        config.setOpenMode(SQLiteOpenMode.FULLMUTEX);
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        config.setBusyTimeout(SQLITE_BUSY_TIMEOUT_MS);

        SQLiteDataSource sqliteDataSource = new SQLiteDataSource(config);
        sqliteDataSource.setUrl(jdbcUrl);
        return sqliteDataSource;
    }
}
