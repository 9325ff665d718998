package com.ryuqq.discovery.application.monitor;

import com.ryuqq.discovery.core.credential.CredentialStatus;
import com.ryuqq.discovery.core.model.ServiceName;
import com.ryuqq.discovery.core.model.Session;
import com.ryuqq.discovery.core.model.SessionId;
import com.ryuqq.discovery.core.model.SessionLogEntry;
import com.ryuqq.discovery.core.statemachine.SessionStatus;

import java.util.List;
import java.util.Optional;

/**
 * Read-only monitoring surface.
 *
 * <p>Polled at an operator-controlled cadence by a dashboard. Implementations never mutate
 * session or credential state.</p>
 *
 * @author Discovery Team
 * @since 1.0.0
 */
public interface SessionMonitor {

    Optional<Session> get(SessionId sessionId);

    /**
     * @return every session, newest first
     */
    List<Session> list();

    /**
     * @param status status filter
     * @return sessions in that status, newest first
     */
    List<Session> list(SessionStatus status);

    /**
     * @param sessionId the session
     * @return log entries in time order
     */
    List<SessionLogEntry> logs(SessionId sessionId);

    /**
     * @param service the service
     * @return credential health snapshot, secrets excluded
     */
    List<CredentialStatus> credentials(ServiceName service);
}
