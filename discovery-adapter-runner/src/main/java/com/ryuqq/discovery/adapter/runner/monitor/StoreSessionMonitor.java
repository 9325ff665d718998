package com.ryuqq.discovery.adapter.runner.monitor;

import com.ryuqq.discovery.application.monitor.SessionMonitor;
import com.ryuqq.discovery.core.credential.CredentialPool;
import com.ryuqq.discovery.core.credential.CredentialStatus;
import com.ryuqq.discovery.core.model.ServiceName;
import com.ryuqq.discovery.core.model.Session;
import com.ryuqq.discovery.core.model.SessionId;
import com.ryuqq.discovery.core.model.SessionLogEntry;
import com.ryuqq.discovery.core.spi.SessionStore;
import com.ryuqq.discovery.core.statemachine.SessionStatus;

import java.util.List;
import java.util.Optional;

/**
 * SessionStore와 CredentialPool의 읽기 전용 뷰.
 *
 * @author Discovery Team
 * @since 1.0.0
 */
public final class StoreSessionMonitor implements SessionMonitor {

    private final SessionStore store;
    private final CredentialPool pool;

    public StoreSessionMonitor(SessionStore store, CredentialPool pool) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (pool == null) {
            throw new IllegalArgumentException("pool cannot be null");
        }
        this.store = store;
        this.pool = pool;
    }

    @Override
    public Optional<Session> get(SessionId sessionId) {
        return store.get(sessionId);
    }

    @Override
    public List<Session> list() {
        return store.list();
    }

    @Override
    public List<Session> list(SessionStatus status) {
        return store.list(status);
    }

    @Override
    public List<SessionLogEntry> logs(SessionId sessionId) {
        return store.logs(sessionId);
    }

    @Override
    public List<CredentialStatus> credentials(ServiceName service) {
        if (!pool.services().contains(service)) {
            return List.of();
        }
        return pool.status(service);
    }
}
