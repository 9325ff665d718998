package com.ryuqq.discovery.core.exception;

import com.ryuqq.discovery.core.model.SessionId;

/**
 * 존재하지 않는 세션에 대한 갱신 요청.
 *
 * @author Discovery Team
 * @since 1.0.0
 */
public class SessionNotFoundException extends DiscoveryException {

    private final SessionId sessionId;

    public SessionNotFoundException(SessionId sessionId) {
        super("Session not found: " + sessionId);
        this.sessionId = sessionId;
    }

    public SessionId getSessionId() {
        return sessionId;
    }
}
