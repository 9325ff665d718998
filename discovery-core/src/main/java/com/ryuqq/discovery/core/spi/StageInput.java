package com.ryuqq.discovery.core.spi;

import com.ryuqq.discovery.core.model.Payload;
import com.ryuqq.discovery.core.model.SessionId;
import com.ryuqq.discovery.core.model.SessionParams;

/**
 * Input handed to a collaborator for one stage of one iteration.
 *
 * @param sessionId the session being driven
 * @param topic the research topic
 * @param params the session parameters
 * @param iteration current iteration, starting at 1
 * @param upstream output of the previous stage (or of the previous iteration's last stage
 *                 for the first stage; empty on the very first stage)
 * @author Discovery Team
 * @since 1.0.0
 */
public record StageInput(
    SessionId sessionId,
    String topic,
    SessionParams params,
    int iteration,
    Payload upstream
) {

    public StageInput {
        if (sessionId == null) {
            throw new IllegalArgumentException("sessionId cannot be null");
        }
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic cannot be null or blank");
        }
        if (params == null) {
            throw new IllegalArgumentException("params cannot be null");
        }
        if (iteration < 1) {
            throw new IllegalArgumentException("iteration must be positive (current: " + iteration + ")");
        }
        upstream = upstream == null ? Payload.empty() : upstream;
    }
}
