package com.ryuqq.discovery.core.spi;

import com.ryuqq.discovery.core.model.Payload;
import com.ryuqq.discovery.core.model.Session;

/**
 * Persists the final output of a session and reports where it went.
 *
 * @author Discovery Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ResultWriter {

    /**
     * Writes the result.
     *
     * @param session session snapshot at the end of the last iteration
     * @param finalOutput output of the last stage of the last iteration
     * @return result location recorded on the session (e.g. a directory path)
     */
    String write(Session session, Payload finalOutput);
}
