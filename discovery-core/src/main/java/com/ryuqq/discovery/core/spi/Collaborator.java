package com.ryuqq.discovery.core.spi;

import com.ryuqq.discovery.core.guard.ExecutionGuard;
import com.ryuqq.discovery.core.outcome.CollaboratorOutcome;

/**
 * External-facing subsystem driven by the orchestrator for one stage
 * (paper retrieval, analysis, hypothesis generation, hypothesis testing, evaluation).
 *
 * <p>The core depends only on the three-way outcome shape. Every outbound call a
 * collaborator makes must go through the supplied {@link ExecutionGuard}.</p>
 *
 * <p><strong>Failure contract:</strong></p>
 * <ul>
 *   <li>Item-level failures are reported inside a {@link com.ryuqq.discovery.core.outcome.Partial}</li>
 *   <li>A batch with zero usable results is reported as {@link com.ryuqq.discovery.core.outcome.Fatal}</li>
 *   <li>An exception escaping {@link #invoke} (e.g. guard exhaustion on a call central to
 *       the stage) is treated as unrecoverable for the stage</li>
 * </ul>
 *
 * @author Discovery Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Collaborator {

    /**
     * Runs the stage.
     *
     * @param input stage input
     * @param guard guard to route every outbound call through
     * @return Success, Partial or Fatal
     */
    CollaboratorOutcome invoke(StageInput input, ExecutionGuard guard);
}
