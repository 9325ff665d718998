/**
 * Outcome of one collaborator invocation.
 *
 * <p>{@link com.ryuqq.discovery.core.outcome.CollaboratorOutcome} is sealed:</p>
 * <ul>
 *   <li>{@link com.ryuqq.discovery.core.outcome.Success}: usable output, no item failures</li>
 *   <li>{@link com.ryuqq.discovery.core.outcome.Partial}: usable output plus per-item failures</li>
 *   <li>{@link com.ryuqq.discovery.core.outcome.Fatal}: no usable output, the session fails</li>
 * </ul>
 *
 * @author Discovery Team
 * @since 1.0.0
 */
package com.ryuqq.discovery.core.outcome;
