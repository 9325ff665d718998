/**
 * Service Provider Interfaces.
 *
 * <p>Adapters implement these to plug storage, collaborators and result sinks into the
 * orchestrator.</p>
 *
 * <p><strong>Main SPIs:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.discovery.core.spi.SessionStore}: session persistence and logs</li>
 *   <li>{@link com.ryuqq.discovery.core.spi.Collaborator}: one pipeline stage</li>
 *   <li>{@link com.ryuqq.discovery.core.spi.ResultWriter}: final result sink</li>
 * </ul>
 *
 * @author Discovery Team
 * @since 1.0.0
 */
package com.ryuqq.discovery.core.spi;
