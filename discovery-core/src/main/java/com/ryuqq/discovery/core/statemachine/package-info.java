/**
 * Session lifecycle and phase catalogue.
 *
 * <p><strong>Status transitions:</strong></p>
 * <pre>
 * PENDING → RUNNING → COMPLETED
 *                   ↘ FAILED
 * </pre>
 *
 * <p>Terminal states never transition again.</p>
 *
 * @see com.ryuqq.discovery.core.statemachine.StatusTransition
 * @author Discovery Team
 * @since 1.0.0
 */
package com.ryuqq.discovery.core.statemachine;
