/**
 * Execution guard contract and failure classification.
 *
 * <p>Every call to a quota-limited service goes through an
 * {@link com.ryuqq.discovery.core.guard.ExecutionGuard}, which picks a credential, applies
 * rate limiting and timeouts, and retries according to the
 * {@link com.ryuqq.discovery.core.guard.FailureKind} of each failure.</p>
 *
 * @author Discovery Team
 * @since 1.0.0
 */
package com.ryuqq.discovery.core.guard;
