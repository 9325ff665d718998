package com.ryuqq.discovery.core.guard;

import com.ryuqq.discovery.core.exception.ExhaustedException;
import com.ryuqq.discovery.core.exception.NonRetryableCallException;
import com.ryuqq.discovery.core.exception.PoolExhaustedException;
import com.ryuqq.discovery.core.model.ServiceName;

/**
 * Executes one logical outbound call with bounded retries and credential rotation.
 *
 * <p><strong>Per attempt:</strong></p>
 * <pre>
 * 1. select credential           (PoolExhausted → backoff, next attempt)
 * 2. acquire rate limiter permit (refused → backoff, next attempt)
 * 3. work(credential) bounded by per-call timeout
 * 4. classify:
 *    success       → recordSuccess, return
 *    RATE_LIMITED  → recordFailure, rotate without sleeping if another credential is free
 *    TRANSIENT     → recordFailure, backoff
 *    NON_RETRYABLE → propagate immediately
 * </pre>
 *
 * <p>Credential side effects are never rolled back and are visible to concurrent callers
 * immediately.</p>
 *
 * @author Discovery Team
 * @since 1.0.0
 */
public interface ExecutionGuard {

    /**
     * Runs the call.
     *
     * @param service the target service
     * @param work the call, invoked once per attempt with the selected credential
     * @param <T> result type
     * @return the first successful result
     * @throws ExhaustedException when the attempt budget is spent
     * @throws PoolExhaustedException when no credential became selectable within the budget
     * @throws NonRetryableCallException when the call failed in a non-retryable way
     */
    <T> T execute(ServiceName service, CredentialCall<T> work);
}
