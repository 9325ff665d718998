/**
 * Retrying execution guard with credential rotation and exponential backoff.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.discovery.adapter.runner.guard.RetryingExecutionGuard}:
 *       {@link com.ryuqq.discovery.core.guard.ExecutionGuard} over a
 *       {@link com.ryuqq.discovery.core.credential.CredentialPool}</li>
 *   <li>{@link com.ryuqq.discovery.adapter.runner.guard.BackoffCalculator}: base·2^(n-1) delays</li>
 *   <li>{@link com.ryuqq.discovery.adapter.runner.guard.GuardConfig}: attempt budget and backoff settings</li>
 * </ul>
 *
 * @author Discovery Team
 * @since 1.0.0
 */
package com.ryuqq.discovery.adapter.runner.guard;
