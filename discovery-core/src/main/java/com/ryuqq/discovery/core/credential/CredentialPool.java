package com.ryuqq.discovery.core.credential;

import com.ryuqq.discovery.core.exception.ConfigurationException;
import com.ryuqq.discovery.core.exception.PoolExhaustedException;
import com.ryuqq.discovery.core.guard.FailureKind;
import com.ryuqq.discovery.core.model.ServiceName;

import java.util.List;
import java.util.Set;

/**
 * Per-service credential pool SPI.
 *
 * <p>Owns the configured credentials of every quota-limited service and hands out a
 * currently usable one per call. All selection and bookkeeping methods are safe to call
 * from concurrent batch workers sharing one pool.</p>
 *
 * <p><strong>Selection policy:</strong></p>
 * <ul>
 *   <li>Never returns a disabled or currently rate-limited credential</li>
 *   <li>Least-recently-used first (never used counts as oldest), ties by configuration order</li>
 *   <li>Choice and {@code lastUsedAt} stamp happen atomically</li>
 * </ul>
 *
 * <p><strong>Re-enable policy:</strong> a disabled credential becomes selectable again once
 * the cool-down window has elapsed since its last failure, or on {@link #reset(ServiceName)}.</p>
 *
 * @author Discovery Team
 * @since 1.0.0
 */
public interface CredentialPool {

    /**
     * Loads the credentials of one service. Called once per service at startup.
     *
     * <p>Blank secrets and unreplaced placeholders ({@code your_...}) are dropped.</p>
     *
     * @param service the service
     * @param secrets configured secrets in priority order
     * @return the loaded credentials
     * @throws ConfigurationException if no usable secret remains or the service was already loaded
     */
    List<Credential> load(ServiceName service, List<String> secrets);

    /**
     * Loads every service of a configuration.
     *
     * @param config the credential configuration built at startup
     * @throws ConfigurationException if any service has no usable secret
     */
    default void loadAll(CredentialConfig config) {
        for (ServiceName service : config.services()) {
            load(service, config.secrets(service));
        }
    }

    /**
     * Selects a usable credential.
     *
     * @param service the service
     * @return least recently used selectable credential
     * @throws PoolExhaustedException if every credential is disabled or rate-limited
     * @throws ConfigurationException if the service was never loaded
     */
    Credential select(ServiceName service);

    /**
     * Number of credentials that {@link #select} could return right now.
     *
     * @param service the service
     * @return selectable credential count
     */
    int availableCount(ServiceName service);

    /**
     * Records a successful call.
     *
     * @param credential the credential used
     */
    void recordSuccess(Credential credential);

    /**
     * Records a failed call.
     *
     * @param credential the credential used
     * @param kind RATE_LIMITED or TRANSIENT
     * @throws IllegalArgumentException if kind is NON_RETRYABLE
     */
    void recordFailure(Credential credential, FailureKind kind);

    /**
     * Operator reset: re-enables every credential of the service and clears rate limits.
     *
     * @param service the service
     */
    void reset(ServiceName service);

    /**
     * Read-only snapshot for monitoring.
     *
     * @param service the service
     * @return status of each credential in configuration order
     */
    List<CredentialStatus> status(ServiceName service);

    /**
     * Services loaded so far.
     *
     * @return loaded service names
     */
    Set<ServiceName> services();
}
