/**
 * Contract tests every {@link com.ryuqq.discovery.core.spi.SessionStore} adapter must pass.
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * class MySessionStoreContractTest extends AbstractSessionStoreContractTest {
 *     {@literal @}Override
 *     protected SessionStore createStore(Clock clock) {
 *         return new MySessionStore(clock);
 *     }
 * }
 * </pre>
 *
 * @author Discovery Team
 * @since 1.0.0
 */
package com.ryuqq.discovery.testkit.contract;
