/**
 * In-memory SessionStore adapter.
 *
 * <p>Reference implementation of {@link com.ryuqq.discovery.core.spi.SessionStore} used by
 * contract tests and single-process runs that do not need durability.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * SessionStore store = new InMemorySessionStore();
 * SessionId id = store.create("lithium-sulfur cathodes", new SessionParams());
 * </pre>
 *
 * @see com.ryuqq.discovery.core.spi.SessionStore
 * @author Discovery Team
 * @since 1.0.0
 */
package com.ryuqq.discovery.adapter.inmemory.store;
