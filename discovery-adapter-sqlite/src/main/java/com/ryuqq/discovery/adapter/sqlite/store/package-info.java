/**
 * Durable SessionStore adapter backed by an embedded SQLite file.
 *
 * <p>Several processes (the pipeline runner and a monitoring dashboard) may open the same
 * database file. WAL journaling lets readers proceed while a writer commits.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * SessionStore store = SqliteSessionStore.open(Path.of("discovery.db"), Clock.systemUTC());
 * </pre>
 *
 * @see com.ryuqq.discovery.core.spi.SessionStore
 * @author Discovery Team
 * @since 1.0.0
 */
package com.ryuqq.discovery.adapter.sqlite.store;
