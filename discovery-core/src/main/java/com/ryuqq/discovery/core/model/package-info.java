/**
 * Value objects of the discovery session domain.
 *
 * <p>All types are immutable. {@link com.ryuqq.discovery.core.model.Session} is a snapshot;
 * mutation goes through {@link com.ryuqq.discovery.core.spi.SessionStore}.</p>
 *
 * @author Discovery Team
 * @since 1.0.0
 */
package com.ryuqq.discovery.core.model;
