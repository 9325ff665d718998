/**
 * Domain exceptions. All extend {@link com.ryuqq.discovery.core.exception.DiscoveryException}
 * except {@link com.ryuqq.discovery.core.exception.InvalidSessionStateException}.
 *
 * @author Discovery Team
 * @since 1.0.0
 */
package com.ryuqq.discovery.core.exception;
