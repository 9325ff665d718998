/**
 * Protection hook implementations: per-service sliding window rate limiting and fixed
 * per-attempt timeouts.
 *
 * @author Discovery Team
 * @since 1.0.0
 */
package com.ryuqq.discovery.adapter.runner.protection;
