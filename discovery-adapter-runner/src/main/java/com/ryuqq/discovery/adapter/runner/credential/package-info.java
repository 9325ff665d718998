/**
 * Credential pool implementation with LRU rotation, rate-limit cool-down and
 * error-count based disabling.
 *
 * @author Discovery Team
 * @since 1.0.0
 */
package com.ryuqq.discovery.adapter.runner.credential;
