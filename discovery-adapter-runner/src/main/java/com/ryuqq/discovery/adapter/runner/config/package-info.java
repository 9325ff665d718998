/**
 * Startup configuration sources.
 *
 * @author Discovery Team
 * @since 1.0.0
 */
package com.ryuqq.discovery.adapter.runner.config;
