/**
 * Phase-sequencing orchestrator.
 *
 * @see com.ryuqq.discovery.application.orchestrator.Orchestrator
 * @author Discovery Team
 * @since 1.0.0
 */
package com.ryuqq.discovery.adapter.runner.orchestrator;
