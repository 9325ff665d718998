/**
 * Bounded-parallel batch execution of per-item service calls sharing one credential pool.
 *
 * @author Discovery Team
 * @since 1.0.0
 */
package com.ryuqq.discovery.adapter.runner.batch;
