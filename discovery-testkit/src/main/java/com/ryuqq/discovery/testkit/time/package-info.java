/**
 * Deterministic time doubles for tests.
 *
 * @author Discovery Team
 * @since 1.0.0
 */
package com.ryuqq.discovery.testkit.time;
