/**
 * Credential pool SPI and credential health bookkeeping.
 *
 * @author Discovery Team
 * @since 1.0.0
 */
package com.ryuqq.discovery.core.credential;
