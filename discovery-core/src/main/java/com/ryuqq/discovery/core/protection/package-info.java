/**
 * Protection hooks applied around every guarded call.
 *
 * @author Discovery Team
 * @since 1.0.0
 */
package com.ryuqq.discovery.core.protection;
