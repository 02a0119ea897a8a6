/**
 * Micrometer instrumentation of the drift engine.
 *
 * @since 1.0.0
 */
package com.driftsentinel.core.metrics;
