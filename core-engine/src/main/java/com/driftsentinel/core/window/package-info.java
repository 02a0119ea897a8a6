/**
 * Time bucketing of samples.
 *
 * <p>
 * {@link com.driftsentinel.core.window.WindowAggregator} owns the open buckets
 * and hands out sealed, immutable {@link com.driftsentinel.core.model.Window}s
 * in start order.
 * </p>
 *
 * @since 1.0.0
 */
package com.driftsentinel.core.window;
