/**
 * Domain model classes for Drift Sentinel.
 *
 * <p>
 * This package contains the value types shared between the drift engine and
 * the Flink job layer:
 * </p>
 * <ul>
 * <li>{@link com.driftsentinel.core.model.RawRecord}: free-form input
 * record</li>
 * <li>{@link com.driftsentinel.core.model.Sample}: validated observation</li>
 * <li>{@link com.driftsentinel.core.model.Window}: sealed time bucket</li>
 * <li>{@link com.driftsentinel.core.model.DriftMetric} and
 * {@link com.driftsentinel.core.model.ChangePoint}: drift signals</li>
 * <li>{@link com.driftsentinel.core.model.Alert}: emitted alert</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.driftsentinel.core.model;
