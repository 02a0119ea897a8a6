/**
 * Statistical comparison of a window against its reference.
 *
 * <p>
 * The individual statistics ({@link com.driftsentinel.core.comparison.JensenShannonDivergence},
 * {@link com.driftsentinel.core.comparison.KolmogorovSmirnovStatistic},
 * {@link com.driftsentinel.core.comparison.ChiSquaredIndependence} and
 * {@link com.driftsentinel.core.comparison.MeanShift}) are pure functions.
 * {@link com.driftsentinel.core.comparison.DistributionComparator} composes
 * them and isolates per-feature failures.
 * </p>
 *
 * @since 1.0.0
 */
package com.driftsentinel.core.comparison;
