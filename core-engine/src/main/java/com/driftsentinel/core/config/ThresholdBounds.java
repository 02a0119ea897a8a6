package com.driftsentinel.core.config;

import com.driftsentinel.core.model.Severity;

import java.io.Serializable;
import java.util.Optional;

/**
 * Warning and critical bounds for one (feature, metric kind) pair.
 *
 * <p>
 * Crossing is strict: a value equal to a bound does not cross it. When
 * {@code lowerIsWorse} is set the bounds are lower limits (p-values), otherwise
 * upper limits.
 * </p>
 *
 * @since 1.0.0
 */
public final class ThresholdBounds implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double warning;
    private final double critical;
    private final boolean lowerIsWorse;

    public ThresholdBounds(double warning, double critical, boolean lowerIsWorse) {
        if (lowerIsWorse ? critical > warning : critical < warning) {
            throw new IllegalArgumentException(String.format(
                    "critical bound %s must not be less severe than warning bound %s", critical, warning));
        }
        this.warning = warning;
        this.critical = critical;
        this.lowerIsWorse = lowerIsWorse;
    }

    /**
     * @param value the metric value to classify
     * @return the crossed severity, or empty when the value is within bounds
     *         or not a number
     */
    public Optional<Severity> classify(double value) {
        if (Double.isNaN(value)) {
            return Optional.empty();
        }
        if (crosses(value, critical)) {
            return Optional.of(Severity.CRITICAL);
        }
        if (crosses(value, warning)) {
            return Optional.of(Severity.WARNING);
        }
        return Optional.empty();
    }

    public double boundFor(Severity severity) {
        return severity == Severity.CRITICAL ? critical : warning;
    }

    private boolean crosses(double value, double bound) {
        return lowerIsWorse ? value < bound : value > bound;
    }

    public double getWarning() {
        return warning;
    }

    public double getCritical() {
        return critical;
    }

    public boolean isLowerWorse() {
        return lowerIsWorse;
    }

    @Override
    public String toString() {
        return "ThresholdBounds{warning=" + warning + ", critical=" + critical
                + (lowerIsWorse ? ", lowerIsWorse" : "") + '}';
    }
}
