package com.driftsentinel.core.config;

import java.io.Serializable;
import java.util.List;

/**
 * Settings for the distribution comparator.
 *
 * @since 1.0.0
 */
public class ComparisonSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Number of reference-quantile bins used for JS divergence on numeric features. */
    private int histogramBins = 10;

    void validate(List<String> errors) {
        if (histogramBins < 2) {
            errors.add("comparison.histogramBins must be >= 2, got: " + histogramBins);
        }
    }

    public int getHistogramBins() {
        return histogramBins;
    }

    public void setHistogramBins(int histogramBins) {
        this.histogramBins = histogramBins;
    }

    @Override
    public String toString() {
        return "ComparisonSettings{histogramBins=" + histogramBins + '}';
    }
}
