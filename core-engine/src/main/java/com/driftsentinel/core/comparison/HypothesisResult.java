package com.driftsentinel.core.comparison;

/**
 * Statistic and p-value of a hypothesis test.
 *
 * @since 1.0.0
 */
public final class HypothesisResult {

    private final double statistic;
    private final double pValue;

    public HypothesisResult(double statistic, double pValue) {
        this.statistic = statistic;
        this.pValue = pValue;
    }

    public double getStatistic() {
        return statistic;
    }

    public double getPValue() {
        return pValue;
    }

    @Override
    public String toString() {
        return "HypothesisResult{statistic=" + statistic + ", pValue=" + pValue + '}';
    }
}
