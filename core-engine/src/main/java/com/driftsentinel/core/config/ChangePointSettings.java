package com.driftsentinel.core.config;

import com.driftsentinel.core.changepoint.CostModel;
import com.driftsentinel.core.changepoint.SeriesStatistic;

import java.io.Serializable;
import java.util.List;
import java.util.Locale;

/**
 * Settings for change-point detection over a per-window scalar series.
 *
 * <p>
 * Example tracking the error rate of a {@code level} field:
 * </p>
 *
 * <pre>
 * changePoint:
 *   enabled: true
 *   statistic: category_rate
 *   feature: level
 *   category: ERROR
 *   horizon: 50
 *   penalty: 10.0
 *   costModel: l2
 * </pre>
 *
 * <p>
 * The series is standardised before segmentation, so {@code penalty} is
 * expressed in units of the standardised cost and does not depend on the
 * scale of the tracked quantity. Larger penalties yield fewer change points.
 * </p>
 *
 * @since 1.0.0
 */
public class ChangePointSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private boolean enabled = false;

    /** Series name used for thresholds and alerts; derived when blank. */
    private String name;

    /** {@code mean}, {@code sample_count} or {@code category_rate}. */
    private String statistic = "mean";

    private String feature;

    private String category;

    /** Number of most recent windows segmented on every run. */
    private int horizon = 50;

    private double penalty = 10.0;

    /** {@code l2} or {@code normal}. */
    private String costModel = "l2";

    private int minSegmentLength = 2;

    void validate(List<String> errors, List<String> numericFeatures, List<String> categoricalFeatures) {
        if (!enabled) {
            return;
        }
        SeriesStatistic stat = null;
        try {
            stat = SeriesStatistic.fromConfig(statistic);
        } catch (IllegalArgumentException e) {
            errors.add("changePoint." + e.getMessage());
        }
        if (stat == SeriesStatistic.MEAN && (feature == null || !numericFeatures.contains(feature))) {
            errors.add("changePoint.feature must name a numeric feature for statistic 'mean', got: " + feature);
        }
        if (stat == SeriesStatistic.CATEGORY_RATE) {
            if (feature == null || !categoricalFeatures.contains(feature)) {
                errors.add("changePoint.feature must name a categorical feature for statistic 'category_rate', got: "
                        + feature);
            }
            if (category == null || category.isBlank()) {
                errors.add("changePoint.category is required for statistic 'category_rate'");
            }
        }
        try {
            CostModel.fromConfig(costModel);
        } catch (IllegalArgumentException e) {
            errors.add("changePoint." + e.getMessage());
        }
        if (!(penalty > 0) || Double.isInfinite(penalty)) {
            errors.add("changePoint.penalty must be a finite value > 0, got: " + penalty);
        }
        if (minSegmentLength < 1) {
            errors.add("changePoint.minSegmentLength must be >= 1, got: " + minSegmentLength);
        }
        if (horizon < 2 * Math.max(1, minSegmentLength)) {
            errors.add("changePoint.horizon must be >= 2 * minSegmentLength, got: " + horizon);
        }
    }

    /**
     * @return the configured name, or one derived from statistic and feature
     */
    public String seriesName() {
        if (name != null && !name.isBlank()) {
            return name;
        }
        if ("sample_count".equals(statistic)) {
            return "sample_count";
        }
        if ("category_rate".equals(statistic)) {
            return feature + "." + category + ".rate";
        }
        return feature + ".mean";
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getStatistic() {
        return statistic;
    }

    public void setStatistic(String statistic) {
        this.statistic = statistic != null ? statistic.toLowerCase(Locale.ROOT) : null;
    }

    public String getFeature() {
        return feature;
    }

    public void setFeature(String feature) {
        this.feature = feature;
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }

    public int getHorizon() {
        return horizon;
    }

    public void setHorizon(int horizon) {
        this.horizon = horizon;
    }

    public double getPenalty() {
        return penalty;
    }

    public void setPenalty(double penalty) {
        this.penalty = penalty;
    }

    public String getCostModel() {
        return costModel;
    }

    public void setCostModel(String costModel) {
        this.costModel = costModel != null ? costModel.toLowerCase(Locale.ROOT) : null;
    }

    public int getMinSegmentLength() {
        return minSegmentLength;
    }

    public void setMinSegmentLength(int minSegmentLength) {
        this.minSegmentLength = minSegmentLength;
    }

    @Override
    public String toString() {
        return "ChangePointSettings{enabled=" + enabled + ", series='" + seriesName() + "', horizon=" + horizon
                + ", penalty=" + penalty + ", costModel='" + costModel + "', minSegmentLength="
                + minSegmentLength + '}';
    }
}
