package com.driftsentinel.core.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Kinds of drift signal evaluated against thresholds.
 *
 * <p>
 * Each kind fixes which number is compared with the configured bounds and in
 * which direction a value gets worse. The two hypothesis tests are judged on
 * their p-value, so smaller is worse; distances are judged on their
 * statistic, so larger is worse.
 * </p>
 *
 * @since 1.0.0
 */
public enum MetricKind {

    /** Jensen-Shannon divergence (base 2), range [0, 1]. */
    JS_DIVERGENCE("js_divergence", false),

    /** Kolmogorov-Smirnov test, evaluated on the p-value. */
    KS_TEST("ks_test", true),

    /** Chi-squared test of independence, evaluated on the p-value. */
    CHI_SQUARED("chi_squared", true),

    /** Absolute mean difference in reference standard deviations. */
    MEAN_SHIFT("mean_shift", false),

    /** Change-point magnitude in horizon standard deviations. */
    CHANGE_POINT("change_point", false);

    private final String configName;
    private final boolean lowerIsWorse;

    MetricKind(String configName, boolean lowerIsWorse) {
        this.configName = configName;
        this.lowerIsWorse = lowerIsWorse;
    }

    public String getConfigName() {
        return configName;
    }

    public boolean isLowerWorse() {
        return lowerIsWorse;
    }

    /**
     * Resolve a configuration name such as {@code js_divergence}.
     *
     * @param name configuration name, case-insensitive
     * @return the matching kind
     * @throws IllegalArgumentException if no kind matches
     */
    public static MetricKind fromConfigName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (MetricKind kind : values()) {
                if (kind.configName.equals(normalized)) {
                    return kind;
                }
            }
        }
        throw new IllegalArgumentException("Unknown metric: '" + name + "'. Supported: "
                + Arrays.stream(values()).map(MetricKind::getConfigName).collect(Collectors.joining(", ")));
    }
}
