package com.driftsentinel.core.config;

import com.driftsentinel.core.model.MetricKind;

import java.io.Serializable;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable lookup of {@link ThresholdBounds} by feature and metric kind.
 *
 * <p>
 * Built from validated {@link ThresholdRule}s; stays fixed for the life of a
 * run unless a new configuration is loaded.
 * </p>
 *
 * @since 1.0.0
 */
public final class ThresholdConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Map<String, Map<MetricKind, ThresholdBounds>> bounds;

    private ThresholdConfig(Map<String, Map<MetricKind, ThresholdBounds>> bounds) {
        this.bounds = bounds;
    }

    /**
     * @param rules validated threshold rules
     * @return the lookup
     * @throws IllegalArgumentException if a rule names an unknown metric or has
     *                                  inverted bounds
     */
    public static ThresholdConfig of(List<ThresholdRule> rules) {
        Objects.requireNonNull(rules, "rules must not be null");
        Map<String, Map<MetricKind, ThresholdBounds>> byFeature = new LinkedHashMap<>();
        for (ThresholdRule rule : rules) {
            MetricKind kind = MetricKind.fromConfigName(rule.getMetric());
            ThresholdBounds b = new ThresholdBounds(
                    Objects.requireNonNull(rule.getWarning(), "warning bound for " + rule.getFeature()),
                    Objects.requireNonNull(rule.getCritical(), "critical bound for " + rule.getFeature()),
                    kind.isLowerWorse());
            byFeature.computeIfAbsent(rule.getFeature(), f -> new EnumMap<>(MetricKind.class)).put(kind, b);
        }
        Map<String, Map<MetricKind, ThresholdBounds>> frozen = new LinkedHashMap<>();
        byFeature.forEach((f, m) -> frozen.put(f, Collections.unmodifiableMap(m)));
        return new ThresholdConfig(Collections.unmodifiableMap(frozen));
    }

    public Optional<ThresholdBounds> boundsFor(String feature, MetricKind kind) {
        return Optional.ofNullable(bounds.getOrDefault(feature, Map.of()).get(kind));
    }

    public boolean covers(String feature) {
        return bounds.containsKey(feature);
    }

    @Override
    public String toString() {
        return "ThresholdConfig" + bounds;
    }
}
