package com.driftsentinel.core.config;

import com.driftsentinel.core.model.MetricKind;
import com.driftsentinel.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DriftConfigLoader} and {@link DriftConfig} validation.
 */
class DriftConfigLoaderTest {

    @Test
    @DisplayName("Should load test configuration from classpath")
    void shouldLoadFromClasspath() {
        DriftConfig config = DriftConfigLoader.fromClasspath("test-drift.yml");

        assertThat(config.getNumericFeatures()).containsExactly("x");
        assertThat(config.getCategoricalFeatures()).containsExactly("level");
        assertThat(config.getWindow().getAlignment()).isEqualTo("first_sample");
        assertThat(config.getChangePoint().isEnabled()).isTrue();
        assertThat(config.getChangePoint().seriesName()).isEqualTo("level.ERROR.rate");
        assertThat(config.getAlerts().getCooldownSeconds()).isEqualTo(120);
        assertThat(config.getThresholds()).hasSize(4);
    }

    @Test
    @DisplayName("Should load bundled default configuration")
    void shouldLoadDefaultConfiguration() {
        DriftConfig config = DriftConfigLoader.fromClasspath(DriftConfigLoader.DEFAULT_RESOURCE);

        assertThat(config.tracked()).containsExactly("feature1", "feature2", "feature3");
        assertThat(config.thresholdConfig().boundsFor("feature1", MetricKind.MEAN_SHIFT)).isPresent();
    }

    @Test
    @DisplayName("Should apply defaults for omitted sections")
    void shouldApplyDefaults() {
        DriftConfig config = DriftConfigLoader.fromString(String.join("\n",
                "numericFeatures: [x]",
                "thresholds:",
                "  - {feature: x, metric: js_divergence, warning: 0.1, critical: 0.2}"));

        assertThat(config.getWindow().getBucketSeconds()).isEqualTo(60);
        assertThat(config.getWindow().getAlignment()).isEqualTo("calendar");
        assertThat(config.getReference().getPolicy()).isEqualTo("manual");
        assertThat(config.getComparison().getHistogramBins()).isEqualTo(10);
        assertThat(config.getChangePoint().isEnabled()).isFalse();
        assertThat(config.getPipeline().getBackpressure()).isEqualTo("block");
    }

    @Test
    @DisplayName("Should reject a tracked feature without thresholds")
    void shouldRejectMissingThreshold() {
        assertThatThrownBy(() -> DriftConfigLoader.fromClasspath("invalid-missing-threshold.yml"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Missing threshold for tracked feature 'y'");
    }

    @Test
    @DisplayName("Should reject a non-positive change-point penalty")
    void shouldRejectNonPositivePenalty() {
        assertThatThrownBy(() -> DriftConfigLoader.fromString(String.join("\n",
                "numericFeatures: [x]",
                "changePoint: {enabled: true, statistic: mean, feature: x, penalty: 0}",
                "thresholds:",
                "  - {feature: x, metric: js_divergence, warning: 0.1, critical: 0.2}",
                "  - {feature: x.mean, metric: change_point, warning: 1.0, critical: 2.0}")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("changePoint.penalty");
    }

    @Test
    @DisplayName("Should reject inverted bounds and report every problem at once")
    void shouldCollectAllErrors() {
        assertThatThrownBy(() -> DriftConfigLoader.fromString(String.join("\n",
                "numericFeatures: [x]",
                "window: {bucketSeconds: 0, alignment: weekly}",
                "thresholds:",
                "  - {feature: x, metric: js_divergence, warning: 0.3, critical: 0.2}")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("critical bound for 'x'")
                .hasMessageContaining("window.bucketSeconds")
                .hasMessageContaining("window.alignment");
    }

    @Test
    @DisplayName("Should reject p-value bounds in the wrong order")
    void shouldRejectInvertedPValueBounds() {
        assertThatThrownBy(() -> DriftConfigLoader.fromString(String.join("\n",
                "numericFeatures: [x]",
                "thresholds:",
                "  - {feature: x, metric: ks_test, warning: 0.01, critical: 0.05}")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("must be <= warning bound");
    }

    @Test
    @DisplayName("Should reject metrics that do not apply to the feature type")
    void shouldRejectInapplicableMetric() {
        assertThatThrownBy(() -> DriftConfigLoader.fromString(String.join("\n",
                "categoricalFeatures: [level]",
                "thresholds:",
                "  - {feature: level, metric: ks_test, warning: 0.05, critical: 0.01}")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("does not apply to 'level'");
    }

    @Test
    @DisplayName("Should reject unknown metric names")
    void shouldRejectUnknownMetric() {
        assertThatThrownBy(() -> DriftConfigLoader.fromString(String.join("\n",
                "numericFeatures: [x]",
                "thresholds:",
                "  - {feature: x, metric: wasserstein, warning: 0.1, critical: 0.2}")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Unknown metric");
    }

    @Test
    @DisplayName("Should wrap malformed YAML in a configuration exception")
    void shouldRejectMalformedYaml() {
        assertThatThrownBy(() -> DriftConfigLoader.fromClasspath("invalid-malformed.yml"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Malformed");
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> DriftConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should throw when file does not exist")
    void shouldThrowForMissingFile() {
        assertThatThrownBy(() -> DriftConfigLoader.fromFile("/no/such/drift.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Threshold lookup should honour metric direction")
    void shouldBuildThresholdLookup() {
        ThresholdConfig thresholds = DriftConfigLoader.fromClasspath("test-drift.yml").thresholdConfig();

        ThresholdBounds ks = thresholds.boundsFor("x", MetricKind.KS_TEST).orElseThrow();
        assertThat(ks.isLowerWorse()).isTrue();
        assertThat(ks.classify(0.001)).contains(Severity.CRITICAL);
        assertThat(ks.classify(0.03)).contains(Severity.WARNING);
        assertThat(ks.classify(0.5)).isEmpty();
        assertThat(thresholds.boundsFor("x", MetricKind.MEAN_SHIFT)).isEmpty();
    }
}
