package com.driftsentinel.core.alert;

import com.driftsentinel.core.WindowFixtures;
import com.driftsentinel.core.config.AlertSettings;
import com.driftsentinel.core.config.ThresholdConfig;
import com.driftsentinel.core.config.ThresholdRule;
import com.driftsentinel.core.model.Alert;
import com.driftsentinel.core.model.ChangePoint;
import com.driftsentinel.core.model.DriftMetric;
import com.driftsentinel.core.model.MetricKind;
import com.driftsentinel.core.model.Severity;
import com.driftsentinel.core.model.Window;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AlertManager}.
 */
class AlertManagerTest {

    private AlertManager manager;

    @BeforeEach
    void setUp() {
        AlertSettings settings = new AlertSettings();
        settings.setCooldownSeconds(300);
        manager = new AlertManager(ThresholdConfig.of(List.of(
                new ThresholdRule("x", "js_divergence", 0.1, 0.2),
                new ThresholdRule("x", "ks_test", 0.05, 0.01),
                new ThresholdRule("x.mean", "change_point", 1.0, 2.0))), settings);
    }

    @Test
    @DisplayName("A single excursion straight to critical should raise one alert")
    void shouldRaiseOneAlertForExcursion() {
        List<AlertState> states = new ArrayList<>();
        List<Alert> alerts = new ArrayList<>();

        double[] js = { 0.01, 0.05, 0.25, 0.02 };
        for (int i = 0; i < js.length; i++) {
            AlertDecision decision = manager.evaluate(js(i, js[i]));
            states.add(decision.getCurrent());
            decision.getAlert().ifPresent(alerts::add);
        }

        assertThat(states).containsExactly(AlertState.NORMAL, AlertState.NORMAL, AlertState.ALERTED,
                AlertState.NORMAL);
        assertThat(alerts).singleElement().satisfies(alert -> {
            assertThat(alert.getSeverity()).isEqualTo(Severity.CRITICAL);
            assertThat(alert.getValue()).isEqualTo(0.25);
            assertThat(alert.getBound()).isEqualTo(0.2);
            assertThat(alert.getTimestamp()).isEqualTo(window(2).getEnd());
            assertThat(alert.getMetric()).isNotNull();
        });
    }

    @Test
    @DisplayName("Escalating from warning to critical inside the cooldown should raise both alerts")
    void shouldEscalateThroughCooldown() {
        List<AlertState> states = new ArrayList<>();
        List<Alert> alerts = new ArrayList<>();

        double[] js = { 0.01, 0.15, 0.25, 0.02 };
        for (int i = 0; i < js.length; i++) {
            AlertDecision decision = manager.evaluate(js(i, js[i]));
            states.add(decision.getCurrent());
            decision.getAlert().ifPresent(alerts::add);
        }

        assertThat(states).containsExactly(AlertState.NORMAL, AlertState.WARNED, AlertState.ALERTED,
                AlertState.NORMAL);
        assertThat(alerts).extracting(Alert::getSeverity).containsExactly(Severity.WARNING, Severity.CRITICAL);
    }

    @Test
    @DisplayName("Equal or lower severity inside the cooldown should be suppressed")
    void shouldSuppressDuringCooldown() {
        assertThat(manager.evaluate(js(0, 0.3)).getAlert()).isPresent();

        AlertDecision repeat = manager.evaluate(js(1, 0.3));
        AlertDecision lower = manager.evaluate(js(2, 0.15));

        assertThat(repeat.isSuppressed()).isTrue();
        assertThat(repeat.getAlert()).isEmpty();
        assertThat(repeat.getSeverity()).contains(Severity.CRITICAL);
        assertThat(lower.isSuppressed()).isTrue();
        assertThat(lower.getCurrent()).isEqualTo(AlertState.WARNED);
    }

    @Test
    @DisplayName("An alert should be emitted again once the cooldown has elapsed")
    void shouldEmitAfterCooldown() {
        assertThat(manager.evaluate(js(0, 0.3)).getAlert()).isPresent();

        // window 0 ends at +60s, so the cooldown runs until +360s, the end of window 5
        assertThat(manager.evaluate(js(4, 0.3)).getAlert()).isEmpty();
        assertThat(manager.evaluate(js(5, 0.3)).getAlert()).isPresent();
    }

    @Test
    @DisplayName("Recovery should change state without alerting")
    void shouldRecoverQuietly() {
        manager.evaluate(js(0, 0.15));

        AlertDecision recovered = manager.evaluate(js(1, 0.01));

        assertThat(recovered.getPrevious()).isEqualTo(AlertState.WARNED);
        assertThat(recovered.getCurrent()).isEqualTo(AlertState.NORMAL);
        assertThat(recovered.getAlert()).isEmpty();
        assertThat(recovered.isSuppressed()).isFalse();
        assertThat(manager.getState("x", MetricKind.JS_DIVERGENCE)).isEqualTo(AlertState.NORMAL);
    }

    @Test
    @DisplayName("Keys should cool down independently")
    void shouldKeepKeysIndependent() {
        manager.evaluate(js(0, 0.3));

        DriftMetric ks = DriftMetric.builder().feature("x").kind(MetricKind.KS_TEST)
                .statistic(0.4).pValue(0.03).window(window(1)).build();
        AlertDecision decision = manager.evaluate(ks);

        assertThat(decision.getAlert()).hasValueSatisfying(alert -> {
            assertThat(alert.getSeverity()).isEqualTo(Severity.WARNING);
            assertThat(alert.getValue()).isEqualTo(0.03);
        });
        assertThat(manager.getState("x", MetricKind.KS_TEST)).isEqualTo(AlertState.WARNED);
        assertThat(manager.getState("x", MetricKind.JS_DIVERGENCE)).isEqualTo(AlertState.ALERTED);
    }

    @Test
    @DisplayName("Change points should be judged on magnitude at the evaluation time")
    void shouldAlertOnChangePoint() {
        Instant evaluatedAt = WindowFixtures.T0.plusSeconds(3600);
        ChangePoint cp = new ChangePoint("x.mean", 42, WindowFixtures.T0, 0.0, 5.0, 2.6, 10.0, "l2");

        AlertDecision decision = manager.evaluate(cp, evaluatedAt);

        assertThat(decision.getAlert()).hasValueSatisfying(alert -> {
            assertThat(alert.getSeverity()).isEqualTo(Severity.CRITICAL);
            assertThat(alert.getKind()).isEqualTo(MetricKind.CHANGE_POINT);
            assertThat(alert.getTimestamp()).isEqualTo(evaluatedAt);
            assertThat(alert.getWindowIndex()).isEqualTo(42);
            assertThat(alert.getChangePoint()).isEqualTo(cp);
        });
    }

    @Test
    @DisplayName("Metrics without configured bounds should not be tracked")
    void shouldIgnoreUntrackedMetric() {
        DriftMetric metric = DriftMetric.builder().feature("y").kind(MetricKind.JS_DIVERGENCE)
                .statistic(0.9).window(window(0)).build();

        AlertDecision decision = manager.evaluate(metric);

        assertThat(decision.getAlert()).isEmpty();
        assertThat(decision.getCurrent()).isEqualTo(AlertState.NORMAL);
        assertThat(manager.getState("y", MetricKind.JS_DIVERGENCE)).isEqualTo(AlertState.NORMAL);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static Window window(int minute) {
        Instant start = WindowFixtures.T0.plusSeconds(60L * minute);
        return new Window(minute, start, start.plusSeconds(60), List.of(), Map.of(), Map.of(), false);
    }

    private static DriftMetric js(int minute, double value) {
        return DriftMetric.builder()
                .feature("x")
                .kind(MetricKind.JS_DIVERGENCE)
                .statistic(value)
                .window(window(minute))
                .referenceVersion(1)
                .build();
    }
}
