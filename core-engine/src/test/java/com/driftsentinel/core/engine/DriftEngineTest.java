package com.driftsentinel.core.engine;

import com.driftsentinel.core.WindowFixtures;
import com.driftsentinel.core.comparison.InsufficientData;
import com.driftsentinel.core.config.DriftConfig;
import com.driftsentinel.core.config.DriftConfigLoader;
import com.driftsentinel.core.config.ThresholdRule;
import com.driftsentinel.core.model.Alert;
import com.driftsentinel.core.model.DriftMetric;
import com.driftsentinel.core.model.MetricKind;
import com.driftsentinel.core.model.RawRecord;
import com.driftsentinel.core.model.Severity;
import com.driftsentinel.core.model.Window;
import com.driftsentinel.core.reference.Provenance;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests for {@link DriftEngine}.
 */
class DriftEngineTest {

    private static final Instant T0 = WindowFixtures.T0;

    @Test
    @DisplayName("A three-sigma shift should be flagged by JS and KS and raise a critical alert")
    void shouldDetectShiftEndToEnd() {
        DriftEngine engine = new DriftEngine(DriftConfigLoader.fromClasspath("test-drift.yml"));
        List<Alert> heard = new ArrayList<>();
        engine.addListener(new DriftListener() {
            @Override
            public void onAlert(Alert alert) {
                heard.add(alert);
            }
        });

        feed(engine, T0, WindowFixtures.normal(1, 0, 1, 1_000), 50);
        feed(engine, T0.plusSeconds(60), WindowFixtures.normal(2, 3, 1, 200), 100);
        List<WindowEvaluation> evaluations = engine.evaluateAll(engine.flush());

        assertThat(evaluations).hasSize(2);
        WindowEvaluation bootstrap = evaluations.get(0);
        assertThat(bootstrap.isBootstrapped()).isTrue();
        assertThat(bootstrap.getAlerts()).isEmpty();
        assertThat(bootstrap.getReport().getSkipped()).extracting(InsufficientData::getReason)
                .containsExactly(InsufficientData.Reason.INSUFFICIENT_REFERENCE);

        WindowEvaluation live = evaluations.get(1);
        assertThat(metric(live, MetricKind.KS_TEST).getPValue()).isLessThan(0.01);
        assertThat(metric(live, MetricKind.JS_DIVERGENCE).getStatistic()).isGreaterThan(0.2);
        assertThat(live.getAlerts())
                .filteredOn(a -> a.getFeature().equals("x") && a.getKind() == MetricKind.JS_DIVERGENCE)
                .singleElement()
                .satisfies(a -> assertThat(a.getSeverity()).isEqualTo(Severity.CRITICAL));
        assertThat(heard).containsAll(live.getAlerts());

        assertThat(engine.getReferenceManager().current()).hasValueSatisfying(ref -> {
            assertThat(ref.getProvenance()).isEqualTo(Provenance.BOOTSTRAP);
            assertThat(ref.getVersion()).isEqualTo(1);
        });
        assertThat(engine.getMetrics().count("drift.windows.sealed")).isEqualTo(2.0);
        assertThat(engine.getMetrics().count("drift.samples.accepted")).isEqualTo(1_200.0);
        assertThat(engine.getMetrics().count("drift.alerts.emitted")).isEqualTo(heard.size());
    }

    @Test
    @DisplayName("Windows from the reference distribution should rarely alert")
    void shouldRarelyAlertWithoutDrift() {
        int trials = 40;
        int quiet = 0;
        for (int trial = 0; trial < trials; trial++) {
            DriftEngine engine = new DriftEngine(numericConfig());
            feed(engine, T0, WindowFixtures.normal(1_000 + trial, 0, 1, 1_000), 50);
            feed(engine, T0.plusSeconds(60), WindowFixtures.normal(2_000 + trial, 0, 1, 200), 100);

            boolean alerted = engine.evaluateAll(engine.flush()).stream()
                    .anyMatch(e -> !e.getAlerts().isEmpty());
            if (!alerted) {
                quiet++;
            }
        }

        assertThat(quiet).isGreaterThanOrEqualTo((int) Math.ceil(0.95 * trials));
    }

    @Test
    @DisplayName("Invalid records should be counted and dropped")
    void shouldRejectInvalidRecords() {
        DriftEngine engine = new DriftEngine(numericConfig());

        engine.accept(new RawRecord().setField("x", 1.0));
        engine.accept(new RawRecord().setField("timestamp", T0).setField("x", "abc"));
        engine.accept(new RawRecord().setField("timestamp", T0).setField("x", Double.NaN));
        engine.accept(new RawRecord().setField("timestamp", T0.toString()).setField("x", "2.5"));

        assertThat(engine.getMetrics().count("drift.samples.rejected")).isEqualTo(3.0);
        assertThat(engine.getMetrics().count("drift.samples.accepted")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Late samples should be counted and kept out of sealed windows")
    void shouldCountLateSamples() {
        DriftEngine engine = new DriftEngine(numericConfig());
        feed(engine, T0, WindowFixtures.normal(3, 0, 1, 40), 1_000);
        feed(engine, T0.plusSeconds(120), WindowFixtures.normal(4, 0, 1, 40), 1_000);

        List<Window> sealed = engine.tick();
        engine.accept(new RawRecord().setField("timestamp", T0.plusSeconds(5)).setField("x", 0.0));

        assertThat(sealed).extracting(Window::getCount).containsExactly(40);
        assertThat(engine.getMetrics().count("drift.samples.late")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("A manual snapshot should replace the bootstrapped reference")
    void shouldSnapshotReference() {
        DriftEngine engine = new DriftEngine(numericConfig());
        feed(engine, T0, WindowFixtures.normal(5, 0, 1, 100), 100);
        feed(engine, T0.plusSeconds(60), WindowFixtures.normal(6, 3, 1, 100), 100);
        List<Window> windows = engine.flush();
        engine.evaluate(windows.get(0));

        engine.snapshotReference(List.of(windows.get(1)));
        WindowEvaluation evaluation = engine.evaluate(windows.get(1));

        assertThat(engine.getReferenceManager().current()).hasValueSatisfying(ref -> {
            assertThat(ref.getProvenance()).isEqualTo(Provenance.MANUAL_SNAPSHOT);
            assertThat(ref.getVersion()).isEqualTo(2);
        });
        assertThat(evaluation.getAlerts()).isEmpty();
    }

    @Test
    @DisplayName("A deserialized engine should keep its reference and open buckets")
    void shouldSurviveSerialization() throws Exception {
        DriftEngine engine = new DriftEngine(numericConfig());
        feed(engine, T0, WindowFixtures.normal(7, 0, 1, 1_000), 50);
        feed(engine, T0.plusSeconds(60), WindowFixtures.normal(8, 3, 1, 100), 100);
        assertThat(engine.evaluateAll(engine.tick(T0.plusSeconds(60))))
                .singleElement()
                .satisfies(e -> assertThat(e.isBootstrapped()).isTrue());

        DriftEngine restored = copy(engine);
        feed(restored, T0.plusSeconds(70), WindowFixtures.normal(9, 3, 1, 100), 100);
        List<WindowEvaluation> evaluations = restored.evaluateAll(restored.flush());

        assertThat(evaluations).singleElement().satisfies(live -> {
            assertThat(live.isBootstrapped()).isFalse();
            assertThat(live.getWindow().getCount()).isEqualTo(200);
            assertThat(live.getAlerts())
                    .filteredOn(a -> a.getKind() == MetricKind.JS_DIVERGENCE)
                    .singleElement()
                    .satisfies(a -> assertThat(a.getSeverity()).isEqualTo(Severity.CRITICAL));
        });
        assertThat(restored.getReferenceManager().current())
                .hasValueSatisfying(ref -> assertThat(ref.getVersion()).isEqualTo(1));
        assertThat(restored.getMetrics().count("drift.windows.sealed")).isEqualTo(1.0);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static DriftConfig numericConfig() {
        DriftConfig config = new DriftConfig();
        config.setNumericFeatures(List.of("x"));
        config.getWindow().setAlignment("first_sample");
        config.setThresholds(List.of(
                new ThresholdRule("x", "js_divergence", 0.1, 0.2),
                new ThresholdRule("x", "ks_test", 0.01, 0.001)));
        config.validate();
        return config;
    }

    private static void feed(DriftEngine engine, Instant start, double[] values, long spacingMillis) {
        for (int i = 0; i < values.length; i++) {
            RawRecord record = new RawRecord()
                    .setField("timestamp", start.plusMillis(i * spacingMillis))
                    .setField("x", values[i])
                    .setField("level", i % 10 == 0 ? "ERROR" : "INFO");
            engine.accept(record);
        }
    }

    private static DriftEngine copy(DriftEngine engine) throws IOException, ClassNotFoundException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
            out.writeObject(engine);
        }
        try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(bytes.toByteArray()))) {
            return (DriftEngine) in.readObject();
        }
    }

    private static DriftMetric metric(WindowEvaluation evaluation, MetricKind kind) {
        return evaluation.getMetrics().stream()
                .filter(m -> m.getFeature().equals("x") && m.getKind() == kind)
                .findFirst()
                .orElseThrow();
    }
}
