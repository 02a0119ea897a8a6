package com.driftsentinel.core.changepoint;

import com.driftsentinel.core.WindowFixtures;
import com.driftsentinel.core.config.ChangePointSettings;
import com.driftsentinel.core.model.ChangePoint;
import com.driftsentinel.core.model.Window;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link ChangePointDetector}.
 */
class ChangePointDetectorTest {

    @Test
    @DisplayName("Should report a level shift exactly once across later windows")
    void shouldReportShiftOnce() {
        ChangePointDetector detector = new ChangePointDetector(meanSettings(40, 12.0, 3));
        List<Window> windows = new ArrayList<>();
        List<ChangePoint> reported = new ArrayList<>();

        for (int i = 0; i < 25; i++) {
            double level = i < 15 ? 0.0 : 5.0;
            Window window = WindowFixtures.numericWindow(i, new double[] { level - 1, level, level + 1 });
            windows.add(window);
            reported.addAll(detector.onWindow(window));
        }

        assertThat(reported).singleElement().satisfies(cp -> {
            assertThat(cp.getSeries()).isEqualTo("x.mean");
            assertThat(cp.getWindowIndex()).isEqualTo(windows.get(15).getIndex());
            assertThat(cp.getTimestamp()).isEqualTo(windows.get(15).getStart());
            assertThat(cp.getMeanBefore()).isCloseTo(0.0, within(1e-9));
            assertThat(cp.getMeanAfter()).isCloseTo(5.0, within(1e-9));
            assertThat(cp.getMagnitude()).isGreaterThan(2.0);
            assertThat(cp.getCostModel()).isEqualTo("l2");
        });
    }

    @Test
    @DisplayName("A noisy level shift should be reported once, including after it leaves the horizon")
    void shouldNotRepeatNoisyShift() {
        for (int trial = 0; trial < 20; trial++) {
            ChangePointDetector detector = new ChangePointDetector(meanSettings(50, 25.0, 3));
            List<Window> windows = new ArrayList<>();
            List<ChangePoint> reported = new ArrayList<>();

            // 100 draws per window; the old regime has fully left the horizon by window 80
            for (int i = 0; i < 90; i++) {
                double level = i < 30 ? 10.0 : 11.0;
                Window window = WindowFixtures.numericWindow(i,
                        WindowFixtures.normal(1000L * trial + i, level, 1.0, 100));
                windows.add(window);
                reported.addAll(detector.onWindow(window));
            }

            long shift = windows.get(30).getIndex();
            assertThat(reported)
                    .as("trial %d", trial)
                    .singleElement()
                    .satisfies(cp -> {
                        assertThat(cp.getWindowIndex()).isEqualTo(shift);
                        assertThat(cp.getMeanAfter() - cp.getMeanBefore()).isGreaterThan(0.5);
                    });
        }
    }

    @Test
    @DisplayName("A shift should not be reported before the new regime outlasts one segment")
    void shouldWaitForConfirmation() {
        ChangePointDetector detector = new ChangePointDetector(meanSettings(40, 12.0, 3));
        List<Long> reportedAt = new ArrayList<>();

        for (int i = 0; i < 25; i++) {
            double level = i < 15 ? 0.0 : 5.0;
            if (!detector.onWindow(WindowFixtures.numericWindow(i, new double[] { level - 1, level, level + 1 }))
                    .isEmpty()) {
                reportedAt.add((long) i);
            }
        }

        // boundary at 15, confirmed once four windows of the new regime exist
        assertThat(reportedAt).containsExactly(18L);
    }

    @Test
    @DisplayName("Detection should be a pure function of the series")
    void shouldDetectPurely() {
        ChangePointDetector detector = new ChangePointDetector(meanSettings(40, 3.0, 2));
        List<SeriesPoint> series = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            series.add(new SeriesPoint(i, WindowFixtures.T0.plusSeconds(60L * i), i < 10 ? 1.0 : 3.0));
        }

        List<ChangePoint> first = detector.detect(series);

        assertThat(first).extracting(ChangePoint::getWindowIndex).containsExactly(10L);
        assertThat(detector.detect(series)).isEqualTo(first);
    }

    @Test
    @DisplayName("A constant series should produce no change points")
    void shouldIgnoreConstantSeries() {
        ChangePointDetector detector = new ChangePointDetector(meanSettings(40, 1.0, 2));
        List<SeriesPoint> series = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            series.add(new SeriesPoint(i, Instant.EPOCH, 7.0));
        }

        assertThat(detector.detect(series)).isEmpty();
    }

    @Test
    @DisplayName("History should be bounded by the horizon")
    void shouldBoundHistory() {
        ChangePointDetector detector = new ChangePointDetector(meanSettings(6, 5.0, 3));

        for (int i = 0; i < 10; i++) {
            detector.onWindow(WindowFixtures.numericWindow(i, new double[] { i, i + 1 }));
        }

        assertThat(detector.getHistory()).hasSize(6);
        assertThat(detector.getHistory().get(0).getValue()).isCloseTo(4.5, within(1e-9));
    }

    @Test
    @DisplayName("Category rate should be the share of the configured category")
    void shouldComputeCategoryRate() {
        ChangePointSettings settings = new ChangePointSettings();
        settings.setEnabled(true);
        settings.setStatistic("category_rate");
        settings.setFeature("level");
        settings.setCategory("ERROR");
        ChangePointDetector detector = new ChangePointDetector(settings);

        Map<String, Integer> counts = new LinkedHashMap<>();
        counts.put("INFO", 3);
        counts.put("ERROR", 1);
        Window window = WindowFixtures.categoricalWindow(0, counts);

        assertThat(detector.getSeriesName()).isEqualTo("level.ERROR.rate");
        assertThat(detector.valueOf(window)).hasValue(0.25);
        assertThat(detector.valueOf(WindowFixtures.numericWindow(1, new double[] { 1 }))).isEmpty();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static ChangePointSettings meanSettings(int horizon, double penalty, int minSegment) {
        ChangePointSettings settings = new ChangePointSettings();
        settings.setEnabled(true);
        settings.setStatistic("mean");
        settings.setFeature("x");
        settings.setHorizon(horizon);
        settings.setPenalty(penalty);
        settings.setMinSegmentLength(minSegment);
        return settings;
    }
}
