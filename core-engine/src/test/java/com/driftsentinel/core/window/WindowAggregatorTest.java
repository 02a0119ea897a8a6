package com.driftsentinel.core.window;

import com.driftsentinel.core.config.WindowSettings;
import com.driftsentinel.core.model.Sample;
import com.driftsentinel.core.model.Window;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link WindowAggregator}.
 */
class WindowAggregatorTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    @Test
    @DisplayName("Calendar alignment should start one-day buckets at UTC midnight")
    void shouldAlignToCalendar() {
        WindowAggregator aggregator = new WindowAggregator(settings(86_400, "calendar", 0, 16));

        aggregator.ingest(sample(Instant.parse("2024-03-01T15:30:00Z"), 1.0));
        List<Window> sealed = aggregator.sealReadyWindows(Instant.parse("2024-03-02T00:00:00Z"));

        assertThat(sealed).hasSize(1);
        assertThat(sealed.get(0).getStart()).isEqualTo(Instant.parse("2024-03-01T00:00:00Z"));
        assertThat(sealed.get(0).getEnd()).isEqualTo(Instant.parse("2024-03-02T00:00:00Z"));
        assertThat(sealed.get(0).isForced()).isFalse();
    }

    @Test
    @DisplayName("First-sample alignment should start buckets at the first timestamp")
    void shouldAlignToFirstSample() {
        WindowAggregator aggregator = new WindowAggregator(settings(60, "first_sample", 0, 16));
        Instant first = Instant.parse("2024-03-01T10:00:17Z");

        aggregator.ingest(sample(first, 1.0));
        aggregator.ingest(sample(first.plusSeconds(61), 2.0));
        List<Window> sealed = aggregator.sealReadyWindows();

        assertThat(sealed).hasSize(1);
        assertThat(sealed.get(0).getStart()).isEqualTo(first);
        assertThat(sealed.get(0).getEnd()).isEqualTo(first.plusSeconds(60));
    }

    @Test
    @DisplayName("Bucket ends should follow the alignment origin")
    void shouldReportBucketEnd() {
        WindowAggregator calendar = new WindowAggregator(settings(60, "calendar", 0, 16));
        assertThat(calendar.bucketEndOf(T0.plusSeconds(17))).contains(T0.plusSeconds(60));

        WindowAggregator firstSample = new WindowAggregator(settings(60, "first_sample", 0, 16));
        Instant first = T0.plusSeconds(17);
        assertThat(firstSample.bucketEndOf(first)).isEmpty();

        firstSample.ingest(sample(first, 1.0));
        assertThat(firstSample.bucketEndOf(first.plusSeconds(30))).contains(first.plusSeconds(60));
        assertThat(firstSample.bucketEndOf(first.plusSeconds(60))).contains(first.plusSeconds(120));
    }

    @Test
    @DisplayName("Should seal only buckets that end before the watermark minus grace")
    void shouldRespectGracePeriod() {
        WindowAggregator aggregator = new WindowAggregator(settings(60, "calendar", 30, 16));

        aggregator.ingest(sample(T0.plusSeconds(10), 1.0));
        assertThat(aggregator.sealReadyWindows(T0.plusSeconds(80))).isEmpty();
        assertThat(aggregator.sealReadyWindows(T0.plusSeconds(90))).hasSize(1);
    }

    @Test
    @DisplayName("Every accepted sample should land in exactly one sealed window, in start order")
    void shouldPartitionSamples() {
        WindowAggregator aggregator = new WindowAggregator(settings(60, "calendar", 120, 16));
        Random random = new Random(7);
        List<Window> sealed = new ArrayList<>();
        int accepted = 0;

        for (int i = 0; i < 2_000; i++) {
            // mostly increasing timestamps with bounded disorder
            Instant ts = T0.plusMillis(i * 500L + random.nextInt(90_000));
            if (aggregator.ingest(sample(ts, i)).isAccepted()) {
                accepted++;
            }
            if (i % 50 == 0) {
                sealed.addAll(aggregator.sealReadyWindows());
            }
        }
        sealed.addAll(aggregator.flush());

        assertThat(sealed.stream().mapToInt(Window::getCount).sum()).isEqualTo(accepted);
        assertThat(accepted + aggregator.getLateCount()).isEqualTo(2_000);
        for (int i = 1; i < sealed.size(); i++) {
            assertThat(sealed.get(i).getStart()).isAfter(sealed.get(i - 1).getStart());
        }
        for (Window w : sealed) {
            assertThat(w.getSamples()).allSatisfy(s -> {
                assertThat(s.getTimestamp()).isAfterOrEqualTo(w.getStart());
                assertThat(s.getTimestamp()).isBefore(w.getEnd());
            });
        }
    }

    @Test
    @DisplayName("Should drop samples that belong to an already sealed bucket")
    void shouldDropLateSamples() {
        WindowAggregator aggregator = new WindowAggregator(settings(60, "calendar", 0, 16));

        aggregator.ingest(sample(T0.plusSeconds(5), 1.0));
        aggregator.ingest(sample(T0.plusSeconds(65), 2.0));
        assertThat(aggregator.sealReadyWindows()).hasSize(1);

        IngestResult late = aggregator.ingest(sample(T0.plusSeconds(30), 3.0));

        assertThat(late.isLate()).isTrue();
        assertThat(aggregator.getLateCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should force-seal the oldest bucket when too many are open")
    void shouldForceSealOldest() {
        WindowAggregator aggregator = new WindowAggregator(settings(60, "calendar", 3_600, 2));

        aggregator.ingest(sample(T0, 1.0));
        aggregator.ingest(sample(T0.plusSeconds(60), 2.0));
        IngestResult result = aggregator.ingest(sample(T0.plusSeconds(120), 3.0));

        assertThat(result.isAccepted()).isTrue();
        assertThat(result.getForcedWindows()).hasSize(1);
        assertThat(result.getForcedWindows().get(0).getStart()).isEqualTo(T0);
        assertThat(result.getForcedWindows().get(0).isForced()).isTrue();
        assertThat(aggregator.getOpenWindowCount()).isEqualTo(2);
        assertThat(aggregator.ingest(sample(T0.plusSeconds(1), 4.0)).isLate()).isTrue();
    }

    @Test
    @DisplayName("Sealed window should carry frozen aggregates")
    void shouldComputeAggregates() {
        WindowAggregator aggregator = new WindowAggregator(settings(60, "calendar", 0, 16));
        aggregator.ingest(Sample.builder().timestamp(T0).numeric("x", 1.0).categorical("level", "INFO").build());
        aggregator.ingest(Sample.builder().timestamp(T0.plusSeconds(1)).numeric("x", 3.0)
                .categorical("level", "ERROR").build());
        aggregator.ingest(Sample.builder().timestamp(T0.plusSeconds(2)).categorical("level", "INFO").build());

        Window window = aggregator.flush().get(0);

        assertThat(window.getCount()).isEqualTo(3);
        assertThat(window.getNumericSummaries().get("x").getMean()).isEqualTo(2.0);
        assertThat(window.getNumericSummaries().get("x").getMin()).isEqualTo(1.0);
        assertThat(window.getNumericSummaries().get("x").getMax()).isEqualTo(3.0);
        assertThat(window.categoryCounts("level")).containsEntry("INFO", 2L).containsEntry("ERROR", 1L);
        assertThat(window.numericValues("x")).containsExactly(1.0, 3.0);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static WindowSettings settings(long bucketSeconds, String alignment, long graceSeconds, int maxOpen) {
        WindowSettings s = new WindowSettings();
        s.setBucketSeconds(bucketSeconds);
        s.setAlignment(alignment);
        s.setGracePeriodSeconds(graceSeconds);
        s.setMaxOpenWindows(maxOpen);
        return s;
    }

    private static Sample sample(Instant ts, double x) {
        return Sample.builder().timestamp(ts).numeric("x", x).build();
    }
}
