package com.driftsentinel.core.comparison;

import com.driftsentinel.core.WindowFixtures;
import com.driftsentinel.core.reference.FeatureReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link KolmogorovSmirnovStatistic}.
 */
class KolmogorovSmirnovStatisticTest {

    @Test
    @DisplayName("Two-sample statistic should be symmetric in its arguments")
    void shouldBeSymmetric() throws InsufficientDataException {
        double[] a = WindowFixtures.normal(1, 0, 1, 300);
        double[] b = WindowFixtures.normal(2, 0.5, 2, 120);

        HypothesisResult ab = KolmogorovSmirnovStatistic.twoSample(a, b);
        HypothesisResult ba = KolmogorovSmirnovStatistic.twoSample(b, a);

        assertThat(ab.getStatistic()).isCloseTo(ba.getStatistic(), within(1e-12));
        assertThat(ab.getPValue()).isCloseTo(ba.getPValue(), within(1e-9));
    }

    @Test
    @DisplayName("Should detect a three-sigma shift with high confidence")
    void shouldDetectShift() throws InsufficientDataException {
        HypothesisResult result = KolmogorovSmirnovStatistic.twoSample(
                WindowFixtures.normal(1, 0, 1, 1_000), WindowFixtures.normal(2, 3, 1, 200));

        assertThat(result.getPValue()).isLessThan(0.01);
        assertThat(result.getStatistic()).isGreaterThan(0.5);
    }

    @Test
    @DisplayName("One-sample test against a histogram reference should accept the same distribution")
    void shouldAcceptSameDistributionAgainstHistogram() throws InsufficientDataException {
        FeatureReference ref = FeatureReference.ofSamples("x", WindowFixtures.normal(5, 0, 1, 5_000), 20, 10_000)
                .decayNumeric(0.9, WindowFixtures.normal(6, 0, 1, 500));

        HypothesisResult same = KolmogorovSmirnovStatistic.test(ref, WindowFixtures.normal(7, 0, 1, 200));
        HypothesisResult shifted = KolmogorovSmirnovStatistic.test(ref, WindowFixtures.normal(8, 1.5, 1, 200));

        assertThat(ref.getShape()).isEqualTo(FeatureReference.Shape.HISTOGRAM);
        assertThat(same.getPValue()).isGreaterThan(0.01);
        assertThat(shifted.getPValue()).isLessThan(0.01);
    }

    @Test
    @DisplayName("Should refuse fewer than two values")
    void shouldRejectTinySamples() {
        assertThatThrownBy(() -> KolmogorovSmirnovStatistic.twoSample(new double[] { 1, 2, 3 }, new double[] { 1 }))
                .isInstanceOf(InsufficientDataException.class)
                .hasMessageContaining("window");
    }
}
