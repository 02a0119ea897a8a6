package com.driftsentinel.core.comparison;

import com.driftsentinel.core.WindowFixtures;
import com.driftsentinel.core.reference.FeatureReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link JensenShannonDivergence}.
 */
class JensenShannonDivergenceTest {

    @Test
    @DisplayName("Identical distributions should have zero divergence")
    void shouldBeZeroForIdentical() throws InsufficientDataException {
        assertThat(JensenShannonDivergence.divergence(new double[] { 1, 2, 3 }, new double[] { 2, 4, 6 }))
                .isCloseTo(0.0, within(1e-12));
    }

    @Test
    @DisplayName("Disjoint distributions should have divergence one")
    void shouldBeOneForDisjoint() throws InsufficientDataException {
        assertThat(JensenShannonDivergence.divergence(new double[] { 5, 0 }, new double[] { 0, 7 }))
                .isCloseTo(1.0, within(1e-12));
    }

    @Test
    @DisplayName("Should be symmetric and bounded for arbitrary inputs")
    void shouldBeSymmetricAndBounded() throws InsufficientDataException {
        Random random = new Random(11);
        for (int trial = 0; trial < 200; trial++) {
            double[] p = new double[8];
            double[] q = new double[8];
            for (int i = 0; i < 8; i++) {
                p[i] = random.nextInt(5);
                q[i] = random.nextInt(5);
            }
            p[0] += 1;
            q[7] += 1;
            double pq = JensenShannonDivergence.divergence(p, q);
            assertThat(pq).isBetween(0.0, 1.0);
            assertThat(JensenShannonDivergence.divergence(q, p)).isCloseTo(pq, within(1e-12));
        }
    }

    @Test
    @DisplayName("Should compare categories over their union")
    void shouldUseCategoryUnion() throws InsufficientDataException {
        double js = JensenShannonDivergence.categorical(Map.of("INFO", 50.0), Map.of("ERROR", 50L));

        assertThat(js).isCloseTo(1.0, within(1e-12));
    }

    @Test
    @DisplayName("Should bin numeric windows on the reference edges")
    void shouldUseReferenceBins() throws InsufficientDataException {
        FeatureReference ref = FeatureReference.ofSamples("x",
                WindowFixtures.normal(1, 0, 1, 2_000), 10, 10_000);

        double same = JensenShannonDivergence.numeric(ref, WindowFixtures.normal(2, 0, 1, 500));
        double shifted = JensenShannonDivergence.numeric(ref, WindowFixtures.normal(3, 3, 1, 500));

        assertThat(same).isLessThan(0.02);
        assertThat(shifted).isGreaterThan(0.2);
    }

    @Test
    @DisplayName("A constant reference should diverge from a window that moves off it")
    void shouldDetectShiftFromConstantReference() throws InsufficientDataException {
        FeatureReference ref = FeatureReference.ofSamples("x", new double[] { 5, 5, 5, 5, 5, 5 }, 10, 10_000);

        assertThat(JensenShannonDivergence.numeric(ref, new double[] { 5, 5, 5 })).isCloseTo(0.0, within(1e-12));
        assertThat(JensenShannonDivergence.numeric(ref, new double[] { 6, 6, 6 })).isCloseTo(1.0, within(1e-12));
        assertThat(JensenShannonDivergence.numeric(ref, new double[] { 4, 4, 4 })).isCloseTo(1.0, within(1e-12));
    }

    @Test
    @DisplayName("Should refuse an empty side")
    void shouldRejectEmpty() {
        assertThatThrownBy(() -> JensenShannonDivergence.divergence(new double[] { 0, 0 }, new double[] { 1, 1 }))
                .isInstanceOf(InsufficientDataException.class);
    }
}
