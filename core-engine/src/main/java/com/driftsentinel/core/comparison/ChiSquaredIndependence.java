package com.driftsentinel.core.comparison;

import org.apache.commons.math3.stat.inference.ChiSquareTest;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Chi-squared test of independence on the 2 x K table of reference versus
 * window category counts.
 *
 * <p>
 * Fractional reference weights are rounded to whole counts. Categories that
 * are zero on both rows are dropped; a table with fewer than two remaining
 * categories, or an empty row, is degenerate.
 * </p>
 *
 * @since 1.0.0
 */
public final class ChiSquaredIndependence {

    private ChiSquaredIndependence() {
        // utility class
    }

    public static HypothesisResult test(Map<String, Double> referenceWeights, Map<String, Long> windowCounts)
            throws InsufficientDataException {
        long[][] table = contingencyTable(referenceWeights, windowCounts);
        ChiSquareTest chi = new ChiSquareTest();
        return new HypothesisResult(chi.chiSquare(table), chi.chiSquareTest(table));
    }

    static long[][] contingencyTable(Map<String, Double> referenceWeights, Map<String, Long> windowCounts)
            throws InsufficientDataException {
        Set<String> categories = new LinkedHashSet<>(referenceWeights.keySet());
        categories.addAll(windowCounts.keySet());

        List<long[]> columns = new ArrayList<>();
        long refTotal = 0;
        long winTotal = 0;
        for (String c : categories) {
            long ref = Math.round(referenceWeights.getOrDefault(c, 0.0));
            long win = windowCounts.getOrDefault(c, 0L);
            if (ref == 0 && win == 0) {
                continue;
            }
            columns.add(new long[] { ref, win });
            refTotal += ref;
            winTotal += win;
        }
        if (columns.size() < 2) {
            throw new InsufficientDataException(InsufficientData.Reason.DEGENERATE_TABLE,
                    "Contingency table has " + columns.size() + " non-empty categor"
                            + (columns.size() == 1 ? "y" : "ies"));
        }
        if (refTotal == 0 || winTotal == 0) {
            throw new InsufficientDataException(InsufficientData.Reason.DEGENERATE_TABLE,
                    "Contingency table has an empty " + (refTotal == 0 ? "reference" : "window") + " row");
        }

        long[][] table = new long[2][columns.size()];
        for (int k = 0; k < columns.size(); k++) {
            table[0][k] = columns.get(k)[0];
            table[1][k] = columns.get(k)[1];
        }
        return table;
    }
}
