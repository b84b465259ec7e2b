package com.di.recalibrator.agent.drift;

import java.util.Arrays;

/**
 * Population stability index over bins cut at the reference sample's quantiles:
 * {@code sum (recent% - reference%) * ln(recent% / reference%)}.
 */
public final class PopulationStabilityIndex {

    /** Floor for empty bins so the log stays finite. */
    static final double MIN_SHARE = 1.0e-4;

    private PopulationStabilityIndex() {
    }

    public static double compute(double[] reference, double[] recent, int bins) {
        if (reference.length == 0 || recent.length == 0) {
            throw new IllegalArgumentException("both samples must be non-empty");
        }
        double[] edges = quantileEdges(reference, bins);
        double[] expected = shares(reference, edges);
        double[] actual = shares(recent, edges);
        double psi = 0.0;
        for (int k = 0; k < expected.length; k++) {
            double e = Math.max(expected[k], MIN_SHARE);
            double a = Math.max(actual[k], MIN_SHARE);
            psi += (a - e) * Math.log(a / e);
        }
        return psi;
    }

    /** Distinct inner cut points; bin k holds values {@code <= edges[k]}, the last bin the rest. */
    static double[] quantileEdges(double[] reference, int bins) {
        double[] sorted = reference.clone();
        Arrays.sort(sorted);
        double[] edges = new double[bins - 1];
        for (int k = 1; k < bins; k++) {
            double pos = (double) k / bins * (sorted.length - 1);
            int lo = (int) Math.floor(pos);
            int hi = Math.min(lo + 1, sorted.length - 1);
            edges[k - 1] = sorted[lo] + (pos - lo) * (sorted[hi] - sorted[lo]);
        }
        return Arrays.stream(edges).distinct().sorted().toArray();
    }

    private static double[] shares(double[] values, double[] edges) {
        double[] counts = new double[edges.length + 1];
        for (double v : values) {
            int idx = Arrays.binarySearch(edges, v);
            int bin = idx >= 0 ? idx : -idx - 1;
            counts[bin]++;
        }
        for (int k = 0; k < counts.length; k++) {
            counts[k] /= values.length;
        }
        return counts;
    }
}
