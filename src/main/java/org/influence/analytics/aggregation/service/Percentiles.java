package org.influence.analytics.aggregation.service;

import java.util.Arrays;

/**
 * Nearest-rank percentiles over a sample. The warehouse returns a bounded reservoir
 * sample per group, so results are approximate in the same way native quantiles are.
 */
public final class Percentiles {

    private Percentiles() {
    }

    /**
     * @param sample     values, in any order; not modified
     * @param percentile in (0, 100]
     * @return the nearest-rank percentile, or 0 for an empty sample
     */
    public static double nearestRank(double[] sample, double percentile) {
        if (percentile <= 0 || percentile > 100) {
            throw new IllegalArgumentException("Percentile must be in (0, 100]: " + percentile);
        }
        if (sample.length == 0) {
            return 0;
        }
        double[] sorted = Arrays.copyOf(sample, sample.length);
        Arrays.sort(sorted);
        int rank = (int) Math.ceil(percentile / 100.0 * sorted.length);
        return sorted[Math.max(rank, 1) - 1];
    }
}
