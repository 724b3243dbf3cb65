package com.fraud.analytics.profile;

import java.util.Arrays;

/**
 * Percentiles by linear interpolation between order statistics: rank {@code p/100 * (n-1)}.
 * Shared by batch profiling and the IQR outlier method so both see the same quartiles.
 */
public final class Percentiles {

    private Percentiles() {
    }

    /**
     * @param sorted ascending values, non-empty
     * @param p      percentile in [0,100]
     */
    public static double ofSorted(double[] sorted, double p) {
        if (sorted.length == 0) {
            throw new IllegalArgumentException("Cannot take a percentile of an empty array");
        }
        if (p < 0 || p > 100) {
            throw new IllegalArgumentException("Percentile must be in [0,100], got " + p);
        }
        double rank = (p / 100.0) * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        if (upper >= sorted.length) return sorted[sorted.length - 1];
        double weight = rank - lower;
        return sorted[lower] * (1 - weight) + sorted[upper] * weight;
    }

    public static double of(double[] values, double p) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        return ofSorted(sorted, p);
    }

    /**
     * Fraction of values less than or equal to {@code value}.
     */
    public static double rankOfSorted(double[] sorted, double value) {
        if (sorted.length == 0) return 0.0;
        int lo = 0;
        int hi = sorted.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (sorted[mid] <= value) lo = mid + 1;
            else hi = mid;
        }
        return (double) lo / sorted.length;
    }
}
