package com.astroslide.service;

import java.util.Arrays;

/** Linear-interpolated percentiles (numpy's default) over float samples. */
final class Percentiles {

    private Percentiles() {}

    /** @param percent in [0,100] */
    static double of(float[] values, double percent) {
        float[] sorted = values.clone();
        Arrays.sort(sorted);
        return ofSorted(sorted, percent);
    }

    static double ofSorted(float[] sorted, double percent) {
        if (sorted.length == 0) throw new IllegalArgumentException("No samples");
        double pos = Math.max(0, Math.min(100, percent)) / 100.0 * (sorted.length - 1);
        int lo = (int) Math.floor(pos);
        int hi = Math.min(lo + 1, sorted.length - 1);
        double frac = pos - lo;
        return sorted[lo] + frac * (sorted[hi] - sorted[lo]);
    }

    static double median(float[] values) {
        return of(values, 50);
    }
}
