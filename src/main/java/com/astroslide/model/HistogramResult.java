package com.astroslide.model;

public class HistogramResult {
    public static final int BINS = 256;

    public final long[] red;
    public final long[] green;
    public final long[] blue;
    public final long[] luminance;

    public HistogramResult(long[] red, long[] green, long[] blue, long[] luminance) {
        this.red = red;
        this.green = green;
        this.blue = blue;
        this.luminance = luminance;
    }

    public static long total(long[] counts) {
        long sum = 0;
        for (long c : counts) sum += c;
        return sum;
    }
}
