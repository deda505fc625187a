package com.astroslide.service;

import com.astroslide.model.HistogramResult;
import com.astroslide.model.PixelBuffer;

/**
 * 256-bin distributions for display. Bin index is {@code floor(value * 255)} clamped to
 * [0,255]; luminance uses Rec.601 weights. Grayscale buffers report their single channel
 * in all four sequences.
 */
public class HistogramService {

    private static final int BINS = HistogramResult.BINS;
    // Keeps a gray pixel's luma in the same bin as its channels despite weight rounding.
    private static final double LUMA_ROUNDING_GUARD = 1e-6;

    public HistogramResult computeHistogram(PixelBuffer buffer) {
        if (!buffer.isColor()) {
            long[] gray = count(buffer.plane(0));
            return new HistogramResult(gray, gray.clone(), gray.clone(), gray.clone());
        }
        float[] r = buffer.plane(0), g = buffer.plane(1), b = buffer.plane(2);
        long[] red = count(r);
        long[] green = count(g);
        long[] blue = count(b);
        long[] luminance = new long[BINS];
        for (int i = 0; i < r.length; i++) {
            double y = ColorSpaceService.LUMA_R * r[i] + ColorSpaceService.LUMA_G * g[i] + ColorSpaceService.LUMA_B * b[i];
            luminance[bin(y * 255.0 + LUMA_ROUNDING_GUARD)]++;
        }
        return new HistogramResult(red, green, blue, luminance);
    }

    private static long[] count(float[] plane) {
        long[] counts = new long[BINS];
        for (float v : plane) counts[bin(v * 255.0)]++;
        return counts;
    }

    private static int bin(double scaled) {
        if (!(scaled > 0)) return 0;
        int k = (int) Math.floor(scaled);
        return k > BINS - 1 ? BINS - 1 : k;
    }
}
