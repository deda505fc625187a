package com.astroslide.service;

import com.astroslide.model.AppConfig;
import com.astroslide.model.PixelBuffer;
import ij.measure.Measurements;
import ij.plugin.filter.GaussianBlur;
import ij.process.FloatProcessor;
import ij.process.ImageStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Spatial-frequency operators built on ImageJ's Gaussian blur: edge-aware denoising and
 * unsharp masking. Both are deterministic for identical input.
 */
public class FrequencyService {

    private static final Logger log = LoggerFactory.getLogger(FrequencyService.class);

    private static final double BLUR_ACCURACY = 0.0002;
    private static final double EDGE_PRESMOOTH_SIGMA = 1.0;
    private static final int[] LAPLACIAN = {0, 1, 0, 1, -4, 1, 0, 1, 0};
    // Laplacian variance on the 8-bit scale that counts as fully noisy
    private static final double NOISE_VARIANCE_SCALE = 1000.0;

    private final ColorSpaceService colors;
    private final double maxRadius;
    private final double edgeThreshold;

    public FrequencyService(ColorSpaceService colors) {
        this(colors, AppConfig.getDenoiseMaxRadius(), AppConfig.getDenoiseEdgeThreshold());
    }

    /**
     * @param maxRadius     smoothing radius in pixels reached at strength 1
     * @param edgeThreshold Sobel magnitude of the luminance above which smoothing backs off
     */
    public FrequencyService(ColorSpaceService colors, double maxRadius, double edgeThreshold) {
        this.colors = colors;
        this.maxRadius = maxRadius;
        this.edgeThreshold = edgeThreshold;
    }

    /**
     * Edge-preserving smoothing. Strength 0 returns an equal copy; larger strength widens the
     * Gaussian and mixes more of it in. Pixels on luminance edges stronger than the threshold
     * receive proportionally less smoothing.
     */
    public PixelBuffer denoise(PixelBuffer buffer, double strength) {
        if (strength < 0) throw new IllegalArgumentException("Denoise strength must be >= 0: " + strength);
        if (strength == 0) return buffer.copy();
        double s = Math.min(strength, 1.0);
        double sigma = Math.max(0.5, s * maxRadius / 2.0);
        double mix = Math.min(1.0, 2.0 * s);

        float[] weight = smoothingWeights(buffer);
        PixelBuffer out = buffer.copy();
        for (int c = 0; c < out.getChannels(); c++) {
            float[] in = out.plane(c);
            float[] blurred = blur(buffer.toProcessor(c), sigma);
            for (int i = 0; i < in.length; i++) {
                in[i] = (float) (in[i] + mix * weight[i] * (blurred[i] - in[i]));
            }
        }
        return out.clamp();
    }

    /** Denoise whose strength follows the estimated noise level: base x (0.5 + 2 x noise). */
    public PixelBuffer adaptiveDenoise(PixelBuffer buffer, double baseStrength) {
        if (baseStrength == 0) return buffer.copy();
        double noise = estimateNoiseLevel(buffer);
        double strength = Math.max(0, Math.min(1.0, baseStrength * (0.5 + 2.0 * noise)));
        log.debug("Adaptive denoise: noise={} base={} strength={}", noise, baseStrength, strength);
        return denoise(buffer, strength);
    }

    /** Laplacian variance of the luminance, normalised to [0,1]. */
    public double estimateNoiseLevel(PixelBuffer buffer) {
        FloatProcessor lum = new FloatProcessor(buffer.getWidth(), buffer.getHeight(), colors.luminance(buffer));
        lum.convolve3x3(LAPLACIAN);
        ImageStatistics stats = ImageStatistics.getStatistics(lum, Measurements.MEAN | Measurements.STD_DEV, null);
        double variance = stats.stdDev * stats.stdDev * 255.0 * 255.0;
        return Math.min(variance / NOISE_VARIANCE_SCALE, 1.0);
    }

    /** {@code out = in + amount * (in - gaussian(in, radius))}, clamped. */
    public PixelBuffer unsharpMask(PixelBuffer buffer, double radius, double amount) {
        if (!(radius > 0)) throw new IllegalArgumentException("Unsharp radius must be positive: " + radius);
        if (amount == 0) return buffer.copy();
        PixelBuffer out = buffer.copy();
        for (int c = 0; c < out.getChannels(); c++) {
            float[] in = out.plane(c);
            float[] blurred = blur(buffer.toProcessor(c), radius);
            for (int i = 0; i < in.length; i++) {
                in[i] = (float) (in[i] + amount * (in[i] - blurred[i]));
            }
        }
        return out.clamp();
    }

    private float[] smoothingWeights(PixelBuffer buffer) {
        FloatProcessor edges = new FloatProcessor(buffer.getWidth(), buffer.getHeight(), colors.luminance(buffer));
        blurInPlace(edges, EDGE_PRESMOOTH_SIGMA);
        edges.findEdges();
        float[] magnitude = (float[]) edges.getPixels();
        float[] weight = new float[magnitude.length];
        for (int i = 0; i < weight.length; i++) {
            double m = magnitude[i];
            weight[i] = m <= edgeThreshold ? 1f : (float) ((edgeThreshold / m) * (edgeThreshold / m));
        }
        return weight;
    }

    static float[] blur(FloatProcessor fp, double sigma) {
        blurInPlace(fp, sigma);
        return (float[]) fp.getPixels();
    }

    static void blurInPlace(FloatProcessor fp, double sigma) {
        new GaussianBlur().blurGaussian(fp, sigma, sigma, BLUR_ACCURACY);
    }
}
