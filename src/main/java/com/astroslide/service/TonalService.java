package com.astroslide.service;

import com.astroslide.model.EnhancementException;
import com.astroslide.model.PixelBuffer;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.function.Consumer;
import java.util.function.DoubleUnaryOperator;

/**
 * Tonal remapping: percentile stretch, gamma, CLAHE, white balance, background
 * extraction and the lightness curves used by the lunar presets.
 * All operators return a new, clamped buffer.
 */
public class TonalService {

    private static final Logger log = LoggerFactory.getLogger(TonalService.class);

    static final int BINS = 256;
    private static final double BACKGROUND_PERCENTILE = 25.0;
    private static final double WHITE_PATCH_PERCENTILE = 99.5;

    public enum WhiteBalanceMethod { GRAY_WORLD, WHITE_PATCH }

    private final ColorSpaceService colors;

    public TonalService(ColorSpaceService colors) {
        this.colors = colors;
    }

    /**
     * Per-channel linear remap of the {@code lowPercentile}..{@code highPercentile} range
     * (percent units) onto [0,1]. A flat channel is left as is.
     */
    public PixelBuffer histogramStretch(PixelBuffer buffer, double lowPercentile, double highPercentile) {
        if (lowPercentile < 0 || highPercentile > 100 || lowPercentile > highPercentile) {
            throw new IllegalArgumentException("Bad percentile range " + lowPercentile + ".." + highPercentile);
        }
        PixelBuffer out = buffer.copy();
        for (int c = 0; c < out.getChannels(); c++) {
            float[] p = out.plane(c);
            float[] sorted = p.clone();
            Arrays.sort(sorted);
            double low = Percentiles.ofSorted(sorted, lowPercentile);
            double high = Percentiles.ofSorted(sorted, highPercentile);
            if (high <= low) {
                log.debug("Channel {} is flat at {}, stretch skipped", c, low);
                continue;
            }
            double range = high - low;
            for (int i = 0; i < p.length; i++) p[i] = (float) ((p[i] - low) / range);
        }
        return out.clamp();
    }

    public PixelBuffer gammaCurve(PixelBuffer buffer, double gamma) {
        if (!(gamma > 0)) throw new IllegalArgumentException("Gamma must be positive: " + gamma);
        PixelBuffer out = buffer.copy().clamp();
        for (int c = 0; c < out.getChannels(); c++) {
            float[] p = out.plane(c);
            for (int i = 0; i < p.length; i++) p[i] = (float) Math.pow(p[i], gamma);
        }
        return out;
    }

    /**
     * Contrast limited adaptive histogram equalization of the lightness channel.
     * Tiles whose samples are all equal keep an identity mapping.
     */
    public PixelBuffer adaptiveContrast(PixelBuffer buffer, double clipLimit, int tileGridSize) {
        if (!(clipLimit > 0) || tileGridSize < 1) {
            throw new IllegalArgumentException("Bad CLAHE parameters clip=" + clipLimit + " grid=" + tileGridSize);
        }
        int width = buffer.getWidth();
        int height = buffer.getHeight();
        return mapLightness(buffer, l -> equalize(l, width, height, clipLimit, tileGridSize));
    }

    /**
     * CLAHE at several tile scales on the same lightness, blended by {@code weights}.
     * Coarse grids carry global tone mapping, fine grids local detail.
     */
    public PixelBuffer multiScaleContrast(PixelBuffer buffer, double[] clipLimits, int[] tileGridSizes, double[] weights) {
        if (clipLimits.length == 0 || clipLimits.length != tileGridSizes.length || clipLimits.length != weights.length) {
            throw new IllegalArgumentException("Need one clip limit, tile grid and weight per scale");
        }
        for (int s = 0; s < clipLimits.length; s++) {
            if (!(clipLimits[s] > 0) || tileGridSizes[s] < 1 || !(weights[s] >= 0)) {
                throw new IllegalArgumentException("Bad CLAHE scale " + s + ": clip=" + clipLimits[s]
                        + " grid=" + tileGridSizes[s] + " weight=" + weights[s]);
            }
        }
        int width = buffer.getWidth();
        int height = buffer.getHeight();
        return mapLightness(buffer, l -> {
            double[] blended = new double[l.length];
            for (int s = 0; s < clipLimits.length; s++) {
                float[] scale = l.clone();
                equalize(scale, width, height, clipLimits[s], tileGridSizes[s]);
                for (int i = 0; i < l.length; i++) blended[i] += weights[s] * scale[i];
            }
            for (int i = 0; i < l.length; i++) l[i] = (float) ColorSpaceService.clamp01(blended[i]);
        });
    }

    private static void equalize(float[] l, int width, int height, double clipLimit, int tileGridSize) {
        int gx = Math.min(tileGridSize, width);
        int gy = Math.min(tileGridSize, height);
        float[][] luts = new float[gx * gy][];

        for (int ty = 0; ty < gy; ty++) {
            int y0 = ty * height / gy, y1 = (ty + 1) * height / gy;
            for (int tx = 0; tx < gx; tx++) {
                int x0 = tx * width / gx, x1 = (tx + 1) * width / gx;
                luts[ty * gx + tx] = tileMapping(l, width, x0, x1, y0, y1, clipLimit);
            }
        }

        double tileW = (double) width / gx;
        double tileH = (double) height / gy;
        float[] out = new float[l.length];
        for (int y = 0; y < height; y++) {
            double tyf = (y + 0.5) / tileH - 0.5;
            int ty1 = (int) Math.floor(tyf);
            double wy = tyf - ty1;
            int ty2 = Math.min(ty1 + 1, gy - 1);
            ty1 = Math.max(ty1, 0);
            for (int x = 0; x < width; x++) {
                double txf = (x + 0.5) / tileW - 0.5;
                int tx1 = (int) Math.floor(txf);
                double wx = txf - tx1;
                int tx2 = Math.min(tx1 + 1, gx - 1);
                tx1 = Math.max(tx1, 0);

                float v = l[y * width + x];
                double top = (1 - wx) * lookup(luts[ty1 * gx + tx1], v) + wx * lookup(luts[ty1 * gx + tx2], v);
                double bottom = (1 - wx) * lookup(luts[ty2 * gx + tx1], v) + wx * lookup(luts[ty2 * gx + tx2], v);
                out[y * width + x] = (float) ((1 - wy) * top + wy * bottom);
            }
        }
        System.arraycopy(out, 0, l, 0, l.length);
    }

    private static float[] tileMapping(float[] l, int width, int x0, int x1, int y0, int y1, double clipLimit) {
        int[] hist = new int[BINS];
        float min = Float.MAX_VALUE, max = -Float.MAX_VALUE;
        for (int y = y0; y < y1; y++) {
            for (int x = x0; x < x1; x++) {
                float v = l[y * width + x];
                hist[bin(v)]++;
                if (v < min) min = v;
                if (v > max) max = v;
            }
        }
        float[] lut = new float[BINS];
        if (max <= min) {
            for (int k = 0; k < BINS; k++) lut[k] = k / 255f;
            return lut;
        }
        int pixels = (x1 - x0) * (y1 - y0);

        int limit = Math.max(1, (int) (clipLimit * pixels / BINS));
        int excess = 0;
        for (int k = 0; k < BINS; k++) {
            if (hist[k] > limit) {
                excess += hist[k] - limit;
                hist[k] = limit;
            }
        }
        int share = excess / BINS;
        int remainder = excess - share * BINS;
        for (int k = 0; k < BINS; k++) hist[k] += share;
        if (remainder > 0) {
            int step = Math.max(BINS / remainder, 1);
            for (int k = 0; k < BINS && remainder > 0; k += step, remainder--) hist[k]++;
        }

        long cdf = 0;
        for (int k = 0; k < BINS; k++) {
            cdf += hist[k];
            lut[k] = (float) cdf / pixels;
        }
        return lut;
    }

    private static int bin(float v) {
        int b = (int) (v * 255);
        return b < 0 ? 0 : (b > 255 ? 255 : b);
    }

    private static double lookup(float[] lut, float v) {
        double pos = Math.max(0, Math.min(255, v * 255.0));
        int k = (int) pos;
        if (k >= 255) return lut[255];
        double frac = pos - k;
        return lut[k] + frac * (lut[k + 1] - lut[k]);
    }

    /**
     * Gray-world equalises channel means; white-patch equalises the 99.5th percentile of
     * each channel to the brightest one. Grayscale buffers are returned unchanged.
     *
     * @throws EnhancementException DEGENERATE_INPUT when a channel's reference level is zero
     */
    public PixelBuffer whiteBalance(PixelBuffer buffer, WhiteBalanceMethod method) throws EnhancementException {
        if (!buffer.isColor()) return buffer.copy();
        double[] reference = new double[3];
        for (int c = 0; c < 3; c++) {
            reference[c] = method == WhiteBalanceMethod.GRAY_WORLD
                    ? mean(buffer.plane(c))
                    : Percentiles.of(buffer.plane(c), WHITE_PATCH_PERCENTILE);
            if (!(reference[c] > 0)) {
                throw EnhancementException.degenerate("White balance: channel " + c + " has no signal");
            }
        }
        double target = method == WhiteBalanceMethod.GRAY_WORLD
                ? (reference[0] + reference[1] + reference[2]) / 3.0
                : Math.max(reference[0], Math.max(reference[1], reference[2]));
        double[] gains = new double[3];
        for (int c = 0; c < 3; c++) gains[c] = target / reference[c];
        log.debug("White balance {} gains {}", method, Arrays.toString(gains));
        return colors.applyChannelGains(buffer, gains);
    }

    /**
     * Removes large-scale gradients (light pollution, vignetting). The background model is
     * the 25th percentile of each grid cell, upsampled bicubically; the image is shifted so
     * the model's median level is kept.
     */
    public PixelBuffer extractBackground(PixelBuffer buffer, int gridSize) {
        if (gridSize < 1) throw new IllegalArgumentException("Grid size must be positive: " + gridSize);
        int width = buffer.getWidth(), height = buffer.getHeight();
        int grid = Math.min(gridSize, Math.min(width, height));
        int cellW = width / grid, cellH = height / grid;

        FloatProcessor[] samples = new FloatProcessor[buffer.getChannels()];
        float[] allSamples = new float[grid * grid * buffer.getChannels()];
        int n = 0;
        for (int c = 0; c < buffer.getChannels(); c++) {
            float[] plane = buffer.plane(c);
            samples[c] = new FloatProcessor(grid, grid);
            float[] cell = new float[cellW * cellH];
            for (int gy = 0; gy < grid; gy++) {
                for (int gx = 0; gx < grid; gx++) {
                    int k = 0;
                    for (int y = gy * cellH; y < (gy + 1) * cellH; y++) {
                        for (int x = gx * cellW; x < (gx + 1) * cellW; x++) cell[k++] = plane[y * width + x];
                    }
                    float level = (float) Percentiles.of(cell, BACKGROUND_PERCENTILE);
                    samples[c].setf(gx, gy, level);
                    allSamples[n++] = level;
                }
            }
        }
        double neutral = Percentiles.median(allSamples);

        PixelBuffer out = buffer.copy();
        for (int c = 0; c < out.getChannels(); c++) {
            float[] model = backgroundModel(samples[c], width, height);
            float[] p = out.plane(c);
            for (int i = 0; i < p.length; i++) p[i] = (float) (p[i] - model[i] + neutral);
        }
        return out.clamp();
    }

    private static float[] backgroundModel(FloatProcessor samples, int width, int height) {
        if (samples.getWidth() == 1) {
            float[] flat = new float[width * height];
            Arrays.fill(flat, samples.getf(0, 0));
            return flat;
        }
        samples.setInterpolationMethod(ImageProcessor.BICUBIC);
        return (float[]) samples.resize(width, height).getPixels();
    }

    /** Lifts dark lightness toward {@code l^exponent}, weighted by (1-l)^2. */
    public PixelBuffer shadowLift(PixelBuffer buffer, double amount, double exponent) {
        return mapLightness(buffer, curve(l -> {
            double lifted = Math.pow(l, exponent);
            double weight = (1 - l) * (1 - l);
            return l + (lifted - l) * weight * amount;
        }));
    }

    /** Soft-knee compression of lightness above {@code knee}. */
    public PixelBuffer highlightCompress(PixelBuffer buffer, double amount, double knee) {
        if (knee < 0 || knee >= 1) throw new IllegalArgumentException("Knee must be in [0,1): " + knee);
        return mapLightness(buffer, curve(l -> {
            double mask = Math.max(l - knee, 0) / (1 - knee);
            return l - mask * amount * (l - knee);
        }));
    }

    /** Blends lightness with a logistic S-curve centred on 0.5. */
    public PixelBuffer sCurve(PixelBuffer buffer, double amount, double steepness) {
        return mapLightness(buffer, curve(l -> {
            double s = 1 / (1 + Math.exp(-steepness * (l - 0.5)));
            return l * (1 - amount) + s * amount;
        }));
    }

    private static Consumer<float[]> curve(DoubleUnaryOperator f) {
        return l -> {
            for (int i = 0; i < l.length; i++) l[i] = (float) f.applyAsDouble(ColorSpaceService.clamp01(l[i]));
        };
    }

    /**
     * Runs {@code op} on lightness scaled to [0,1]: LAB L* for colour buffers, the single
     * channel for grayscale. Chroma is left alone.
     */
    private PixelBuffer mapLightness(PixelBuffer buffer, Consumer<float[]> op) {
        if (!buffer.isColor()) {
            PixelBuffer out = buffer.copy().clamp();
            op.accept(out.plane(0));
            return out.clamp();
        }
        PixelBuffer lab = colors.rgbToLab(buffer);
        float[] L = lab.plane(0);
        float[] l = new float[L.length];
        for (int i = 0; i < l.length; i++) l[i] = L[i] / 100f;
        op.accept(l);
        for (int i = 0; i < l.length; i++) L[i] = (float) (ColorSpaceService.clamp01(l[i]) * 100.0);
        return colors.labToRgb(lab);
    }

    static double mean(float[] values) {
        double sum = 0;
        for (float v : values) sum += v;
        return values.length == 0 ? 0 : sum / values.length;
    }
}
