package com.astroslide.service;

import com.astroslide.model.PixelBuffer;

/**
 * RGB / HSV / CIELAB conversions over whole buffers. Every method returns a new buffer
 * and leaves its input untouched.
 * <p>
 * HSV planes hold H in [0,1), S and V in [0,1]. LAB planes hold L* in [0,100] and signed
 * a*, b* (D65 white, sRGB companding); these intermediate buffers are not clamped.
 */
public class ColorSpaceService {

    // Rec.601 luma weights
    public static final double LUMA_R = 0.299;
    public static final double LUMA_G = 0.587;
    public static final double LUMA_B = 0.114;

    // D65 white point
    private static final double XN = 0.95047;
    private static final double YN = 1.00000;
    private static final double ZN = 1.08883;

    private static final double EPSILON = 216.0 / 24389.0;
    private static final double KAPPA = 24389.0 / 27.0;

    // Pixels at or below this value are treated as empty sky.
    private static final double SUBJECT_FLOOR = 10.0 / 255.0;

    public PixelBuffer rgbToHsv(PixelBuffer rgb) {
        requireColor(rgb);
        PixelBuffer hsv = rgb.blankCopy();
        float[] r = rgb.plane(0), g = rgb.plane(1), b = rgb.plane(2);
        float[] h = hsv.plane(0), s = hsv.plane(1), v = hsv.plane(2);
        for (int i = 0; i < r.length; i++) {
            double rr = r[i], gg = g[i], bb = b[i];
            double max = Math.max(rr, Math.max(gg, bb));
            double min = Math.min(rr, Math.min(gg, bb));
            double delta = max - min;
            double hue = 0;
            if (delta > 0) {
                if (max == rr) hue = ((gg - bb) / delta) / 6.0;
                else if (max == gg) hue = ((bb - rr) / delta + 2.0) / 6.0;
                else hue = ((rr - gg) / delta + 4.0) / 6.0;
                if (hue < 0) hue += 1.0;
            }
            h[i] = (float) hue;
            s[i] = (float) (max > 0 ? delta / max : 0);
            v[i] = (float) max;
        }
        return hsv;
    }

    /** Saturation and value are clamped on the way back; the result is a valid RGB buffer. */
    public PixelBuffer hsvToRgb(PixelBuffer hsv) {
        requireColor(hsv);
        PixelBuffer rgb = hsv.blankCopy();
        float[] h = hsv.plane(0), s = hsv.plane(1), v = hsv.plane(2);
        float[] r = rgb.plane(0), g = rgb.plane(1), b = rgb.plane(2);
        for (int i = 0; i < h.length; i++) {
            double hue = h[i] - Math.floor(h[i]);
            double sat = clamp01(s[i]);
            double val = clamp01(v[i]);
            double sector = hue * 6.0;
            int k = (int) Math.floor(sector) % 6;
            double f = sector - Math.floor(sector);
            double p = val * (1 - sat);
            double q = val * (1 - sat * f);
            double t = val * (1 - sat * (1 - f));
            double rr, gg, bb;
            switch (k) {
                case 0: rr = val; gg = t; bb = p; break;
                case 1: rr = q; gg = val; bb = p; break;
                case 2: rr = p; gg = val; bb = t; break;
                case 3: rr = p; gg = q; bb = val; break;
                case 4: rr = t; gg = p; bb = val; break;
                default: rr = val; gg = p; bb = q; break;
            }
            r[i] = (float) rr;
            g[i] = (float) gg;
            b[i] = (float) bb;
        }
        return rgb;
    }

    public PixelBuffer rgbToLab(PixelBuffer rgb) {
        requireColor(rgb);
        PixelBuffer lab = rgb.blankCopy();
        float[] r = rgb.plane(0), g = rgb.plane(1), b = rgb.plane(2);
        float[] L = lab.plane(0), A = lab.plane(1), B = lab.plane(2);
        for (int i = 0; i < r.length; i++) {
            double rl = gammaExpand(r[i]);
            double gl = gammaExpand(g[i]);
            double bl = gammaExpand(b[i]);

            double x = 0.4124564 * rl + 0.3575761 * gl + 0.1804375 * bl;
            double y = 0.2126729 * rl + 0.7151522 * gl + 0.0721750 * bl;
            double z = 0.0193339 * rl + 0.1191920 * gl + 0.9503041 * bl;

            double fx = labF(x / XN);
            double fy = labF(y / YN);
            double fz = labF(z / ZN);

            L[i] = (float) (116.0 * fy - 16.0);
            A[i] = (float) (500.0 * (fx - fy));
            B[i] = (float) (200.0 * (fy - fz));
        }
        return lab;
    }

    /** Inverse of {@link #rgbToLab}; out-of-gamut results are clamped into [0,1]. */
    public PixelBuffer labToRgb(PixelBuffer lab) {
        requireColor(lab);
        PixelBuffer rgb = lab.blankCopy();
        float[] L = lab.plane(0), A = lab.plane(1), B = lab.plane(2);
        float[] r = rgb.plane(0), g = rgb.plane(1), b = rgb.plane(2);
        for (int i = 0; i < L.length; i++) {
            double fy = (L[i] + 16.0) / 116.0;
            double fx = fy + A[i] / 500.0;
            double fz = fy - B[i] / 200.0;

            double x = XN * labFInverse(fx);
            double y = YN * (L[i] > KAPPA * EPSILON ? fy * fy * fy : L[i] / KAPPA);
            double z = ZN * labFInverse(fz);

            double rl = 3.2404542 * x - 1.5371385 * y - 0.4985314 * z;
            double gl = -0.9692660 * x + 1.8760108 * y + 0.0415560 * z;
            double bl = 0.0556434 * x - 0.2040259 * y + 1.0572252 * z;

            r[i] = (float) clamp01(gammaCompress(rl));
            g[i] = (float) clamp01(gammaCompress(gl));
            b[i] = (float) clamp01(gammaCompress(bl));
        }
        return rgb;
    }

    /** Multiplies one channel by {@code gain}. No clamping: callers merge and clamp. */
    public PixelBuffer scaleChannel(PixelBuffer buffer, int channelIndex, double gain) {
        if (channelIndex < 0 || channelIndex >= buffer.getChannels()) {
            throw new IllegalArgumentException("Channel " + channelIndex + " out of range for " + buffer);
        }
        PixelBuffer out = buffer.copy();
        float[] p = out.plane(channelIndex);
        for (int i = 0; i < p.length; i++) p[i] = (float) (p[i] * gain);
        return out;
    }

    public PixelBuffer applyChannelGains(PixelBuffer buffer, double[] gains) {
        if (gains.length != buffer.getChannels()) {
            throw new IllegalArgumentException("Expected " + buffer.getChannels() + " gains, got " + gains.length);
        }
        PixelBuffer out = buffer.copy();
        for (int c = 0; c < gains.length; c++) {
            float[] p = out.plane(c);
            for (int i = 0; i < p.length; i++) p[i] = (float) (p[i] * gains[c]);
        }
        return out.clamp();
    }

    /**
     * Scales one LAB channel (0 = L*, 1 = a*, 2 = b*) and merges back to RGB.
     * Grayscale buffers carry no chroma and are returned unchanged.
     */
    public PixelBuffer labChannelScale(PixelBuffer buffer, int labChannel, double gain) {
        if (!buffer.isColor()) return buffer.copy();
        return labToRgb(scaleChannel(rgbToLab(buffer), labChannel, gain));
    }

    /** Multiplies HSV saturation by {@code gain}; grayscale buffers are returned unchanged. */
    public PixelBuffer saturationScale(PixelBuffer buffer, double gain) {
        if (!buffer.isColor()) return buffer.copy();
        return hsvToRgb(scaleChannel(rgbToHsv(buffer), 1, gain));
    }

    /**
     * Adjusts a saturation gain to the image: washed-out, dark or low-variance subjects get
     * more of the boost, already saturated ones less. Only pixels brighter than the sky
     * floor are considered. The adjusted gain is clamped to [{@code minGain}, {@code maxGain}];
     * without any subject pixels the gain is returned as given.
     */
    public double adaptiveSaturationGain(PixelBuffer buffer, double gain, double minGain, double maxGain) {
        if (minGain > maxGain) {
            throw new IllegalArgumentException("Gain bounds reversed: " + minGain + " > " + maxGain);
        }
        if (!buffer.isColor()) return gain;
        PixelBuffer hsv = rgbToHsv(buffer);
        float[] s = hsv.plane(1), v = hsv.plane(2);
        int n = 0;
        for (float value : v) if (value > SUBJECT_FLOOR) n++;
        if (n == 0) return gain;

        float[] sat = new float[n];
        double sumS = 0, sumV = 0;
        int k = 0;
        for (int i = 0; i < v.length; i++) {
            if (v[i] > SUBJECT_FLOOR) {
                sat[k++] = s[i];
                sumS += s[i];
                sumV += v[i];
            }
        }
        double meanSat = sumS / n;
        double meanVal = sumV / n;
        double var = 0;
        for (float value : sat) var += (value - meanSat) * (value - meanSat);
        double stdSat = Math.sqrt(var / n);
        double p75 = Percentiles.of(sat, 75);

        double satFactor = meanSat < 0.15 ? 1.3 : meanSat < 0.25 ? 1.15 : meanSat > 0.4 ? 0.85 : 1.0;
        double varianceFactor = stdSat > 0.15 ? 1.1 : stdSat < 0.08 ? 0.95 : 1.0;
        double brightnessFactor = meanVal < 0.3 ? 1.05 : meanVal > 0.7 ? 0.98 : 1.0;
        double distributionFactor = p75 > 0.5 ? 0.9 : p75 < 0.2 ? 1.1 : 1.0;

        double factor = satFactor * varianceFactor * brightnessFactor * distributionFactor;
        return Math.max(minGain, Math.min(maxGain, gain * factor));
    }

    /** Luma plane of the buffer; for grayscale a copy of the single channel. */
    public float[] luminance(PixelBuffer buffer) {
        if (!buffer.isColor()) return buffer.plane(0).clone();
        float[] r = buffer.plane(0), g = buffer.plane(1), b = buffer.plane(2);
        float[] y = new float[r.length];
        for (int i = 0; i < y.length; i++) {
            y[i] = (float) (LUMA_R * r[i] + LUMA_G * g[i] + LUMA_B * b[i]);
        }
        return y;
    }

    private static void requireColor(PixelBuffer buffer) {
        if (!buffer.isColor()) {
            throw new IllegalArgumentException("Colour conversion needs a 3-channel buffer, got " + buffer);
        }
    }

    static double clamp01(double v) {
        return v < 0 ? 0 : (v > 1 ? 1 : v);
    }

    private static double gammaExpand(double c) {
        return c <= 0.04045 ? c / 12.92 : Math.pow((c + 0.055) / 1.055, 2.4);
    }

    private static double gammaCompress(double c) {
        if (c <= 0) return 0;
        return c <= 0.0031308 ? 12.92 * c : 1.055 * Math.pow(c, 1 / 2.4) - 0.055;
    }

    private static double labF(double t) {
        return t > EPSILON ? Math.cbrt(t) : (KAPPA * t + 16.0) / 116.0;
    }

    private static double labFInverse(double f) {
        double f3 = f * f * f;
        return f3 > EPSILON ? f3 : (116.0 * f - 16.0) / KAPPA;
    }
}
