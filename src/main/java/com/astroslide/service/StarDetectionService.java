package com.astroslide.service;

import com.astroslide.model.PixelBuffer;
import com.astroslide.model.Star;
import com.astroslide.model.StarDetectionSettings;
import com.astroslide.model.StarMap;
import ij.ImagePlus;
import ij.measure.Measurements;
import ij.measure.ResultsTable;
import ij.plugin.filter.ParticleAnalyzer;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import ij.process.ImageStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Finds compact, bright, roughly round sources on the luminance plane.
 * Background and noise come from the global histogram (mode and standard deviation);
 * ImageJ's particle analyzer segments everything above background + k sigma, and each
 * particle is then checked against its own annulus background.
 */
public class StarDetectionService {

    private static final Logger log = LoggerFactory.getLogger(StarDetectionService.class);

    private static final int[][] RAYS = {{1, 0}, {-1, 0}, {0, 1}, {0, -1}, {1, 1}, {1, -1}, {-1, 1}, {-1, -1}};
    private static final double MIN_RADIUS = 0.5;
    private static final double ANNULUS_GAP = 2.0;
    private static final double ANNULUS_WIDTH = 3.0;

    private final ColorSpaceService colors;
    private final StarDetectionSettings settings;

    public StarDetectionService(ColorSpaceService colors, StarDetectionSettings settings) {
        this.colors = colors;
        this.settings = settings;
    }

    public StarDetectionSettings getSettings() {
        return settings;
    }

    public StarMap detect(PixelBuffer buffer) {
        int width = buffer.getWidth();
        int height = buffer.getHeight();
        float[] lum = colors.luminance(buffer);
        FloatProcessor ip = new FloatProcessor(width, height, lum.clone());

        // --- BACKGROUND ---
        ImageStatistics globalStats = ImageStatistics.getStatistics(ip,
                Measurements.MEAN | Measurements.STD_DEV | Measurements.MODE | Measurements.MIN_MAX, null);
        double skyLevel = globalStats.dmode;
        if (skyLevel == 0) skyLevel = globalStats.mean;
        double noise = globalStats.stdDev;
        if (!(noise > 0)) {
            log.debug("Flat luminance, no stars to detect");
            return new StarMap(width, height, skyLevel, 0, List.of());
        }

        // --- SEGMENTATION ---
        double threshold = skyLevel + settings.thresholdSigma * noise;
        if (threshold > globalStats.max) {
            return new StarMap(width, height, skyLevel, noise, List.of());
        }
        ip.setThreshold(threshold, globalStats.max, ImageProcessor.NO_LUT_UPDATE);

        int measurements = Measurements.AREA | Measurements.CENTROID | Measurements.MIN_MAX | Measurements.ELLIPSE;
        ResultsTable rt = new ResultsTable();
        ParticleAnalyzer pa = new ParticleAnalyzer(ParticleAnalyzer.SHOW_NONE, measurements, rt,
                settings.minArea, settings.maxArea);
        pa.analyze(new ImagePlus("", ip));

        // --- QUALIFICATION ---
        List<Star> stars = new ArrayList<>();
        int count = rt.getCounter();
        int rejectedShape = 0, rejectedContrast = 0;
        for (int i = 0; i < count; i++) {
            double major = rt.getValue("Major", i);
            double minor = rt.getValue("Minor", i);
            double roundness = (major > 0) ? Math.min(1.0, minor / major) : 0.0;
            if (roundness < settings.minRoundness) {
                rejectedShape++;
                continue;
            }
            // centroids are reported with pixel centres at +0.5
            double cx = rt.getValue("X", i) - 0.5;
            double cy = rt.getValue("Y", i) - 0.5;
            double peak = rt.getValue("Max", i);
            double blobRadius = Math.sqrt(rt.getValue("Area", i) / Math.PI);

            double localBackground = annulusMedian(lum, width, height, cx, cy, blobRadius, skyLevel);
            if (peak - localBackground < settings.thresholdSigma * noise) {
                rejectedContrast++;
                continue;
            }
            double radius = halfMaximumRadius(lum, width, height, cx, cy, peak, localBackground);
            stars.add(new Star(cx, cy, radius, peak, localBackground));
        }

        stars.sort(Comparator.comparingDouble((Star s) -> s.peak).reversed());
        if (stars.size() > settings.maxStars) {
            stars = new ArrayList<>(stars.subList(0, settings.maxStars));
        }
        log.debug("Detected {} stars of {} particles (shape rejects {}, contrast rejects {}), sky={} noise={}",
                stars.size(), count, rejectedShape, rejectedContrast, skyLevel, noise);
        return new StarMap(width, height, skyLevel, noise, stars);
    }

    private static double annulusMedian(float[] lum, int width, int height, double cx, double cy,
                                        double blobRadius, double fallback) {
        double inner = blobRadius + ANNULUS_GAP;
        double outer = inner + ANNULUS_WIDTH;
        int x0 = Math.max(0, (int) Math.floor(cx - outer)), x1 = Math.min(width - 1, (int) Math.ceil(cx + outer));
        int y0 = Math.max(0, (int) Math.floor(cy - outer)), y1 = Math.min(height - 1, (int) Math.ceil(cy + outer));
        float[] ring = new float[(x1 - x0 + 1) * (y1 - y0 + 1)];
        int n = 0;
        for (int y = y0; y <= y1; y++) {
            for (int x = x0; x <= x1; x++) {
                double d2 = (x - cx) * (x - cx) + (y - cy) * (y - cy);
                if (d2 >= inner * inner && d2 <= outer * outer) ring[n++] = lum[y * width + x];
            }
        }
        if (n == 0) return fallback;
        return Percentiles.median(Arrays.copyOf(ring, n));
    }

    /** Mean over eight rays of the distance where brightness drops to half the peak above background. */
    private static double halfMaximumRadius(float[] lum, int width, int height, double cx, double cy,
                                            double peak, double background) {
        int px = (int) Math.round(cx);
        int py = (int) Math.round(cy);
        double half = background + (peak - background) / 2.0;
        double sum = 0;
        for (int[] ray : RAYS) {
            double step = Math.hypot(ray[0], ray[1]);
            double previous = lum[py * width + px];
            double distance = 0;
            for (int t = 1; ; t++) {
                int x = px + t * ray[0];
                int y = py + t * ray[1];
                if (x < 0 || y < 0 || x >= width || y >= height) {
                    distance = (t - 1) * step;
                    break;
                }
                double value = lum[y * width + x];
                if (value <= half) {
                    double frac = previous > value ? Math.max(0, Math.min(1, (previous - half) / (previous - value))) : 0;
                    distance = (t - 1 + frac) * step;
                    break;
                }
                previous = value;
            }
            sum += distance;
        }
        return Math.max(MIN_RADIUS, sum / RAYS.length);
    }
}
