package com.astroslide.model;

/**
 * Calibration knobs for star detection and masking. Thresholds are tuned against real
 * telescope frames, so they travel as configuration rather than constants in the detector.
 */
public final class StarDetectionSettings {

    static final double DEFAULT_THRESHOLD_SIGMA = 3.0;
    static final double DEFAULT_MIN_AREA = 3;
    static final double DEFAULT_MAX_AREA = 400;
    static final double DEFAULT_MIN_ROUNDNESS = 0.5;
    static final int DEFAULT_MAX_STARS = 2000;
    static final double DEFAULT_MASK_SCALE = 1.5;
    static final double DEFAULT_MASK_PADDING = 1.0;

    /** Segmentation level above background, in units of background noise. */
    public final double thresholdSigma;
    /** Particle area bounds in pixels; larger blobs are nebulosity or planetary disks. */
    public final double minArea;
    public final double maxArea;
    /** Minor/major axis ratio of the fitted ellipse. */
    public final double minRoundness;
    public final int maxStars;
    public final double maskScale;
    public final double maskPadding;

    public StarDetectionSettings(double thresholdSigma, double minArea, double maxArea, double minRoundness,
                                 int maxStars, double maskScale, double maskPadding) {
        if (thresholdSigma <= 0 || minArea < 1 || maxArea < minArea || maxStars < 1 || maskScale <= 0 || maskPadding < 0) {
            throw new IllegalArgumentException("Invalid star detection settings");
        }
        this.thresholdSigma = thresholdSigma;
        this.minArea = minArea;
        this.maxArea = maxArea;
        this.minRoundness = minRoundness;
        this.maxStars = maxStars;
        this.maskScale = maskScale;
        this.maskPadding = maskPadding;
    }

    public static StarDetectionSettings defaults() {
        return new StarDetectionSettings(DEFAULT_THRESHOLD_SIGMA, DEFAULT_MIN_AREA, DEFAULT_MAX_AREA,
                DEFAULT_MIN_ROUNDNESS, DEFAULT_MAX_STARS, DEFAULT_MASK_SCALE, DEFAULT_MASK_PADDING);
    }
}
