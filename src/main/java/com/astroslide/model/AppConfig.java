package com.astroslide.model;

import java.util.prefs.Preferences;

public class AppConfig {
    private static final Preferences prefs = Preferences.userNodeForPackage(AppConfig.class);

    // Star detection
    private static final String KEY_STAR_SIGMA = "star_threshold_sigma";
    private static final String KEY_STAR_MIN_AREA = "star_min_area";
    private static final String KEY_STAR_MAX_AREA = "star_max_area";
    private static final String KEY_STAR_ROUNDNESS = "star_min_roundness";
    private static final String KEY_STAR_MAX_COUNT = "star_max_count";
    private static final String KEY_STAR_MASK_SCALE = "star_mask_scale";
    private static final String KEY_STAR_MASK_PADDING = "star_mask_padding";

    // Frequency operators
    private static final String KEY_DENOISE_RADIUS = "denoise_max_radius";
    private static final String KEY_DENOISE_EDGE = "denoise_edge_threshold";

    // Worker pool
    private static final String KEY_WORKERS = "pool_workers";
    private static final String KEY_PIXEL_BUDGET = "pool_pixel_budget";
    private static final String KEY_QUEUE_DEPTH = "pool_queue_depth";
    private static final String KEY_TIMEOUT = "request_timeout_ms";

    // Output
    private static final String KEY_JPEG_QUALITY = "jpeg_quality";
    private static final String KEY_PREVIEW_SIZE = "preview_size";

    public static double getStarThresholdSigma() { return prefs.getDouble(KEY_STAR_SIGMA, StarDetectionSettings.DEFAULT_THRESHOLD_SIGMA); }
    public static void setStarThresholdSigma(double v) { prefs.putDouble(KEY_STAR_SIGMA, v); }

    public static double getStarMinArea() { return prefs.getDouble(KEY_STAR_MIN_AREA, StarDetectionSettings.DEFAULT_MIN_AREA); }
    public static void setStarMinArea(double v) { prefs.putDouble(KEY_STAR_MIN_AREA, v); }

    public static double getStarMaxArea() { return prefs.getDouble(KEY_STAR_MAX_AREA, StarDetectionSettings.DEFAULT_MAX_AREA); }
    public static void setStarMaxArea(double v) { prefs.putDouble(KEY_STAR_MAX_AREA, v); }

    public static double getStarMinRoundness() { return prefs.getDouble(KEY_STAR_ROUNDNESS, StarDetectionSettings.DEFAULT_MIN_ROUNDNESS); }
    public static void setStarMinRoundness(double v) { prefs.putDouble(KEY_STAR_ROUNDNESS, v); }

    public static int getStarMaxCount() { return prefs.getInt(KEY_STAR_MAX_COUNT, StarDetectionSettings.DEFAULT_MAX_STARS); }
    public static void setStarMaxCount(int v) { prefs.putInt(KEY_STAR_MAX_COUNT, v); }

    public static double getStarMaskScale() { return prefs.getDouble(KEY_STAR_MASK_SCALE, StarDetectionSettings.DEFAULT_MASK_SCALE); }
    public static void setStarMaskScale(double v) { prefs.putDouble(KEY_STAR_MASK_SCALE, v); }

    public static double getStarMaskPadding() { return prefs.getDouble(KEY_STAR_MASK_PADDING, StarDetectionSettings.DEFAULT_MASK_PADDING); }
    public static void setStarMaskPadding(double v) { prefs.putDouble(KEY_STAR_MASK_PADDING, v); }

    public static double getDenoiseMaxRadius() { return prefs.getDouble(KEY_DENOISE_RADIUS, 4.0); }
    public static void setDenoiseMaxRadius(double v) { prefs.putDouble(KEY_DENOISE_RADIUS, v); }

    public static double getDenoiseEdgeThreshold() { return prefs.getDouble(KEY_DENOISE_EDGE, 0.15); }
    public static void setDenoiseEdgeThreshold(double v) { prefs.putDouble(KEY_DENOISE_EDGE, v); }

    public static int getWorkers() { return prefs.getInt(KEY_WORKERS, ExecutorSettings.DEFAULT_WORKERS); }
    public static void setWorkers(int v) { prefs.putInt(KEY_WORKERS, v); }

    public static long getPixelBudget() { return prefs.getLong(KEY_PIXEL_BUDGET, ExecutorSettings.DEFAULT_PIXEL_BUDGET); }
    public static void setPixelBudget(long v) { prefs.putLong(KEY_PIXEL_BUDGET, v); }

    public static int getQueueDepth() { return prefs.getInt(KEY_QUEUE_DEPTH, ExecutorSettings.DEFAULT_QUEUE_DEPTH); }
    public static void setQueueDepth(int v) { prefs.putInt(KEY_QUEUE_DEPTH, v); }

    public static long getRequestTimeoutMillis() { return prefs.getLong(KEY_TIMEOUT, ExecutorSettings.DEFAULT_TIMEOUT_MS); }
    public static void setRequestTimeoutMillis(long v) { prefs.putLong(KEY_TIMEOUT, v); }

    public static float getJpegQuality() { return prefs.getFloat(KEY_JPEG_QUALITY, 0.98f); }
    public static void setJpegQuality(float v) { prefs.putFloat(KEY_JPEG_QUALITY, v); }

    public static int getPreviewSize() { return prefs.getInt(KEY_PREVIEW_SIZE, 512); }
    public static void setPreviewSize(int v) { prefs.putInt(KEY_PREVIEW_SIZE, v); }

    public static StarDetectionSettings starDetectionSettings() {
        return new StarDetectionSettings(getStarThresholdSigma(), getStarMinArea(), getStarMaxArea(),
                getStarMinRoundness(), getStarMaxCount(), getStarMaskScale(), getStarMaskPadding());
    }

    public static ExecutorSettings executorSettings() {
        return new ExecutorSettings(getWorkers(), getPixelBudget(), getQueueDepth(), getRequestTimeoutMillis());
    }
}
