package com.astroslide.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only registry of the named presets, built once when the class loads.
 * Every tuned number is a named constant so presets stay data.
 */
public final class PresetCatalog {

    public static final String GENERAL = "general";
    public static final String DEEP_SKY = "deep_sky";
    public static final String MINERAL_MOON_SUBTLE = "mineral_moon_subtle";
    public static final String MINERAL_MOON = "mineral_moon";
    public static final String MINERAL_MOON_VIVID = "mineral_moon_vivid";
    public static final String MOON_HDR = "moon_hdr";
    public static final String STAR_REDUCTION = "star_reduction";

    public static final int LAB_A = 1;
    public static final int LAB_B = 2;
    public static final double WB_GRAY_WORLD = 0;
    public static final double WB_WHITE_PATCH = 1;

    // --- Stretch ---
    static final double STRETCH_LOW_PERCENTILE = 0.1;
    static final double STRETCH_HIGH_PERCENTILE = 99.9;

    // --- General ---
    static final double GENERAL_SATURATION = 1.15;
    static final double GENERAL_DENOISE = 0.2;

    // --- Deep sky ---
    static final int DEEP_SKY_BACKGROUND_GRID = 8;
    static final double DEEP_SKY_SATURATION = 1.4;
    static final double DEEP_SKY_SHARPEN_RADIUS = 2.0;
    static final double DEEP_SKY_SHARPEN_AMOUNT = 0.5;
    static final double DEEP_SKY_DENOISE = 0.6;

    // --- Mineral moon family ---
    static final int MINERAL_TILE_GRID = 8;
    static final double SUBTLE_CLIP_LIMIT = 1.5;
    static final double SUBTLE_LAB_GAIN = 1.25;
    static final double SUBTLE_SATURATION = 1.4;
    static final double SUBTLE_SATURATION_MIN = 1.2;
    static final double SUBTLE_SATURATION_MAX = 1.8;
    static final double SUBTLE_SUBJECT_THRESHOLD = 10.0 / 255.0;
    static final double SUBTLE_SHARPEN_AMOUNT = 0.2;
    static final double SUBTLE_DENOISE = 0.2;

    static final double MINERAL_CLIP_LIMIT = 2.0;
    static final double MINERAL_LAB_GAIN = 1.6;
    static final double MINERAL_SATURATION = 1.8;
    static final double MINERAL_SHARPEN_AMOUNT = 0.3;
    static final double MINERAL_DENOISE = 0.25;

    static final double VIVID_CLIP_LIMIT = 2.5;
    static final double VIVID_LAB_GAIN = 1.6;
    static final double VIVID_SATURATION = 3.5;
    static final double VIVID_GAMMA = 0.9;
    static final double VIVID_DENOISE = 0.3;

    static final double MINERAL_SHARPEN_RADIUS = 1.0;

    // --- Moon HDR ---
    /** Clip limit, tile grid and blend weight per CLAHE scale: global tone, regions, fine detail. */
    static final double[][] HDR_CLAHE_SCALES = {{3.0, 4, 0.25}, {2.5, 8, 0.35}, {2.0, 16, 0.40}};
    static final double HDR_SUBJECT_THRESHOLD = 15.0 / 255.0;
    static final double HDR_MASK_CLEANUP_RADIUS = 2.0;
    static final double HDR_SHADOW_LIFT = 0.4;
    static final double HDR_SHADOW_EXPONENT = 0.85;
    static final double HDR_HIGHLIGHT_COMPRESSION = 0.3;
    static final double HDR_HIGHLIGHT_KNEE = 0.75;
    static final double[][] HDR_SHARPEN_PASSES = {{1.0, 0.3}, {2.5, 0.2}, {5.0, 0.15}};
    static final double HDR_S_CURVE_BLEND = 0.3;
    static final double HDR_S_CURVE_STEEPNESS = 10.0;
    static final double HDR_DENOISE = 0.3;

    // --- Star reduction ---
    static final double STAR_REDUCTION_AMOUNT = 0.7;

    private static final Map<String, PresetDefinition> PRESETS = build();

    private PresetCatalog() {}

    public static Optional<PresetDefinition> find(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(PRESETS.get(id));
    }

    public static boolean contains(String id) {
        return id != null && PRESETS.containsKey(id);
    }

    public static List<PresetDefinition> all() {
        return List.copyOf(PRESETS.values());
    }

    public static List<String> ids() {
        return List.copyOf(PRESETS.keySet());
    }

    private static Map<String, PresetDefinition> build() {
        Map<String, PresetDefinition> map = new LinkedHashMap<>();

        register(map, new PresetDefinition(GENERAL, "General Auto",
                "Balanced enhancement for any astrophoto", "General astrophotography", List.of(
                        stretch(),
                        saturation(GENERAL_SATURATION),
                        denoise(GENERAL_DENOISE, true))));

        register(map, new PresetDefinition(DEEP_SKY, "Deep Sky Boost",
                "Optimized for nebulae, galaxies, and star clusters", "Deep space objects", List.of(
                        Stage.of(StageKind.WHITE_BALANCE).scaled("amount", 0, 1).fixed("method", WB_GRAY_WORLD).build(),
                        Stage.of(StageKind.BACKGROUND_EXTRACT).scaled("amount", 0, 1).fixed("gridSize", DEEP_SKY_BACKGROUND_GRID).build(),
                        stretch(),
                        saturation(DEEP_SKY_SATURATION),
                        sharpen(DEEP_SKY_SHARPEN_RADIUS, DEEP_SKY_SHARPEN_AMOUNT),
                        denoise(DEEP_SKY_DENOISE, true))));

        register(map, new PresetDefinition(MINERAL_MOON_SUBTLE, "Mineral Moon (Subtle)",
                "Conservative enhancement for scientific accuracy", "Scientific/realistic lunar imaging",
                new SubjectMask(SUBTLE_SUBJECT_THRESHOLD, 0), List.of(
                        clahe(SUBTLE_CLIP_LIMIT, MINERAL_TILE_GRID),
                        labGain(LAB_A, SUBTLE_LAB_GAIN),
                        labGain(LAB_B, SUBTLE_LAB_GAIN),
                        adaptiveSaturation(SUBTLE_SATURATION, SUBTLE_SATURATION_MIN, SUBTLE_SATURATION_MAX),
                        sharpen(MINERAL_SHARPEN_RADIUS, SUBTLE_SHARPEN_AMOUNT),
                        denoise(SUBTLE_DENOISE, false),
                        blackBackground())));

        register(map, new PresetDefinition(MINERAL_MOON, "Mineral Moon",
                "Reveals lunar mineral colours with a balanced boost", "Colourful lunar surface imaging", List.of(
                        clahe(MINERAL_CLIP_LIMIT, MINERAL_TILE_GRID),
                        labGain(LAB_A, MINERAL_LAB_GAIN),
                        labGain(LAB_B, MINERAL_LAB_GAIN),
                        saturation(MINERAL_SATURATION),
                        sharpen(MINERAL_SHARPEN_RADIUS, MINERAL_SHARPEN_AMOUNT),
                        denoise(MINERAL_DENOISE, false))));

        register(map, new PresetDefinition(MINERAL_MOON_VIVID, "Mineral Moon (Vivid)",
                "Aggressive colour separation of lunar maria", "Artistic lunar imaging", List.of(
                        clahe(VIVID_CLIP_LIMIT, MINERAL_TILE_GRID),
                        labGain(LAB_A, VIVID_LAB_GAIN),
                        labGain(LAB_B, VIVID_LAB_GAIN),
                        saturation(VIVID_SATURATION),
                        Stage.of(StageKind.GAMMA_CURVE).scaled("gamma", 1, VIVID_GAMMA).build(),
                        sharpen(MINERAL_SHARPEN_RADIUS, MINERAL_SHARPEN_AMOUNT),
                        denoise(VIVID_DENOISE, false))));

        register(map, new PresetDefinition(MOON_HDR, "Moon HDR",
                "HDR tone mapping for lunar surface detail", "Seestar and smart telescope moon captures",
                new SubjectMask(HDR_SUBJECT_THRESHOLD, HDR_MASK_CLEANUP_RADIUS), List.of(
                        multiScaleClahe(HDR_CLAHE_SCALES),
                        Stage.of(StageKind.SHADOW_LIFT).scaled("amount", 0, HDR_SHADOW_LIFT)
                                .fixed("exponent", HDR_SHADOW_EXPONENT).build(),
                        Stage.of(StageKind.HIGHLIGHT_COMPRESS).scaled("amount", 0, HDR_HIGHLIGHT_COMPRESSION)
                                .fixed("knee", HDR_HIGHLIGHT_KNEE).build(),
                        sharpen(HDR_SHARPEN_PASSES[0][0], HDR_SHARPEN_PASSES[0][1]),
                        sharpen(HDR_SHARPEN_PASSES[1][0], HDR_SHARPEN_PASSES[1][1]),
                        sharpen(HDR_SHARPEN_PASSES[2][0], HDR_SHARPEN_PASSES[2][1]),
                        Stage.of(StageKind.S_CURVE).scaled("amount", 0, HDR_S_CURVE_BLEND)
                                .fixed("steepness", HDR_S_CURVE_STEEPNESS).build(),
                        denoise(HDR_DENOISE, false),
                        blackBackground())));

        register(map, new PresetDefinition(STAR_REDUCTION, "Star Reduction",
                "Stretches faint structure and shrinks foreground stars", "Nebulae behind dense star fields", List.of(
                        stretch(),
                        Stage.of(StageKind.STAR_REDUCE).scaled("amount", 0, STAR_REDUCTION_AMOUNT).build())));

        return Collections.unmodifiableMap(map);
    }

    private static void register(Map<String, PresetDefinition> map, PresetDefinition preset) {
        map.put(preset.id, preset);
    }

    private static Stage stretch() {
        return Stage.of(StageKind.HISTOGRAM_STRETCH).scaled("amount", 0, 1)
                .fixed("lowPercentile", STRETCH_LOW_PERCENTILE)
                .fixed("highPercentile", STRETCH_HIGH_PERCENTILE).build();
    }

    private static Stage saturation(double gain) {
        return Stage.of(StageKind.HSV_SATURATION_SCALE).scaled("gain", 1, gain).fixed("adaptive", 0).build();
    }

    /** Gain adjusted to the subject's colour statistics, kept between the bounds; all three start at 1. */
    private static Stage adaptiveSaturation(double gain, double minGain, double maxGain) {
        return Stage.of(StageKind.HSV_SATURATION_SCALE).scaled("gain", 1, gain).fixed("adaptive", 1)
                .scaled("minGain", 1, minGain).scaled("maxGain", 1, maxGain).build();
    }

    private static Stage labGain(int channel, double gain) {
        return Stage.of(StageKind.LAB_CHANNEL_SCALE).scaled("gain", 1, gain).fixed("channel", channel).build();
    }

    private static Stage clahe(double clipLimit, int tileGrid) {
        return Stage.of(StageKind.CLAHE_CONTRAST).scaled("amount", 0, 1)
                .fixed("clipLimit", clipLimit).fixed("tileGridSize", tileGrid).build();
    }

    /** One indexed clip/grid/weight triple per scale: {@code clipLimit.0}, {@code tileGridSize.0}, {@code weight.0}... */
    private static Stage multiScaleClahe(double[][] scales) {
        Stage.Builder builder = Stage.of(StageKind.MULTI_SCALE_CLAHE).scaled("amount", 0, 1);
        for (int i = 0; i < scales.length; i++) {
            builder.fixed("clipLimit." + i, scales[i][0])
                    .fixed("tileGridSize." + i, scales[i][1])
                    .fixed("weight." + i, scales[i][2]);
        }
        return builder.build();
    }

    private static Stage blackBackground() {
        return Stage.of(StageKind.BLACK_BACKGROUND).scaled("amount", 0, 1).build();
    }

    private static Stage sharpen(double radius, double amount) {
        return Stage.of(StageKind.UNSHARP_MASK).scaled("amount", 0, amount).fixed("radius", radius).build();
    }

    private static Stage denoise(double strength, boolean adaptive) {
        return Stage.of(StageKind.DENOISE).scaled("strength", 0, strength).fixed("adaptive", adaptive ? 1 : 0).build();
    }
}
