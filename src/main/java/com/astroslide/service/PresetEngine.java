package com.astroslide.service;

import com.astroslide.model.EnhancementException;
import com.astroslide.model.ErrorKind;
import com.astroslide.model.PipelineRun;
import com.astroslide.model.PixelBuffer;
import com.astroslide.model.PresetCatalog;
import com.astroslide.model.PresetDefinition;
import com.astroslide.model.Stage;
import com.astroslide.model.StageKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Runs a named preset over a buffer. Stages execute in their declared order with parameters
 * interpolated by the intensity scalar; any stage failure fails the whole run and no image
 * is returned. The caller's buffer is never modified. Presets with a subject mask only
 * change pixels inside it.
 */
public class PresetEngine {

    private static final Logger log = LoggerFactory.getLogger(PresetEngine.class);

    private final ColorSpaceService colors;
    private final TonalService tonal;
    private final FrequencyService frequency;
    private final StarReductionService stars;
    private final SubjectMaskService masks;

    public PresetEngine(ColorSpaceService colors, TonalService tonal, FrequencyService frequency,
                        StarReductionService stars) {
        this(colors, tonal, frequency, stars, new SubjectMaskService(colors));
    }

    public PresetEngine(ColorSpaceService colors, TonalService tonal, FrequencyService frequency,
                        StarReductionService stars, SubjectMaskService masks) {
        this.colors = colors;
        this.tonal = tonal;
        this.frequency = frequency;
        this.stars = stars;
        this.masks = masks;
    }

    public PixelBuffer enhance(PixelBuffer buffer, String presetName, double intensity) throws EnhancementException {
        return execute(buffer, presetName, intensity, new PipelineRun());
    }

    public PixelBuffer execute(PixelBuffer buffer, String presetName, double intensity, PipelineRun run)
            throws EnhancementException {
        run.validating();
        PresetDefinition preset;
        try {
            preset = validate(buffer, presetName, intensity);
        } catch (EnhancementException e) {
            throw run.fail(e);
        }

        List<Stage> stages = preset.getStages();
        PixelBuffer current = buffer.copy();
        long start = System.currentTimeMillis();
        boolean[] subject = intensity > 0
                ? preset.getSubjectMask().map(mask -> masks.compute(buffer, mask)).orElse(null)
                : null;
        for (int i = 0; i < stages.size(); i++) {
            if (run.isCancelled()) {
                throw run.fail(new EnhancementException(ErrorKind.CANCELLED,
                        "Preset " + preset.id + " cancelled before stage " + (i + 1)));
            }
            run.executing(i, stages.size());
            Stage stage = stages.get(i);
            if (stage.isIdentityAt(intensity)) continue;

            try {
                current = applyStage(stage, current, intensity, subject);
            } catch (EnhancementException e) {
                log.warn("Preset {} failed at stage {}/{} ({}): {}", preset.id, i + 1, stages.size(), stage.getKind(), e.getMessage());
                throw run.fail(e);
            } catch (IllegalArgumentException e) {
                throw run.fail(new EnhancementException(ErrorKind.INVALID_PARAMETER,
                        "Stage " + stage.getKind() + " rejected " + stage.effectiveParameters(intensity)
                                + ": " + e.getMessage(), e));
            } catch (RuntimeException e) {
                log.error("Preset {} crashed at stage {}", preset.id, stage.getKind(), e);
                throw run.fail(new EnhancementException(ErrorKind.INTERNAL,
                        "Stage " + stage.getKind() + " failed: " + e, e));
            }
        }
        run.done();
        log.debug("Preset {} at intensity {} on {} done in {} ms", preset.id, intensity, buffer,
                System.currentTimeMillis() - start);
        return current;
    }

    PresetDefinition validate(PixelBuffer buffer, String presetName, double intensity) throws EnhancementException {
        if (buffer == null) throw EnhancementException.invalid("No image supplied");
        PresetDefinition preset = PresetCatalog.find(presetName).orElseThrow(() -> EnhancementException.invalid(
                "Unknown preset '" + presetName + "'. Available: " + PresetCatalog.ids()));
        if (!(intensity >= 0 && intensity <= 1)) {
            throw EnhancementException.invalid("Intensity must be within [0,1], got " + intensity);
        }
        return preset;
    }

    /**
     * One stage at the given intensity. With a subject mask, pixels outside it keep their
     * input values, except for the background stage which darkens exactly those pixels.
     */
    PixelBuffer applyStage(Stage stage, PixelBuffer in, double intensity, boolean[] subject) throws EnhancementException {
        Map<String, Double> params = stage.effectiveParameters(intensity);
        if (stage.getKind() == StageKind.BLACK_BACKGROUND) {
            return subject == null ? in.copy() : darkenOutside(in, subject, params.get("amount"));
        }
        PixelBuffer out = apply(stage, in, params);
        return subject == null ? out : keepOutside(in, out, subject);
    }

    private PixelBuffer apply(Stage stage, PixelBuffer in, Map<String, Double> p) throws EnhancementException {
        switch (stage.getKind()) {
            case WHITE_BALANCE:
                TonalService.WhiteBalanceMethod method = p.get("method") == PresetCatalog.WB_WHITE_PATCH
                        ? TonalService.WhiteBalanceMethod.WHITE_PATCH
                        : TonalService.WhiteBalanceMethod.GRAY_WORLD;
                return blend(in, tonal.whiteBalance(in, method), p.get("amount"));
            case BACKGROUND_EXTRACT:
                return blend(in, tonal.extractBackground(in, p.get("gridSize").intValue()), p.get("amount"));
            case HISTOGRAM_STRETCH:
                return blend(in, tonal.histogramStretch(in, p.get("lowPercentile"), p.get("highPercentile")), p.get("amount"));
            case GAMMA_CURVE:
                return tonal.gammaCurve(in, p.get("gamma"));
            case LAB_CHANNEL_SCALE:
                return colors.labChannelScale(in, p.get("channel").intValue(), p.get("gain"));
            case HSV_SATURATION_SCALE:
                double gain = p.get("gain");
                if (p.getOrDefault("adaptive", 0.0) != 0) {
                    gain = colors.adaptiveSaturationGain(in, gain, p.get("minGain"), p.get("maxGain"));
                }
                return colors.saturationScale(in, gain);
            case CLAHE_CONTRAST:
                return blend(in, tonal.adaptiveContrast(in, p.get("clipLimit"), p.get("tileGridSize").intValue()), p.get("amount"));
            case MULTI_SCALE_CLAHE:
                double[] grids = indexed(p, "tileGridSize");
                int[] tileGridSizes = new int[grids.length];
                for (int i = 0; i < grids.length; i++) tileGridSizes[i] = (int) grids[i];
                return blend(in, tonal.multiScaleContrast(in, indexed(p, "clipLimit"), tileGridSizes,
                        indexed(p, "weight")), p.get("amount"));
            case SHADOW_LIFT:
                return tonal.shadowLift(in, p.get("amount"), p.get("exponent"));
            case HIGHLIGHT_COMPRESS:
                return tonal.highlightCompress(in, p.get("amount"), p.get("knee"));
            case S_CURVE:
                return tonal.sCurve(in, p.get("amount"), p.get("steepness"));
            case UNSHARP_MASK:
                return frequency.unsharpMask(in, p.get("radius"), p.get("amount"));
            case DENOISE:
                return p.getOrDefault("adaptive", 0.0) != 0
                        ? frequency.adaptiveDenoise(in, p.get("strength"))
                        : frequency.denoise(in, p.get("strength"));
            case STAR_REDUCE:
                return stars.reduceStars(in, p.get("amount"));
            default:
                throw new IllegalArgumentException("Unsupported stage " + stage.getKind());
        }
    }

    /** Values of {@code name.0}, {@code name.1}, ... up to the first missing index. */
    private static double[] indexed(Map<String, Double> p, String name) {
        int n = 0;
        while (p.containsKey(name + "." + n)) n++;
        double[] values = new double[n];
        for (int i = 0; i < n; i++) values[i] = p.get(name + "." + i);
        return values;
    }

    private static PixelBuffer keepOutside(PixelBuffer before, PixelBuffer after, boolean[] subject) {
        for (int c = 0; c < after.getChannels(); c++) {
            float[] o = after.plane(c), b = before.plane(c);
            for (int i = 0; i < o.length; i++) {
                if (!subject[i]) o[i] = b[i];
            }
        }
        return after;
    }

    private static PixelBuffer darkenOutside(PixelBuffer in, boolean[] subject, double amount) {
        PixelBuffer out = in.copy();
        float keep = (float) (1 - amount);
        for (int c = 0; c < out.getChannels(); c++) {
            float[] o = out.plane(c);
            for (int i = 0; i < o.length; i++) {
                if (!subject[i]) o[i] *= keep;
            }
        }
        return out;
    }

    /** {@code original + amount * (processed - original)}; amount 1 yields {@code processed} itself. */
    static PixelBuffer blend(PixelBuffer original, PixelBuffer processed, double amount) {
        if (amount >= 1) return processed;
        PixelBuffer out = original.copy();
        for (int c = 0; c < out.getChannels(); c++) {
            float[] o = out.plane(c), q = processed.plane(c);
            for (int i = 0; i < o.length; i++) o[i] = (float) (o[i] + amount * (q[i] - o[i]));
        }
        return out.clamp();
    }
}
