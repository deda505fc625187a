package com.astroslide.service;

import com.astroslide.model.AppConfig;
import com.astroslide.model.EnhancementException;
import com.astroslide.model.ErrorKind;
import com.astroslide.model.ExecutorSettings;
import com.astroslide.model.HistogramResult;
import com.astroslide.model.PixelBuffer;
import com.astroslide.model.PresetCatalog;
import com.astroslide.model.PresetDefinition;
import com.astroslide.model.StarDetectionSettings;

import java.util.List;

/**
 * Entry point for callers holding decoded pixels. Enhancement, preview and star reduction
 * run on the bounded worker pool; histograms are computed on the calling thread.
 */
public class EnhancementService implements AutoCloseable {

    private final PresetEngine engine;
    private final PreviewService previews;
    private final StarReductionService stars;
    private final HistogramService histograms = new HistogramService();
    private final EnhancementExecutor executor;

    public EnhancementService() {
        this(AppConfig.starDetectionSettings(), AppConfig.executorSettings());
    }

    public EnhancementService(StarDetectionSettings starSettings, ExecutorSettings executorSettings) {
        ColorSpaceService colors = new ColorSpaceService();
        this.stars = new StarReductionService(new StarDetectionService(colors, starSettings));
        this.engine = new PresetEngine(colors, new TonalService(colors), new FrequencyService(colors), stars,
                new SubjectMaskService(colors));
        this.previews = new PreviewService(engine);
        this.executor = new EnhancementExecutor(executorSettings);
    }

    public PixelBuffer enhance(PixelBuffer buffer, String presetName, double intensity) throws EnhancementException {
        engine.validate(buffer, presetName, intensity);
        return executor.submit(buffer.getPixelCount(), run -> engine.execute(buffer, presetName, intensity, run));
    }

    public HistogramResult computeHistogram(PixelBuffer buffer) throws EnhancementException {
        if (buffer == null) throw EnhancementException.invalid("No image supplied");
        return histograms.computeHistogram(buffer);
    }

    public PixelBuffer generatePreview(PixelBuffer buffer, String presetName, int targetSize) throws EnhancementException {
        if (targetSize <= 0) throw EnhancementException.invalid("Preview size must be positive, got " + targetSize);
        engine.validate(buffer, presetName, 1.0);
        return executor.submit(buffer.getPixelCount(),
                run -> previews.generatePreview(buffer, presetName, targetSize, run));
    }

    public PixelBuffer reduceStars(PixelBuffer buffer, double reductionAmount) throws EnhancementException {
        if (buffer == null) throw EnhancementException.invalid("No image supplied");
        if (!(reductionAmount >= 0 && reductionAmount <= 1)) {
            throw EnhancementException.invalid("Reduction amount must be within [0,1], got " + reductionAmount);
        }
        return executor.submit(buffer.getPixelCount(), run -> {
            try {
                return stars.reduceStars(buffer, reductionAmount);
            } catch (RuntimeException e) {
                throw new EnhancementException(ErrorKind.INTERNAL, "Star reduction failed: " + e, e);
            }
        });
    }

    public List<PresetDefinition> presets() {
        return PresetCatalog.all();
    }

    EnhancementExecutor getExecutor() {
        return executor;
    }

    @Override
    public void close() {
        executor.close();
    }
}
