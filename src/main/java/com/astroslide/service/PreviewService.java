package com.astroslide.service;

import com.astroslide.model.EnhancementException;
import com.astroslide.model.PipelineRun;
import com.astroslide.model.PixelBuffer;

/**
 * Fast feedback thumbnails: area-averaged downsampling followed by the full preset at
 * intensity 1. Operators with spatial radii (sharpening, star detection) act on the reduced
 * scale, so a preview resembles but does not equal a downscaled full enhancement.
 */
public class PreviewService {

    private final PresetEngine engine;

    public PreviewService(PresetEngine engine) {
        this.engine = engine;
    }

    public PixelBuffer generatePreview(PixelBuffer buffer, String presetName, int targetSize) throws EnhancementException {
        return generatePreview(buffer, presetName, targetSize, new PipelineRun());
    }

    public PixelBuffer generatePreview(PixelBuffer buffer, String presetName, int targetSize, PipelineRun run)
            throws EnhancementException {
        if (targetSize <= 0) {
            throw run.fail(EnhancementException.invalid("Preview size must be positive, got " + targetSize));
        }
        try {
            engine.validate(buffer, presetName, 1.0);
        } catch (EnhancementException e) {
            throw run.fail(e);
        }
        return engine.execute(downsample(buffer, targetSize), presetName, 1.0, run);
    }

    /**
     * Shrinks the buffer to fit inside {@code targetSize x targetSize}, keeping the aspect
     * ratio. Each output sample is the exact area-weighted mean of the source pixels it
     * covers. Buffers that already fit are copied.
     */
    public PixelBuffer downsample(PixelBuffer buffer, int targetSize) {
        int w = buffer.getWidth(), h = buffer.getHeight();
        int longest = Math.max(w, h);
        if (longest <= targetSize) return buffer.copy();

        double scale = (double) targetSize / longest;
        int dw = Math.max(1, Math.min(targetSize, (int) Math.round(w * scale)));
        int dh = Math.max(1, Math.min(targetSize, (int) Math.round(h * scale)));

        AxisWeights xw = new AxisWeights(w, dw);
        AxisWeights yw = new AxisWeights(h, dh);
        PixelBuffer out = PixelBuffer.create(dw, dh, buffer.getChannels());
        float[] rows = new float[dw * h];
        for (int c = 0; c < buffer.getChannels(); c++) {
            float[] src = buffer.plane(c);
            for (int y = 0; y < h; y++) {
                for (int x = 0; x < dw; x++) {
                    double sum = 0;
                    for (int k = 0; k < xw.count[x]; k++) sum += xw.weight[x][k] * src[y * w + xw.first[x] + k];
                    rows[y * dw + x] = (float) sum;
                }
            }
            float[] dst = out.plane(c);
            for (int y = 0; y < dh; y++) {
                for (int x = 0; x < dw; x++) {
                    double sum = 0;
                    for (int k = 0; k < yw.count[y]; k++) sum += yw.weight[y][k] * rows[(yw.first[y] + k) * dw + x];
                    dst[y * dw + x] = (float) sum;
                }
            }
        }
        return out.clamp();
    }

    /** Coverage of each destination cell over source pixels along one axis. */
    private static final class AxisWeights {
        final int[] first;
        final int[] count;
        final double[][] weight;

        AxisWeights(int srcLength, int dstLength) {
            first = new int[dstLength];
            count = new int[dstLength];
            weight = new double[dstLength][];
            double ratio = (double) srcLength / dstLength;
            for (int d = 0; d < dstLength; d++) {
                double start = d * ratio;
                double end = Math.min(srcLength, (d + 1) * ratio);
                int s0 = (int) Math.floor(start);
                int s1 = Math.min(srcLength, (int) Math.ceil(end));
                first[d] = s0;
                count[d] = s1 - s0;
                weight[d] = new double[count[d]];
                for (int s = s0; s < s1; s++) {
                    double overlap = Math.min(end, s + 1) - Math.max(start, s);
                    weight[d][s - s0] = overlap / (end - start);
                }
            }
        }
    }
}
