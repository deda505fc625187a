package com.astroslide.service;

import com.astroslide.model.PixelBuffer;
import com.astroslide.model.SubjectMask;
import ij.plugin.filter.RankFilters;
import ij.process.ByteProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Separates a bright subject from black sky: luminance above the mask threshold, optionally
 * cleaned by a morphological close (fills pits in the disk) followed by an open (drops
 * specks of hot pixels and stars).
 */
public class SubjectMaskService {

    private static final Logger log = LoggerFactory.getLogger(SubjectMaskService.class);

    private static final int ON = 255;

    private final ColorSpaceService colors;

    public SubjectMaskService(ColorSpaceService colors) {
        this.colors = colors;
    }

    /** One flag per pixel, row-major; {@code true} inside the subject. */
    public boolean[] compute(PixelBuffer buffer, SubjectMask mask) {
        int width = buffer.getWidth();
        int height = buffer.getHeight();
        float[] lum = colors.luminance(buffer);

        ByteProcessor bp = new ByteProcessor(width, height);
        byte[] raw = (byte[]) bp.getPixels();
        for (int i = 0; i < lum.length; i++) {
            if (lum[i] > mask.threshold) raw[i] = (byte) ON;
        }

        if (mask.cleanupRadius > 0) {
            RankFilters rank = new RankFilters();
            // close
            rank.rank(bp, mask.cleanupRadius, RankFilters.MAX);
            rank.rank(bp, mask.cleanupRadius, RankFilters.MIN);
            // open
            rank.rank(bp, mask.cleanupRadius, RankFilters.MIN);
            rank.rank(bp, mask.cleanupRadius, RankFilters.MAX);
        }

        byte[] pixels = (byte[]) bp.getPixels();
        boolean[] inside = new boolean[lum.length];
        int count = 0;
        for (int i = 0; i < inside.length; i++) {
            if ((pixels[i] & 0xFF) == ON) {
                inside[i] = true;
                count++;
            }
        }
        log.debug("{} covers {} of {} pixels", mask, count, inside.length);
        return inside;
    }
}
