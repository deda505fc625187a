package com.astroslide.service;

import com.astroslide.model.PixelBuffer;
import com.astroslide.model.SubjectMask;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SubjectMaskServiceTest {

    private final SubjectMaskService masks = new SubjectMaskService(new ColorSpaceService());

    private static PixelBuffer disk(int size, int radius, float level) {
        PixelBuffer frame = PixelBuffer.filled(size, size, PixelBuffer.GRAY, 0.01f);
        int c = size / 2;
        for (int y = 0; y < size; y++) {
            for (int x = 0; x < size; x++) {
                if ((x - c) * (x - c) + (y - c) * (y - c) <= radius * radius) frame.set(x, y, 0, level);
            }
        }
        return frame;
    }

    @Test
    void thresholdSeparatesDiskFromSky() {
        PixelBuffer frame = disk(40, 10, 0.5f);
        boolean[] inside = masks.compute(frame, new SubjectMask(10.0 / 255.0, 0));

        assertTrue(inside[20 * 40 + 20]);
        assertTrue(inside[20 * 40 + 30]);
        assertFalse(inside[20 * 40 + 31]);
        assertFalse(inside[0]);
    }

    @Test
    void colourFramesUseLuminance() {
        PixelBuffer frame = PixelBuffer.create(4, 1, PixelBuffer.RGB);
        frame.set(0, 0, 0, 0.1f);  // 0.299 * 0.1 = 0.030
        frame.set(1, 0, 1, 0.1f);  // 0.587 * 0.1 = 0.059
        boolean[] inside = masks.compute(frame, new SubjectMask(10.0 / 255.0, 0));
        assertFalse(inside[0]);
        assertTrue(inside[1]);
    }

    @Test
    @DisplayName("Cleanup drops isolated specks and fills pits inside the disk")
    void cleanupRemovesSpecksAndFillsPits() {
        PixelBuffer frame = disk(60, 15, 0.6f);
        frame.set(5, 5, 0, 1f);
        frame.set(30, 30, 0, 0f);

        boolean[] raw = masks.compute(frame, new SubjectMask(15.0 / 255.0, 0));
        assertTrue(raw[5 * 60 + 5]);
        assertFalse(raw[30 * 60 + 30]);

        boolean[] cleaned = masks.compute(frame, new SubjectMask(15.0 / 255.0, 2));
        assertFalse(cleaned[5 * 60 + 5]);
        assertTrue(cleaned[30 * 60 + 30]);
        assertTrue(cleaned[30 * 60 + 40]);
        assertFalse(cleaned[30 * 60 + 50]);
    }

    @Test
    void rejectsInvalidMask() {
        assertThrows(IllegalArgumentException.class, () -> new SubjectMask(-0.1, 0));
        assertThrows(IllegalArgumentException.class, () -> new SubjectMask(0.1, -1));
    }
}
