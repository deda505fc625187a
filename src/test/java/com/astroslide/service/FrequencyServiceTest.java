package com.astroslide.service;

import com.astroslide.TestImages;
import com.astroslide.model.PixelBuffer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FrequencyServiceTest {

    private final FrequencyService frequency = new FrequencyService(new ColorSpaceService(), 4.0, 0.15);

    @Nested
    class Denoise {

        @Test
        void zeroStrengthReturnsEqualCopy() {
            PixelBuffer input = TestImages.random(16, 16, PixelBuffer.RGB, 7);
            PixelBuffer out = frequency.denoise(input, 0);
            assertNotSame(input, out);
            assertTrue(out.contentEquals(input));
        }

        @Test
        void reducesNoiseOnFlatSky() {
            PixelBuffer sky = TestImages.noisy(64, 64, PixelBuffer.GRAY, 0.5f, 0.1f, 8);
            PixelBuffer out = frequency.denoise(sky, 1.0);
            assertTrue(TestImages.stdDev(out.plane(0)) < 0.7 * TestImages.stdDev(sky.plane(0)));
        }

        @Test
        @DisplayName("Strong edges survive smoothing")
        void preservesStrongEdges() {
            PixelBuffer edge = TestImages.step(64, 16, 32, 0f, 1f);
            PixelBuffer out = frequency.denoise(edge, 1.0);
            float contrast = out.get(32, 8, 0) - out.get(31, 8, 0);
            assertTrue(contrast > 0.9f, "edge contrast " + contrast);
        }

        @Test
        void isDeterministic() {
            PixelBuffer input = TestImages.noisy(32, 32, PixelBuffer.RGB, 0.4f, 0.1f, 9);
            assertTrue(frequency.denoise(input, 0.6).contentEquals(frequency.denoise(input, 0.6)));
        }

        @Test
        void rejectsNegativeStrength() {
            PixelBuffer input = PixelBuffer.create(4, 4, PixelBuffer.GRAY);
            assertThrows(IllegalArgumentException.class, () -> frequency.denoise(input, -0.1));
        }
    }

    @Nested
    class NoiseEstimate {

        @Test
        void flatImageHasNoNoise() {
            assertEquals(0.0, frequency.estimateNoiseLevel(PixelBuffer.filled(32, 32, PixelBuffer.RGB, 0.3f)), 1e-9);
        }

        @Test
        void noisyImageScoresHigher() {
            double quiet = frequency.estimateNoiseLevel(TestImages.noisy(32, 32, PixelBuffer.GRAY, 0.5f, 0.01f, 10));
            double loud = frequency.estimateNoiseLevel(TestImages.noisy(32, 32, PixelBuffer.GRAY, 0.5f, 0.2f, 10));
            assertTrue(loud > quiet);
            assertTrue(loud <= 1.0);
        }

        @Test
        void adaptiveDenoiseWithZeroBaseIsIdentity() {
            PixelBuffer input = TestImages.random(8, 8, PixelBuffer.GRAY, 11);
            assertTrue(frequency.adaptiveDenoise(input, 0).contentEquals(input));
        }
    }

    @Nested
    class UnsharpMask {

        @Test
        void overshootsAcrossEdges() {
            PixelBuffer edge = TestImages.step(64, 16, 32, 0.3f, 0.6f);
            PixelBuffer out = frequency.unsharpMask(edge, 2.0, 0.5);
            assertTrue(out.get(31, 8, 0) < 0.3f);
            assertTrue(out.get(32, 8, 0) > 0.6f);
            assertEquals(0.3f, out.get(2, 8, 0), 1e-4);
        }

        @Test
        void flatImageIsUnchanged() {
            PixelBuffer flat = PixelBuffer.filled(16, 16, PixelBuffer.RGB, 0.4f);
            assertTrue(frequency.unsharpMask(flat, 1.0, 0.3).maxDifference(flat) < 1e-5);
        }

        @Test
        void zeroAmountAndBadRadius() {
            PixelBuffer input = TestImages.random(8, 8, PixelBuffer.GRAY, 12);
            assertTrue(frequency.unsharpMask(input, 1.0, 0).contentEquals(input));
            assertThrows(IllegalArgumentException.class, () -> frequency.unsharpMask(input, 0, 0.3));
        }
    }
}
