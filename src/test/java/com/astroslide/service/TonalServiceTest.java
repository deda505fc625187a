package com.astroslide.service;

import com.astroslide.TestImages;
import com.astroslide.model.EnhancementException;
import com.astroslide.model.ErrorKind;
import com.astroslide.model.PixelBuffer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class TonalServiceTest {

    private final TonalService tonal = new TonalService(new ColorSpaceService());

    @Nested
    class Stretch {

        @Test
        @DisplayName("Full-range stretch is idempotent")
        void fullRangeStretchIsIdempotent() {
            PixelBuffer input = TestImages.noisy(32, 32, PixelBuffer.RGB, 0.4f, 0.2f, 5);
            PixelBuffer once = tonal.histogramStretch(input, 0, 100);
            PixelBuffer twice = tonal.histogramStretch(once, 0, 100);
            assertTrue(twice.contentEquals(once));
        }

        @Test
        void stretchSpansUnitRange() {
            PixelBuffer input = TestImages.ramp(64, 4, PixelBuffer.GRAY, 0.3f, 0.6f);
            PixelBuffer out = tonal.histogramStretch(input, 0, 100);
            assertEquals(0f, TestImages.min(out.plane(0)), 1e-6);
            assertEquals(1f, TestImages.max(out.plane(0)), 1e-6);
        }

        @Test
        void flatChannelIsLeftAlone() {
            PixelBuffer flat = PixelBuffer.filled(8, 8, PixelBuffer.RGB, 0.3f);
            assertTrue(tonal.histogramStretch(flat, 0.1, 99.9).contentEquals(flat));
        }

        @Test
        void rejectsInvertedPercentiles() {
            PixelBuffer flat = PixelBuffer.filled(2, 2, PixelBuffer.GRAY, 0.3f);
            assertThrows(IllegalArgumentException.class, () -> tonal.histogramStretch(flat, 60, 40));
            assertThrows(IllegalArgumentException.class, () -> tonal.histogramStretch(flat, -1, 40));
        }
    }

    @Test
    void gammaCurve() {
        PixelBuffer input = PixelBuffer.filled(2, 2, PixelBuffer.GRAY, 0.25f);
        assertTrue(tonal.gammaCurve(input, 1.0).contentEquals(input));
        assertEquals(0.5f, tonal.gammaCurve(input, 0.5).get(1, 1, 0), 1e-6);
        assertThrows(IllegalArgumentException.class, () -> tonal.gammaCurve(input, 0));
    }

    @Nested
    class AdaptiveContrast {

        @Test
        @DisplayName("Flat input maps through identity tiles")
        void flatInputUnchanged() {
            PixelBuffer gray = PixelBuffer.filled(32, 32, PixelBuffer.GRAY, 0.4f);
            assertTrue(tonal.adaptiveContrast(gray, 2.0, 8).maxDifference(gray) < 1e-5);

            PixelBuffer rgb = PixelBuffer.filled(32, 32, PixelBuffer.RGB, 0.4f);
            assertTrue(tonal.adaptiveContrast(rgb, 2.0, 8).maxDifference(rgb) < 1e-3);
        }

        @Test
        void widensLowContrastRange() {
            PixelBuffer input = TestImages.ramp(64, 64, PixelBuffer.GRAY, 0.4f, 0.5f);
            PixelBuffer out = tonal.adaptiveContrast(input, 2.0, 2);
            float inRange = TestImages.max(input.plane(0)) - TestImages.min(input.plane(0));
            float outRange = TestImages.max(out.plane(0)) - TestImages.min(out.plane(0));
            assertTrue(outRange > inRange, inRange + " -> " + outRange);
        }

        @Test
        void gridLargerThanImageIsTolerated() {
            PixelBuffer tiny = TestImages.random(3, 3, PixelBuffer.RGB, 6);
            PixelBuffer out = tonal.adaptiveContrast(tiny, 2.5, 8);
            assertTrue(out.sameShape(tiny));
        }

        @Test
        void rejectsBadParameters() {
            PixelBuffer gray = PixelBuffer.filled(4, 4, PixelBuffer.GRAY, 0.4f);
            assertThrows(IllegalArgumentException.class, () -> tonal.adaptiveContrast(gray, 0, 8));
            assertThrows(IllegalArgumentException.class, () -> tonal.adaptiveContrast(gray, 2, 0));
        }

        @Test
        @DisplayName("Multi-scale CLAHE is the weighted blend of the single-scale passes")
        void multiScaleBlendsSingleScales() {
            PixelBuffer input = TestImages.noisy(64, 48, PixelBuffer.GRAY, 0.45f, 0.1f, 12);
            double[] clips = {3.0, 2.5, 2.0};
            int[] grids = {4, 8, 16};
            double[] weights = {0.25, 0.35, 0.40};

            PixelBuffer out = tonal.multiScaleContrast(input, clips, grids, weights);

            float[][] passes = new float[3][];
            for (int s = 0; s < 3; s++) passes[s] = tonal.adaptiveContrast(input, clips[s], grids[s]).plane(0);
            float[] o = out.plane(0);
            for (int i = 0; i < o.length; i++) {
                double expected = weights[0] * passes[0][i] + weights[1] * passes[1][i] + weights[2] * passes[2][i];
                assertEquals(expected, o[i], 1e-5, "pixel " + i);
            }
        }

        @Test
        void singleScaleWithUnitWeightMatchesPlainClahe() {
            PixelBuffer input = TestImages.random(40, 40, PixelBuffer.RGB, 13);
            PixelBuffer multi = tonal.multiScaleContrast(input, new double[] {2.0}, new int[] {8}, new double[] {1.0});
            assertTrue(multi.maxDifference(tonal.adaptiveContrast(input, 2.0, 8)) < 1e-5);
        }

        @Test
        void multiScaleRejectsMismatchedScales() {
            PixelBuffer gray = PixelBuffer.filled(8, 8, PixelBuffer.GRAY, 0.4f);
            assertThrows(IllegalArgumentException.class,
                    () -> tonal.multiScaleContrast(gray, new double[] {2.0, 3.0}, new int[] {8}, new double[] {1.0}));
            assertThrows(IllegalArgumentException.class,
                    () -> tonal.multiScaleContrast(gray, new double[0], new int[0], new double[0]));
            assertThrows(IllegalArgumentException.class,
                    () -> tonal.multiScaleContrast(gray, new double[] {2.0}, new int[] {0}, new double[] {1.0}));
        }
    }

    @Nested
    class WhiteBalance {

        private PixelBuffer tinted(float r, float g, float b) {
            PixelBuffer buffer = PixelBuffer.create(4, 4, PixelBuffer.RGB);
            Arrays.fill(buffer.plane(0), r);
            Arrays.fill(buffer.plane(1), g);
            Arrays.fill(buffer.plane(2), b);
            return buffer;
        }

        @Test
        void grayWorldEqualisesMeans() throws EnhancementException {
            PixelBuffer out = tonal.whiteBalance(tinted(0.2f, 0.4f, 0.6f), TonalService.WhiteBalanceMethod.GRAY_WORLD);
            for (int c = 0; c < 3; c++) assertEquals(0.4f, out.get(2, 2, c), 1e-6);
        }

        @Test
        void whitePatchMatchesBrightestChannel() throws EnhancementException {
            PixelBuffer out = tonal.whiteBalance(tinted(0.5f, 0.25f, 0.5f), TonalService.WhiteBalanceMethod.WHITE_PATCH);
            for (int c = 0; c < 3; c++) assertEquals(0.5f, out.get(0, 0, c), 1e-6);
        }

        @Test
        @DisplayName("A channel without signal is reported as degenerate input")
        void emptyChannelIsDegenerate() {
            EnhancementException e = assertThrows(EnhancementException.class,
                    () -> tonal.whiteBalance(tinted(0.3f, 0f, 0.3f), TonalService.WhiteBalanceMethod.GRAY_WORLD));
            assertEquals(ErrorKind.DEGENERATE_INPUT, e.getKind());
        }

        @Test
        void grayscaleIsUnchanged() throws EnhancementException {
            PixelBuffer gray = PixelBuffer.filled(4, 4, PixelBuffer.GRAY, 0f);
            assertTrue(tonal.whiteBalance(gray, TonalService.WhiteBalanceMethod.GRAY_WORLD).contentEquals(gray));
        }
    }

    @Test
    @DisplayName("Background extraction flattens a sky gradient")
    void backgroundExtractionFlattensGradient() {
        PixelBuffer sky = TestImages.ramp(64, 64, PixelBuffer.GRAY, 0.2f, 0.6f);
        PixelBuffer out = tonal.extractBackground(sky, 8);
        assertTrue(TestImages.stdDev(out.plane(0)) < 0.5 * TestImages.stdDev(sky.plane(0)));
        assertThrows(IllegalArgumentException.class, () -> tonal.extractBackground(sky, 0));
    }

    @Nested
    class LightnessCurves {

        private final PixelBuffer dark = PixelBuffer.filled(4, 4, PixelBuffer.GRAY, 0.2f);
        private final PixelBuffer mid = PixelBuffer.filled(4, 4, PixelBuffer.GRAY, 0.5f);
        private final PixelBuffer bright = PixelBuffer.filled(4, 4, PixelBuffer.GRAY, 0.9f);

        @Test
        void shadowLiftRaisesDarkTones() {
            float v = tonal.shadowLift(dark, 0.4, 0.85).get(0, 0, 0);
            double expected = 0.2 + (Math.pow(0.2, 0.85) - 0.2) * 0.64 * 0.4;
            assertEquals(expected, v, 1e-6);
        }

        @Test
        void highlightCompressionOnlyAboveKnee() {
            assertEquals(0.873, tonal.highlightCompress(bright, 0.3, 0.75).get(0, 0, 0), 1e-6);
            assertTrue(tonal.highlightCompress(mid, 0.3, 0.75).contentEquals(mid));
            assertThrows(IllegalArgumentException.class, () -> tonal.highlightCompress(mid, 0.3, 1.0));
        }

        @Test
        void sCurveKeepsMidpointAndSteepensAroundIt() {
            assertEquals(0.5f, tonal.sCurve(mid, 0.3, 10).get(0, 0, 0), 1e-6);
            assertTrue(tonal.sCurve(bright, 0.3, 10).get(0, 0, 0) > 0.9f);
            assertTrue(tonal.sCurve(dark, 0.3, 10).get(0, 0, 0) < 0.2f);
        }

        @Test
        void colourBuffersKeepTheirHue() {
            PixelBuffer rgb = PixelBuffer.ofPlanes(1, 1, new float[] {0.3f}, new float[] {0.2f}, new float[] {0.1f});
            PixelBuffer out = tonal.shadowLift(rgb, 0.4, 0.85);
            assertTrue(out.get(0, 0, 0) > out.get(0, 0, 1));
            assertTrue(out.get(0, 0, 1) > out.get(0, 0, 2));
        }
    }
}
