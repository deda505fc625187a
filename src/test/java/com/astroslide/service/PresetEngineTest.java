package com.astroslide.service;

import com.astroslide.TestImages;
import com.astroslide.model.EnhancementException;
import com.astroslide.model.ErrorKind;
import com.astroslide.model.ExecutionState;
import com.astroslide.model.PipelineRun;
import com.astroslide.model.PixelBuffer;
import com.astroslide.model.PresetCatalog;
import com.astroslide.model.Stage;
import com.astroslide.model.StageKind;
import com.astroslide.model.StarDetectionSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PresetEngineTest {

    private final PresetEngine engine = newEngine();

    static PresetEngine newEngine() {
        ColorSpaceService colors = new ColorSpaceService();
        StarReductionService stars = new StarReductionService(
                new StarDetectionService(colors, StarDetectionSettings.defaults()));
        return new PresetEngine(colors, new TonalService(colors), new FrequencyService(colors, 4.0, 0.15), stars);
    }

    static List<String> presetIds() {
        return PresetCatalog.ids();
    }

    private static PixelBuffer frame() {
        PixelBuffer frame = TestImages.noisy(48, 40, PixelBuffer.RGB, 0.3f, 0.15f, 21);
        for (int y = 0; y < frame.getHeight(); y++) {
            for (int x = 0; x < frame.getWidth(); x++) {
                frame.set(x, y, 0, frame.get(x, y, 0) * 0.8f + 0.1f * x / frame.getWidth());
            }
        }
        return withStar(frame);
    }

    private static PixelBuffer withStar(PixelBuffer frame) {
        for (int y = 17; y <= 23; y++) {
            for (int x = 21; x <= 27; x++) {
                if ((x - 24) * (x - 24) + (y - 20) * (y - 20) <= 9) {
                    for (int c = 0; c < 3; c++) frame.set(x, y, c, 1f);
                }
            }
        }
        return frame;
    }

    @Nested
    class Laws {

        @ParameterizedTest
        @MethodSource("com.astroslide.service.PresetEngineTest#presetIds")
        @DisplayName("Intensity 0 returns the input unchanged")
        void zeroIntensityIsIdentity(String preset) throws EnhancementException {
            PixelBuffer input = frame();
            assertTrue(engine.enhance(input, preset, 0).contentEquals(input));
        }

        @ParameterizedTest
        @MethodSource("com.astroslide.service.PresetEngineTest#presetIds")
        @DisplayName("Full intensity is bit-for-bit deterministic")
        void fullIntensityIsDeterministic(String preset) throws EnhancementException {
            PixelBuffer input = frame();
            PixelBuffer first = engine.enhance(input, preset, 1);
            PixelBuffer second = engine.enhance(input, preset, 1);
            assertTrue(first.contentEquals(second));
            assertTrue(first.sameShape(input));
        }

        @ParameterizedTest
        @MethodSource("com.astroslide.service.PresetEngineTest#presetIds")
        void outputStaysNormalized(String preset) throws EnhancementException {
            PixelBuffer out = engine.enhance(frame(), preset, 0.7);
            for (int c = 0; c < out.getChannels(); c++) {
                assertTrue(TestImages.min(out.plane(c)) >= 0f, preset);
                assertTrue(TestImages.max(out.plane(c)) <= 1f, preset);
            }
        }

        @Test
        void inputBufferIsNeverModified() throws EnhancementException {
            PixelBuffer input = frame();
            PixelBuffer pristine = input.copy();
            engine.enhance(input, PresetCatalog.MOON_HDR, 1);
            assertTrue(input.contentEquals(pristine));
        }

        @Test
        void grayscaleFramesKeepOneChannel() throws EnhancementException {
            PixelBuffer gray = TestImages.noisy(32, 32, PixelBuffer.GRAY, 0.4f, 0.1f, 22);
            PixelBuffer out = engine.enhance(gray, PresetCatalog.MINERAL_MOON, 1);
            assertEquals(PixelBuffer.GRAY, out.getChannels());
        }

        @Test
        void intensityChangesTheResult() throws EnhancementException {
            PixelBuffer input = frame();
            PixelBuffer half = engine.enhance(input, PresetCatalog.MINERAL_MOON, 0.5);
            PixelBuffer full = engine.enhance(input, PresetCatalog.MINERAL_MOON, 1);
            assertFalse(half.contentEquals(input));
            assertFalse(half.contentEquals(full));
        }
    }

    @Nested
    class Validation {

        @Test
        void unknownPresetListsAvailableOnes() {
            PipelineRun run = new PipelineRun();
            EnhancementException e = assertThrows(EnhancementException.class,
                    () -> engine.execute(frame(), "lunar", 1, run));
            assertEquals(ErrorKind.INVALID_PARAMETER, e.getKind());
            assertTrue(e.getMessage().contains(PresetCatalog.GENERAL));
            assertEquals(ExecutionState.FAILED, run.getState());
            assertSame(e, run.getFailure());
        }

        @ParameterizedTest
        @ValueSource(doubles = {-0.1, 1.01, Double.NaN})
        void intensityOutsideUnitRange(double intensity) {
            EnhancementException e = assertThrows(EnhancementException.class,
                    () -> engine.enhance(frame(), PresetCatalog.GENERAL, intensity));
            assertEquals(ErrorKind.INVALID_PARAMETER, e.getKind());
        }

        @Test
        void missingBuffer() {
            EnhancementException e = assertThrows(EnhancementException.class,
                    () -> engine.enhance(null, PresetCatalog.GENERAL, 1));
            assertEquals(ErrorKind.INVALID_PARAMETER, e.getKind());
        }
    }

    @Nested
    class Execution {

        @Test
        void successfulRunEndsDone() throws EnhancementException {
            PipelineRun run = new PipelineRun();
            engine.execute(frame(), PresetCatalog.GENERAL, 1, run);
            assertEquals(ExecutionState.DONE, run.getState());
            int stages = PresetCatalog.find(PresetCatalog.GENERAL).orElseThrow().getStages().size();
            assertEquals(stages, run.getStageCount());
            assertEquals(stages - 1, run.getStageIndex());
        }

        @Test
        @DisplayName("A black frame fails white balance and returns no image")
        void degenerateFrameFailsWholeRun() {
            PipelineRun run = new PipelineRun();
            PixelBuffer black = PixelBuffer.create(32, 32, PixelBuffer.RGB);
            EnhancementException e = assertThrows(EnhancementException.class,
                    () -> engine.execute(black, PresetCatalog.DEEP_SKY, 1, run));
            assertEquals(ErrorKind.DEGENERATE_INPUT, e.getKind());
            assertEquals(ExecutionState.FAILED, run.getState());
            assertEquals(0, run.getStageIndex());
        }

        @Test
        void cancelledRunStopsBeforeNextStage() {
            PipelineRun run = new PipelineRun();
            run.cancel();
            EnhancementException e = assertThrows(EnhancementException.class,
                    () -> engine.execute(frame(), PresetCatalog.GENERAL, 1, run));
            assertEquals(ErrorKind.CANCELLED, e.getKind());
            assertEquals(ExecutionState.FAILED, run.getState());
        }

        @Test
        void runCannotBeReused() throws EnhancementException {
            PipelineRun run = new PipelineRun();
            engine.execute(frame(), PresetCatalog.GENERAL, 0.5, run);
            assertThrows(IllegalStateException.class, () -> engine.execute(frame(), PresetCatalog.GENERAL, 0.5, run));
        }
    }

    @Nested
    class LunarMasking {

        private static final int SIZE = 120;
        private static final int CENTRE = 60;
        private static final int RADIUS = 40;

        /** Textured disk on dark sky whose noise stays below both lunar thresholds. */
        private PixelBuffer moon() {
            PixelBuffer frame = TestImages.noisy(SIZE, SIZE, PixelBuffer.RGB, 0.015f, 0.015f, 31);
            PixelBuffer surface = TestImages.noisy(SIZE, SIZE, PixelBuffer.RGB, 0.5f, 0.15f, 32);
            for (int y = 0; y < SIZE; y++) {
                for (int x = 0; x < SIZE; x++) {
                    if (distance(x, y) <= RADIUS) {
                        for (int c = 0; c < 3; c++) frame.set(x, y, c, surface.get(x, y, c));
                    }
                }
            }
            return frame;
        }

        private double distance(int x, int y) {
            return Math.hypot(x - CENTRE, y - CENTRE);
        }

        @ParameterizedTest
        @ValueSource(strings = {PresetCatalog.MINERAL_MOON_SUBTLE, PresetCatalog.MOON_HDR})
        @DisplayName("Sky around the lunar disk comes out black")
        void skyIsForcedToBlack(String preset) throws EnhancementException {
            PixelBuffer out = engine.enhance(moon(), preset, 1);
            for (int y = 0; y < SIZE; y++) {
                for (int x = 0; x < SIZE; x++) {
                    if (distance(x, y) > RADIUS + 3) {
                        for (int c = 0; c < 3; c++) assertEquals(0f, out.get(x, y, c), preset + " at " + x + "," + y);
                    }
                }
            }
            assertTrue(out.get(CENTRE, CENTRE, 1) > 0.1f);
        }

        @ParameterizedTest
        @ValueSource(strings = {PresetCatalog.MINERAL_MOON_SUBTLE, PresetCatalog.MOON_HDR})
        @DisplayName("At half intensity the sky is only dimmed, never processed")
        void skyUntouchedByStagesAtHalfIntensity(String preset) throws EnhancementException {
            PixelBuffer input = moon();
            PixelBuffer out = engine.enhance(input, preset, 0.5);
            for (int y = 0; y < SIZE; y += 3) {
                for (int x = 0; x < SIZE; x += 3) {
                    if (distance(x, y) > RADIUS + 3) {
                        assertEquals(input.get(x, y, 0) * 0.5f, out.get(x, y, 0), 1e-7f);
                    }
                }
            }
        }

        @Test
        void unmaskedPresetsStillProcessTheSky() throws EnhancementException {
            PixelBuffer input = moon();
            PixelBuffer out = engine.enhance(input, PresetCatalog.MINERAL_MOON, 1);
            double skyIn = 0, skyOut = 0;
            for (int x = 0; x < 10; x++) {
                skyIn += input.get(x, 0, 1);
                skyOut += out.get(x, 0, 1);
            }
            assertNotEquals(skyIn, skyOut);
        }
    }

    @Test
    @DisplayName("The engine scales LAB a* by 1.3 for mineral moon at half intensity")
    void mineralMoonLabStageAtHalfIntensity() throws EnhancementException {
        ColorSpaceService colors = new ColorSpaceService();
        Stage labA = PresetCatalog.find(PresetCatalog.MINERAL_MOON).orElseThrow().getStages().stream()
                .filter(s -> s.getKind() == StageKind.LAB_CHANNEL_SCALE)
                .filter(s -> s.getParameters().get("channel").nominalValue == PresetCatalog.LAB_A)
                .findFirst().orElseThrow();
        PixelBuffer input = TestImages.random(24, 24, PixelBuffer.RGB, 33);

        PixelBuffer out = engine.applyStage(labA, input, 0.5, null);

        assertTrue(out.maxDifference(colors.labChannelScale(input, PresetCatalog.LAB_A, 1.3)) < 1e-6);
        assertTrue(out.maxDifference(colors.labChannelScale(input, PresetCatalog.LAB_A, 1.6)) > 1e-3);
    }

    @Test
    void blendInterpolatesAndPassesThroughAtFullAmount() {
        PixelBuffer a = PixelBuffer.filled(2, 2, PixelBuffer.GRAY, 0.2f);
        PixelBuffer b = PixelBuffer.filled(2, 2, PixelBuffer.GRAY, 0.6f);
        assertEquals(0.4f, PresetEngine.blend(a, b, 0.5).get(0, 0, 0), 1e-6);
        assertSame(b, PresetEngine.blend(a, b, 1.0));
    }
}
