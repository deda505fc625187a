package com.astroslide.model;

import ij.process.FloatProcessor;

import java.util.Arrays;

/**
 * Normalized in-memory image: height x width x channels, one float plane per channel.
 * Dimensions and channel count never change after creation; sample values may be
 * mutated by the pipeline that owns the buffer.
 */
public final class PixelBuffer {

    public static final int GRAY = 1;
    public static final int RGB = 3;

    private final int width;
    private final int height;
    private final float[][] planes;

    private PixelBuffer(int width, int height, float[][] planes) {
        this.width = width;
        this.height = height;
        this.planes = planes;
    }

    public static PixelBuffer create(int width, int height, int channels) {
        checkShape(width, height, channels);
        return new PixelBuffer(width, height, new float[channels][width * height]);
    }

    public static PixelBuffer filled(int width, int height, int channels, float value) {
        PixelBuffer buffer = create(width, height, channels);
        for (float[] plane : buffer.planes) Arrays.fill(plane, value);
        return buffer;
    }

    /** Wraps the given planes without copying. Each plane must hold width*height samples. */
    public static PixelBuffer ofPlanes(int width, int height, float[]... planes) {
        checkShape(width, height, planes.length);
        for (float[] p : planes) {
            if (p == null || p.length != width * height) {
                throw new IllegalArgumentException("Plane size does not match " + width + "x" + height);
            }
        }
        return new PixelBuffer(width, height, planes);
    }

    /** Packed 0xRRGGBB pixels, as returned by {@code BufferedImage.getRGB}. */
    public static PixelBuffer fromPackedRgb(int width, int height, int[] rgb) {
        PixelBuffer buffer = create(width, height, RGB);
        for (int i = 0; i < rgb.length; i++) {
            int c = rgb[i];
            buffer.planes[0][i] = ((c >> 16) & 0xFF) / 255f;
            buffer.planes[1][i] = ((c >> 8) & 0xFF) / 255f;
            buffer.planes[2][i] = (c & 0xFF) / 255f;
        }
        return buffer;
    }

    private static void checkShape(int width, int height, int channels) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Invalid dimensions " + width + "x" + height);
        }
        if (channels != GRAY && channels != RGB) {
            throw new IllegalArgumentException("Channel count must be 1 or 3, got " + channels);
        }
    }

    public int getWidth() { return width; }
    public int getHeight() { return height; }
    public int getChannels() { return planes.length; }
    public int getPixelCount() { return width * height; }
    public boolean isColor() { return planes.length == RGB; }

    public float get(int x, int y, int channel) {
        return planes[channel][y * width + x];
    }

    public void set(int x, int y, int channel, float value) {
        planes[channel][y * width + x] = value;
    }

    /** Live plane; writes go straight into this buffer. */
    public float[] plane(int channel) {
        return planes[channel];
    }

    public PixelBuffer copy() {
        float[][] copy = new float[planes.length][];
        for (int c = 0; c < planes.length; c++) copy[c] = planes[c].clone();
        return new PixelBuffer(width, height, copy);
    }

    /** Same shape, zeroed samples. */
    public PixelBuffer blankCopy() {
        return create(width, height, planes.length);
    }

    public PixelBuffer clamp() {
        for (float[] plane : planes) {
            for (int i = 0; i < plane.length; i++) {
                float v = plane[i];
                if (v < 0f || Float.isNaN(v)) plane[i] = 0f;
                else if (v > 1f) plane[i] = 1f;
            }
        }
        return this;
    }

    /** Copy of one plane as an ImageJ processor. */
    public FloatProcessor toProcessor(int channel) {
        return new FloatProcessor(width, height, planes[channel].clone());
    }

    public void setPlane(int channel, FloatProcessor fp) {
        if (fp.getWidth() != width || fp.getHeight() != height) {
            throw new IllegalArgumentException("Processor size does not match buffer");
        }
        System.arraycopy((float[]) fp.getPixels(), 0, planes[channel], 0, planes[channel].length);
    }

    public boolean sameShape(PixelBuffer other) {
        return other != null && other.width == width && other.height == height
                && other.planes.length == planes.length;
    }

    /** Largest absolute sample difference against a buffer of the same shape. */
    public double maxDifference(PixelBuffer other) {
        if (!sameShape(other)) return Double.POSITIVE_INFINITY;
        double max = 0;
        for (int c = 0; c < planes.length; c++) {
            float[] a = planes[c], b = other.planes[c];
            for (int i = 0; i < a.length; i++) max = Math.max(max, Math.abs(a[i] - b[i]));
        }
        return max;
    }

    public boolean contentEquals(PixelBuffer other) {
        if (!sameShape(other)) return false;
        for (int c = 0; c < planes.length; c++) {
            if (!Arrays.equals(planes[c], other.planes[c])) return false;
        }
        return true;
    }

    @Override
    public String toString() {
        return "PixelBuffer[" + width + "x" + height + "x" + planes.length + "]";
    }
}
