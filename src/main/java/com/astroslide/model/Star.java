package com.astroslide.model;

public class Star {
    public final double x;
    public final double y;
    /** Distance at which brightness falls to half of the peak above local background. */
    public final double radius;
    public final double peak;
    public final double localBackground;

    public Star(double x, double y, double radius, double peak, double localBackground) {
        this.x = x;
        this.y = y;
        this.radius = radius;
        this.peak = peak;
        this.localBackground = localBackground;
    }

    @Override
    public String toString() {
        return String.format("Star[%.1f,%.1f r=%.2f peak=%.3f]", x, y, radius, peak);
    }
}
