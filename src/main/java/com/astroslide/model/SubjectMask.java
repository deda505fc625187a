package com.astroslide.model;

/**
 * Bright subject (the lunar disk) isolated from black sky by a luminance threshold.
 * Presets carrying a mask only change pixels inside it.
 */
public final class SubjectMask {

    /** Luminance a pixel must exceed to belong to the subject. */
    public final double threshold;
    /** Radius of the close-then-open cleanup; 0 keeps the raw threshold. */
    public final double cleanupRadius;

    public SubjectMask(double threshold, double cleanupRadius) {
        if (!(threshold >= 0 && threshold < 1) || !(cleanupRadius >= 0)) {
            throw new IllegalArgumentException("Invalid subject mask " + threshold + "/" + cleanupRadius);
        }
        this.threshold = threshold;
        this.cleanupRadius = cleanupRadius;
    }

    @Override
    public String toString() {
        return "SubjectMask[>" + threshold + (cleanupRadius > 0 ? ", cleanup r=" + cleanupRadius : "") + "]";
    }
}
