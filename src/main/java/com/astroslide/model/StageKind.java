package com.astroslide.model;

/**
 * Operator kinds a preset stage may invoke. Each kind names the parameter that carries
 * its strength: when that parameter sits at its off value the stage is an identity.
 */
public enum StageKind {
    WHITE_BALANCE("amount"),
    BACKGROUND_EXTRACT("amount"),
    HISTOGRAM_STRETCH("amount"),
    GAMMA_CURVE("gamma"),
    LAB_CHANNEL_SCALE("gain"),
    HSV_SATURATION_SCALE("gain"),
    CLAHE_CONTRAST("amount"),
    MULTI_SCALE_CLAHE("amount"),
    SHADOW_LIFT("amount"),
    HIGHLIGHT_COMPRESS("amount"),
    S_CURVE("amount"),
    UNSHARP_MASK("amount"),
    DENOISE("strength"),
    STAR_REDUCE("amount"),
    BLACK_BACKGROUND("amount");

    private final String strengthParameter;

    StageKind(String strengthParameter) {
        this.strengthParameter = strengthParameter;
    }

    public String getStrengthParameter() {
        return strengthParameter;
    }
}
