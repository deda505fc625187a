package com.astroslide.model;

public final class StageParameter {

    public final String name;
    public final double offValue;
    public final double nominalValue;

    public StageParameter(String name, double offValue, double nominalValue) {
        this.name = name;
        this.offValue = offValue;
        this.nominalValue = nominalValue;
    }

    /** Constant parameter: does not move with intensity (indices, grid sizes, radii). */
    public static StageParameter fixed(String name, double value) {
        return new StageParameter(name, value, value);
    }

    public double at(double intensity) {
        return offValue + intensity * (nominalValue - offValue);
    }

    @Override
    public String toString() {
        return offValue == nominalValue ? name + "=" + nominalValue : name + "=" + offValue + ".." + nominalValue;
    }
}
