package com.astroslide.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One operator invocation inside a preset: a kind plus its parameter ranges.
 */
public final class Stage {

    private final StageKind kind;
    private final Map<String, StageParameter> parameters;

    private Stage(StageKind kind, Map<String, StageParameter> parameters) {
        this.kind = kind;
        this.parameters = Collections.unmodifiableMap(parameters);
    }

    public static Builder of(StageKind kind) {
        return new Builder(kind);
    }

    public StageKind getKind() { return kind; }

    public Map<String, StageParameter> getParameters() { return parameters; }

    /** Parameter values linearly interpolated between off and nominal by {@code intensity}. */
    public Map<String, Double> effectiveParameters(double intensity) {
        Map<String, Double> values = new LinkedHashMap<>();
        for (StageParameter p : parameters.values()) values.put(p.name, p.at(intensity));
        return values;
    }

    public boolean isIdentityAt(double intensity) {
        StageParameter strength = parameters.get(kind.getStrengthParameter());
        return strength.at(intensity) == strength.offValue;
    }

    @Override
    public String toString() {
        return kind + parameters.values().toString();
    }

    public static final class Builder {
        private final StageKind kind;
        private final Map<String, StageParameter> parameters = new LinkedHashMap<>();

        private Builder(StageKind kind) {
            this.kind = kind;
        }

        public Builder scaled(String name, double offValue, double nominalValue) {
            parameters.put(name, new StageParameter(name, offValue, nominalValue));
            return this;
        }

        public Builder fixed(String name, double value) {
            parameters.put(name, StageParameter.fixed(name, value));
            return this;
        }

        public Stage build() {
            if (!parameters.containsKey(kind.getStrengthParameter())) {
                throw new IllegalStateException(kind + " stage needs a '" + kind.getStrengthParameter() + "' parameter");
            }
            return new Stage(kind, new LinkedHashMap<>(parameters));
        }
    }
}
