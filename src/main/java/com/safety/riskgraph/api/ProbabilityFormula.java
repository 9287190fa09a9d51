package com.safety.riskgraph.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a basic event's failure probability is derived from its FIT rate over
 * the mission duration.
 */
public enum ProbabilityFormula {
    /** {@code p = lambda * tau} with {@code lambda = FIT / 1e9}. */
    LINEAR,
    /** {@code p = 1 - exp(-lambda * tau)}. */
    EXPONENTIAL,
    /** The supplied probability is used as is; FIT is ignored. */
    CONSTANT;

    @JsonValue
    public String jsonName() {
        return name().toLowerCase();
    }

    /** Unknown or missing text selects {@link #LINEAR}. */
    @JsonCreator
    public static ProbabilityFormula fromString(String text) {
        if (text != null) {
            for (ProbabilityFormula f : values()) {
                if (f.name().equalsIgnoreCase(text.trim())) {
                    return f;
                }
            }
        }
        return LINEAR;
    }
}
