package com.safety.riskgraph.api;

/**
 * FMEDA fault classification of a failure mode. Permanent faults feed the
 * single-point metric, transient faults the latent-point metric.
 */
public enum FaultType {
    PERMANENT,
    TRANSIENT;

    /** Unknown or missing text is treated as permanent. */
    public static FaultType fromString(String text) {
        if (text != null && text.trim().equalsIgnoreCase("transient")) {
            return TRANSIENT;
        }
        return PERMANENT;
    }
}
