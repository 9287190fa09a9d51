package com.safety.riskgraph.fmeda;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.safety.riskgraph.asil.Asil;

import java.util.Map;

/**
 * Minimum hardware architectural metrics for one ASIL.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AsilTarget(double spfm, double lpfm, double dc) {

    public static final AsilTarget NONE = new AsilTarget(0.0, 0.0, 0.0);

    private static final Map<Asil, AsilTarget> DEFAULTS = Map.of(
            Asil.D, new AsilTarget(0.99, 0.90, 0.99),
            Asil.C, new AsilTarget(0.97, 0.90, 0.97),
            Asil.B, new AsilTarget(0.90, 0.60, 0.90),
            Asil.A, NONE,
            Asil.QM, NONE);

    public static AsilTarget forAsil(Asil asil) {
        return DEFAULTS.getOrDefault(asil, NONE);
    }
}
