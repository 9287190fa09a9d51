package com.safety.riskgraph.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.safety.riskgraph.api.ProbabilityFormula;
import com.safety.riskgraph.asil.Asil;
import com.safety.riskgraph.fmeda.AsilTarget;
import com.safety.riskgraph.fmeda.FmedaCalculator;
import com.safety.riskgraph.fmeda.MissionProfile;

import java.util.EnumMap;
import java.util.Map;

import lombok.Data;

/**
 * Named configuration of a {@link com.safety.riskgraph.engine.RiskEngine}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class EngineConfig {
    private MissionProfile missionProfile = new MissionProfile("default", 1.0, 0.0);
    private ProbabilityFormula probabilityFormula = ProbabilityFormula.LINEAR;
    /** FIT model of the reliability prediction, e.g. "IEC 62380"; reported, not interpreted. */
    private String reliabilityStandard = "";
    private double fractionTolerance = FmedaCalculator.DEFAULT_FRACTION_TOLERANCE;
    /** Replaces the default targets of the listed ASILs. */
    private Map<Asil, AsilTarget> asilTargets = new EnumMap<>(Asil.class);

    public AsilTarget targetFor(Asil asil) {
        AsilTarget t = asilTargets != null ? asilTargets.get(asil) : null;
        return t != null ? t : AsilTarget.forAsil(asil);
    }
}
