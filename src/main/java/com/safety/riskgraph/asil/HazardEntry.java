package com.safety.riskgraph.asil;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AccessLevel;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One HARA row: a malfunction, its hazard and the risk parameters that fix its
 * ASIL. The ASIL is derived, never set; changing severity, controllability or
 * exposure re-derives it.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class HazardEntry {
    private String malfunction = "";
    private String hazard = "";
    private int severity = 1;
    private int controllability = 1;
    private int exposure = 1;
    private String safetyGoal = "";
    @Setter(AccessLevel.NONE)
    @JsonProperty(access = JsonProperty.Access.READ_ONLY)
    private Asil asil = Asil.QM;

    public HazardEntry(String malfunction, String hazard, int severity, int controllability, int exposure,
            String safetyGoal) {
        this.malfunction = malfunction;
        this.hazard = hazard;
        this.severity = severity;
        this.controllability = controllability;
        this.exposure = exposure;
        this.safetyGoal = safetyGoal;
        recalculate();
    }

    public void setSeverity(int severity) {
        this.severity = severity;
        recalculate();
    }

    public void setControllability(int controllability) {
        this.controllability = controllability;
        recalculate();
    }

    public void setExposure(int exposure) {
        this.exposure = exposure;
        recalculate();
    }

    /** Re-derives {@link #getAsil()} from the current severity, controllability and exposure. */
    public Asil recalculate() {
        asil = AsilTable.calcAsil(severity, controllability, exposure);
        return asil;
    }
}
