package com.safety.riskgraph.fmeda;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Operating profile of the item over its lifetime. Only the durations feed the
 * probability conversion; the environmental figures are carried for the
 * reliability prediction that supplies FIT rates.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MissionProfile {
    private String name = "";
    private double tauOn;
    private double tauOff;
    private double boardTemp = 25.0;
    private double ambientTemp = 25.0;
    private double humidity = 50.0;
    private double dutyCycle = 1.0;

    public MissionProfile(String name, double tauOn, double tauOff) {
        this.name = name;
        this.tauOn = tauOn;
        this.tauOff = tauOff;
    }

    /** Mission duration in hours; a non-positive total falls back to 1h. */
    public double tau() {
        double tau = tauOn + tauOff;
        return tau > 0.0 ? tau : 1.0;
    }
}
