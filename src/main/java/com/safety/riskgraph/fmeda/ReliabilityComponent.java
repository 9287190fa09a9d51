package com.safety.riskgraph.fmeda;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A BOM line as delivered by the reliability prediction: a named part with its
 * per-unit FIT rate and the number of units fitted.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ReliabilityComponent {
    private String name = "";
    private double fit;
    private int quantity = 1;

    public double totalFit() {
        return fit * quantity;
    }
}
