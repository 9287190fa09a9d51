package com.safety.riskgraph.api;

import com.safety.riskgraph.fn.FnN;
import com.safety.riskgraph.fn.LevelFn;
import com.safety.riskgraph.fn.gate.ComplementProductProbability;
import com.safety.riskgraph.fn.gate.InvertedMeanOrAssurance;
import com.safety.riskgraph.fn.gate.PairwiseAndAssurance;
import com.safety.riskgraph.fn.gate.ProductProbability;

/**
 * Boolean gate of a composite node, bundled with the combination functions the
 * calculators apply for it.
 */
public enum GateType {
    AND(new ProductProbability(), new PairwiseAndAssurance()),
    OR(new ComplementProductProbability(), new InvertedMeanOrAssurance());

    private final FnN probabilityFn;
    private final LevelFn assuranceFn;

    GateType(FnN probabilityFn, LevelFn assuranceFn) {
        this.probabilityFn = probabilityFn;
        this.assuranceFn = assuranceFn;
    }

    public FnN probabilityFn() {
        return probabilityFn;
    }

    public LevelFn assuranceFn() {
        return assuranceFn;
    }

    /** Composite nodes without an explicit gate behave as AND. */
    public static GateType orDefault(GateType gate) {
        return gate != null ? gate : AND;
    }

    /** Blank text means AND; anything other than AND/OR is rejected. */
    public static GateType fromString(String text) {
        if (text == null || text.isBlank()) {
            return AND;
        }
        for (GateType g : values()) {
            if (g.name().equalsIgnoreCase(text.trim())) {
                return g;
            }
        }
        throw new IllegalArgumentException("Unknown GateType: " + text);
    }
}
