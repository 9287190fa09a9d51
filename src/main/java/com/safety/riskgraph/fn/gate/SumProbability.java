package com.safety.riskgraph.fn.gate;

import com.safety.riskgraph.fn.AbstractFnN;

/**
 * Rare-event sum across independent top events, used for the PMHF aggregate.
 */
public class SumProbability extends AbstractFnN {

    @Override
    protected double calculate(double[] inputs) {
        double sum = 0.0;
        for (double p : inputs)
            sum += p;
        return sum;
    }
}
