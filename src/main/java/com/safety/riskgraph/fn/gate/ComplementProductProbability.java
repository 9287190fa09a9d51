package com.safety.riskgraph.fn.gate;

import com.safety.riskgraph.fn.AbstractFnN;

/**
 * OR gate probability: the chance that at least one independent child occurs.
 * <p>
 * Formula: {@code p = 1 - (1 - p_1) * (1 - p_2) * ... * (1 - p_n)}
 */
public class ComplementProductProbability extends AbstractFnN {

    @Override
    protected double calculate(double[] inputs) {
        double prod = 1.0;
        for (double p : inputs)
            prod *= (1.0 - p);
        return 1.0 - prod;
    }
}
