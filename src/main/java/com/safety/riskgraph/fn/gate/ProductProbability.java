package com.safety.riskgraph.fn.gate;

import com.safety.riskgraph.fn.AbstractFnN;

/**
 * AND gate probability under the independence assumption.
 * <p>
 * Formula: {@code p = p_1 * p_2 * ... * p_n}
 */
public class ProductProbability extends AbstractFnN {

    @Override
    protected double calculate(double[] inputs) {
        double prod = 1.0;
        for (double p : inputs)
            prod *= p;
        return prod;
    }
}
