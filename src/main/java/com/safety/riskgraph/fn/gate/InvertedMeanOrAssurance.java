package com.safety.riskgraph.fn.gate;

import com.safety.riskgraph.fn.AbstractLevelFn;

/**
 * OR gate assurance: the mean child level inverted around the scale midpoint.
 * <p>
 * Formula: {@code round(6 - mean(levels))}, ties to even, clipped to [1,5].
 * <p>
 * This rule does not derive from the AND or base tables; strong children (4, 5)
 * lower the requirement on the gate, weak children raise it.
 */
public class InvertedMeanOrAssurance extends AbstractLevelFn {

    @Override
    protected int calculate(int[] levels) {
        double sum = 0.0;
        for (int l : levels)
            sum += l;
        return (int) Math.rint(6.0 - sum / levels.length);
    }
}
