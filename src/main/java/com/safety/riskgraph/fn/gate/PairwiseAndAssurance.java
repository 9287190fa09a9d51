package com.safety.riskgraph.fn.gate;

import com.safety.riskgraph.fn.AbstractLevelFn;
import com.safety.riskgraph.tables.AssuranceTables;

/**
 * AND gate assurance: folds the children left to right through the pairwise
 * AND table, {@code ((l1 & l2) & l3) & ...}.
 */
public class PairwiseAndAssurance extends AbstractLevelFn {

    @Override
    protected int calculate(int[] levels) {
        int current = levels[0];
        for (int i = 1; i < levels.length; i++)
            current = AssuranceTables.andPair(current, levels[i]);
        return current;
    }
}
