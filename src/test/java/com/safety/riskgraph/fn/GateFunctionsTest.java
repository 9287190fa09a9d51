package com.safety.riskgraph.fn;

import com.safety.riskgraph.api.GateType;
import com.safety.riskgraph.fn.gate.ComplementProductProbability;
import com.safety.riskgraph.fn.gate.InvertedMeanOrAssurance;
import com.safety.riskgraph.fn.gate.PairwiseAndAssurance;
import com.safety.riskgraph.fn.gate.ProductProbability;
import com.safety.riskgraph.fn.gate.SumProbability;
import org.junit.Test;

import static org.junit.Assert.*;

public class GateFunctionsTest {

    @Test
    public void testProbabilityGates() {
        assertEquals(0.02, new ProductProbability().apply(new double[] { 0.1, 0.2 }), 1e-9);
        assertEquals(0.28, new ComplementProductProbability().apply(new double[] { 0.1, 0.2 }), 1e-9);
        assertEquals(0.3, new SumProbability().apply(new double[] { 0.1, 0.2 }), 1e-9);
    }

    @Test
    public void testGateTypeBindsFunctions() {
        assertEquals(0.02, GateType.AND.probabilityFn().apply(new double[] { 0.1, 0.2 }), 1e-9);
        assertEquals(0.28, GateType.OR.probabilityFn().apply(new double[] { 0.1, 0.2 }), 1e-9);
        assertEquals(5, GateType.AND.assuranceFn().apply(new int[] { 5, 5 }));
    }

    @Test
    public void testProbabilityFallbacks() {
        ProductProbability and = new ProductProbability();
        assertEquals(0.0, and.apply(new double[0]), 0.0);
        assertEquals(0.0, and.apply(null), 0.0);
        assertEquals(0.0, and.apply(new double[] { 0.5, Double.NaN }), 0.0);
    }

    @Test
    public void testPairwiseAndFoldsLeftToRight() {
        PairwiseAndAssurance and = new PairwiseAndAssurance();
        assertEquals(1, and.apply(new int[] { 1 }));
        // (1 & 1) = 3, then (3 & 1) = 4
        assertEquals(4, and.apply(new int[] { 1, 1, 1 }));
        assertEquals(5, and.apply(new int[] { 5, 5 }));
        assertEquals(5, and.apply(new int[] { 0, 9 }));
    }

    @Test
    public void testOrInvertsMean() {
        InvertedMeanOrAssurance or = new InvertedMeanOrAssurance();
        for (int v = 1; v <= 5; v++)
            assertEquals(Math.max(1, Math.min(5, 6 - v)), or.apply(new int[] { v, v }));
        // 6 - 2.5 = 3.5 and 6 - 3.5 = 2.5 round half to even
        assertEquals(4, or.apply(new int[] { 2, 3 }));
        assertEquals(2, or.apply(new int[] { 3, 4 }));
    }

    @Test
    public void testLevelFnEmptyInput() {
        assertEquals(1, new PairwiseAndAssurance().apply(new int[0]));
        assertEquals(1, new InvertedMeanOrAssurance().apply(null));
    }
}
