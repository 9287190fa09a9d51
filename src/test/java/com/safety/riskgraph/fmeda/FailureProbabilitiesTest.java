package com.safety.riskgraph.fmeda;

import com.safety.riskgraph.api.NodeType;
import com.safety.riskgraph.api.ProbabilityFormula;
import com.safety.riskgraph.asil.Asil;
import com.safety.riskgraph.model.FaultNode;
import org.junit.Test;

import static org.junit.Assert.*;

public class FailureProbabilitiesTest {

    private final FaultNode node = new FaultNode(1, NodeType.BASIC_EVENT);

    @Test
    public void testLinear() {
        assertEquals(1e-4, FailureProbabilities.compute(node, ProbabilityFormula.LINEAR, 100.0, 1000.0), 1e-15);
    }

    @Test
    public void testExponential() {
        double p = FailureProbabilities.compute(node, ProbabilityFormula.EXPONENTIAL, 100.0, 1000.0);
        assertEquals(1.0 - Math.exp(-1e-4), p, 1e-15);
        assertTrue(p < 1e-4);
    }

    @Test
    public void testConstantIgnoresFit() {
        node.setFailureProb(0.25);
        assertEquals(0.25, FailureProbabilities.compute(node, ProbabilityFormula.CONSTANT, 1e9, 1000.0), 0.0);
        node.setFailureProb(null);
        assertEquals(0.0, FailureProbabilities.compute(node, ProbabilityFormula.CONSTANT, 1e9, 1000.0), 0.0);
    }

    @Test
    public void testNodeFormulaUsedWhenNoneGiven() {
        node.setProbFormula(ProbabilityFormula.EXPONENTIAL);
        assertEquals(1.0 - Math.exp(-1.0), FailureProbabilities.compute(node, null, 1e9, 1.0), 1e-12);
    }

    @Test
    public void testMissionProfileDuration() {
        assertEquals(15.0, new MissionProfile("p", 10.0, 5.0).tau(), 0.0);
        assertEquals(1.0, new MissionProfile("p", 0.0, 0.0).tau(), 0.0);
        assertEquals(1e-9, FailureProbabilities.compute(node, ProbabilityFormula.LINEAR, 1.0,
                new MissionProfile("idle", 0.0, 0.0)), 1e-21);
        assertEquals(2e-6, FailureProbabilities.compute(node, ProbabilityFormula.LINEAR, 1.0,
                new MissionProfile("car", 1500.0, 500.0)), 1e-18);
    }

    @Test
    public void testAsilTargets() {
        assertEquals(0.99, AsilTarget.forAsil(Asil.D).spfm(), 0.0);
        assertEquals(0.60, AsilTarget.forAsil(Asil.B).lpfm(), 0.0);
        assertEquals(AsilTarget.NONE, AsilTarget.forAsil(Asil.A));
    }

    @Test
    public void testComponentTotalFit() {
        assertEquals(30.0, new ReliabilityComponent("R", 10.0, 3).totalFit(), 0.0);
    }
}
