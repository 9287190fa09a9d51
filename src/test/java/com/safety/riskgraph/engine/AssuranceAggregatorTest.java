package com.safety.riskgraph.engine;

import com.safety.riskgraph.api.AssuranceLevel;
import com.safety.riskgraph.api.GateType;
import com.safety.riskgraph.api.NodeType;
import com.safety.riskgraph.dsl.FaultTreeBuilder;
import com.safety.riskgraph.model.FaultNode;
import com.safety.riskgraph.model.FaultTree;
import com.safety.riskgraph.model.IdAllocator;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

import static org.junit.Assert.*;

public class AssuranceAggregatorTest {

    private AssuranceAggregator aggregator;
    private FaultTreeBuilder b;

    @Before
    public void setUp() {
        aggregator = new AssuranceAggregator();
        b = FaultTreeBuilder.create("pal");
    }

    private double calc(FaultNode node) {
        return aggregator.calculate(node, new HashSet<>());
    }

    @Test
    public void testBaseLeavesAreTruncatedAndClipped() {
        FaultNode te = b.topEvent("TE");
        FaultNode c = b.confidence(te, 7.9);
        FaultNode r = b.robustness(te, 2.8);

        assertEquals(5.0, calc(c), 0.0);
        assertEquals("Confidence [5]", c.getDisplayLabel());
        assertEquals("Base Confidence => 5", c.getDetailedEquation());
        assertEquals(2.0, calc(r), 0.0);
        assertEquals("Robustness [2]", r.getDisplayLabel());
    }

    @Test
    public void testChildlessNodeFallsBackToStoredValue() {
        FaultNode te = b.topEvent("TE");
        FaultNode g = b.gate(te, GateType.AND, "Empty");
        b.edit(g, n -> n.setQuantValue(2.6));
        FaultNode unset = b.gate(te, GateType.AND, "Unset");

        assertEquals(2.0, calc(g), 0.0);
        assertEquals("Node [2]", g.getDisplayLabel());
        assertEquals("No children => fallback value 2", g.getDetailedEquation());
        assertEquals(1.0, calc(unset), 0.0);
    }

    @Test
    public void testBaseDerivationThroughMatrix() {
        FaultNode te = b.topEvent("TE");
        FaultNode g = b.gate(te, GateType.AND, "G");
        b.confidence(g, 2);
        b.robustness(g, 4);

        assertEquals(3.0, calc(g), 0.0);
        assertEquals(AssuranceLevel.MODERATE, g.getAssuranceLevel());
        assertEquals("Prototype Assurance Level (PAL) [Moderate]", g.getDisplayLabel());
        assertTrue(g.getDetailedEquation().contains("Base Assurance from children = 3"));
        assertTrue(g.getDetailedEquation().contains("Composite Assurance from gates = N/A"));
    }

    @Test
    public void testSingleBaseKindServesBothAxes() {
        FaultNode te = b.topEvent("TE");
        FaultNode g = b.gate(te, GateType.AND, "G");
        b.confidence(g, 1);
        b.confidence(g, 2);

        // mean 1.5 rounds half to even: 2, matrix[2][2] = 4
        assertEquals(4.0, calc(g), 0.0);
    }

    @Test
    public void testAndOfCompositesUsesPairTable() {
        FaultNode te = b.topEvent("TE");
        FaultNode and = b.gate(te, GateType.AND, "AND");
        for (int i = 0; i < 2; i++) {
            FaultNode g = b.gate(and, GateType.AND, "G" + i);
            b.confidence(g, 1);
            b.robustness(g, 2);
        }

        // each child is matrix[1][2] = 4; AND(4, 4) = 5
        assertEquals(5.0, calc(and), 0.0);
        assertEquals(AssuranceLevel.HIGH_PLUS, and.getAssuranceLevel());
    }

    @Test
    public void testOrOfCompositesInvertsMean() {
        FaultNode te = b.topEvent("TE");
        FaultNode or = b.gate(te, GateType.OR, "OR");
        for (int i = 0; i < 2; i++) {
            FaultNode g = b.gate(or, GateType.AND, "G" + i);
            b.confidence(g, 1);
            b.robustness(g, 2);
        }

        // round(6 - 4) = 2
        assertEquals(2.0, calc(or), 0.0);
    }

    @Test
    public void testMissingGateDefaultsToAnd() {
        FaultNode te = b.topEvent("TE");
        FaultNode g = b.gate(te, null, "G");
        b.valued(g, NodeType.RIGOR_LEVEL, "R1", 4);
        b.valued(g, NodeType.RIGOR_LEVEL, "R2", 4);

        assertEquals(5.0, calc(g), 0.0);
    }

    @Test
    public void testBaseAndCompositeAreAveragedWithFloor() {
        FaultNode te = b.topEvent("TE");
        FaultNode g = b.gate(te, GateType.AND, "G");
        b.confidence(g, 3);
        b.robustness(g, 3);
        FaultNode sub = b.gate(g, GateType.AND, "Sub");
        b.confidence(sub, 1);
        b.robustness(sub, 2);

        // base 3, composite 4, (3 + 4) / 2 = 3
        assertEquals(3.0, calc(g), 0.0);
        assertTrue(g.getDetailedEquation().contains("Combined Children Assurance (average) = 3"));
    }

    @Test
    public void testTopEventBlendsSeverityAndControllability() {
        FaultNode te = b.topEvent("TE", 1, 1);
        b.confidence(te, 1);
        b.robustness(te, 1);

        // (5 + 1 + 1) / 3 = 2.33
        assertEquals(2.0, calc(te), 0.0);
        assertTrue(te.getDetailedEquation().contains("Final Assurance = ((5 + 1 + 1) /3) = 2"));
    }

    @Test
    public void testTopEventDefaultsToWorstRiskParameters() {
        FaultNode te = b.topEvent("TE");
        FaultNode g = b.gate(te, GateType.AND, "G");
        b.confidence(g, 3);
        b.robustness(g, 3);

        // composite 3, severity and controllability default to 3 (scaled 5): (3 + 5 + 5) / 3 = 4.33
        assertEquals(4.0, calc(te), 0.0);
        assertEquals("Prototype Assurance Level (PAL) [High]", te.getDisplayLabel());
    }

    @Test
    public void testScaleMapsOneToThreeOntoOneToFive() {
        assertEquals(1, AssuranceAggregator.scale(1));
        assertEquals(3, AssuranceAggregator.scale(2));
        assertEquals(5, AssuranceAggregator.scale(3));
    }

    @Test
    public void testRerunIsIdempotent() {
        FaultNode te = b.topEvent("TE", 2, 3);
        FaultNode or = b.gate(te, GateType.OR, "OR");
        FaultNode g1 = b.gate(or, GateType.AND, "G1");
        b.confidence(g1, 2);
        b.robustness(g1, 5);
        FaultNode g2 = b.gate(or, GateType.AND, "G2");
        b.confidence(g2, 4);
        b.link(g2, g1);
        b.confidence(te, 3);
        FaultTree tree = b.build();

        calc(te);
        List<String> first = snapshot(tree);
        calc(te);
        assertEquals(first, snapshot(tree));
    }

    @Test
    public void testCycleTerminates() {
        FaultTree tree = new FaultTree("cyclic", new IdAllocator());
        FaultNode te = tree.createTopEvent("TE");
        FaultNode g1 = tree.addChild(te, NodeType.GATE, "G1");
        FaultNode g2 = tree.addChild(g1, NodeType.GATE, "G2");
        tree.attachChild(g2, g1);
        tree.addChild(g2, NodeType.CONFIDENCE_LEVEL, "C").setQuantValue(2.0);

        double v = calc(te);
        assertTrue(v >= 1.0 && v <= 5.0);
        assertNotNull(g1.getQuantValue());
        assertNotNull(g2.getQuantValue());
    }

    @Test
    public void testVisitedNodeReturnsStoredValue() {
        FaultNode te = b.topEvent("TE");
        b.edit(te, n -> n.setQuantValue(4.0));
        HashSet<Integer> visited = new HashSet<>();
        visited.add(te.getUniqueId());

        assertEquals(4.0, aggregator.calculate(te, visited), 0.0);
        assertEquals("", te.getDisplayLabel());
    }

    private static List<String> snapshot(FaultTree tree) {
        List<String> out = new ArrayList<>();
        for (FaultNode n : tree.nodes())
            out.add(n.getUniqueId() + "|" + n.getQuantValue() + "|" + n.getDisplayLabel() + "|"
                    + n.getDetailedEquation() + "|" + n.getAssuranceLevel());
        return out;
    }
}
