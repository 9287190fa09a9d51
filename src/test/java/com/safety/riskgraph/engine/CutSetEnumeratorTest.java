package com.safety.riskgraph.engine;

import com.safety.riskgraph.api.GateType;
import com.safety.riskgraph.api.NodeType;
import com.safety.riskgraph.dsl.FaultTreeBuilder;
import com.safety.riskgraph.model.FaultNode;
import com.safety.riskgraph.model.FaultTree;
import com.safety.riskgraph.model.IdAllocator;
import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.Set;

import static org.junit.Assert.*;

public class CutSetEnumeratorTest {

    private CutSetEnumerator enumerator;
    private FaultTreeBuilder b;
    private FaultNode te;

    @Before
    public void setUp() {
        enumerator = new CutSetEnumerator();
        b = FaultTreeBuilder.create("cuts");
        te = b.topEvent("TE");
    }

    @Test
    public void testLeafIsItsOwnCutSet() {
        FaultNode e = b.basicEvent(te, "E", 0.1);
        assertEquals(List.of(Set.of(e.getUniqueId())), enumerator.cutSets(e));
    }

    @Test
    public void testAndOfTwoLeaves() {
        FaultNode g = b.gate(te, GateType.AND, "AND");
        FaultNode a = b.basicEvent(g, "A", 0.1);
        FaultNode c = b.basicEvent(g, "B", 0.2);

        assertEquals(List.of(Set.of(a.getUniqueId(), c.getUniqueId())), enumerator.cutSets(g));
    }

    @Test
    public void testOrOfTwoLeaves() {
        FaultNode g = b.gate(te, GateType.OR, "OR");
        FaultNode a = b.basicEvent(g, "A", 0.1);
        FaultNode c = b.basicEvent(g, "B", 0.2);

        assertEquals(List.of(Set.of(a.getUniqueId()), Set.of(c.getUniqueId())), enumerator.cutSets(g));
    }

    @Test
    public void testAndDistributesOverOr() {
        FaultNode and = b.gate(te, GateType.AND, "AND");
        FaultNode or = b.gate(and, GateType.OR, "OR");
        FaultNode a = b.basicEvent(or, "A", 0.1);
        FaultNode c = b.basicEvent(or, "B", 0.1);
        FaultNode d = b.basicEvent(and, "C", 0.1);

        List<Set<Integer>> sets = enumerator.cutSets(and);
        assertEquals(List.of(
                Set.of(a.getUniqueId(), d.getUniqueId()),
                Set.of(c.getUniqueId(), d.getUniqueId())), sets);
    }

    @Test
    public void testSharedSubtreeIsExpandedPerPath() {
        FaultNode or = b.gate(te, GateType.OR, "OR");
        FaultNode g1 = b.gate(or, GateType.AND, "G1");
        FaultNode g2 = b.gate(or, GateType.AND, "G2");
        FaultNode shared = b.basicEvent(g1, "Shared", 0.5);
        b.link(g2, shared);
        FaultNode a = b.basicEvent(g1, "A", 0.1);
        FaultNode c = b.basicEvent(g2, "B", 0.1);

        assertEquals(List.of(
                Set.of(shared.getUniqueId(), a.getUniqueId()),
                Set.of(shared.getUniqueId(), c.getUniqueId())), enumerator.cutSets(or));
    }

    @Test
    public void testOrIsNotMinimized() {
        FaultNode or = b.gate(te, GateType.OR, "OR");
        FaultNode a = b.basicEvent(or, "A", 0.1);
        FaultNode and = b.gate(or, GateType.AND, "AND");
        b.link(and, a);
        FaultNode c = b.basicEvent(and, "B", 0.1);

        // {A} absorbs {A, B} in a minimal result; the cover keeps both
        assertEquals(List.of(Set.of(a.getUniqueId()), Set.of(a.getUniqueId(), c.getUniqueId())),
                enumerator.cutSets(or));
    }

    @Test
    public void testCycleContributesNothing() {
        FaultTree tree = new FaultTree("cyclic", new IdAllocator());
        FaultNode root = tree.createTopEvent("TE");
        FaultNode g1 = tree.addChild(root, NodeType.GATE, "G1");
        tree.edit(g1, g -> g.setGateType(GateType.OR));
        FaultNode g2 = tree.addChild(g1, NodeType.GATE, "G2");
        tree.edit(g2, g -> g.setGateType(GateType.OR));
        FaultNode e = tree.addChild(g2, NodeType.BASIC_EVENT, "E");
        tree.attachChild(g2, g1);

        assertEquals(List.of(Set.of(e.getUniqueId())), enumerator.cutSets(root));
    }
}
