package com.safety.riskgraph.dsl;

import com.safety.riskgraph.api.FaultType;
import com.safety.riskgraph.api.GateType;
import com.safety.riskgraph.api.NodeType;
import com.safety.riskgraph.api.ProbabilityFormula;
import com.safety.riskgraph.model.FaultNode;
import com.safety.riskgraph.model.FaultTree;
import com.safety.riskgraph.model.IdAllocator;

import java.util.function.Consumer;

/**
 * Fault Tree Builder -- fluent construction API.
 *
 * Usage Pattern:
 * 1. Create a builder: FaultTreeBuilder b = FaultTreeBuilder.create("brake");
 * 2. Define top events: var te = b.topEvent("Loss of braking", 3, 1);
 * 3. Define gates and leaves: var g = b.gate(te, GateType.OR, "Causes");
 * b.basicEvent(g, "Pump failure", 1e-4);
 * 4. Build: FaultTree tree = b.build();
 *
 * Every node is created through the underlying {@link FaultTree}, so ids come
 * from the injected {@link IdAllocator} and clones stay synchronized. A
 * builder can be built once.
 */
public final class FaultTreeBuilder {
    private final FaultTree tree;
    private boolean built;

    private FaultTreeBuilder(String name, IdAllocator ids) {
        this.tree = new FaultTree(name, ids);
    }

    public static FaultTreeBuilder create(String name) {
        return new FaultTreeBuilder(name, new IdAllocator());
    }

    /** Creates a builder drawing ids from a shared allocator. */
    public static FaultTreeBuilder create(String name, IdAllocator ids) {
        return new FaultTreeBuilder(name, ids);
    }

    // ── Top events ───────────────────────────────────────────────

    public FaultNode topEvent(String name) {
        checkNotBuilt();
        return tree.createTopEvent(name);
    }

    /**
     * @param severity        1..3
     * @param controllability 1..3
     */
    public FaultNode topEvent(String name, int severity, int controllability) {
        FaultNode te = topEvent(name);
        te.setSeverity(severity);
        te.setControllability(controllability);
        return te;
    }

    /** Top event of a safety goal, as used for FMEDA and PMHF. */
    public FaultNode safetyGoal(String name, String asil) {
        FaultNode te = topEvent(name);
        te.setSafetyGoalDescription(name);
        te.setSafetyGoalAsil(asil);
        return te;
    }

    // ── Composite nodes ─────────────────────────────────────────

    public FaultNode gate(FaultNode parent, GateType gateType, String name) {
        return composite(parent, NodeType.GATE, gateType, name);
    }

    /** Any non-leaf node type, e.g. a rigor level or triggering condition. */
    public FaultNode composite(FaultNode parent, NodeType type, GateType gateType, String name) {
        checkNotBuilt();
        FaultNode n = tree.addChild(parent, type, name);
        tree.edit(n, x -> x.setGateType(gateType));
        return n;
    }

    // ── Assurance leaves ────────────────────────────────────────

    public FaultNode confidence(FaultNode parent, double value) {
        return valued(parent, NodeType.CONFIDENCE_LEVEL, "Confidence", value);
    }

    public FaultNode robustness(FaultNode parent, double value) {
        return valued(parent, NodeType.ROBUSTNESS_SCORE, "Robustness", value);
    }

    public FaultNode valued(FaultNode parent, NodeType type, String name, double value) {
        checkNotBuilt();
        FaultNode n = tree.addChild(parent, type, name);
        tree.edit(n, x -> x.setQuantValue(value));
        return n;
    }

    // ── Basic events ────────────────────────────────────────────

    public FaultNode basicEvent(FaultNode parent, String name, double failureProb) {
        checkNotBuilt();
        FaultNode n = tree.addChild(parent, NodeType.BASIC_EVENT, name);
        tree.edit(n, x -> x.setFailureProb(failureProb));
        return n;
    }

    /**
     * A failure mode for FMEDA: its component, share of the component FIT,
     * fault type, diagnostic coverage and the safety goal it violates.
     */
    public FaultNode failureMode(FaultNode parent, String name, String component, double fraction,
            FaultType faultType, double diagnosticCoverage, String safetyGoal) {
        checkNotBuilt();
        FaultNode n = tree.addChild(parent, NodeType.BASIC_EVENT, name);
        tree.edit(n, x -> {
            x.setFmeaComponent(component);
            x.setFaultFraction(fraction);
            x.setFaultType(faultType);
            x.setDiagnosticCoverage(diagnosticCoverage);
            x.setFmedaSafetyGoal(safetyGoal);
            x.setProbFormula(ProbabilityFormula.LINEAR);
        });
        return n;
    }

    // ── Structure ───────────────────────────────────────────────

    /** Pastes a clone of {@code source} below {@code newParent}. */
    public FaultNode clone(FaultNode source, FaultNode newParent) {
        checkNotBuilt();
        return tree.cloneNode(source, newParent);
    }

    /** Shares an existing node under a second parent without cloning it. */
    public FaultNode link(FaultNode parent, FaultNode child) {
        checkNotBuilt();
        tree.attachChild(parent, child);
        return child;
    }

    /** Changes semantic fields of {@code node}; clones are redirected to their primary. */
    public FaultNode edit(FaultNode node, Consumer<FaultNode> mutation) {
        checkNotBuilt();
        tree.edit(node, mutation);
        return node.primary();
    }

    public FaultTree build() {
        checkNotBuilt();
        built = true;
        return tree;
    }

    private void checkNotBuilt() {
        if (built)
            throw new IllegalStateException("Builder already built: " + tree.name());
    }
}
