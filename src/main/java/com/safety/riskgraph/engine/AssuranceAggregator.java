package com.safety.riskgraph.engine;

import com.safety.riskgraph.api.AssuranceLevel;
import com.safety.riskgraph.api.CalculationListener;
import com.safety.riskgraph.api.GateType;
import com.safety.riskgraph.api.NodeType;
import com.safety.riskgraph.model.FaultNode;
import com.safety.riskgraph.tables.AssuranceTables;
import com.safety.riskgraph.util.Coercions;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Recursive Prototype Assurance Level (PAL) calculator.
 *
 * Walks a subtree depth first and stamps every node with its assurance level
 * (quant value, qualitative label and an audit trail in the detailed
 * equation). Children are always resolved before their parent.
 *
 * Per node:
 * 1. Confidence / robustness leaves: the stored value, truncated and clipped to [1,5].
 * 2. Any other childless node: the same fallback on its stored value.
 * 3. Composite node: children are split into base leaves and composite
 * subtrees. Base leaves are averaged per kind (confidence, robustness) and
 * looked up in the inversion matrix; composite values are combined by the
 * node's gate (AND pairwise table, OR inverted mean). Both contributions are
 * averaged with floor division when present.
 * 4. Top events additionally blend in severity and controllability, each
 * scaled from 1..3 onto 1..5, and round the mean of the three.
 *
 * Cycle safety:
 * The visited set is shared across the whole pass. A node seen a second time
 * returns its last stamped value without descending again, so shared subtrees
 * are evaluated once and a cyclic graph terminates.
 */
public final class AssuranceAggregator {
    private static final Logger log = LogManager.getLogger(AssuranceAggregator.class);

    private final CalculationListener listener;
    private long pass;
    private int evaluated;

    public AssuranceAggregator() {
        this(CalculationListener.NOOP);
    }

    public AssuranceAggregator(CalculationListener listener) {
        this.listener = listener != null ? listener : CalculationListener.NOOP;
    }

    /** Tags subsequent listener callbacks with {@code pass} and resets the evaluation counter. */
    void beginPass(long pass) {
        this.pass = pass;
        this.evaluated = 0;
    }

    /** Node evaluations since the last {@link #beginPass(long)}. */
    int evaluated() {
        return evaluated;
    }

    /**
     * Computes and stamps the assurance level of {@code node} and its subtree.
     *
     * @param node    Root of the subtree.
     * @param visited Ids already evaluated in this pass; updated in place.
     * @return The level in [1,5].
     */
    public double calculate(FaultNode node, Set<Integer> visited) {
        if (!visited.add(node.getUniqueId())) {
            Double q = node.getQuantValue();
            return q != null ? q : 1;
        }

        NodeType type = node.getNodeType();
        if (type == NodeType.CONFIDENCE_LEVEL) {
            int v = leafValue(node);
            return stamp(node, v, "Confidence [" + v + "]", "Base Confidence => " + v);
        }
        if (type == NodeType.ROBUSTNESS_SCORE) {
            int v = leafValue(node);
            return stamp(node, v, "Robustness [" + v + "]", "Base Robustness => " + v);
        }
        if (node.isLeaf()) {
            int v = leafValue(node);
            return stamp(node, v, "Node [" + v + "]", "No children => fallback value " + v);
        }

        for (FaultNode child : node.getChildren())
            calculate(child, visited);

        // ── Partition ────────────────────────────────────────────
        List<Integer> confidence = new ArrayList<>();
        List<Integer> robustness = new ArrayList<>();
        List<Integer> composite = new ArrayList<>();
        for (FaultNode child : node.getChildren()) {
            int v = storedLevel(child);
            switch (child.getNodeType()) {
                case CONFIDENCE_LEVEL -> confidence.add(v);
                case ROBUSTNESS_SCORE -> robustness.add(v);
                default -> composite.add(v);
            }
        }

        Integer base = baseAssurance(confidence, robustness);
        Integer gated = composite.isEmpty() ? null
                : GateType.orDefault(node.getGateType()).assuranceFn().apply(toArray(composite));

        int combined;
        if (base != null && gated != null)
            combined = (base + gated) / 2;
        else if (base != null)
            combined = base;
        else if (gated != null)
            combined = gated;
        else
            combined = 1;

        StringBuilder eq = new StringBuilder()
                .append("Base Assurance from children = ").append(base != null ? base : "N/A").append('\n')
                .append("Composite Assurance from gates = ").append(gated != null ? gated : "N/A").append('\n');

        int result;
        if (type == NodeType.TOP_EVENT) {
            int sRaw = riskParameter(node.getSeverity(), node, "severity");
            int cRaw = riskParameter(node.getControllability(), node, "controllability");
            int s = scale(sRaw);
            int c = scale(cRaw);
            result = Coercions.clip((int) Math.rint((combined + s + c) / 3.0), 1, 5);
            eq.append("Combined (average) = ").append(combined).append('\n')
                    .append("Node Severity (TOP EVENT) = ").append(sRaw).append(" (scaled: ").append(s).append(")\n")
                    .append("Node Controllability = ").append(cRaw).append(" (scaled: ").append(c).append(")\n")
                    .append("Final Assurance = ((").append(combined).append(" + ").append(s).append(" + ").append(c)
                    .append(") /3) = ").append(result);
        } else {
            result = combined;
            eq.append("Combined Children Assurance (average) = ").append(combined).append('\n');
        }

        String label = "Prototype Assurance Level (PAL) [" + AssuranceLevel.ofLevel(result).label() + "]";
        return stamp(node, result, label, eq.toString());
    }

    // ── Helpers ─────────────────────────────────────────────────

    /**
     * Base matrix lookup on the rounded mean of each kind. When only one kind
     * is present it stands in for both axes.
     */
    private static Integer baseAssurance(List<Integer> confidence, List<Integer> robustness) {
        if (confidence.isEmpty() && robustness.isEmpty())
            return null;
        List<Integer> conf = confidence.isEmpty() ? robustness : confidence;
        List<Integer> rob = robustness.isEmpty() ? confidence : robustness;
        return AssuranceTables.deriveFromBase(roundedMean(conf), roundedMean(rob));
    }

    private static int roundedMean(List<Integer> values) {
        double sum = 0.0;
        for (int v : values)
            sum += v;
        return (int) Math.rint(sum / values.size());
    }

    private int leafValue(FaultNode node) {
        Double q = node.getQuantValue();
        if (q == null || q.isNaN()) {
            if (q != null)
                listener.onNodeWarning(pass, node.getUniqueId(), "non-numeric quant value, using 1");
            return 1;
        }
        return Coercions.clip(q.intValue(), 1, 5);
    }

    private static int storedLevel(FaultNode node) {
        Double q = node.getQuantValue();
        return q == null || q.isNaN() ? 1 : Coercions.clip(q.intValue(), 1, 5);
    }

    private int riskParameter(Integer raw, FaultNode node, String what) {
        if (raw == null) {
            listener.onNodeWarning(pass, node.getUniqueId(), what + " not set, using 3");
            return 3;
        }
        return Coercions.clip(raw, 1, 3);
    }

    /** 1..3 onto 1..5: 1 -> 1, 2 -> 3, 3 -> 5. */
    static int scale(int x) {
        return (x - 1) * 2 + 1;
    }

    private static int[] toArray(List<Integer> values) {
        int[] a = new int[values.size()];
        for (int i = 0; i < a.length; i++)
            a[i] = values.get(i);
        return a;
    }

    private double stamp(FaultNode node, int value, String label, String equation) {
        node.stampQuantValue(value);
        node.setAssuranceLevel(AssuranceLevel.ofLevel(value));
        node.setDisplayLabel(label);
        node.setDetailedEquation(equation);
        evaluated++;
        listener.onNodeEvaluated(pass, node.getUniqueId(), node.getNodeType(), value);
        if (log.isDebugEnabled())
            log.debug("PAL {} = {}", node, value);
        return value;
    }
}
