package com.safety.riskgraph.util;

import com.safety.riskgraph.model.FaultNode;

import java.util.HashSet;
import java.util.Set;

/**
 * Diagnostic utility for inspecting annotated nodes.
 *
 * <p>
 * Renders the state a recalculation left on a node and an indented dump of a
 * subtree. Intended for debugging sessions and log output; shared subtrees are
 * printed once and marked on later visits.
 */
public final class TreeExplain {
    private TreeExplain() {
        // Utility class
    }

    /**
     * Dumps detailed state of a single node.
     */
    public static String explainNode(FaultNode node) {
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(node).append('\n')
                .append("  Type: ").append(node.getNodeType().displayName()).append('\n')
                .append("  Gate: ").append(node.getGateType() != null ? node.getGateType() : "-").append('\n')
                .append("  Primary: ").append(node.isPrimaryInstance()).append('\n')
                .append("  Quant value: ").append(node.getQuantValue()).append('\n');
        if (node.getAssuranceLevel() != null)
            sb.append("  PAL: ").append(node.getAssuranceLevel().label()).append('\n');
        if (node.getProbability() != null)
            sb.append("  Probability: ").append(node.getProbability()).append('\n');
        if (node.getSpfmRaw() != null)
            sb.append("  Residual FIT: spf=").append(node.getSpfmRaw())
                    .append(" lpf=").append(node.getLpfmRaw()).append('\n');
        sb.append("  Label: ").append(node.getDisplayLabel()).append('\n');
        if (!node.getDetailedEquation().isEmpty()) {
            sb.append("  Equation:\n");
            for (String line : node.getDetailedEquation().split("\n"))
                sb.append("    ").append(line).append('\n');
        }
        sb.append("  Children (").append(node.getChildren().size()).append("): ");
        for (int i = 0; i < node.getChildren().size(); i++) {
            if (i > 0)
                sb.append(", ");
            sb.append(node.getChildren().get(i).getUniqueId());
        }
        return sb.append('\n').toString();
    }

    /** Indented outline of the subtree below {@code root}. */
    public static String dumpTree(FaultNode root) {
        StringBuilder sb = new StringBuilder();
        dump(root, 0, new HashSet<>(), sb);
        return sb.toString();
    }

    private static void dump(FaultNode node, int depth, Set<Integer> seen, StringBuilder sb) {
        sb.append("  ".repeat(depth)).append(node);
        if (!node.getDisplayLabel().isEmpty())
            sb.append(" : ").append(node.getDisplayLabel());
        if (!seen.add(node.getUniqueId())) {
            sb.append(" (see above)\n");
            return;
        }
        sb.append('\n');
        for (FaultNode c : node.getChildren())
            dump(c, depth + 1, seen, sb);
    }
}
