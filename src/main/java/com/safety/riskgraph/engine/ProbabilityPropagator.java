package com.safety.riskgraph.engine;

import com.safety.riskgraph.api.CalculationListener;
import com.safety.riskgraph.api.GateType;
import com.safety.riskgraph.api.NodeType;
import com.safety.riskgraph.model.FaultNode;
import com.safety.riskgraph.util.Coercions;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Quantitative fault tree evaluation under the independence assumption.
 * <p>
 * Basic events contribute their failure probability, clipped to [0,1] with a
 * listener warning when out of range; AND gates multiply their
 * children, every other gate combines them as {@code 1 - prod(1 - p)}. Each
 * child is evaluated with its own copy of the visited set, so a subtree
 * shared by two gates counts under both while a cycle still terminates.
 */
public final class ProbabilityPropagator {
    private static final Logger log = LogManager.getLogger(ProbabilityPropagator.class);

    private final CalculationListener listener;
    private long pass;
    private int evaluated;

    public ProbabilityPropagator() {
        this(CalculationListener.NOOP);
    }

    public ProbabilityPropagator(CalculationListener listener) {
        this.listener = listener != null ? listener : CalculationListener.NOOP;
    }

    void beginPass(long pass) {
        this.pass = pass;
        this.evaluated = 0;
    }

    int evaluated() {
        return evaluated;
    }

    /**
     * Computes and stamps the failure probability of {@code node}.
     *
     * @param visited Ids on the current path; copied for every child.
     */
    public double propagate(FaultNode node, Set<Integer> visited) {
        if (!visited.add(node.getUniqueId())) {
            Double p = node.getProbability();
            return p != null ? p : 0.0;
        }

        if (node.getNodeType() == NodeType.BASIC_EVENT || node.isLeaf())
            return stamp(node, leafProbability(node));

        List<FaultNode> children = node.getChildren();
        double[] probs = new double[children.size()];
        for (int i = 0; i < probs.length; i++)
            probs[i] = propagate(children.get(i), new HashSet<>(visited));

        return stamp(node, GateType.orDefault(node.getGateType()).probabilityFn().apply(probs));
    }

    private double leafProbability(FaultNode node) {
        Double p = node.getFailureProb();
        if (p == null || p.isNaN()) {
            if (node.getNodeType() == NodeType.BASIC_EVENT)
                listener.onNodeWarning(pass, node.getUniqueId(), "no failure probability, using 0");
            return 0.0;
        }
        if (p < 0.0 || p > 1.0) {
            listener.onNodeWarning(pass, node.getUniqueId(), "failure probability " + p + " outside [0,1], clipped");
            return Coercions.clip(p.doubleValue(), 0.0, 1.0);
        }
        return p;
    }

    private double stamp(FaultNode node, double p) {
        node.setProbability(p);
        node.setDisplayLabel(label(p));
        evaluated++;
        listener.onNodeEvaluated(pass, node.getUniqueId(), node.getNodeType(), p);
        if (log.isDebugEnabled())
            log.debug("P({}) = {}", node, p);
        return p;
    }

    static String label(double p) {
        return String.format(Locale.ROOT, "P=%.2e", p);
    }
}
