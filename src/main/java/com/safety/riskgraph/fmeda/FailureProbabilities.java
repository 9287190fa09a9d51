package com.safety.riskgraph.fmeda;

import com.safety.riskgraph.api.ProbabilityFormula;
import com.safety.riskgraph.model.FaultNode;

/**
 * FIT rate to mission failure probability.
 * <p>
 * Formulas, with {@code lambda = FIT / 1e9} per hour:
 * linear {@code p = lambda * tau}, exponential {@code p = 1 - exp(-lambda * tau)},
 * constant {@code p = node.failureProb}.
 */
public final class FailureProbabilities {
    private FailureProbabilities() {
        // Utility class
    }

    public static final double FIT_SCALE = 1e9;

    /**
     * @param node    The basic event; only read for the constant formula.
     * @param formula Conversion to apply; null means the node's own formula.
     * @param fit     FIT rate of the failure mode.
     * @param tau     Mission duration in hours.
     */
    public static double compute(FaultNode node, ProbabilityFormula formula, double fit, double tau) {
        ProbabilityFormula f = formula != null ? formula : node.getProbFormula();
        if (f == null)
            f = ProbabilityFormula.LINEAR;
        if (f == ProbabilityFormula.CONSTANT) {
            Double p = node.getFailureProb();
            return p != null && !p.isNaN() ? p : 0.0;
        }
        double lambda = (Double.isNaN(fit) ? 0.0 : fit) / FIT_SCALE;
        double t = tau > 0.0 ? tau : 1.0;
        if (f == ProbabilityFormula.EXPONENTIAL)
            return 1.0 - Math.exp(-lambda * t);
        return lambda * t;
    }

    public static double compute(FaultNode node, ProbabilityFormula formula, double fit, MissionProfile profile) {
        return compute(node, formula, fit, profile != null ? profile.tau() : 1.0);
    }
}
