package com.safety.riskgraph.util;

import com.safety.riskgraph.api.CalculationListener;
import com.safety.riskgraph.api.NodeType;

import java.util.EnumMap;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A listener that keeps counters over recalculation passes.
 *
 * <p>
 * Captures:
 * <ul>
 * <li><b>Passes:</b> total number of passes and the last operation run.</li>
 * <li><b>Workload:</b> nodes evaluated in the last pass and overall, per node type.</li>
 * <li><b>Fallbacks:</b> warnings raised for defaulted inputs, logged rate-limited.</li>
 * </ul>
 */
public final class PassStatsListener implements CalculationListener {
    private static final Logger log = LogManager.getLogger(PassStatsListener.class);

    private final ErrorRateLimiter warnLimiter = new ErrorRateLimiter(log, 1000);
    private final Map<NodeType, Integer> evaluatedByType = new EnumMap<>(NodeType.class);
    private long totalPasses;
    private long totalEvaluated;
    private long totalWarnings;
    private int lastNodesEvaluated;
    private String lastOperation = "";

    @Override
    public void onPassStart(long pass, String operation) {
        lastOperation = operation;
    }

    @Override
    public void onNodeEvaluated(long pass, int nodeId, NodeType type, double value) {
        evaluatedByType.merge(type, 1, Integer::sum);
    }

    @Override
    public void onNodeWarning(long pass, int nodeId, String message) {
        totalWarnings++;
        warnLimiter.warn(String.format("Pass %d, node %d: %s", pass, nodeId, message));
    }

    @Override
    public void onPassEnd(long pass, String operation, int nodesEvaluated) {
        totalPasses++;
        lastNodesEvaluated = nodesEvaluated;
        totalEvaluated += nodesEvaluated;
    }

    public long totalPasses() {
        return totalPasses;
    }

    public long totalEvaluated() {
        return totalEvaluated;
    }

    public long totalWarnings() {
        return totalWarnings;
    }

    /** Warning lines held back by the rate limiter since the last one logged. */
    public int suppressedWarnings() {
        return warnLimiter.suppressed();
    }

    public int lastNodesEvaluated() {
        return lastNodesEvaluated;
    }

    public String lastOperation() {
        return lastOperation;
    }

    public int evaluatedCount(NodeType type) {
        return evaluatedByType.getOrDefault(type, 0);
    }

    public void reset() {
        totalPasses = 0;
        totalEvaluated = 0;
        totalWarnings = 0;
        lastNodesEvaluated = 0;
        lastOperation = "";
        evaluatedByType.clear();
    }

    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-20s | %10s\n", "Metric", "Value"));
        sb.append("-----------------------------------\n");
        sb.append(String.format("%-20s | %10d\n", "Passes", totalPasses));
        sb.append(String.format("%-20s | %10d\n", "Nodes evaluated", totalEvaluated));
        sb.append(String.format("%-20s | %10d\n", "Warnings", totalWarnings));
        sb.append(String.format("%-20s | %10d\n", "Warnings suppressed", warnLimiter.suppressed()));
        for (Map.Entry<NodeType, Integer> e : evaluatedByType.entrySet())
            sb.append(String.format("%-20s | %10d\n", e.getKey().displayName(), e.getValue()));
        return sb.toString();
    }
}
