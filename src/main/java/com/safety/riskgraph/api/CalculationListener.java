package com.safety.riskgraph.api;

/**
 * Observability interface for monitoring recalculation passes.
 *
 * Implementations can be registered with the RiskEngine to receive callbacks
 * while a tree is being annotated. This is the primary mechanism for:
 *
 * - Auditing: recording which nodes received which value in a given pass.
 * - Debugging: tracing fallbacks to neutral defaults (non-numeric inputs, missing FIT).
 * - Metrics: counting evaluated nodes per pass.
 *
 * Callbacks run inside the recursive traversal and must not mutate the tree.
 */
public interface CalculationListener {

    /** Listener that ignores every callback. */
    CalculationListener NOOP = new CalculationListener() {
        @Override
        public void onPassStart(long pass, String operation) {
        }

        @Override
        public void onNodeEvaluated(long pass, int nodeId, NodeType type, double value) {
        }

        @Override
        public void onNodeWarning(long pass, int nodeId, String message) {
        }

        @Override
        public void onPassEnd(long pass, String operation, int nodesEvaluated) {
        }
    };

    /**
     * Called immediately before a pass begins.
     *
     * @param pass      The incrementing pass number of the engine.
     * @param operation Name of the entry point ("assurance", "probability", ...).
     */
    void onPassStart(long pass, String operation);

    /**
     * Called after a node has been evaluated and annotated.
     *
     * @param pass   Current pass number.
     * @param nodeId Unique id of the node.
     * @param type   Node type.
     * @param value  The value stamped on the node.
     */
    void onNodeEvaluated(long pass, int nodeId, NodeType type, double value);

    /**
     * Called when a node's inputs forced a fallback to a neutral default.
     *
     * @param pass    Current pass number.
     * @param nodeId  Unique id of the node.
     * @param message Human-readable description of the fallback.
     */
    void onNodeWarning(long pass, int nodeId, String message);

    /**
     * Called when the pass is fully complete.
     *
     * @param pass           Current pass number.
     * @param operation      Name of the entry point.
     * @param nodesEvaluated Number of node evaluations in this pass.
     */
    void onPassEnd(long pass, String operation, int nodesEvaluated);
}
