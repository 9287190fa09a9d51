package com.safety.riskgraph.fn;

/**
 * Functional interface for a probability combination over N child values.
 *
 * Implementations must not capture or store the "inputs" array; callers may
 * reuse it between invocations.
 */
@FunctionalInterface
public interface FnN {
    /**
     * Computes a result from an array of inputs.
     *
     * @param inputs The input values (read-only, transient).
     * @return The result.
     */
    double apply(double[] inputs);
}
