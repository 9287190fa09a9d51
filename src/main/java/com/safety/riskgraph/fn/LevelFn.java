package com.safety.riskgraph.fn;

/**
 * Functional interface for combining integer assurance levels (1..5) of the
 * children of a gate into the level of the gate.
 */
@FunctionalInterface
public interface LevelFn {
    /**
     * @param levels Child levels in child order (read-only, transient).
     * @return The combined level, always within [1,5].
     */
    int apply(int[] levels);
}
