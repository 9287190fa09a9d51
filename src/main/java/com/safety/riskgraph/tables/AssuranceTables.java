package com.safety.riskgraph.tables;

import java.util.Map;

/**
 * Fixed lookup tables of the Prototype Assurance Level (PAL) calculus.
 *
 * All tables are pure data: immutable, keyed by level tuples, and shared by
 * every calculator. Levels are integers on the 1..5 scale.
 *
 * Base derivation ({@link #deriveFromBase(int, int)}):
 * A 5x5 inversion matrix indexed by (confidence, robustness). Low confidence
 * and low robustness demand high assurance, so the matrix is monotonically
 * non-increasing along both axes, from 5 at (1,1) down to 1 at (5,5).
 *
 * AND aggregation ({@link #andPair(int, int)}):
 * A symmetric pairwise table. Combining two children under an AND never yields
 * less than the larger of the two and saturates at 5 as soon as either side is
 * 4 or 5. Pairs missing from the table fall back to the larger level.
 */
public final class AssuranceTables {
    private AssuranceTables() {
        // Utility class
    }

    // Rows are confidence 1..5, columns robustness 1..5.
    private static final int[][] ASSURANCE_MATRIX = {
            { 5, 4, 4, 3, 3 },
            { 4, 4, 3, 3, 2 },
            { 4, 3, 3, 2, 2 },
            { 3, 3, 2, 2, 1 },
            { 3, 2, 2, 1, 1 },
    };

    private static final Map<LevelPair, Integer> AND_AGGREGATION = Map.ofEntries(
            Map.entry(LevelPair.of(1, 1), 3),
            Map.entry(LevelPair.of(1, 2), 4), Map.entry(LevelPair.of(2, 2), 4),
            Map.entry(LevelPair.of(1, 3), 4), Map.entry(LevelPair.of(2, 3), 4), Map.entry(LevelPair.of(3, 3), 5),
            Map.entry(LevelPair.of(1, 4), 5), Map.entry(LevelPair.of(2, 4), 5), Map.entry(LevelPair.of(3, 4), 5),
            Map.entry(LevelPair.of(4, 4), 5),
            Map.entry(LevelPair.of(1, 5), 5), Map.entry(LevelPair.of(2, 5), 5), Map.entry(LevelPair.of(3, 5), 5),
            Map.entry(LevelPair.of(4, 5), 5), Map.entry(LevelPair.of(5, 5), 5));

    /**
     * Looks up the base assurance for averaged confidence and robustness
     * levels. Out-of-range inputs are clipped to [1,5].
     */
    public static int deriveFromBase(int confidence, int robustness) {
        return ASSURANCE_MATRIX[clip(confidence) - 1][clip(robustness) - 1];
    }

    /**
     * Combines two child levels under an AND gate. Unknown pairs resolve to
     * {@code max(a, b)}.
     */
    public static int andPair(int a, int b) {
        LevelPair pair = LevelPair.of(a, b);
        return AND_AGGREGATION.getOrDefault(pair, pair.max());
    }

    private static int clip(int level) {
        return Math.max(1, Math.min(5, level));
    }
}
