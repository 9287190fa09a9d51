package com.safety.riskgraph.tables;

import java.util.List;
import java.util.Map;

/**
 * Reverse lookups of the gate aggregation rules: for a required parent
 * assurance level, which pairs of child levels produce it.
 *
 * Used when a requirement on a gate is decomposed onto its two children. The
 * AND list is the curated subset of {@link AssuranceTables#andPair(int, int)}
 * offered to analysts; the OR list follows the {@code 6 - avg} inversion of
 * identical children.
 */
public final class AssuranceDecomposition {
    private AssuranceDecomposition() {
        // Utility class
    }

    private static final Map<Integer, List<LevelPair>> AND_DECOMPOSITION = Map.of(
            3, List.of(LevelPair.of(1, 1)),
            4, List.of(LevelPair.of(1, 2), LevelPair.of(2, 2), LevelPair.of(1, 3), LevelPair.of(2, 3)),
            5, List.of(LevelPair.of(1, 4), LevelPair.of(2, 4), LevelPair.of(3, 4), LevelPair.of(4, 4),
                    LevelPair.of(1, 5), LevelPair.of(2, 5), LevelPair.of(3, 5), LevelPair.of(4, 5),
                    LevelPair.of(5, 5)));

    private static final Map<Integer, List<LevelPair>> OR_DECOMPOSITION = Map.of(
            1, List.of(LevelPair.of(5, 5)),
            2, List.of(LevelPair.of(4, 4)),
            3, List.of(LevelPair.of(3, 3)),
            4, List.of(LevelPair.of(2, 2)),
            5, List.of(LevelPair.of(1, 1)));

    /** Child pairs that combine to {@code level} under AND; empty for levels 1 and 2. */
    public static List<LevelPair> andPairsFor(int level) {
        return AND_DECOMPOSITION.getOrDefault(level, List.of());
    }

    /** Child pairs that combine to {@code level} under OR. */
    public static List<LevelPair> orPairsFor(int level) {
        return OR_DECOMPOSITION.getOrDefault(level, List.of());
    }
}
