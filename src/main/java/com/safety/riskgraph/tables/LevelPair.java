package com.safety.riskgraph.tables;

/**
 * Unordered pair of assurance levels used as a table key. The factory sorts
 * the pair so that {@code of(4, 2)} and {@code of(2, 4)} are the same key.
 */
public record LevelPair(int low, int high) {

    public LevelPair {
        if (low > high)
            throw new IllegalArgumentException("LevelPair must be ordered: " + low + " > " + high);
    }

    public static LevelPair of(int a, int b) {
        return a <= b ? new LevelPair(a, b) : new LevelPair(b, a);
    }

    public int max() {
        return high;
    }

    @Override
    public String toString() {
        return "(" + low + "," + high + ")";
    }
}
