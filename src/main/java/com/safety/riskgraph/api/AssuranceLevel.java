package com.safety.riskgraph.api;

/**
 * Qualitative Prototype Assurance Level (PAL) on the 1..5 scale.
 *
 * <p>
 * Continuous values are discretized with the thresholds 1.5 / 2.5 / 3.5 / 4.5,
 * each threshold belonging to the upper level (1.5 is {@link #LOW}, 4.5 is
 * {@link #HIGH_PLUS}).
 */
public enum AssuranceLevel {
    EXTRA_LOW(1, "Extra Low"),
    LOW(2, "Low"),
    MODERATE(3, "Moderate"),
    HIGH(4, "High"),
    HIGH_PLUS(5, "High+");

    private final int level;
    private final String label;

    AssuranceLevel(int level, String label) {
        this.level = level;
        this.label = label;
    }

    public int level() {
        return level;
    }

    public String label() {
        return label;
    }

    /** Maps a continuous assurance value onto its integer level 1..5. */
    public static int discretize(double value) {
        if (value < 1.5)
            return 1;
        if (value < 2.5)
            return 2;
        if (value < 3.5)
            return 3;
        if (value < 4.5)
            return 4;
        return 5;
    }

    public static AssuranceLevel fromValue(double value) {
        return ofLevel(discretize(value));
    }

    /** Out-of-range levels are clipped to [1,5]. */
    public static AssuranceLevel ofLevel(int level) {
        int clipped = Math.max(1, Math.min(5, level));
        return values()[clipped - 1];
    }
}
