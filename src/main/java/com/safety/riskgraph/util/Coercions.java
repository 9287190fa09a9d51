package com.safety.riskgraph.util;

/**
 * Conversions for attribute values that arrive untyped (loaded from
 * JSON, typed into a table cell). Nothing here throws; unparsable input yields
 * the caller's default.
 */
public final class Coercions {
    private Coercions() {
        // Utility class
    }

    public static double toDouble(Object value, double fallback) {
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return Double.isNaN(d) ? fallback : d;
        }
        if (value instanceof String s) {
            try {
                double d = Double.parseDouble(s.trim());
                return Double.isNaN(d) ? fallback : d;
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }

    /** Truncates toward zero, like a plain integer cast. */
    public static int toInt(Object value, int fallback) {
        double d = toDouble(value, Double.NaN);
        if (Double.isNaN(d) || Double.isInfinite(d))
            return fallback;
        return (int) d;
    }

    public static int clip(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    public static double clip(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
