package com.safety.riskgraph.asil;

import java.util.Collection;

/**
 * Automotive Safety Integrity Level, ordered {@code QM < A < B < C < D}.
 *
 * <p>
 * Decomposed variants such as {@code B(D)} or {@code QM(C)} rank as their base
 * letter; the parenthesised original level only documents where the
 * requirement came from.
 */
public enum Asil {
    QM,
    A,
    B,
    C,
    D;

    public int rank() {
        return ordinal();
    }

    public boolean isAtLeast(Asil other) {
        return rank() >= other.rank();
    }

    /**
     * Parses "D", "ASIL B(D)", "qm(a)" and the like. Missing or unknown text
     * reads as {@link #QM}.
     */
    public static Asil parse(String text) {
        if (text == null)
            return QM;
        String s = text.trim().toUpperCase();
        if (s.startsWith("ASIL"))
            s = s.substring(4).trim();
        int paren = s.indexOf('(');
        if (paren >= 0)
            s = s.substring(0, paren).trim();
        for (Asil a : values()) {
            if (a.name().equals(s))
                return a;
        }
        return QM;
    }

    public static Asil max(Asil a, Asil b) {
        if (a == null)
            return b == null ? QM : b;
        if (b == null)
            return a;
        return a.rank() >= b.rank() ? a : b;
    }

    /** Highest level among the given ASIL strings; {@link #QM} when empty. */
    public static Asil highest(Collection<String> asils) {
        Asil result = QM;
        if (asils != null) {
            for (String s : asils)
                result = max(result, parse(s));
        }
        return result;
    }
}
