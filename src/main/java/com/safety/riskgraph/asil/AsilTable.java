package com.safety.riskgraph.asil;

import java.util.HashMap;
import java.util.Map;

/**
 * ISO 26262 risk graph: (severity 1..3, controllability 1..3, exposure 1..4)
 * to ASIL.
 *
 * Controllability is keyed with 1 as the hardest to control (C3 in the
 * standard's naming), so the worst case is {@code (3, 1, 4) -> D}. Every
 * combination outside the table, including out-of-range inputs, is
 * {@link Asil#QM}.
 */
public final class AsilTable {
    private AsilTable() {
        // Utility class
    }

    private static final Map<Key, Asil> TABLE = new HashMap<>();

    private record Key(int severity, int controllability, int exposure) {
    }

    static {
        // Severity 1
        row(1, 1, Asil.QM, Asil.QM, Asil.QM, Asil.B);
        row(1, 2, Asil.QM, Asil.QM, Asil.QM, Asil.A);
        row(1, 3, Asil.QM, Asil.QM, Asil.QM, Asil.QM);
        // Severity 2
        row(2, 1, Asil.QM, Asil.A, Asil.B, Asil.C);
        row(2, 2, Asil.QM, Asil.QM, Asil.A, Asil.B);
        row(2, 3, Asil.QM, Asil.QM, Asil.QM, Asil.A);
        // Severity 3
        row(3, 1, Asil.A, Asil.B, Asil.C, Asil.D);
        row(3, 2, Asil.QM, Asil.A, Asil.B, Asil.C);
        row(3, 3, Asil.QM, Asil.QM, Asil.A, Asil.B);
    }

    private static void row(int severity, int controllability, Asil... byExposure) {
        for (int e = 0; e < byExposure.length; e++)
            TABLE.put(new Key(severity, controllability, e + 1), byExposure[e]);
    }

    public static Asil calcAsil(int severity, int controllability, int exposure) {
        return TABLE.getOrDefault(new Key(severity, controllability, exposure), Asil.QM);
    }
}
