package com.safety.riskgraph.asil;

import java.util.List;
import java.util.Map;

/**
 * ASIL decomposition schemes: the pairs of ASILs a requirement may be split
 * into, each tagged with the level it was decomposed from.
 */
public final class AsilDecomposition {
    private AsilDecomposition() {
        // Utility class
    }

    /** One admissible split, e.g. {@code B(D) + B(D)}. */
    public record DecompositionOption(Asil first, Asil second, Asil original) {

        public String firstLabel() {
            return label(first);
        }

        public String secondLabel() {
            return label(second);
        }

        private String label(Asil part) {
            return "ASIL " + part.name() + "(" + original.name() + ")";
        }

        @Override
        public String toString() {
            return firstLabel() + " + " + secondLabel();
        }
    }

    private static final Map<Asil, List<DecompositionOption>> SCHEMES = Map.of(
            Asil.D, List.of(
                    option(Asil.B, Asil.B, Asil.D),
                    option(Asil.C, Asil.QM, Asil.D),
                    option(Asil.A, Asil.C, Asil.D),
                    option(Asil.B, Asil.QM, Asil.D)),
            Asil.C, List.of(
                    option(Asil.B, Asil.A, Asil.C),
                    option(Asil.C, Asil.QM, Asil.C)),
            Asil.B, List.of(
                    option(Asil.A, Asil.A, Asil.B),
                    option(Asil.B, Asil.QM, Asil.B)),
            Asil.A, List.of(
                    option(Asil.A, Asil.QM, Asil.A)));

    private static DecompositionOption option(Asil first, Asil second, Asil original) {
        return new DecompositionOption(first, second, original);
    }

    /** Admissible splits of {@code asil}; empty for QM. */
    public static List<DecompositionOption> schemesFor(Asil asil) {
        return SCHEMES.getOrDefault(asil, List.of());
    }

    public static List<DecompositionOption> schemesFor(String asil) {
        return schemesFor(Asil.parse(asil));
    }
}
