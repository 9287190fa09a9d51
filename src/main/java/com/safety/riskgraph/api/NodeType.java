package com.safety.riskgraph.api;

/**
 * Kinds of analysis node that can appear in a fault-tree style DAG.
 *
 * <p>
 * The same DAG hosts several analyses at once: PAL assurance trees (confidence
 * and robustness leaves under gates), classical FTA (basic events under gates)
 * and SOTIF style chains (triggering conditions and functional
 * insufficiencies). Each calculator only interprets the types it understands
 * and treats the rest as generic composite or leaf nodes.
 */
public enum NodeType {
    CONFIDENCE_LEVEL("Confidence Level"),
    ROBUSTNESS_SCORE("Robustness Score"),
    BASIC_EVENT("Basic Event"),
    GATE("Gate"),
    RIGOR_LEVEL("Rigor Level"),
    TOP_EVENT("Top Event"),
    TRIGGERING_CONDITION("Triggering Condition"),
    FUNCTIONAL_INSUFFICIENCY("Functional Insufficiency");

    private final String displayName;

    NodeType(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /** True for the two leaf kinds that feed the base assurance matrix. */
    public boolean isBaseAssurance() {
        return this == CONFIDENCE_LEVEL || this == ROBUSTNESS_SCORE;
    }

    /**
     * Accepts the enum constant name or the display name, ignoring case, with
     * spaces and underscores treated alike ("TOP EVENT", "Top Event",
     * "top_event").
     */
    public static NodeType fromString(String text) {
        if (text != null) {
            String normalized = text.trim().replace(' ', '_');
            for (NodeType t : values()) {
                if (t.name().equalsIgnoreCase(normalized)) {
                    return t;
                }
            }
        }
        throw new IllegalArgumentException("Unknown NodeType: " + text);
    }
}
