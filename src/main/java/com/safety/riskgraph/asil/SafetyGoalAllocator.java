package com.safety.riskgraph.asil;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.extern.log4j.Log4j2;

/**
 * Allocates ASILs to safety goals: each goal inherits the highest ASIL of the
 * hazards mapped to it.
 */
@Log4j2
public final class SafetyGoalAllocator {
    private SafetyGoalAllocator() {
        // Utility class
    }

    /** Goal name to ASIL, in first-seen order. Rows without a safety goal are skipped. */
    public static Map<String, Asil> allocate(Collection<HazardEntry> entries) {
        Map<String, Asil> result = new LinkedHashMap<>();
        for (HazardEntry e : entries) {
            String goal = e.getSafetyGoal();
            if (goal == null || goal.isBlank()) {
                log.debug("Hazard '{}' has no safety goal", e.getHazard());
                continue;
            }
            Asil asil = e.recalculate();
            result.merge(goal, asil, Asil::max);
        }
        return result;
    }

    /** Highest ASIL among the requirements allocated to an element; QM when there are none. */
    public static Asil allocatedAsil(Collection<String> requirementAsils) {
        return Asil.highest(requirementAsils);
    }
}
