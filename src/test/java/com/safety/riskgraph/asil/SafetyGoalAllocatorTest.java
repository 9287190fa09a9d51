package com.safety.riskgraph.asil;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class SafetyGoalAllocatorTest {

    @Test
    public void testHazardEntryDerivesAsil() {
        HazardEntry e = new HazardEntry("No braking", "Collision", 3, 1, 4, "SG1");
        assertEquals(Asil.D, e.getAsil());

        e.setExposure(1);
        assertEquals(Asil.A, e.getAsil());
        e.setSeverity(2);
        assertEquals(Asil.QM, e.getAsil());
        e.setControllability(1);
        e.setExposure(4);
        assertEquals(Asil.C, e.getAsil());
    }

    @Test
    public void testHazardEntryFromJsonIgnoresStoredAsil() throws Exception {
        HazardEntry e = new ObjectMapper().readValue(
                "{\"hazard\":\"Collision\",\"severity\":3,\"controllability\":1,\"exposure\":4,\"asil\":\"QM\"}",
                HazardEntry.class);

        assertEquals(Asil.D, e.getAsil());
    }

    @Test
    public void testGoalTakesHighestHazardAsil() {
        List<HazardEntry> entries = List.of(
                new HazardEntry("m1", "h1", 2, 2, 3, "SG1"),
                new HazardEntry("m2", "h2", 3, 1, 4, "SG1"),
                new HazardEntry("m3", "h3", 1, 1, 4, "SG2"),
                new HazardEntry("m4", "h4", 3, 3, 4, ""));

        Map<String, Asil> goals = SafetyGoalAllocator.allocate(entries);

        assertEquals(2, goals.size());
        assertEquals(Asil.D, goals.get("SG1"));
        assertEquals(Asil.B, goals.get("SG2"));
    }

    @Test
    public void testAllocatedAsil() {
        assertEquals(Asil.D, SafetyGoalAllocator.allocatedAsil(List.of("B", "D")));
        assertEquals(Asil.QM, SafetyGoalAllocator.allocatedAsil(List.of()));
    }
}
