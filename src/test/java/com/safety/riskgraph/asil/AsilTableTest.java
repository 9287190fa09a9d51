package com.safety.riskgraph.asil;

import org.junit.Test;

import static org.junit.Assert.*;

public class AsilTableTest {

    @Test
    public void testWorstAndBenignCases() {
        assertEquals(Asil.D, AsilTable.calcAsil(3, 1, 4));
        assertEquals(Asil.QM, AsilTable.calcAsil(2, 3, 1));
        assertEquals(Asil.QM, AsilTable.calcAsil(1, 3, 4));
    }

    @Test
    public void testRows() {
        assertEquals(Asil.B, AsilTable.calcAsil(1, 1, 4));
        assertEquals(Asil.C, AsilTable.calcAsil(2, 1, 4));
        assertEquals(Asil.A, AsilTable.calcAsil(3, 1, 1));
        assertEquals(Asil.A, AsilTable.calcAsil(2, 2, 3));
        assertEquals(Asil.B, AsilTable.calcAsil(3, 3, 4));
    }

    @Test
    public void testMissingCombinationsAreQm() {
        assertEquals(Asil.QM, AsilTable.calcAsil(0, 1, 4));
        assertEquals(Asil.QM, AsilTable.calcAsil(3, 1, 5));
        assertEquals(Asil.QM, AsilTable.calcAsil(4, 4, 4));
    }

    @Test
    public void testRiskGraphIsMonotone() {
        for (int s = 1; s <= 3; s++) {
            for (int c = 1; c <= 3; c++) {
                for (int e = 1; e <= 4; e++) {
                    Asil v = AsilTable.calcAsil(s, c, e);
                    if (s < 3)
                        assertTrue(AsilTable.calcAsil(s + 1, c, e).isAtLeast(v));
                    if (e < 4)
                        assertTrue(AsilTable.calcAsil(s, c, e + 1).isAtLeast(v));
                    if (c < 3)
                        assertTrue(v.isAtLeast(AsilTable.calcAsil(s, c + 1, e)));
                }
            }
        }
    }
}
