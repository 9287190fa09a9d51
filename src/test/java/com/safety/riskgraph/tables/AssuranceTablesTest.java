package com.safety.riskgraph.tables;

import com.safety.riskgraph.fn.gate.InvertedMeanOrAssurance;
import org.junit.Test;

import static org.junit.Assert.*;

public class AssuranceTablesTest {

    @Test
    public void testBaseMatrixIsNonIncreasingInBothAxes() {
        for (int c = 1; c <= 5; c++) {
            for (int r = 1; r <= 5; r++) {
                int v = AssuranceTables.deriveFromBase(c, r);
                if (c < 5)
                    assertTrue("confidence axis at " + c + "," + r, AssuranceTables.deriveFromBase(c + 1, r) <= v);
                if (r < 5)
                    assertTrue("robustness axis at " + c + "," + r, AssuranceTables.deriveFromBase(c, r + 1) <= v);
            }
        }
        assertEquals(5, AssuranceTables.deriveFromBase(1, 1));
        assertEquals(1, AssuranceTables.deriveFromBase(5, 5));
    }

    @Test
    public void testBaseMatrixClipsInputs() {
        assertEquals(AssuranceTables.deriveFromBase(1, 5), AssuranceTables.deriveFromBase(0, 9));
    }

    @Test
    public void testAndPairTable() {
        assertEquals(5, AssuranceTables.andPair(5, 5));
        assertEquals(3, AssuranceTables.andPair(1, 1));
        assertEquals(4, AssuranceTables.andPair(2, 1));
        assertEquals(5, AssuranceTables.andPair(3, 3));
        for (int a = 1; a <= 5; a++) {
            for (int b = 1; b <= 5; b++) {
                int v = AssuranceTables.andPair(a, b);
                assertEquals(v, AssuranceTables.andPair(b, a));
                assertTrue(v >= Math.max(a, b));
                if (a >= 4 || b >= 4)
                    assertEquals(5, v);
            }
        }
    }

    @Test
    public void testAndDecompositionReproducesParentLevel() {
        for (int level = 1; level <= 5; level++) {
            for (LevelPair p : AssuranceDecomposition.andPairsFor(level))
                assertEquals(p.toString(), level, AssuranceTables.andPair(p.low(), p.high()));
        }
        assertTrue(AssuranceDecomposition.andPairsFor(1).isEmpty());
        assertEquals(9, AssuranceDecomposition.andPairsFor(5).size());
    }

    @Test
    public void testOrDecompositionReproducesParentLevel() {
        InvertedMeanOrAssurance or = new InvertedMeanOrAssurance();
        for (int level = 1; level <= 5; level++) {
            LevelPair p = AssuranceDecomposition.orPairsFor(level).get(0);
            assertEquals(level, or.apply(new int[] { p.low(), p.high() }));
        }
    }

    @Test
    public void testLevelPairOrdering() {
        assertEquals(LevelPair.of(4, 2), LevelPair.of(2, 4));
        assertEquals("(2,4)", LevelPair.of(4, 2).toString());
        assertEquals(4, LevelPair.of(4, 2).max());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnorderedPairRejected() {
        new LevelPair(3, 1);
    }
}
