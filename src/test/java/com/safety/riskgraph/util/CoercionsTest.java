package com.safety.riskgraph.util;

import org.junit.Test;

import static org.junit.Assert.*;

public class CoercionsTest {

    @Test
    public void testToDouble() {
        assertEquals(2.5, Coercions.toDouble(2.5f, 0.0), 0.0);
        assertEquals(3.0, Coercions.toDouble(" 3 ", 0.0), 0.0);
        assertEquals(-1.0, Coercions.toDouble("abc", -1.0), 0.0);
        assertEquals(-1.0, Coercions.toDouble(Double.NaN, -1.0), 0.0);
        assertEquals(-1.0, Coercions.toDouble(null, -1.0), 0.0);
        assertEquals(-1.0, Coercions.toDouble(new Object(), -1.0), 0.0);
    }

    @Test
    public void testToIntTruncates() {
        assertEquals(3, Coercions.toInt(3.9, 0));
        assertEquals(-2, Coercions.toInt("-2.7", 0));
        assertEquals(7, Coercions.toInt("x", 7));
        assertEquals(7, Coercions.toInt(Double.POSITIVE_INFINITY, 7));
    }

    @Test
    public void testClip() {
        assertEquals(1, Coercions.clip(0, 1, 5));
        assertEquals(5, Coercions.clip(9, 1, 5));
        assertEquals(3, Coercions.clip(3, 1, 5));
        assertEquals(1.0, Coercions.clip(0.2, 1.0, 5.0), 0.0);
    }
}
