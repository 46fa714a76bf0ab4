package com.acme.strmatch.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class AlleleSetTest {

    @Test
    void sortsAndDeduplicates() {
        AlleleSet s = AlleleSet.of(12, 9.3, 12, 9);
        assertArrayEquals(new double[]{9, 9.3, 12}, s.values());
        assertEquals(9.0, s.min());
        assertEquals(12.0, s.max());
        assertEquals("9,9.3,12", s.toString());
    }

    @Test
    void equalityIsByValue() {
        assertEquals(AlleleSet.of(10, 11), AlleleSet.of(11, 10, 10));
        assertEquals(AlleleSet.of(10, 11).hashCode(), AlleleSet.of(11, 10).hashCode());
        assertNotEquals(AlleleSet.of(10), AlleleSet.of(10, 11));
    }

    @Test
    void intersection() {
        assertTrue(AlleleSet.of(8, 10, 14).intersects(AlleleSet.of(11, 14)));
        assertFalse(AlleleSet.of(8, 10).intersects(AlleleSet.of(9, 11)));
    }

    @Test
    void valuesAreDefensiveCopies() {
        AlleleSet s = AlleleSet.of(10);
        s.values()[0] = 99;
        assertTrue(s.contains(10));
    }

    @Test
    void emptyIsRejected() {
        assertThrows(IllegalArgumentException.class, AlleleSet::of);
    }
}
