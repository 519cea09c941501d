package com.questrail.tso.api;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TimestampTest {

    @Test
    void ordersByPhysicalThenLogical() {
        Timestamp a = new Timestamp(1000, 5);
        Timestamp b = new Timestamp(1000, 6);
        Timestamp c = new Timestamp(1001, 0);

        assertTrue(b.isAfter(a));
        assertTrue(c.isAfter(b));
        assertFalse(a.isAfter(a));

        List<Timestamp> list = new ArrayList<>(List.of(c, a, b));
        Collections.sort(list);
        assertEquals(List.of(a, b, c), list);
    }

    @Test
    void rejectsLogicalOutsideRange() {
        assertThrows(IllegalArgumentException.class, () -> new Timestamp(1, -1));
        assertThrows(IllegalArgumentException.class, () -> new Timestamp(1, Timestamp.MAX_LOGICAL));
        assertThrows(IllegalArgumentException.class, () -> new Timestamp(-1, 0));
        assertDoesNotThrow(() -> new Timestamp(1, Timestamp.MAX_LOGICAL - 1));
    }

    @Test
    void nextStaysWithinPhysical() {
        Timestamp first = new Timestamp(1000, 10);

        assertEquals(new Timestamp(1000, 13), first.next(3));
        assertEquals(first, first.next(0));
        assertThrows(IllegalArgumentException.class, () -> first.next(-1));
        assertThrows(IllegalArgumentException.class, () -> first.next((int) Timestamp.MAX_LOGICAL));
    }

    @Test
    void composedFormPreservesOrder() {
        Timestamp a = new Timestamp(1_700_000_000_000L, Timestamp.MAX_LOGICAL - 1);
        Timestamp b = new Timestamp(1_700_000_000_001L, 0);

        assertTrue(b.toComposed() > a.toComposed());
        assertEquals(a, Timestamp.fromComposed(a.toComposed()));
        assertEquals((1L << 18) | 7, new Timestamp(1, 7).toComposed());
    }
}
