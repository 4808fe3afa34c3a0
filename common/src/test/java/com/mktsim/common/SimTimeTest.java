package com.mktsim.common;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SimTimeTest {

    @Test
    void testParseAndFormat() {
        long t = SimTime.parse("2021-03-22T10:30:00.000000123Z");
        assertEquals(1616409000000000123L, t);
        assertEquals("2021-03-22 10:30:00.000000123", SimTime.format(t));
    }

    @Test
    void testZoneLessIsUtc() {
        assertEquals(SimTime.parse("2021-03-22T10:30:00Z"), SimTime.parse("2021-03-22 10:30:00"));
    }

    @Test
    void testOfSeconds() {
        assertEquals(1_500_000_000L, SimTime.ofSeconds(1.5));
    }
}
