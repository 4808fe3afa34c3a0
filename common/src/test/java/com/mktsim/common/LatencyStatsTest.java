package com.mktsim.common;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LatencyStatsTest {

    @Test
    void testRecordAndReset() {
        LatencyStats stats = new LatencyStats("test");
        stats.record(1_000);
        stats.record(2_000);
        stats.record(-5);

        assertEquals(3, stats.count());
        assertTrue(stats.percentileMicros(100) >= 1.99);

        stats.logAndReset();
        assertEquals(0, stats.count());
    }
}
