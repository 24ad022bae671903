package com.example.sandstormtracker.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for StatBatch key derivation.
 */
class StatBatchTest {

    @Test
    void testDeltaKeysAreUniqueWithinBatch() {
        StatBatch batch = new StatBatch("file-1:200", "m1")
                .add("steam:1", "Alice", StatMetric.KILLS)
                .add("steam:1", "Alice", StatMetric.WEAPON_KILLS, "AK74", 1)
                .add("steam:2", "Bob", StatMetric.DEATHS);

        assertEquals(3, batch.getDeltas().size());
        assertEquals("file-1:200#0", batch.getDeltas().get(0).getIdempotencyKey());
        assertEquals("file-1:200#2", batch.getDeltas().get(2).getIdempotencyKey());
        assertEquals("AK74", batch.getDeltas().get(1).getWeapon());
        assertEquals("m1", batch.getDeltas().get(2).getMatchId());
    }

    @Test
    void testDeltasAreReadOnly() {
        StatBatch batch = new StatBatch("k", "m1");

        assertTrue(batch.isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> batch.getDeltas().add(new StatDelta()));
    }
}
