package com.example.sandstormtracker.service;

import com.example.sandstormtracker.config.TrackerConfig;
import com.example.sandstormtracker.model.StatBatch;
import com.example.sandstormtracker.model.StatDelta;
import com.example.sandstormtracker.model.StatMetric;
import com.example.sandstormtracker.persistence.InMemoryStatsStore;
import com.example.sandstormtracker.persistence.StatsStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.transaction.support.TransactionOperations;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for StatsAggregator.
 */
@ExtendWith(MockitoExtension.class)
class StatsAggregatorTest {

    private static final String ALICE = "steam:76561198000000001";
    private static final String BOB = "steam:76561198000000002";

    @Mock
    private StatsStore mockStore;

    private TrackerConfig config;
    private InMemoryStatsStore store;
    private StatsAggregator aggregator;

    @BeforeEach
    void setUp() {
        config = new TrackerConfig();
        store = new InMemoryStatsStore();
        aggregator = new StatsAggregator(store, TransactionOperations.withoutTransaction(), config);
    }

    private static StatBatch killBatch(String key) {
        return new StatBatch(key, "m1")
                .add(ALICE, "Alice", StatMetric.KILLS)
                .add(ALICE, "Alice", StatMetric.WEAPON_KILLS, "AK74", 1)
                .add(BOB, "Bob", StatMetric.DEATHS);
    }

    @Test
    void testBatchUpdatesMatchAndAllTimeCounters() {
        assertTrue(aggregator.apply(killBatch("file-1:100")));

        assertEquals(1, store.matchStat("m1", ALICE, StatMetric.KILLS));
        assertEquals(1, store.weaponKills("m1", ALICE, "AK74"));
        assertEquals(1, store.matchStat("m1", BOB, StatMetric.DEATHS));
        assertEquals(1, store.totalStat(ALICE, StatMetric.KILLS));
        assertEquals(1, store.totalStat(BOB, StatMetric.DEATHS));
        assertEquals(1, aggregator.getBatchesApplied());
    }

    @Test
    void testRecentReplayIsSkipped() {
        aggregator.apply(killBatch("file-1:100"));

        assertFalse(aggregator.apply(killBatch("file-1:100")));

        assertEquals(1, aggregator.getDuplicatesSkipped());
        assertEquals(1, store.matchStat("m1", ALICE, StatMetric.KILLS));
    }

    @Test
    void testReplayAfterRestartIsAbsorbedByStore() {
        aggregator.apply(killBatch("file-1:100"));
        StatsAggregator restarted = new StatsAggregator(store, TransactionOperations.withoutTransaction(), config);

        restarted.apply(killBatch("file-1:100"));

        assertEquals(0, restarted.getDuplicatesSkipped());
        assertEquals(1, store.matchStat("m1", ALICE, StatMetric.KILLS));
        assertEquals(1, store.totalStat(ALICE, StatMetric.KILLS));
    }

    @Test
    void testEvictedKeyFallsBackToStore() {
        config.getAggregation().setRecentKeyWindow(2);
        aggregator = new StatsAggregator(store, TransactionOperations.withoutTransaction(), config);
        aggregator.apply(killBatch("k1"));
        aggregator.apply(killBatch("k2"));
        aggregator.apply(killBatch("k3"));

        assertTrue(aggregator.apply(killBatch("k1")));

        assertEquals(3, store.matchStat("m1", ALICE, StatMetric.KILLS));
        assertFalse(aggregator.apply(killBatch("k3")));
    }

    @Test
    void testTransientFailuresAreRetried() {
        store.failNext(2, new QueryTimeoutException("lock wait timeout"));

        assertTrue(aggregator.apply(killBatch("file-1:100")));

        assertEquals(2, aggregator.getRetries());
        assertEquals(1, store.matchStat("m1", ALICE, StatMetric.KILLS));
    }

    @Test
    void testGivesUpAfterMaxAttempts() {
        store.failNext(3, new CannotAcquireLockException("row locked"));

        assertThrows(CannotAcquireLockException.class, () -> aggregator.apply(killBatch("file-1:100")));
        assertEquals(2, aggregator.getRetries());
        assertEquals(0, aggregator.getBatchesApplied());

        assertTrue(aggregator.apply(killBatch("file-1:100")));
        assertEquals(1, store.matchStat("m1", ALICE, StatMetric.KILLS));
    }

    @Test
    void testNonTransientFailureIsNotRetried() {
        store.failNext(1, new DataAccessResourceFailureException("database down"));

        assertThrows(DataAccessResourceFailureException.class, () -> aggregator.apply(killBatch("file-1:100")));
        assertEquals(0, aggregator.getRetries());
    }

    @Test
    void testEmptyBatchTouchesNothing() {
        StatsAggregator mocked = new StatsAggregator(mockStore, TransactionOperations.withoutTransaction(), config);

        assertTrue(mocked.apply(new StatBatch("file-1:5", "m1")));

        verifyNoInteractions(mockStore);
    }

    @Test
    void testDuplicateDoesNotReachStore() {
        StatsAggregator mocked = new StatsAggregator(mockStore, TransactionOperations.withoutTransaction(), config);
        when(mockStore.upsertPlayerMatchStats(any(StatDelta.class))).thenReturn(true);
        when(mockStore.upsertAllTimeStats(any(StatDelta.class))).thenReturn(true);

        mocked.apply(killBatch("file-1:100"));
        mocked.apply(killBatch("file-1:100"));

        verify(mockStore, times(3)).upsertPlayerMatchStats(any(StatDelta.class));
        verify(mockStore, times(3)).upsertAllTimeStats(any(StatDelta.class));
    }
}
