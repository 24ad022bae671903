package com.example.sandstormtracker.service;

import com.example.sandstormtracker.config.TrackerConfig;
import com.example.sandstormtracker.model.StatBatch;
import com.example.sandstormtracker.model.StatDelta;
import com.example.sandstormtracker.persistence.StatsStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Applies stat deltas exactly once.
 * <p>
 * Every delta of a batch goes to the per-match and the all-time counters inside one transaction.
 * A window of recently applied batch keys short-circuits replays; the store's applied-delta
 * markers are the authority once a key has left the window.
 */
@Service
@Slf4j
public class StatsAggregator {

    private final StatsStore store;
    private final TransactionOperations transactions;
    private final int maxAttempts;
    private final Map<String, Boolean> recentKeys;

    private final AtomicLong batchesApplied = new AtomicLong();
    private final AtomicLong duplicatesSkipped = new AtomicLong();
    private final AtomicLong retries = new AtomicLong();

    public StatsAggregator(StatsStore store, TransactionOperations statsTransactionTemplate, TrackerConfig config) {
        this.store = store;
        this.transactions = statsTransactionTemplate;
        this.maxAttempts = Math.max(1, config.getAggregation().getMaxTransactionAttempts());
        final int window = config.getAggregation().getRecentKeyWindow();
        this.recentKeys = Collections.synchronizedMap(new LinkedHashMap<String, Boolean>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                return size() > window;
            }
        });
    }

    /**
     * @return false when the batch was recognized as already applied without touching the store
     * @throws org.springframework.dao.DataAccessException when the store keeps failing
     */
    public boolean apply(StatBatch batch) {
        if (batch.isEmpty()) {
            return true;
        }
        if (recentKeys.containsKey(batch.getIdempotencyKey())) {
            duplicatesSkipped.incrementAndGet();
            log.debug("Batch {} recently applied, skipping", batch.getIdempotencyKey());
            return false;
        }

        for (int attempt = 1; ; attempt++) {
            try {
                transactions.executeWithoutResult(status -> {
                    for (StatDelta delta : batch.getDeltas()) {
                        store.upsertPlayerMatchStats(delta);
                        store.upsertAllTimeStats(delta);
                    }
                });
                recentKeys.put(batch.getIdempotencyKey(), Boolean.TRUE);
                batchesApplied.incrementAndGet();
                return true;
            } catch (TransientDataAccessException | DataIntegrityViolationException e) {
                if (attempt >= maxAttempts) {
                    log.error("Giving up on batch {} after {} attempts: {}",
                            batch.getIdempotencyKey(), attempt, e.getMessage());
                    throw e;
                }
                retries.incrementAndGet();
                log.warn("Store contention applying batch {} (attempt {}/{}): {}",
                        batch.getIdempotencyKey(), attempt, maxAttempts, e.getMessage());
            }
        }
    }

    public long getBatchesApplied() {
        return batchesApplied.get();
    }

    public long getDuplicatesSkipped() {
        return duplicatesSkipped.get();
    }

    public long getRetries() {
        return retries.get();
    }
}
