package com.example.sandstormtracker.model;

import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * All deltas produced by one log line. Applied atomically.
 */
@Getter
@ToString
public class StatBatch {
    private final String idempotencyKey;
    private final String matchId;
    private final List<StatDelta> deltas = new ArrayList<>();

    public StatBatch(String idempotencyKey, String matchId) {
        this.idempotencyKey = idempotencyKey;
        this.matchId = matchId;
    }

    /**
     * Adds a delta whose key is the batch key plus its index, so each delta stays unique.
     */
    public StatBatch add(String identity, String displayName, StatMetric metric, String weapon, long amount) {
        String key = idempotencyKey + "#" + deltas.size();
        deltas.add(new StatDelta(matchId, identity, displayName, metric, weapon, amount, key));
        return this;
    }

    public StatBatch add(String identity, String displayName, StatMetric metric) {
        return add(identity, displayName, metric, null, 1);
    }

    public List<StatDelta> getDeltas() {
        return Collections.unmodifiableList(deltas);
    }

    public boolean isEmpty() {
        return deltas.isEmpty();
    }
}
