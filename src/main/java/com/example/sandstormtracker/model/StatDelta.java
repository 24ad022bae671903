package com.example.sandstormtracker.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An incremental contribution to one counter of one player.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StatDelta {
    private String matchId;
    private String identity;
    private String displayName;
    private StatMetric metric;

    /**
     * Only set for weapon metrics, see {@link StatMetric#isWeaponMetric()}.
     */
    private String weapon;

    private long amount;

    /**
     * Unique per delta; derived from the position of the log line that produced it.
     */
    private String idempotencyKey;
}
