package com.example.sandstormtracker.persistence;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Marks a delta as applied to one aggregation target. The primary key is what makes a
 * second application of the same delta a no-op.
 */
@Entity
@Table(name = "applied_delta")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AppliedDeltaEntity {

    public enum Target {
        MATCH,
        ALL_TIME,
        /**
         * A closed session folded into the player's match row.
         */
        SESSION
    }

    /**
     * Idempotency key plus target.
     */
    @Id
    @Column(length = 512)
    private String id;

    @Column(nullable = false, length = 512)
    private String idempotencyKey;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Target target;

    @Column(nullable = false)
    private long appliedAt;

    public static String idFor(String idempotencyKey, Target target) {
        return idempotencyKey + "|" + target.name();
    }
}
