package com.example.sandstormtracker.persistence;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * All-time totals per player.
 */
@Entity
@Table(name = "player_total_stats")
@Data
@NoArgsConstructor
public class PlayerTotalStatsEntity {

    @Id
    private String identity;

    @Column(nullable = false)
    private String displayName;

    @Embedded
    private StatCounters counters = new StatCounters();

    public PlayerTotalStatsEntity(String identity, String displayName) {
        this.identity = identity;
        this.displayName = displayName;
    }
}
