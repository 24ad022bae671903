package com.example.sandstormtracker.persistence;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One row per player per match.
 */
@Entity
@Table(name = "player_match_stats", uniqueConstraints = {
    @UniqueConstraint(name = "uk_player_match", columnNames = {"matchId", "identity"})
})
@Data
@NoArgsConstructor
public class PlayerMatchStatsEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String matchId;

    @Column(nullable = false)
    private String identity;

    @Column(nullable = false)
    private String displayName;

    private Integer team;

    /**
     * Score from the last snapshot that saw the player.
     */
    @Column(nullable = false)
    private int score;

    /**
     * Sum of all closed sessions in this match.
     */
    @Column(nullable = false)
    private long totalPlayTimeSeconds;

    @Column(nullable = false)
    private int sessionCount;

    private LocalDateTime firstJoinedAt;

    private LocalDateTime lastLeftAt;

    @Embedded
    private StatCounters counters = new StatCounters();

    public PlayerMatchStatsEntity(String matchId, String identity, String displayName) {
        this.matchId = matchId;
        this.identity = identity;
        this.displayName = displayName;
    }
}
