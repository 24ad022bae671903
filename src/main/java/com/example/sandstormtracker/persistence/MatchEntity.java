package com.example.sandstormtracker.persistence;

import com.example.sandstormtracker.model.MatchPhase;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "matches", indexes = {
    @Index(name = "idx_matches_server_end", columnList = "serverId,endedAt")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MatchEntity {

    /**
     * Server id plus start timestamp.
     */
    @Id
    private String matchId;

    @Column(nullable = false)
    private String serverId;

    private String mapName;

    private String scenario;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private MatchPhase phase;

    @Column(nullable = false)
    private int roundNumber;

    @Column(nullable = false)
    private LocalDateTime startedAt;

    private LocalDateTime endedAt;

    private Integer winnerTeam;

    @Column(name = "implicit_open", nullable = false)
    private boolean implicit;

    @Column(nullable = false)
    private int damageEvents;

    @Column(nullable = false)
    private int warmupDamageEvents;
}
