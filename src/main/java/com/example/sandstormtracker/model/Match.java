package com.example.sandstormtracker.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * One played match on one server, from map load to the next map load or log rotation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Match implements Serializable {
    private static final long serialVersionUID = 1L;
    private static final DateTimeFormatter ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss.SSS");

    private String matchId;
    private String serverId;
    private String mapName;
    private String scenario;
    private MatchPhase phase;
    private int roundNumber;
    private LocalDateTime startedAt;
    private LocalDateTime endedAt;
    private Integer winnerTeam;

    /**
     * Winner of the most recent round; becomes the match winner on game over.
     */
    private Integer lastRoundWinner;

    /**
     * True when the match was opened by a kill, round start or snapshot rather than a map load.
     */
    private boolean implicit;

    /**
     * Set once the game reported the end of play; the match still waits for the next map load.
     */
    private boolean gameOver;

    private int warmupDamageEvents;
    private int damageEvents;

    public static String idFor(String serverId, LocalDateTime startedAt) {
        return serverId + "@" + startedAt.format(ID_FORMAT);
    }

    public static Match open(String serverId, String mapName, String scenario,
                             LocalDateTime startedAt, boolean implicit) {
        Match match = new Match();
        match.setMatchId(idFor(serverId, startedAt));
        match.setServerId(serverId);
        match.setMapName(mapName);
        match.setScenario(scenario);
        match.setPhase(MatchPhase.WARMUP);
        match.setStartedAt(startedAt);
        match.setImplicit(implicit);
        return match;
    }
}
