package com.example.sandstormtracker.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.LocalDateTime;

/**
 * A player's presence within one match.
 */
@Data
@NoArgsConstructor
public class PlayerSession implements Serializable {
    private static final long serialVersionUID = 1L;

    private String serverId;
    private String matchId;

    /**
     * Canonical identity key, see {@link IdentityKeys}.
     */
    private String identity;
    private String displayName;
    private String playerId;
    private Integer team;
    private LocalDateTime joinedAt;
    private LocalDateTime leftAt;
    private LocalDateTime lastActivityAt;
    private int missedSnapshots;
    private int lastScore;
    private SessionSource source;

    public enum SessionSource {
        LOG,
        SNAPSHOT
    }

    public PlayerSession(String serverId, String matchId, String identity, String displayName,
                         String playerId, LocalDateTime joinedAt, SessionSource source) {
        this.serverId = serverId;
        this.matchId = matchId;
        this.identity = identity;
        this.displayName = displayName;
        this.playerId = playerId;
        this.joinedAt = joinedAt;
        this.lastActivityAt = joinedAt;
        this.source = source;
    }

    public boolean isOpen() {
        return leftAt == null;
    }

    public boolean hasPlayerId() {
        return playerId != null && !playerId.isEmpty();
    }

    public void touch(LocalDateTime at) {
        if (at != null && (lastActivityAt == null || at.isAfter(lastActivityAt))) {
            lastActivityAt = at;
        }
        missedSnapshots = 0;
    }

    public void close(LocalDateTime at) {
        if (leftAt == null) {
            leftAt = at;
        }
    }

    /**
     * Detached copy, closed at {@code at} if still open.
     */
    public PlayerSession closedCopy(LocalDateTime at) {
        PlayerSession copy = new PlayerSession(serverId, matchId, identity, displayName, playerId, joinedAt, source);
        copy.setTeam(team);
        copy.setLastActivityAt(lastActivityAt);
        copy.setLastScore(lastScore);
        copy.setLeftAt(leftAt != null ? leftAt : at);
        return copy;
    }

    /**
     * Key of this stay in its match; a stay is recorded once.
     */
    public String stayKey() {
        return matchId + "|" + identity + "|" + joinedAt;
    }
}
