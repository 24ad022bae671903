package com.example.sandstormtracker.model.event;

import com.example.sandstormtracker.model.RawLine;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * A join is logged in several lines; each carries only part of the identity.
 */
@Getter
@ToString(callSuper = true)
public class PlayerConnectEvent extends GameEvent {

    public enum Stage {
        /** LogNet login request: name and platform id. */
        LOGIN,
        /** LogNet join succeeded: name only. */
        JOINED,
        /** Anti-cheat registration: id only. */
        REGISTERED
    }

    private final Stage stage;
    private final String playerName;
    private final String playerId;

    public PlayerConnectEvent(RawLine line, LocalDateTime timestamp, Stage stage,
                              String playerName, String playerId) {
        super(line, timestamp);
        this.stage = stage;
        this.playerName = playerName;
        this.playerId = playerId;
    }

    @Override
    public EventType getType() {
        return EventType.PLAYER_CONNECT;
    }
}
