package com.example.sandstormtracker.model.event;

import com.example.sandstormtracker.model.RawLine;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;

@Getter
@ToString(callSuper = true)
public class PlayerDisconnectEvent extends GameEvent {
    private final String playerId;
    private final String playerName;

    public PlayerDisconnectEvent(RawLine line, LocalDateTime timestamp, String playerId, String playerName) {
        super(line, timestamp);
        this.playerId = playerId;
        this.playerName = playerName;
    }

    @Override
    public EventType getType() {
        return EventType.PLAYER_DISCONNECT;
    }
}
