package com.example.sandstormtracker.model.event;

import com.example.sandstormtracker.model.RawLine;
import lombok.ToString;

import java.time.LocalDateTime;

@ToString(callSuper = true)
public class GameOverEvent extends GameEvent {

    public GameOverEvent(RawLine line, LocalDateTime timestamp) {
        super(line, timestamp);
    }

    @Override
    public EventType getType() {
        return EventType.GAME_OVER;
    }
}
