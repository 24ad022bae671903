package com.example.sandstormtracker.model.event;

import com.example.sandstormtracker.model.RawLine;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;

@Getter
@ToString(callSuper = true)
public class ChatMessageEvent extends GameEvent {
    private final String playerName;
    private final String playerId;
    private final String channel;
    private final String message;

    public ChatMessageEvent(RawLine line, LocalDateTime timestamp, String playerName, String playerId,
                            String channel, String message) {
        super(line, timestamp);
        this.playerName = playerName;
        this.playerId = playerId;
        this.channel = channel;
        this.message = message;
    }

    public boolean isCommand() {
        return message.startsWith("!");
    }

    @Override
    public EventType getType() {
        return EventType.CHAT_MESSAGE;
    }
}
