package com.example.sandstormtracker.model.event;

import com.example.sandstormtracker.model.RawLine;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * A typed occurrence parsed from one log line. Subclasses carry the payload of their kind.
 */
@Getter
@ToString
public abstract class GameEvent {
    private final String serverId;

    /**
     * In-game timestamp from the line prefix; null for unrecognized lines without one.
     */
    private final LocalDateTime timestamp;

    private final String fileIdentity;
    private final long offset;

    protected GameEvent(RawLine line, LocalDateTime timestamp) {
        this.serverId = line.getServerId();
        this.fileIdentity = line.getFileIdentity();
        this.offset = line.getStartOffset();
        this.timestamp = timestamp;
    }

    public abstract EventType getType();

    /**
     * Key derived from (file identity and rotation generation, byte offset); stable across replays
     * of the same line.
     */
    public String idempotencyKey() {
        return fileIdentity + ":" + offset;
    }
}
