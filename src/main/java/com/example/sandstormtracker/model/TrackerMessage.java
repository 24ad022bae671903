package com.example.sandstormtracker.model;

import com.example.sandstormtracker.model.event.GameEvent;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.function.Consumer;

/**
 * Entry of a server's ordered input queue. Log events and live snapshots share one queue
 * so the tracker sees a single ordered stream.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TrackerMessage {

    public enum Kind {
        EVENT,
        SNAPSHOT,
        ROTATION,
        CHECKPOINT,
        STOP
    }

    private final Kind kind;
    private final GameEvent event;
    private final LiveSnapshot snapshot;
    private final LogCursor cursor;

    /**
     * Invoked by the tracker once everything queued before a checkpoint has been applied.
     */
    @ToString.Exclude
    private final Consumer<LogCursor> commit;

    public static TrackerMessage event(GameEvent event) {
        return new TrackerMessage(Kind.EVENT, event, null, null, null);
    }

    public static TrackerMessage snapshot(LiveSnapshot snapshot) {
        return new TrackerMessage(Kind.SNAPSHOT, null, snapshot, null, null);
    }

    public static TrackerMessage rotation(LogCursor newCursor) {
        return new TrackerMessage(Kind.ROTATION, null, null, newCursor, null);
    }

    public static TrackerMessage checkpoint(LogCursor cursor, Consumer<LogCursor> commit) {
        return new TrackerMessage(Kind.CHECKPOINT, null, null, cursor, commit);
    }

    public static TrackerMessage stop() {
        return new TrackerMessage(Kind.STOP, null, null, null, null);
    }
}
