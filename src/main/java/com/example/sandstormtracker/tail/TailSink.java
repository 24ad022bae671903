package com.example.sandstormtracker.tail;

import com.example.sandstormtracker.model.LogCursor;
import com.example.sandstormtracker.model.RawLine;
import com.example.sandstormtracker.model.TrackerEvent;

/**
 * Receiver of everything a {@link LogTailer} produces, in file order.
 * Implementations may block to apply backpressure.
 */
public interface TailSink {

    /**
     * The watched path now refers to a different (or truncated) file. Reading restarts at
     * {@code newCursor}.
     */
    void onRotation(LogCursor newCursor, String reason);

    void onLine(RawLine line);

    /**
     * Every line up to {@code cursor} has been handed to {@link #onLine}.
     */
    void onCheckpoint(LogCursor cursor);

    /**
     * Operator-visible condition such as a missing file or a read error.
     */
    void onNotice(TrackerEvent.EventType type, String description);
}
