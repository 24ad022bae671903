package com.example.sandstormtracker.model.event;

import com.example.sandstormtracker.model.RawLine;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * Any line no matcher claimed. Counted, never fatal.
 */
@Getter
@ToString(callSuper = true)
public class UnrecognizedEvent extends GameEvent {

    public enum Reason {
        NO_TIMESTAMP,
        BAD_TIMESTAMP,
        NO_MATCHER,
        MALFORMED_FIELDS
    }

    private final Reason reason;
    private final String text;

    public UnrecognizedEvent(RawLine line, LocalDateTime timestamp, Reason reason) {
        super(line, timestamp);
        this.reason = reason;
        this.text = line.getText();
    }

    @Override
    public EventType getType() {
        return EventType.UNRECOGNIZED;
    }
}
