package com.example.sandstormtracker.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Operator-visible record of something the pipeline did or noticed.
 */
@Data
@AllArgsConstructor
public class TrackerEvent {
    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern("HH:mm:ss.SSS");

    private LocalDateTime timestamp;
    private EventType type;
    private String description;
    private String serverId;

    public enum EventType {
        PIPELINE_STARTED,
        PIPELINE_STOPPED,
        LOG_ROTATED,
        LOG_MISSING,
        LOG_READ_ERROR,
        MATCH_OPENED,
        MATCH_CLOSED,
        ROUND_STARTED,
        ROUND_ENDED,
        SESSION_OPENED,
        SESSION_CLOSED,
        IDENTITY_AMBIGUOUS,
        CHAT_COMMAND,
        SERVER_UNREACHABLE,
        PERSISTENCE_FAILURE
    }

    public String getFormattedTimestamp() {
        return timestamp.format(FORMATTER);
    }

    public String toLogString() {
        return String.format("[%s] %s (server=%s): %s",
            getFormattedTimestamp(),
            type,
            serverId,
            description);
    }
}
