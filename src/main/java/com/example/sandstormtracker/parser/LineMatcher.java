package com.example.sandstormtracker.parser;

import com.example.sandstormtracker.model.RawLine;
import com.example.sandstormtracker.model.event.GameEvent;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Recognizes one line shape and builds the matching event.
 */
public interface LineMatcher {

    String name();

    /**
     * @param body the line with its [timestamp][frame] prefix removed
     * @return empty when the line does not have this matcher's shape
     */
    Optional<GameEvent> match(RawLine line, LocalDateTime timestamp, String body);
}
