package com.example.sandstormtracker.parser;

import com.example.sandstormtracker.model.RawLine;
import com.example.sandstormtracker.model.event.GameEvent;
import com.example.sandstormtracker.model.event.UnrecognizedEvent;

import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps one raw line to exactly one event. Holds no mutable state, so a single instance is
 * shared by every tailer.
 *
 * <p>The log format is not a controlled contract: anything the matchers do not recognize,
 * including lines whose fields fail to convert, comes back as an {@link UnrecognizedEvent}.
 */
public class EventParser {

    private static final Pattern PREFIX = Pattern.compile(
        "^\\uFEFF?\\[(\\d{4}\\.\\d{2}\\.\\d{2}-\\d{2}\\.\\d{2}\\.\\d{2}:\\d{1,3})\\](?:\\[\\s*\\d*\\])?");

    private final List<LineMatcher> matchers;

    public EventParser(List<LineMatcher> matchers) {
        this.matchers = List.copyOf(matchers);
    }

    public static EventParser withDefaultMatchers() {
        return new EventParser(SandstormGrammar.matchers());
    }

    public GameEvent parse(RawLine line) {
        String text = line.getText().trim();
        Matcher prefix = PREFIX.matcher(text);
        if (!prefix.find()) {
            return new UnrecognizedEvent(line, null, UnrecognizedEvent.Reason.NO_TIMESTAMP);
        }

        LocalDateTime timestamp;
        try {
            timestamp = LogTimestamps.parse(prefix.group(1));
        } catch (DateTimeParseException e) {
            return new UnrecognizedEvent(line, null, UnrecognizedEvent.Reason.BAD_TIMESTAMP);
        }

        String body = text.substring(prefix.end());
        for (LineMatcher matcher : matchers) {
            try {
                Optional<GameEvent> event = matcher.match(line, timestamp, body);
                if (event.isPresent()) {
                    return event.get();
                }
            } catch (NumberFormatException e) {
                return new UnrecognizedEvent(line, timestamp, UnrecognizedEvent.Reason.MALFORMED_FIELDS);
            }
        }
        return new UnrecognizedEvent(line, timestamp, UnrecognizedEvent.Reason.NO_MATCHER);
    }
}
