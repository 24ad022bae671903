package com.example.sandstormtracker.parser;

import com.example.sandstormtracker.model.RawLine;
import com.example.sandstormtracker.model.event.GameEvent;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Matcher backed by one pattern anchored at the start of the line body.
 */
public class RegexLineMatcher implements LineMatcher {

    @FunctionalInterface
    public interface EventFactory {
        GameEvent create(RawLine line, LocalDateTime timestamp, Matcher groups);
    }

    private final String name;
    private final Pattern pattern;
    private final EventFactory factory;

    public RegexLineMatcher(String name, String regex, EventFactory factory) {
        this.name = name;
        this.pattern = Pattern.compile(regex);
        this.factory = factory;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Optional<GameEvent> match(RawLine line, LocalDateTime timestamp, String body) {
        Matcher m = pattern.matcher(body);
        if (!m.lookingAt()) {
            return Optional.empty();
        }
        return Optional.ofNullable(factory.create(line, timestamp, m));
    }

    @Override
    public String toString() {
        return name + "=" + pattern.pattern();
    }
}
