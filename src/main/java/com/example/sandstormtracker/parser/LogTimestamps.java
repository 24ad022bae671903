package com.example.sandstormtracker.parser;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Unreal log timestamps look like 2025.10.04-21.27.51:780. The millisecond part has one to
 * three digits and is read as a plain number of milliseconds.
 */
public final class LogTimestamps {

    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy.MM.dd-HH.mm.ss");

    private LogTimestamps() {
    }

    public static LocalDateTime parse(String value) {
        int colon = value.lastIndexOf(':');
        if (colon < 0) {
            throw new DateTimeParseException("Missing millisecond separator", value, 0);
        }
        LocalDateTime base = LocalDateTime.parse(value.substring(0, colon), DATE_TIME);
        String millis = value.substring(colon + 1);
        try {
            return base.plusNanos(Integer.parseInt(millis) * 1_000_000L);
        } catch (NumberFormatException e) {
            throw new DateTimeParseException("Bad milliseconds", value, colon + 1);
        }
    }

    public static String format(LocalDateTime time) {
        return String.format("%s:%03d", time.format(DATE_TIME), time.getNano() / 1_000_000);
    }
}
