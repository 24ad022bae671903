package com.example.sandstormtracker.parser;

import com.example.sandstormtracker.model.event.Participant;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the player lists of kill and objective lines.
 */
final class ParticipantParser {

    private static final Pattern FULL = Pattern.compile("^(.+?)\\[([^,\\]]*), team (\\d+)\\]$");
    private static final Pattern SIMPLE = Pattern.compile("^(.+?)\\[([^\\]]+)\\]$");
    private static final Pattern LISTED = Pattern.compile("(.+?)\\[([^\\]]+)\\](?:, |$)");

    private ParticipantParser() {
    }

    /**
     * Killer sections join players with " + "; a lone "?" means nobody is credited.
     */
    static List<Participant> parseKillers(String section) {
        List<Participant> killers = new ArrayList<>();
        String trimmed = section.trim();
        if (trimmed.equals("?")) {
            return killers;
        }
        for (String part : trimmed.split(" \\+ ")) {
            Participant participant = parseOne(part.trim());
            if (participant != null) {
                killers.add(participant);
            }
        }
        return killers;
    }

    /**
     * Objective sections list players as "A[id], B[id]".
     */
    static List<Participant> parseListed(String section) {
        List<Participant> players = new ArrayList<>();
        Matcher m = LISTED.matcher(section.trim());
        while (m.find()) {
            Participant participant = parseOne(m.group(0).replaceFirst(", $", "").trim());
            if (participant != null) {
                players.add(participant);
            }
        }
        return players;
    }

    static Participant parseOne(String part) {
        Matcher full = FULL.matcher(part);
        if (full.matches()) {
            return new Participant(full.group(1).trim(), full.group(2).trim(), Integer.parseInt(full.group(3)));
        }
        Matcher simple = SIMPLE.matcher(part);
        if (simple.matches()) {
            return new Participant(simple.group(1).trim(), simple.group(2).trim(), -1);
        }
        return null;
    }
}
