package com.example.sandstormtracker.service;

import com.example.sandstormtracker.model.TrackerEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;

/**
 * Bounded buffer of operator-visible events across all pipelines.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TrackerEventLog {

    static final int MAX_EVENTS = 100;

    private final Clock clock;
    private final LinkedList<TrackerEvent> events = new LinkedList<>();

    public void record(String serverId, TrackerEvent.EventType type, String description) {
        TrackerEvent event = new TrackerEvent(LocalDateTime.now(clock), type, description, serverId);
        synchronized (events) {
            events.add(event);
            while (events.size() > MAX_EVENTS) {
                events.removeFirst();
            }
        }
        log.info("[EVENT] {}", event.toLogString());
    }

    public List<TrackerEvent> getEvents() {
        synchronized (events) {
            return new ArrayList<>(events);
        }
    }

    public List<TrackerEvent> getEvents(String serverId) {
        List<TrackerEvent> result = new ArrayList<>();
        for (TrackerEvent event : getEvents()) {
            if (serverId.equals(event.getServerId())) {
                result.add(event);
            }
        }
        return result;
    }
}
