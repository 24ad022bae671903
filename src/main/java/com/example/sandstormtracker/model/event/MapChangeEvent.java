package com.example.sandstormtracker.model.event;

import com.example.sandstormtracker.model.RawLine;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;

@Getter
@ToString(callSuper = true)
public class MapChangeEvent extends GameEvent {
    private final String mapName;
    private final String scenario;
    private final int maxPlayers;
    private final String lighting;

    public MapChangeEvent(RawLine line, LocalDateTime timestamp, String mapName, String scenario,
                          int maxPlayers, String lighting) {
        super(line, timestamp);
        this.mapName = mapName;
        this.scenario = scenario;
        this.maxPlayers = maxPlayers;
        this.lighting = lighting;
    }

    /**
     * Side the human players take, read from the scenario name; null for versus modes.
     */
    public String getPlayerTeam() {
        if (scenario.contains("_Security")) {
            return "Security";
        }
        if (scenario.contains("_Insurgents")) {
            return "Insurgents";
        }
        return null;
    }

    @Override
    public EventType getType() {
        return EventType.MAP_CHANGE;
    }
}
