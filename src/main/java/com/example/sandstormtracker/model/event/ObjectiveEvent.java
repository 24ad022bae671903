package com.example.sandstormtracker.model.event;

import com.example.sandstormtracker.model.RawLine;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;

@Getter
@ToString(callSuper = true)
public class ObjectiveEvent extends GameEvent {

    public enum Action {
        CAPTURED,
        DESTROYED
    }

    private final Action action;
    private final int objectiveNumber;
    private final int creditedTeam;
    private final int opposingTeam;

    /**
     * First entry gets the credit.
     */
    private final List<Participant> players;

    public ObjectiveEvent(RawLine line, LocalDateTime timestamp, Action action, int objectiveNumber,
                          int creditedTeam, int opposingTeam, List<Participant> players) {
        super(line, timestamp);
        this.action = action;
        this.objectiveNumber = objectiveNumber;
        this.creditedTeam = creditedTeam;
        this.opposingTeam = opposingTeam;
        this.players = Collections.unmodifiableList(players);
    }

    @Override
    public EventType getType() {
        return EventType.OBJECTIVE;
    }
}
