package com.example.sandstormtracker.model.event;

import com.example.sandstormtracker.model.RawLine;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;

@Getter
@ToString(callSuper = true)
public class RoundEndEvent extends GameEvent {

    /**
     * Null when the line omits the round number.
     */
    private final Integer roundNumber;
    private final int winningTeam;
    private final String winReason;

    public RoundEndEvent(RawLine line, LocalDateTime timestamp, Integer roundNumber,
                         int winningTeam, String winReason) {
        super(line, timestamp);
        this.roundNumber = roundNumber;
        this.winningTeam = winningTeam;
        this.winReason = winReason;
    }

    @Override
    public EventType getType() {
        return EventType.ROUND_END;
    }
}
