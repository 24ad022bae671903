package com.example.sandstormtracker.model.event;

import com.example.sandstormtracker.model.RawLine;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;

@Getter
@ToString(callSuper = true)
public class RoundStartEvent extends GameEvent {
    private final int roundNumber;

    /**
     * Pre-round is the preparation phase before the round proper.
     */
    private final boolean preRound;

    public RoundStartEvent(RawLine line, LocalDateTime timestamp, int roundNumber, boolean preRound) {
        super(line, timestamp);
        this.roundNumber = roundNumber;
        this.preRound = preRound;
    }

    @Override
    public EventType getType() {
        return EventType.ROUND_START;
    }
}
