package com.example.sandstormtracker.model.event;

import com.example.sandstormtracker.model.RawLine;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * Damage lines name no player; only the amount and cause are known.
 */
@Getter
@ToString(callSuper = true)
public class DamageEvent extends GameEvent {
    private final double amount;
    private final String cause;

    public DamageEvent(RawLine line, LocalDateTime timestamp, double amount, String cause) {
        super(line, timestamp);
        this.amount = amount;
        this.cause = cause;
    }

    @Override
    public EventType getType() {
        return EventType.DAMAGE;
    }
}
