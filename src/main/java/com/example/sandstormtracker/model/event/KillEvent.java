package com.example.sandstormtracker.model.event;

import com.example.sandstormtracker.model.RawLine;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;

@Getter
@ToString(callSuper = true)
public class KillEvent extends GameEvent {

    /**
     * First entry made the kill, the rest assisted. Empty for "?" killers.
     */
    private final List<Participant> killers;
    private final Participant victim;
    private final String weapon;
    private final boolean headshot;

    public KillEvent(RawLine line, LocalDateTime timestamp, List<Participant> killers,
                     Participant victim, String weapon, boolean headshot) {
        super(line, timestamp);
        this.killers = Collections.unmodifiableList(killers);
        this.victim = victim;
        this.weapon = weapon;
        this.headshot = headshot;
    }

    public Participant getKiller() {
        return killers.isEmpty() ? null : killers.get(0);
    }

    public List<Participant> getAssisters() {
        return killers.size() <= 1 ? Collections.emptyList() : killers.subList(1, killers.size());
    }

    @Override
    public EventType getType() {
        return EventType.KILL;
    }
}
