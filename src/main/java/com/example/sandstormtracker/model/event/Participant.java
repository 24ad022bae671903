package com.example.sandstormtracker.model.event;

import com.example.sandstormtracker.model.IdentityKeys;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A player or bot named in a kill or objective line: Name[id, team n].
 */
@Data
@AllArgsConstructor
public class Participant {
    private String name;
    private String playerId;

    /**
     * -1 when the line does not state a team (objective lines).
     */
    private int team;

    public boolean isBot() {
        return !IdentityKeys.isValidPlayerId(playerId);
    }
}
