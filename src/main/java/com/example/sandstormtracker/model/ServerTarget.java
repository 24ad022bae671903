package com.example.sandstormtracker.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One configured game server. Immutable for the duration of a run.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ServerTarget {
    private String name;
    private String logPath;
    private boolean enabled;
    private String queryAddress;

    public boolean hasQueryAddress() {
        return queryAddress != null && !queryAddress.isBlank();
    }

    @Override
    public String toString() {
        return String.format("%s[%s]%s", name, logPath, hasQueryAddress() ? "@" + queryAddress : "");
    }
}
