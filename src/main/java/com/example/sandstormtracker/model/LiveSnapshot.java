package com.example.sandstormtracker.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One query cycle result for a server. Not persisted.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LiveSnapshot {
    private String serverId;
    private Instant queriedAt;
    private boolean reachable;
    private ServerDetails details;
    private List<SnapshotPlayer> players = new ArrayList<>();
    private String failure;

    public static LiveSnapshot unreachable(String serverId, Instant queriedAt, String failure) {
        return new LiveSnapshot(serverId, queriedAt, false, null, new ArrayList<>(), failure);
    }

    public static LiveSnapshot of(String serverId, Instant queriedAt, ServerDetails details,
                                  List<SnapshotPlayer> players) {
        return new LiveSnapshot(serverId, queriedAt, true, details, new ArrayList<>(players), null);
    }
}
