package com.example.sandstormtracker.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Point-in-time view of one server pipeline for operators.
 */
@Data
@NoArgsConstructor
public class ServerStatus {
    private String serverId;
    private boolean running;

    // Tailer
    private String logPath;
    private String fileIdentity;
    private long rotationGeneration;
    private long byteOffset;
    private long linesRead;
    private boolean logMissing;
    private String lastReadError;
    private int queueDepth;

    // Tracker
    private String matchId;
    private String mapName;
    private MatchPhase phase;
    private int roundNumber;
    private int damageEvents;
    private int warmupDamageEvents;
    private int openSessions;
    private long eventsProcessed;
    private long unrecognizedLines;
    private long replayedEventsSkipped;
    private long identityAmbiguities;
    private long persistenceFailures;
    private int pendingWrites;
    private long backpressureWaits;
    private String lastError;

    // Poller
    private boolean queryEnabled;
    private Instant lastSnapshotAt;
    private Boolean serverReachable;
    private Integer playersOnline;
    private long skippedPolls;
}
