package com.example.sandstormtracker.persistence;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Persisted tailing position, one row per server log.
 */
@Entity
@Table(name = "log_cursor")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LogCursorEntity {

    @Id
    private String serverId;

    @Column(nullable = false, length = 1024)
    private String path;

    @Column(nullable = false)
    private String fileIdentity;

    @Column(name = "rotation_generation", nullable = false)
    private long generation;

    @Column(nullable = false)
    private long byteOffset;

    @Column(nullable = false)
    private long lastLineChecksum;

    /**
     * Timestamp of last update for monitoring.
     */
    @Column(nullable = false)
    private long lastUpdated;
}
