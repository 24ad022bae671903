package com.example.sandstormtracker.persistence;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Serialized match tracker state, written at the same boundary as the log cursor.
 */
@Entity
@Table(name = "tracker_checkpoint")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TrackerCheckpointEntity {

    @Id
    private String serverId;

    /**
     * Java-serialized {@link com.example.sandstormtracker.model.TrackerState}.
     */
    @Lob
    @Column(nullable = false)
    private byte[] stateData;

    private String fileIdentity;

    @Column(name = "state_offset", nullable = false)
    private long offset;

    @Column(nullable = false)
    private long savedAt;

    /**
     * Size in bytes for monitoring.
     */
    @Column(nullable = false)
    private long sizeBytes;
}
