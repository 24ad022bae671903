package com.example.sandstormtracker.model;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Tailing progress for one file.
 * <p>
 * Every rotation bumps {@link #generation}, including truncations and in-place replacements that
 * keep the OS file key. The offset only moves forward within one {@link #streamKey()}.
 */
@Data
@NoArgsConstructor
public class LogCursor {
    private String serverId;
    private String path;

    /**
     * OS file key (device and inode on Unix) or creation time when the platform has no key.
     */
    private String fileIdentity;

    /**
     * Number of rotations seen on this server's log since tailing began.
     */
    private long generation;

    private long byteOffset;

    /**
     * CRC32 of the bytes just before {@link #byteOffset}, used to spot a file replaced in place.
     */
    private long lastLineChecksum;

    public LogCursor(String serverId, String path, String fileIdentity, long byteOffset, long lastLineChecksum) {
        this(serverId, path, fileIdentity, 0L, byteOffset, lastLineChecksum);
    }

    public LogCursor(String serverId, String path, String fileIdentity, long generation, long byteOffset,
                     long lastLineChecksum) {
        this.serverId = serverId;
        this.path = path;
        this.fileIdentity = fileIdentity;
        this.generation = generation;
        this.byteOffset = byteOffset;
        this.lastLineChecksum = lastLineChecksum;
    }

    public static LogCursor start(String serverId, String path, String fileIdentity) {
        return start(serverId, path, fileIdentity, 0L);
    }

    public static LogCursor start(String serverId, String path, String fileIdentity, long generation) {
        return new LogCursor(serverId, path, fileIdentity, generation, 0L, 0L);
    }

    /**
     * Names the byte stream the offsets refer to. Lines and the idempotency keys derived from them
     * carry this rather than the bare file identity, so content written after a truncation never
     * reuses the keys of the content it replaced.
     */
    public String streamKey() {
        return fileIdentity + "#" + generation;
    }

    public LogCursor copy() {
        return new LogCursor(serverId, path, fileIdentity, generation, byteOffset, lastLineChecksum);
    }
}
