package com.example.sandstormtracker.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * One physical line read from a log file, without its terminator.
 */
@Data
@AllArgsConstructor
public class RawLine {
    private String serverId;

    /**
     * {@link LogCursor#streamKey()} of the cursor that read the line.
     */
    private String fileIdentity;
    private long startOffset;
    private long endOffset;
    private String text;

    public String positionKey() {
        return fileIdentity + ":" + startOffset;
    }
}
