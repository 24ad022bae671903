package com.example.sandstormtracker.tail;

import com.example.sandstormtracker.config.TrackerConfig;
import com.example.sandstormtracker.model.LogCursor;
import com.example.sandstormtracker.model.RawLine;
import com.example.sandstormtracker.model.TrackerEvent;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;

/**
 * Incremental reader of one server log.
 * <p>
 * Each {@link #poll()} reads bytes appended since the last call and hands complete lines to the
 * {@link TailSink}. A trailing line without terminator stays buffered until its newline arrives.
 * The cursor only ever points at the end of a complete line.
 * <p>
 * Rotation is detected by a change of file identity, and truncation by the file shrinking below the
 * cursor. Both restart reading at offset 0 of the current file under the next cursor generation,
 * and checkpoint that position at once so a restart never reads new content under an old generation.
 */
@Slf4j
public class LogTailer {

    private static final int READ_CHUNK = 64 * 1024;

    private final String serverId;
    private final Path path;
    private final TrackerConfig.Tailer config;
    private final Clock clock;
    private final TailSink sink;

    private LogCursor cursor;
    private final ByteArrayOutputStream pending = new ByteArrayOutputStream();
    private int linesSinceCheckpoint;

    @Getter
    private volatile boolean missing;
    private long backoffMs;
    private Instant nextAttemptAt = Instant.EPOCH;

    @Getter
    private volatile long linesRead;
    @Getter
    private volatile String lastError;

    public LogTailer(String serverId, Path path, TrackerConfig.Tailer config, Clock clock, TailSink sink) {
        this.serverId = serverId;
        this.path = path;
        this.config = config;
        this.clock = clock;
        this.sink = sink;
    }

    /**
     * Resumes from a persisted cursor, or from the start of the file when there is none.
     * A persisted cursor that no longer describes the file on disk produces a rotation.
     */
    public synchronized void open(LogCursor persisted) {
        pending.reset();
        linesSinceCheckpoint = 0;
        if (!Files.exists(path)) {
            cursor = persisted != null ? persisted.copy() : LogCursor.start(serverId, path.toString(), null);
            markMissing();
            return;
        }

        try {
            String identity = FileIdentities.of(path);
            if (persisted == null) {
                cursor = LogCursor.start(serverId, path.toString(), identity);
                log.info("[{}] Tailing {} from start (file {})", serverId, path, identity);
                return;
            }

            cursor = persisted.copy();
            cursor.setPath(path.toString());
            if (!identity.equals(persisted.getFileIdentity())) {
                rotate(identity, "file identity changed while stopped");
            } else if (Files.size(path) < persisted.getByteOffset()) {
                rotate(identity, "file shorter than stored offset");
            } else if (FileIdentities.checksumBefore(path, persisted.getByteOffset())
                    != persisted.getLastLineChecksum()) {
                rotate(identity, "content at stored offset changed");
            } else {
                log.info("[{}] Resuming {} at offset {}", serverId, path, cursor.getByteOffset());
            }
        } catch (IOException e) {
            reportReadError(e);
        }
    }

    /**
     * Reads everything appended since the previous poll.
     *
     * @return number of complete lines delivered to the sink
     */
    public synchronized int poll() {
        if (cursor == null) {
            throw new IllegalStateException("Tailer for " + serverId + " not opened");
        }
        if (missing && clock.instant().isBefore(nextAttemptAt)) {
            return 0;
        }
        if (!Files.exists(path)) {
            markMissing();
            return 0;
        }
        if (missing) {
            log.info("[{}] Log file {} is present again", serverId, path);
            missing = false;
            backoffMs = 0;
        }

        int delivered = 0;
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            String identity = FileIdentities.of(path);
            long size = channel.size();

            if (cursor.getFileIdentity() == null) {
                cursor.setFileIdentity(identity);
            } else if (!identity.equals(cursor.getFileIdentity())) {
                rotate(identity, "file recreated");
            } else if (size < cursor.getByteOffset()) {
                rotate(identity, "file truncated");
            }

            long position = cursor.getByteOffset() + pending.size();
            ByteBuffer buffer = ByteBuffer.allocate(READ_CHUNK);
            while (position < size) {
                buffer.clear();
                int read = channel.read(buffer, position);
                if (read <= 0) {
                    break;
                }
                position += read;
                delivered += consume(buffer.array(), read);
            }
            lastError = null;
        } catch (IOException e) {
            reportReadError(e);
        }

        if (linesSinceCheckpoint > 0) {
            checkpoint();
        }
        return delivered;
    }

    /**
     * Emits a checkpoint for everything delivered so far. Used when the pipeline stops.
     */
    public synchronized void flush() {
        if (cursor != null && cursor.getFileIdentity() != null) {
            checkpoint();
        }
    }

    public synchronized LogCursor getCursor() {
        return cursor == null ? null : cursor.copy();
    }

    private int consume(byte[] bytes, int length) {
        int lines = 0;
        int segmentStart = 0;
        for (int i = 0; i < length; i++) {
            if (bytes[i] != '\n') {
                continue;
            }
            pending.write(bytes, segmentStart, i - segmentStart);
            segmentStart = i + 1;

            byte[] lineBytes = pending.toByteArray();
            pending.reset();

            long start = cursor.getByteOffset();
            long end = start + lineBytes.length + 1;
            int textLength = lineBytes.length;
            if (textLength > 0 && lineBytes[textLength - 1] == '\r') {
                textLength--;
            }
            String text = new String(lineBytes, 0, textLength, StandardCharsets.UTF_8);

            cursor.setByteOffset(end);
            sink.onLine(new RawLine(serverId, cursor.streamKey(), start, end, text));
            lines++;
            linesRead++;

            if (++linesSinceCheckpoint >= config.getFlushEveryLines()) {
                checkpoint();
            }
        }
        pending.write(bytes, segmentStart, length - segmentStart);
        return lines;
    }

    private void checkpoint() {
        try {
            cursor.setLastLineChecksum(FileIdentities.checksumBefore(path, cursor.getByteOffset()));
        } catch (IOException e) {
            log.warn("[{}] Could not checksum {} at {}: {}", serverId, path, cursor.getByteOffset(), e.getMessage());
        }
        linesSinceCheckpoint = 0;
        sink.onCheckpoint(cursor.copy());
    }

    private void rotate(String identity, String reason) {
        if (pending.size() > 0) {
            log.debug("[{}] Dropping {} bytes of unterminated line from previous file", serverId, pending.size());
            pending.reset();
        }
        linesSinceCheckpoint = 0;
        cursor = LogCursor.start(serverId, path.toString(), identity, cursor.getGeneration() + 1);
        log.info("[{}] Log rotation detected on {}: {} (generation {})", serverId, path, reason,
            cursor.getGeneration());
        sink.onRotation(cursor.copy(), reason);
        checkpoint();
    }

    private void markMissing() {
        if (!missing) {
            log.warn("[{}] Log file {} does not exist, waiting for it", serverId, path);
            sink.onNotice(TrackerEvent.EventType.LOG_MISSING, "Log file " + path + " does not exist");
        }
        missing = true;
        backoffMs = backoffMs == 0
            ? config.getPollIntervalMs()
            : Math.min(backoffMs * 2, config.getMissingFileMaxBackoffMs());
        nextAttemptAt = clock.instant().plusMillis(backoffMs);
    }

    private void reportReadError(IOException e) {
        lastError = e.getMessage();
        log.error("[{}] Error reading {}: {}", serverId, path, e.getMessage(), e);
        sink.onNotice(TrackerEvent.EventType.LOG_READ_ERROR, "Error reading " + path + ": " + e.getMessage());
    }

    /**
     * Current wait before the next existence check of a missing file.
     */
    long getBackoffMs() {
        return backoffMs;
    }
}
