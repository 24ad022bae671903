package com.example.sandstormtracker.persistence;

import com.example.sandstormtracker.model.LogCursor;
import com.example.sandstormtracker.model.TrackerState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.*;
import java.util.Optional;

/**
 * Persistence of tailing cursors and tracker checkpoints.
 * A checkpoint is always saved before the cursor that covers it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrackerPersistenceService {

    private final LogCursorRepository cursorRepository;
    private final TrackerCheckpointRepository checkpointRepository;

    // ==================== Cursor Persistence ====================

    public Optional<LogCursor> loadCursor(String serverId) {
        Optional<LogCursorEntity> entity = cursorRepository.findById(serverId);
        if (entity.isEmpty()) {
            log.info("No persisted cursor for {}, tailing from start", serverId);
            return Optional.empty();
        }
        LogCursorEntity e = entity.get();
        log.info("Loaded cursor for {}: file={}, generation={}, offset={}", serverId, e.getFileIdentity(),
                e.getGeneration(), e.getByteOffset());
        return Optional.of(new LogCursor(serverId, e.getPath(), e.getFileIdentity(), e.getGeneration(),
                e.getByteOffset(), e.getLastLineChecksum()));
    }

    @Transactional
    public void saveCursor(LogCursor cursor) {
        LogCursorEntity entity = cursorRepository.findById(cursor.getServerId())
            .orElseGet(LogCursorEntity::new);
        entity.setServerId(cursor.getServerId());
        entity.setPath(cursor.getPath());
        entity.setFileIdentity(cursor.getFileIdentity());
        entity.setGeneration(cursor.getGeneration());
        entity.setByteOffset(cursor.getByteOffset());
        entity.setLastLineChecksum(cursor.getLastLineChecksum());
        entity.setLastUpdated(System.currentTimeMillis());
        cursorRepository.save(entity);
        log.debug("Saved cursor for {}: file={}, offset={}",
                cursor.getServerId(), cursor.getFileIdentity(), cursor.getByteOffset());
    }

    // ==================== Checkpoint Persistence ====================

    public Optional<TrackerState> loadCheckpoint(String serverId) {
        Optional<TrackerCheckpointEntity> entity = checkpointRepository.findById(serverId);
        if (entity.isEmpty()) {
            log.info("No tracker checkpoint for {}", serverId);
            return Optional.empty();
        }

        try (ObjectInputStream ois = new ObjectInputStream(
                new ByteArrayInputStream(entity.get().getStateData()))) {
            TrackerState state = (TrackerState) ois.readObject();
            log.info("Loaded checkpoint for {}: file={}, offset={}, size={} bytes",
                    serverId, state.getFileIdentity(), state.getOffset(), entity.get().getSizeBytes());
            return Optional.of(state);
        } catch (IOException | ClassNotFoundException | ClassCastException e) {
            // An unreadable checkpoint is discarded; the tracker starts idle from the cursor.
            log.error("Failed to load checkpoint for {}: {}", serverId, e.getMessage(), e);
            return Optional.empty();
        }
    }

    @Transactional
    public void saveCheckpoint(String serverId, TrackerState state) {
        byte[] data;
        try {
            ByteArrayOutputStream bos = new ByteArrayOutputStream();
            try (ObjectOutputStream oos = new ObjectOutputStream(bos)) {
                oos.writeObject(state);
            }
            data = bos.toByteArray();
        } catch (IOException e) {
            throw new TrackerPersistenceException("Failed to serialize checkpoint for " + serverId, e);
        }

        checkpointRepository.save(new TrackerCheckpointEntity(
            serverId,
            data,
            state.getFileIdentity(),
            state.getOffset(),
            System.currentTimeMillis(),
            data.length
        ));
        log.debug("Saved checkpoint for {}: offset={}, size={} bytes", serverId, state.getOffset(), data.length);
    }
}
