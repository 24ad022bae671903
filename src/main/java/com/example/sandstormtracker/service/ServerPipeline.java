package com.example.sandstormtracker.service;

import com.example.sandstormtracker.a2s.A2SClient;
import com.example.sandstormtracker.a2s.A2SPoller;
import com.example.sandstormtracker.config.TrackerConfig;
import com.example.sandstormtracker.model.LiveSnapshot;
import com.example.sandstormtracker.model.LogCursor;
import com.example.sandstormtracker.model.Match;
import com.example.sandstormtracker.model.RawLine;
import com.example.sandstormtracker.model.ServerStatus;
import com.example.sandstormtracker.model.ServerTarget;
import com.example.sandstormtracker.model.TrackerEvent;
import com.example.sandstormtracker.model.TrackerMessage;
import com.example.sandstormtracker.parser.EventParser;
import com.example.sandstormtracker.persistence.TrackerPersistenceService;
import com.example.sandstormtracker.tail.LogTailer;
import com.example.sandstormtracker.tail.TailSink;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Paths;
import java.time.Clock;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Everything that runs for one server: the tailer task, the optional poller, and the tracker
 * thread, joined by one bounded queue.
 * <p>
 * The tailer parses lines on its own thread and blocks on a full queue, which throttles
 * reading to the tracker's pace.
 */
@Slf4j
public class ServerPipeline implements TailSink {

    private static final long STOP_TIMEOUT_MS = 10_000;

    @Getter
    private final ServerTarget target;
    private final BlockingQueue<TrackerMessage> queue;
    private final LogTailer tailer;
    private final A2SPoller poller;
    private final MatchTracker tracker;
    private final EventParser parser;
    private final TrackerPersistenceService persistence;
    private final TrackerEventLog eventLog;
    private final ScheduledExecutorService scheduler;
    private final long pollIntervalMs;

    private ScheduledFuture<?> tailTask;
    private Thread trackerThread;
    @Getter
    private volatile boolean running;

    /**
     * @param queryClient null disables live queries for this server
     */
    public ServerPipeline(ServerTarget target, TrackerConfig config, BlockingQueue<TrackerMessage> queue,
                          MatchTracker tracker, A2SClient queryClient, EventParser parser,
                          TrackerPersistenceService persistence, TrackerEventLog eventLog,
                          ScheduledExecutorService scheduler, ExecutorService queryExecutor, Clock clock) {
        this.target = target;
        this.queue = queue;
        this.tracker = tracker;
        this.parser = parser;
        this.persistence = persistence;
        this.eventLog = eventLog;
        this.scheduler = scheduler;
        this.pollIntervalMs = config.getTailer().getPollIntervalMs();
        this.tailer = new LogTailer(target.getName(), Paths.get(target.getLogPath()), config.getTailer(), clock, this);
        if (queryClient != null && target.hasQueryAddress()) {
            this.poller = new A2SPoller(target.getName(), target.getQueryAddress(), queryClient, scheduler,
                    queryExecutor, this::acceptSnapshot, config.getQuery().getIntervalMs());
        } else {
            this.poller = null;
        }
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        String serverId = target.getName();
        log.info("Starting pipeline for {}", target);

        tracker.restore();
        tailer.open(persistence.loadCursor(serverId).orElse(null));

        trackerThread = new Thread(tracker, "tracker-" + serverId);
        trackerThread.setDaemon(true);
        trackerThread.start();

        tailTask = scheduler.scheduleWithFixedDelay(this::pollLog, 0, pollIntervalMs, TimeUnit.MILLISECONDS);
        if (poller != null) {
            poller.start();
        }
        running = true;
        eventLog.record(serverId, TrackerEvent.EventType.PIPELINE_STARTED, "Tailing " + target.getLogPath());
    }

    /**
     * Stops reading, flushes a final checkpoint through the queue and waits for the tracker
     * to drain it. The current match stays open; it continues on the next start.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        String serverId = target.getName();
        log.info("Stopping pipeline for {}", serverId);

        if (tailTask != null) {
            tailTask.cancel(false);
        }
        if (poller != null) {
            poller.stop();
        }
        tailer.flush();
        enqueue(TrackerMessage.stop());

        try {
            trackerThread.join(STOP_TIMEOUT_MS);
            if (trackerThread.isAlive()) {
                log.warn("Tracker for {} did not drain within {} ms, interrupting", serverId, STOP_TIMEOUT_MS);
                trackerThread.interrupt();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            trackerThread.interrupt();
        }
        running = false;
        eventLog.record(serverId, TrackerEvent.EventType.PIPELINE_STOPPED, "Pipeline stopped");
    }

    private void pollLog() {
        try {
            tailer.poll();
        } catch (RuntimeException e) {
            log.error("Tailer task for {} failed: {}", target.getName(), e.getMessage(), e);
        }
    }

    /**
     * Snapshot sink for the poller.
     */
    public void acceptSnapshot(LiveSnapshot snapshot) {
        enqueue(TrackerMessage.snapshot(snapshot));
    }

    // ==================== TailSink ====================

    @Override
    public void onRotation(LogCursor newCursor, String reason) {
        enqueue(TrackerMessage.rotation(newCursor));
    }

    @Override
    public void onLine(RawLine line) {
        enqueue(TrackerMessage.event(parser.parse(line)));
    }

    @Override
    public void onCheckpoint(LogCursor cursor) {
        enqueue(TrackerMessage.checkpoint(cursor, persistence::saveCursor));
    }

    @Override
    public void onNotice(TrackerEvent.EventType type, String description) {
        eventLog.record(target.getName(), type, description);
    }

    private void enqueue(TrackerMessage message) {
        try {
            queue.put(message);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while queueing {} for {}", message.getKind(), target.getName());
        }
    }

    // ==================== Status ====================

    public ServerStatus getStatus() {
        ServerStatus status = new ServerStatus();
        status.setServerId(target.getName());
        status.setRunning(running);
        status.setLogPath(target.getLogPath());

        LogCursor cursor = tailer.getCursor();
        if (cursor != null) {
            status.setFileIdentity(cursor.getFileIdentity());
            status.setRotationGeneration(cursor.getGeneration());
            status.setByteOffset(cursor.getByteOffset());
        }
        status.setLinesRead(tailer.getLinesRead());
        status.setLogMissing(tailer.isMissing());
        status.setLastReadError(tailer.getLastError());
        status.setQueueDepth(queue.size());

        Match match = tracker.getPublishedMatch();
        if (match != null) {
            status.setMatchId(match.getMatchId());
            status.setMapName(match.getMapName());
            status.setPhase(match.getPhase());
            status.setRoundNumber(match.getRoundNumber());
            status.setDamageEvents(match.getDamageEvents());
            status.setWarmupDamageEvents(match.getWarmupDamageEvents());
        }
        status.setOpenSessions(tracker.getPublishedSessionCount());
        status.setEventsProcessed(tracker.getEventsProcessed());
        status.setUnrecognizedLines(tracker.getUnrecognizedLines());
        status.setReplayedEventsSkipped(tracker.getReplayedEventsSkipped());
        status.setIdentityAmbiguities(tracker.getIdentityAmbiguities());
        status.setPersistenceFailures(tracker.getPersistenceFailures());
        status.setPendingWrites(tracker.getPendingWriteCount());
        status.setBackpressureWaits(tracker.getBackpressureWaits());
        status.setLastError(tracker.getLastError());

        status.setQueryEnabled(poller != null);
        if (poller != null) {
            status.setSkippedPolls(poller.getSkippedTicks().get());
            LiveSnapshot snapshot = poller.getLastSnapshot();
            if (snapshot != null) {
                status.setLastSnapshotAt(snapshot.getQueriedAt());
                status.setServerReachable(snapshot.isReachable());
                status.setPlayersOnline(snapshot.isReachable() ? snapshot.getPlayers().size() : null);
            }
        }
        return status;
    }

    MatchTracker getTracker() {
        return tracker;
    }

    LogTailer getTailer() {
        return tailer;
    }
}
