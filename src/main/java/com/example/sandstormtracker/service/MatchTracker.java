package com.example.sandstormtracker.service;

import com.example.sandstormtracker.config.TrackerConfig;
import com.example.sandstormtracker.model.LiveSnapshot;
import com.example.sandstormtracker.model.LogCursor;
import com.example.sandstormtracker.model.Match;
import com.example.sandstormtracker.model.MatchPhase;
import com.example.sandstormtracker.model.PlayerSession;
import com.example.sandstormtracker.model.StatBatch;
import com.example.sandstormtracker.model.StatMetric;
import com.example.sandstormtracker.model.TrackerEvent;
import com.example.sandstormtracker.model.TrackerMessage;
import com.example.sandstormtracker.model.TrackerState;
import com.example.sandstormtracker.model.event.ChatMessageEvent;
import com.example.sandstormtracker.model.event.DamageEvent;
import com.example.sandstormtracker.model.event.GameEvent;
import com.example.sandstormtracker.model.event.KillEvent;
import com.example.sandstormtracker.model.event.MapChangeEvent;
import com.example.sandstormtracker.model.event.ObjectiveEvent;
import com.example.sandstormtracker.model.event.Participant;
import com.example.sandstormtracker.model.event.PlayerConnectEvent;
import com.example.sandstormtracker.model.event.PlayerDisconnectEvent;
import com.example.sandstormtracker.model.event.RoundEndEvent;
import com.example.sandstormtracker.model.event.RoundStartEvent;
import com.example.sandstormtracker.model.event.UnrecognizedEvent;
import com.example.sandstormtracker.persistence.StatsStore;
import com.example.sandstormtracker.persistence.TrackerPersistenceService;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.function.Consumer;

/**
 * Per-server match state machine.
 * <p>
 * Consumes the server's queue on a single thread: log events, live snapshots, rotation notices
 * and checkpoint markers, strictly in queue order. Phases move
 * IDLE → WARMUP → ROUND_ACTIVE → ROUND_END → (WARMUP | next map). A map load concludes the
 * current match and opens the next one; a log rotation concludes it without a successor.
 * <p>
 * Store writes that fail are kept and retried at the next checkpoint. While any remain, the
 * checkpoint is not written and the log cursor does not advance. Once the configured number of
 * writes is pending, the tracker stops taking messages and retries with backoff until the store
 * recovers, so the bounded queue holds back the tailer and poller.
 */
@Slf4j
public class MatchTracker implements Runnable {

    /**
     * An idempotent store write, retried until it succeeds.
     */
    @FunctionalInterface
    interface StoreWrite {
        void run();
    }

    private static class PendingWrite {
        private final String description;
        private final StoreWrite write;

        PendingWrite(String description, StoreWrite write) {
            this.description = description;
            this.write = write;
        }
    }

    private final String serverId;
    private final BlockingQueue<TrackerMessage> queue;
    private final IdentityResolver identities;
    private final StatsAggregator aggregator;
    private final StatsStore store;
    private final TrackerPersistenceService persistence;
    private final TrackerEventLog eventLog;
    private final TrackerConfig.Aggregation settings;
    private final Clock clock;

    private Match currentMatch;
    private String lastFileIdentity;
    private long lastOffset = -1;
    private LocalDateTime lastEventAt;
    private boolean lastSnapshotReachable = true;
    private boolean damageUnsynced;
    private final Deque<PendingWrite> pendingWrites = new ArrayDeque<>();

    @Getter
    private volatile long eventsProcessed;
    @Getter
    private volatile long unrecognizedLines;
    @Getter
    private volatile long replayedEventsSkipped;
    @Getter
    private volatile long ignoredTransitions;
    @Getter
    private volatile long persistenceFailures;
    @Getter
    private volatile long backpressureWaits;
    @Getter
    private volatile String lastError;
    @Getter
    private volatile boolean stopped;

    /**
     * Copies published after every message for readers on other threads.
     */
    @Getter
    private volatile Match publishedMatch;
    @Getter
    private volatile int publishedSessionCount;

    public MatchTracker(String serverId, BlockingQueue<TrackerMessage> queue, IdentityResolver identities,
                        StatsAggregator aggregator, StatsStore store, TrackerPersistenceService persistence,
                        TrackerEventLog eventLog, TrackerConfig.Aggregation settings, Clock clock) {
        this.serverId = serverId;
        this.queue = queue;
        this.identities = identities;
        this.aggregator = aggregator;
        this.store = store;
        this.persistence = persistence;
        this.eventLog = eventLog;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Loads the last checkpoint, if any. Must run before the first message is handled.
     */
    public void restore() {
        Optional<TrackerState> state = persistence.loadCheckpoint(serverId);
        if (state.isEmpty()) {
            return;
        }
        TrackerState s = state.get();
        currentMatch = s.getCurrentMatch();
        lastFileIdentity = s.getFileIdentity();
        lastOffset = s.getOffset();
        identities.restore(s.getSessions());
        log.info("[{}] Restored tracker state: match={}, sessions={}, position={}:{}", serverId,
                currentMatch != null ? currentMatch.getMatchId() : null,
                identities.getOpenSessions().size(), lastFileIdentity, lastOffset);
        publishedMatch = currentMatch != null ? copyOf(currentMatch) : null;
        publishedSessionCount = identities.getOpenSessions().size();
    }

    @Override
    public void run() {
        log.info("[{}] Match tracker started", serverId);
        try {
            while (true) {
                TrackerMessage message = queue.take();
                if (message.getKind() == TrackerMessage.Kind.STOP) {
                    break;
                }
                handle(message);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[{}] Match tracker interrupted", serverId);
        } finally {
            stopped = true;
            log.info("[{}] Match tracker stopped", serverId);
        }
    }

    /**
     * Processes one message. Never throws; failures are logged and counted.
     */
    public void handle(TrackerMessage message) {
        try {
            switch (message.getKind()) {
                case EVENT:
                    onEvent(message.getEvent());
                    break;
                case SNAPSHOT:
                    onSnapshot(message.getSnapshot());
                    break;
                case ROTATION:
                    onRotation(message.getCursor());
                    break;
                case CHECKPOINT:
                    onCheckpoint(message.getCursor(), message.getCommit());
                    break;
                default:
                    break;
            }
        } catch (RuntimeException e) {
            lastError = e.getMessage();
            log.error("[{}] Failed to handle {}: {}", serverId, message.getKind(), e.getMessage(), e);
        }
        publishedMatch = currentMatch != null ? copyOf(currentMatch) : null;
        publishedSessionCount = identities.getOpenSessions().size();
    }

    // ==================== Log events ====================

    void onEvent(GameEvent event) {
        if (isCovered(event)) {
            replayedEventsSkipped++;
            return;
        }
        if (event.getTimestamp() != null) {
            lastEventAt = event.getTimestamp();
        }

        switch (event.getType()) {
            case MAP_CHANGE:
                onMapChange((MapChangeEvent) event);
                break;
            case ROUND_START:
                onRoundStart((RoundStartEvent) event);
                break;
            case ROUND_END:
                onRoundEnd((RoundEndEvent) event);
                break;
            case GAME_OVER:
                onGameOver();
                break;
            case KILL:
                onKill((KillEvent) event);
                break;
            case DAMAGE:
                onDamage((DamageEvent) event);
                break;
            case OBJECTIVE:
                onObjective((ObjectiveEvent) event);
                break;
            case PLAYER_CONNECT:
                onConnect((PlayerConnectEvent) event);
                break;
            case PLAYER_DISCONNECT:
                PlayerDisconnectEvent disconnect = (PlayerDisconnectEvent) event;
                reportSessions(identities.onDisconnect(disconnect.getPlayerId(), disconnect.getPlayerName(),
                        event.getTimestamp()));
                break;
            case CHAT_MESSAGE:
                onChat((ChatMessageEvent) event);
                break;
            case UNRECOGNIZED:
                unrecognizedLines++;
                if (log.isTraceEnabled()) {
                    log.trace("[{}] Unrecognized ({}): {}", serverId,
                            ((UnrecognizedEvent) event).getReason(), ((UnrecognizedEvent) event).getText());
                }
                break;
            default:
                break;
        }

        eventsProcessed++;
        lastFileIdentity = event.getFileIdentity();
        lastOffset = event.getOffset();
    }

    /**
     * True for events at or before the last position folded into the state, as happens when
     * lines between the committed cursor and the checkpoint are read again after a restart.
     */
    private boolean isCovered(GameEvent event) {
        return lastFileIdentity != null
                && lastFileIdentity.equals(event.getFileIdentity())
                && event.getOffset() <= lastOffset;
    }

    private void onMapChange(MapChangeEvent event) {
        concludeCurrent(event.getTimestamp(), "map change to " + event.getMapName());
        Match match = Match.open(serverId, event.getMapName(), event.getScenario(), event.getTimestamp(), false);
        startMatch(match, event.getTimestamp());
    }

    private void onRoundStart(RoundStartEvent event) {
        Match match = ensureMatch(event.getTimestamp(), null);
        if (event.isPreRound()) {
            if (match.getPhase() != MatchPhase.WARMUP) {
                match.setPhase(MatchPhase.WARMUP);
                syncProgress(match);
            }
            return;
        }
        if (match.getPhase() == MatchPhase.ROUND_ACTIVE && match.getRoundNumber() == event.getRoundNumber()) {
            log.debug("[{}] Duplicate start of round {} ignored", serverId, event.getRoundNumber());
            ignoredTransitions++;
            return;
        }
        match.setPhase(MatchPhase.ROUND_ACTIVE);
        match.setRoundNumber(event.getRoundNumber());
        syncProgress(match);
        eventLog.record(serverId, TrackerEvent.EventType.ROUND_STARTED,
                "Round " + event.getRoundNumber() + " started in " + match.getMatchId());
    }

    private void onRoundEnd(RoundEndEvent event) {
        if (currentMatch == null || currentMatch.getPhase() != MatchPhase.ROUND_ACTIVE) {
            log.debug("[{}] Round end outside an active round ignored", serverId);
            ignoredTransitions++;
            return;
        }
        currentMatch.setPhase(MatchPhase.ROUND_END);
        currentMatch.setLastRoundWinner(event.getWinningTeam());
        syncProgress(currentMatch);
        eventLog.record(serverId, TrackerEvent.EventType.ROUND_ENDED, String.format(
                "Round %d won by team %d (%s)", currentMatch.getRoundNumber(), event.getWinningTeam(),
                event.getWinReason()));
    }

    private void onGameOver() {
        if (currentMatch == null) {
            return;
        }
        currentMatch.setGameOver(true);
        currentMatch.setWinnerTeam(currentMatch.getLastRoundWinner());
        log.info("[{}] Game over in {}, winner team {}", serverId, currentMatch.getMatchId(),
                currentMatch.getWinnerTeam());
    }

    private void onKill(KillEvent event) {
        Match match = ensureMatch(event.getTimestamp(), null);
        boolean warmup = match.getPhase() != MatchPhase.ROUND_ACTIVE;
        LocalDateTime at = event.getTimestamp();
        String matchId = match.getMatchId();
        IdentityResolver.SessionChanges seen = new IdentityResolver.SessionChanges();
        Participant victim = event.getVictim();
        StatBatch batch = new StatBatch(event.idempotencyKey(), matchId);

        Participant killer = event.getKiller();
        if (killer != null && !killer.isBot()) {
            String killerId = identities.resolve(killer, at, matchId, seen);
            boolean suicide = killer.getPlayerId().equals(victim.getPlayerId());
            boolean teamKill = !suicide && !victim.isBot() && killer.getTeam() == victim.getTeam();
            if (suicide) {
                batch.add(killerId, killer.getName(), StatMetric.SUICIDES);
            } else if (teamKill) {
                batch.add(killerId, killer.getName(), StatMetric.TEAM_KILLS);
            } else if (warmup) {
                batch.add(killerId, killer.getName(), StatMetric.WARMUP_KILLS);
            } else {
                batch.add(killerId, killer.getName(), StatMetric.KILLS);
                batch.add(killerId, killer.getName(), StatMetric.WEAPON_KILLS, event.getWeapon(), 1);
                if (event.isHeadshot()) {
                    batch.add(killerId, killer.getName(), StatMetric.HEADSHOTS);
                }
            }
        }

        for (Participant assister : event.getAssisters()) {
            if (!assister.isBot()) {
                String assisterId = identities.resolve(assister, at, matchId, seen);
                batch.add(assisterId, assister.getName(), StatMetric.ASSISTS);
                if (!warmup && event.getWeapon() != null) {
                    batch.add(assisterId, assister.getName(), StatMetric.WEAPON_ASSISTS, event.getWeapon(), 1);
                }
            }
        }

        if (!victim.isBot()) {
            String victimId = identities.resolve(victim, at, matchId, seen);
            batch.add(victimId, victim.getName(), warmup ? StatMetric.WARMUP_DEATHS : StatMetric.DEATHS);
        }

        reportSessions(seen);
        applyBatch(batch);
    }

    private void onDamage(DamageEvent event) {
        Match match = ensureMatch(event.getTimestamp(), null);
        if (match.getPhase() == MatchPhase.ROUND_ACTIVE) {
            match.setDamageEvents(match.getDamageEvents() + 1);
        } else {
            match.setWarmupDamageEvents(match.getWarmupDamageEvents() + 1);
        }
        damageUnsynced = true;
    }

    private void onObjective(ObjectiveEvent event) {
        Match match = ensureMatch(event.getTimestamp(), null);
        if (event.getPlayers().isEmpty()) {
            return;
        }
        Participant credited = event.getPlayers().get(0);
        if (credited.isBot()) {
            return;
        }
        StatMetric metric = event.getAction() == ObjectiveEvent.Action.CAPTURED
                ? StatMetric.OBJECTIVES_CAPTURED
                : StatMetric.OBJECTIVES_DESTROYED;
        IdentityResolver.SessionChanges seen = new IdentityResolver.SessionChanges();
        StatBatch batch = new StatBatch(event.idempotencyKey(), match.getMatchId());
        batch.add(identities.resolve(credited, event.getTimestamp(), match.getMatchId(), seen),
                credited.getName(), metric);
        reportSessions(seen);
        applyBatch(batch);
    }

    private void onConnect(PlayerConnectEvent event) {
        String matchId = currentMatch != null ? currentMatch.getMatchId() : null;
        switch (event.getStage()) {
            case LOGIN:
                reportSessions(identities.onLogin(event.getPlayerName(), event.getPlayerId(),
                        event.getTimestamp(), matchId));
                break;
            case JOINED:
                reportSessions(identities.onJoined(event.getPlayerName(), event.getTimestamp(), matchId));
                break;
            case REGISTERED:
                reportSessions(identities.onRegistered(event.getPlayerId(), event.getTimestamp(), matchId));
                break;
            default:
                break;
        }
    }

    private void onChat(ChatMessageEvent event) {
        identities.touch(event.getPlayerId(), event.getPlayerName(), event.getTimestamp());
        if (event.isCommand()) {
            eventLog.record(serverId, TrackerEvent.EventType.CHAT_COMMAND,
                    String.format("%s: %s", event.getPlayerName().trim(), event.getMessage()));
        }
    }

    // ==================== Snapshots ====================

    void onSnapshot(LiveSnapshot snapshot) {
        if (!snapshot.isReachable()) {
            if (lastSnapshotReachable) {
                eventLog.record(serverId, TrackerEvent.EventType.SERVER_UNREACHABLE,
                        "Query failed: " + snapshot.getFailure());
            }
            lastSnapshotReachable = false;
            return;
        }
        lastSnapshotReachable = true;

        LocalDateTime at = LocalDateTime.ofInstant(snapshot.getQueriedAt(), clock.getZone());
        String map = snapshot.getDetails() != null ? snapshot.getDetails().getMap() : null;
        if (currentMatch == null && !snapshot.getPlayers().isEmpty()) {
            ensureMatch(at, map);
        } else if (currentMatch != null && currentMatch.getMapName() == null && map != null) {
            currentMatch.setMapName(map);
            syncProgress(currentMatch);
        }

        String matchId = currentMatch != null ? currentMatch.getMatchId() : null;
        reportSessions(identities.mergeSnapshot(snapshot.getPlayers(), at, matchId));
    }

    // ==================== Rotation and checkpoints ====================

    void onRotation(LogCursor newCursor) {
        LocalDateTime at = lastEventAt != null ? lastEventAt : LocalDateTime.now(clock);
        concludeCurrent(at, "log rotated");
        for (PlayerSession session : identities.closeAll(at)) {
            log.debug("[{}] Session {} closed by rotation", serverId, session.getIdentity());
            recordStay(session);
        }
        lastFileIdentity = newCursor.streamKey();
        lastOffset = -1;
        eventLog.record(serverId, TrackerEvent.EventType.LOG_ROTATED,
                "Now reading " + newCursor.getPath() + " (" + newCursor.streamKey() + ")");
    }

    void onCheckpoint(LogCursor cursor, Consumer<LogCursor> commit) {
        if (currentMatch != null && damageUnsynced) {
            syncProgress(currentMatch);
        }
        if (!retryPendingWrites()) {
            log.warn("[{}] {} store writes still failing, checkpoint at offset {} deferred",
                    serverId, pendingWrites.size(), cursor.getByteOffset());
            return;
        }

        TrackerState state = new TrackerState(currentMatch, identities.getOpenSessions(),
                lastFileIdentity, lastOffset);
        try {
            persistence.saveCheckpoint(serverId, state);
            if (commit != null) {
                commit.accept(cursor);
            }
        } catch (RuntimeException e) {
            recordPersistenceFailure("checkpoint at offset " + cursor.getByteOffset(), e);
        }
    }

    // ==================== Match lifecycle ====================

    /**
     * Returns the current match, opening an implicit one when the server has none.
     */
    private Match ensureMatch(LocalDateTime at, String mapName) {
        if (currentMatch == null) {
            LocalDateTime startedAt = at != null ? at : LocalDateTime.now(clock);
            startMatch(Match.open(serverId, mapName, null, startedAt, true), startedAt);
        }
        return currentMatch;
    }

    private void startMatch(Match match, LocalDateTime at) {
        currentMatch = match;
        for (PlayerSession ended : identities.moveToMatch(match.getMatchId(), at)) {
            recordStay(ended);
        }
        write("open match " + match.getMatchId(), () -> store.openMatch(match));
        eventLog.record(serverId, TrackerEvent.EventType.MATCH_OPENED, String.format("Match %s on %s%s",
                match.getMatchId(), match.getMapName(), match.isImplicit() ? " (implicit)" : ""));
    }

    private void concludeCurrent(LocalDateTime at, String reason) {
        if (currentMatch == null) {
            return;
        }
        Match match = currentMatch;
        currentMatch = null;
        match.setPhase(MatchPhase.CONCLUDED);
        match.setEndedAt(at);
        if (!match.isGameOver()) {
            match.setWinnerTeam(null);
        }
        damageUnsynced = false;
        final Match concluded = copyOf(match);
        write("close match " + match.getMatchId(), () -> store.closeMatch(concluded));
        eventLog.record(serverId, TrackerEvent.EventType.MATCH_CLOSED,
                String.format("Match %s concluded: %s", match.getMatchId(), reason));
    }

    private void syncProgress(Match match) {
        damageUnsynced = false;
        final Match copy = copyOf(match);
        write("update match " + match.getMatchId(), () -> store.updateMatchProgress(copy));
    }

    private static Match copyOf(Match match) {
        Match copy = new Match();
        copy.setMatchId(match.getMatchId());
        copy.setServerId(match.getServerId());
        copy.setMapName(match.getMapName());
        copy.setScenario(match.getScenario());
        copy.setPhase(match.getPhase());
        copy.setRoundNumber(match.getRoundNumber());
        copy.setStartedAt(match.getStartedAt());
        copy.setEndedAt(match.getEndedAt());
        copy.setWinnerTeam(match.getWinnerTeam());
        copy.setLastRoundWinner(match.getLastRoundWinner());
        copy.setImplicit(match.isImplicit());
        copy.setGameOver(match.isGameOver());
        copy.setDamageEvents(match.getDamageEvents());
        copy.setWarmupDamageEvents(match.getWarmupDamageEvents());
        return copy;
    }

    // ==================== Store writes ====================

    private void applyBatch(StatBatch batch) {
        if (!batch.isEmpty()) {
            write("stats " + batch.getIdempotencyKey(), () -> aggregator.apply(batch));
        }
    }

    /**
     * Folds a closed stay into the player's match row. Stays outside any match are not kept.
     */
    private void recordStay(PlayerSession session) {
        if (session.getMatchId() == null) {
            return;
        }
        final PlayerSession closed = session.closedCopy(session.getLeftAt());
        write("session " + closed.stayKey(), () -> store.recordSession(closed));
    }

    private void write(String description, StoreWrite write) {
        if (pendingWrites.size() >= settings.getMaxPendingWrites()) {
            awaitStoreRecovery();
        }
        if (!pendingWrites.isEmpty()) {
            pendingWrites.addLast(new PendingWrite(description, write));
            return;
        }
        try {
            write.run();
        } catch (RuntimeException e) {
            recordPersistenceFailure(description, e);
            pendingWrites.addLast(new PendingWrite(description, write));
        }
    }

    /**
     * Blocks the tracker thread, retrying pending writes with exponential backoff until they all
     * succeed. Returns early, leaving the writes queued, when the thread is interrupted.
     */
    private void awaitStoreRecovery() {
        backpressureWaits++;
        log.warn("[{}] {} store writes pending, pausing until the store recovers", serverId, pendingWrites.size());
        long backoff = Math.max(1, settings.getPendingRetryBackoffMs());
        while (!retryPendingWrites()) {
            try {
                Thread.sleep(backoff);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("[{}] Interrupted while waiting for the store, {} writes still pending",
                        serverId, pendingWrites.size());
                return;
            }
            backoff = Math.min(backoff * 2, Math.max(backoff, settings.getPendingRetryMaxBackoffMs()));
        }
        log.info("[{}] Store recovered, pending writes flushed", serverId);
    }

    private boolean retryPendingWrites() {
        while (!pendingWrites.isEmpty()) {
            PendingWrite next = pendingWrites.peekFirst();
            try {
                next.write.run();
                pendingWrites.removeFirst();
            } catch (RuntimeException e) {
                recordPersistenceFailure(next.description, e);
                return false;
            }
        }
        return true;
    }

    private void recordPersistenceFailure(String what, RuntimeException e) {
        persistenceFailures++;
        lastError = e.getMessage();
        log.error("[{}] Persistence failure on {}: {}", serverId, what, e.getMessage(), e);
        eventLog.record(serverId, TrackerEvent.EventType.PERSISTENCE_FAILURE, what + ": " + e.getMessage());
    }

    private void reportSessions(IdentityResolver.SessionChanges changes) {
        for (PlayerSession session : changes.getOpened()) {
            eventLog.record(serverId, TrackerEvent.EventType.SESSION_OPENED, String.format("%s (%s) via %s",
                    session.getDisplayName(), session.getIdentity(), session.getSource()));
        }
        for (PlayerSession session : changes.getClosed()) {
            eventLog.record(serverId, TrackerEvent.EventType.SESSION_CLOSED,
                    String.format("%s (%s)", session.getDisplayName(), session.getIdentity()));
            recordStay(session);
        }
    }

    // ==================== Status ====================

    public Match getCurrentMatch() {
        return currentMatch;
    }

    public List<PlayerSession> getOpenSessions() {
        return identities.getOpenSessions();
    }

    public long getIdentityAmbiguities() {
        return identities.getAmbiguityCount();
    }

    public int getPendingWriteCount() {
        return pendingWrites.size();
    }
}
