package com.example.sandstormtracker.service;

import com.example.sandstormtracker.config.TrackerConfig;
import com.example.sandstormtracker.model.IdentityKeys;
import com.example.sandstormtracker.model.PlayerSession;
import com.example.sandstormtracker.model.PlayerSession.SessionSource;
import com.example.sandstormtracker.model.SnapshotPlayer;
import com.example.sandstormtracker.model.TrackerEvent;
import com.example.sandstormtracker.model.event.Participant;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Best-effort correlation of the identities a server reports through its log (display name,
 * Steam id, each line carrying only part of it) and through live snapshots (name only).
 * <p>
 * Owns the open sessions of one server. Not thread-safe; used from the tracker thread only.
 * Two open sessions sharing a display name are never merged: the one with the most recent
 * activity wins and the ambiguity is reported.
 */
@Slf4j
public class IdentityResolver {

    private final String serverId;
    private final TrackerConfig.Matching config;
    private final TrackerEventLog eventLog;

    /**
     * Open sessions by identity key, in join order.
     */
    private final Map<String, PlayerSession> sessions = new LinkedHashMap<>();

    @Getter
    private volatile long ambiguityCount;

    public IdentityResolver(String serverId, TrackerConfig.Matching config, TrackerEventLog eventLog) {
        this.serverId = serverId;
        this.config = config;
        this.eventLog = eventLog;
    }

    /**
     * Result of folding one log or snapshot observation into the session set.
     */
    @Getter
    public static class SessionChanges {
        private final List<PlayerSession> opened = new ArrayList<>();
        private final List<PlayerSession> closed = new ArrayList<>();

        public boolean isEmpty() {
            return opened.isEmpty() && closed.isEmpty();
        }
    }

    // ==================== Log identities ====================

    /**
     * Login request: carries both name and platform id.
     */
    public SessionChanges onLogin(String name, String playerId, LocalDateTime at, String matchId) {
        SessionChanges changes = new SessionChanges();
        if (!IdentityKeys.isValidPlayerId(playerId)) {
            return onJoined(name, at, matchId);
        }

        PlayerSession session = sessions.get(IdentityKeys.forPlayerId(playerId));
        if (session == null) {
            PlayerSession byName = findByName(name, true);
            if (byName != null && !byName.hasPlayerId()) {
                session = attachPlayerId(byName, playerId);
            }
        }
        if (session == null) {
            session = open(IdentityKeys.forPlayerId(playerId), name, playerId, at, matchId, SessionSource.LOG);
            changes.opened.add(session);
        }
        session.setDisplayName(name);
        session.touch(at);
        return changes;
    }

    /**
     * Join succeeded: name only.
     */
    public SessionChanges onJoined(String name, LocalDateTime at, String matchId) {
        SessionChanges changes = new SessionChanges();
        PlayerSession session = findByName(name, true);
        if (session == null) {
            session = open(IdentityKeys.forName(name), name, null, at, matchId, SessionSource.LOG);
            changes.opened.add(session);
        }
        session.touch(at);
        return changes;
    }

    /**
     * Anti-cheat registration: id only. Linked to the most recently joined session that has no id
     * yet, provided it joined within the identity window.
     */
    public SessionChanges onRegistered(String playerId, LocalDateTime at, String matchId) {
        SessionChanges changes = new SessionChanges();
        if (!IdentityKeys.isValidPlayerId(playerId)) {
            return changes;
        }
        PlayerSession session = sessions.get(IdentityKeys.forPlayerId(playerId));
        if (session == null) {
            PlayerSession candidate = null;
            for (PlayerSession s : sessions.values()) {
                if (s.hasPlayerId() || !withinWindow(s.getJoinedAt(), at)) {
                    continue;
                }
                if (candidate == null || !s.getJoinedAt().isBefore(candidate.getJoinedAt())) {
                    candidate = s;
                }
            }
            if (candidate != null) {
                session = attachPlayerId(candidate, playerId);
            }
        }
        if (session == null) {
            session = open(IdentityKeys.forPlayerId(playerId), playerId, playerId, at, matchId, SessionSource.LOG);
            changes.opened.add(session);
        }
        session.touch(at);
        return changes;
    }

    public SessionChanges onDisconnect(String playerId, String name, LocalDateTime at) {
        SessionChanges changes = new SessionChanges();
        PlayerSession session = null;
        if (IdentityKeys.isValidPlayerId(playerId)) {
            session = sessions.get(IdentityKeys.forPlayerId(playerId));
        }
        if (session == null && name != null) {
            session = findByName(name, true);
        }
        if (session == null) {
            log.debug("[{}] Disconnect for unknown player id={} name={}", serverId, playerId, name);
            return changes;
        }
        close(session, at);
        changes.closed.add(session);
        return changes;
    }

    /**
     * Identity key for a kill or objective participant. Bots have no identity.
     * A player seen for the first time gets a session, added to {@code changes}.
     */
    public String resolve(Participant participant, LocalDateTime at, String matchId, SessionChanges changes) {
        if (participant.isBot()) {
            return null;
        }
        String identity = IdentityKeys.forPlayerId(participant.getPlayerId());
        PlayerSession session = sessions.get(identity);
        if (session == null) {
            PlayerSession byName = findByName(participant.getName(), true);
            if (byName != null && !byName.hasPlayerId()) {
                session = attachPlayerId(byName, participant.getPlayerId());
            }
        }
        if (session == null) {
            session = open(identity, participant.getName(), participant.getPlayerId(), at, matchId,
                    SessionSource.LOG);
            changes.opened.add(session);
        }
        if (participant.getTeam() >= 0) {
            session.setTeam(participant.getTeam());
        }
        session.touch(at);
        return identity;
    }

    /**
     * Chat line: touches the speaker's session, if any.
     */
    public PlayerSession touch(String playerId, String name, LocalDateTime at) {
        PlayerSession session = null;
        if (IdentityKeys.isValidPlayerId(playerId)) {
            session = sessions.get(IdentityKeys.forPlayerId(playerId));
        }
        if (session == null && name != null) {
            session = findByName(name, true);
        }
        if (session != null) {
            session.touch(at);
        }
        return session;
    }

    // ==================== Snapshot identities ====================

    /**
     * Folds one reachable snapshot into the session set. Names without a session open one;
     * sessions missing from enough consecutive snapshots are closed.
     */
    public SessionChanges mergeSnapshot(List<SnapshotPlayer> players, LocalDateTime at, String matchId) {
        SessionChanges changes = new SessionChanges();
        Set<PlayerSession> seen = Collections.newSetFromMap(new IdentityHashMap<>());

        for (SnapshotPlayer player : players) {
            String name = player.getName();
            if (name == null || name.isBlank()) {
                // Still connecting; the server does not know the name yet.
                continue;
            }
            PlayerSession session = findByName(name, true);
            if (session == null) {
                session = findByNameIgnoreCase(name, at);
            }
            if (session == null) {
                session = open(IdentityKeys.forName(name), name, null, at, matchId, SessionSource.SNAPSHOT);
                changes.opened.add(session);
            }
            session.setLastScore(player.getScore());
            session.touch(at);
            seen.add(session);
        }

        for (PlayerSession session : new ArrayList<>(sessions.values())) {
            if (seen.contains(session)) {
                continue;
            }
            session.setMissedSnapshots(session.getMissedSnapshots() + 1);
            if (session.getMissedSnapshots() >= config.getMissingSnapshotThreshold()) {
                log.info("[{}] Closing session {} after {} snapshots without it",
                        serverId, session.getIdentity(), session.getMissedSnapshots());
                close(session, at);
                changes.closed.add(session);
            }
        }
        return changes;
    }

    // ==================== Match boundaries ====================

    /**
     * Players stay connected across a map change; their sessions move to the new match.
     *
     * @return closed copies of the stays that ended in the previous match
     */
    public List<PlayerSession> moveToMatch(String matchId, LocalDateTime at) {
        List<PlayerSession> ended = new ArrayList<>();
        for (PlayerSession session : sessions.values()) {
            if (session.getMatchId() != null) {
                ended.add(session.closedCopy(at));
            }
            session.setMatchId(matchId);
            session.setJoinedAt(at);
            session.setLastScore(0);
        }
        return ended;
    }

    public List<PlayerSession> closeAll(LocalDateTime at) {
        List<PlayerSession> closed = new ArrayList<>(sessions.values());
        for (PlayerSession session : closed) {
            session.close(at);
        }
        sessions.clear();
        return closed;
    }

    public List<PlayerSession> getOpenSessions() {
        return new ArrayList<>(sessions.values());
    }

    public void restore(Collection<PlayerSession> restored) {
        sessions.clear();
        for (PlayerSession session : restored) {
            if (session.isOpen()) {
                sessions.put(session.getIdentity(), session);
            }
        }
    }

    // ==================== Internals ====================

    /**
     * Exact display-name lookup among open sessions. With several candidates the most recently
     * active one is returned and, when {@code report} is set, the ambiguity is reported.
     */
    PlayerSession findByName(String name, boolean report) {
        List<PlayerSession> candidates = new ArrayList<>();
        for (PlayerSession session : sessions.values()) {
            if (name.equals(session.getDisplayName())) {
                candidates.add(session);
            }
        }
        return pick(name, candidates, report);
    }

    private PlayerSession findByNameIgnoreCase(String name, LocalDateTime at) {
        List<PlayerSession> candidates = new ArrayList<>();
        for (PlayerSession session : sessions.values()) {
            if (name.equalsIgnoreCase(session.getDisplayName()) && withinWindow(session.getLastActivityAt(), at)) {
                candidates.add(session);
            }
        }
        return pick(name, candidates, true);
    }

    private PlayerSession pick(String name, List<PlayerSession> candidates, boolean report) {
        if (candidates.isEmpty()) {
            return null;
        }
        PlayerSession best = candidates.get(0);
        for (PlayerSession candidate : candidates) {
            if (isMoreRecent(candidate, best)) {
                best = candidate;
            }
        }
        if (candidates.size() > 1 && report) {
            ambiguityCount++;
            eventLog.record(serverId, TrackerEvent.EventType.IDENTITY_AMBIGUOUS, String.format(
                    "%d open sessions named '%s', attributed to %s", candidates.size(), name, best.getIdentity()));
        }
        return best;
    }

    private boolean isMoreRecent(PlayerSession a, PlayerSession b) {
        if (a.getLastActivityAt() == null) {
            return false;
        }
        return b.getLastActivityAt() == null || a.getLastActivityAt().isAfter(b.getLastActivityAt());
    }

    private boolean withinWindow(LocalDateTime then, LocalDateTime now) {
        if (then == null || now == null) {
            return false;
        }
        return Duration.between(then, now).abs().getSeconds() <= config.getIdentityWindowSeconds();
    }

    private PlayerSession attachPlayerId(PlayerSession session, String playerId) {
        sessions.remove(session.getIdentity());
        session.setPlayerId(playerId);
        session.setIdentity(IdentityKeys.forPlayerId(playerId));
        sessions.put(session.getIdentity(), session);
        log.debug("[{}] Linked session '{}' to player id {}", serverId, session.getDisplayName(), playerId);
        return session;
    }

    private PlayerSession open(String identity, String name, String playerId, LocalDateTime at,
                               String matchId, SessionSource source) {
        PlayerSession session = new PlayerSession(serverId, matchId, identity, name, playerId, at, source);
        sessions.put(identity, session);
        return session;
    }

    private void close(PlayerSession session, LocalDateTime at) {
        session.close(at);
        sessions.remove(session.getIdentity());
    }
}
