package com.example.sandstormtracker.persistence;

import com.example.sandstormtracker.model.Match;
import com.example.sandstormtracker.model.MatchPhase;
import com.example.sandstormtracker.model.PlayerSession;
import com.example.sandstormtracker.model.StatDelta;
import com.example.sandstormtracker.model.StatMetric;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.Optional;

/**
 * Relational {@link StatsStore}. Counter rows are read under a pessimistic write lock so that
 * increments from several server pipelines on the same player serialize in the database.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaStatsStore implements StatsStore {

    private final MatchRepository matchRepository;
    private final PlayerMatchStatsRepository matchStatsRepository;
    private final PlayerTotalStatsRepository totalStatsRepository;
    private final WeaponUsageRepository weaponUsageRepository;
    private final AppliedDeltaRepository appliedDeltaRepository;

    @Override
    public boolean isApplied(String idempotencyKey, AppliedDeltaEntity.Target target) {
        return appliedDeltaRepository.existsById(AppliedDeltaEntity.idFor(idempotencyKey, target));
    }

    // ==================== Counters ====================

    @Override
    @Transactional
    public boolean upsertPlayerMatchStats(StatDelta delta) {
        if (isApplied(delta.getIdempotencyKey(), AppliedDeltaEntity.Target.MATCH)) {
            log.debug("Delta {} already applied to match {}", delta.getIdempotencyKey(), delta.getMatchId());
            return false;
        }

        if (delta.getMetric().isWeaponMetric()) {
            incrementWeapon(delta.getMatchId(), delta);
        } else {
            PlayerMatchStatsEntity row = matchStatsRepository
                .findForUpdate(delta.getMatchId(), delta.getIdentity())
                .orElseGet(() -> new PlayerMatchStatsEntity(
                    delta.getMatchId(), delta.getIdentity(), delta.getDisplayName()));
            row.setDisplayName(delta.getDisplayName());
            row.getCounters().increment(delta.getMetric(), delta.getAmount());
            matchStatsRepository.save(row);
        }

        markApplied(delta, AppliedDeltaEntity.Target.MATCH);
        return true;
    }

    @Override
    @Transactional
    public boolean upsertAllTimeStats(StatDelta delta) {
        if (isApplied(delta.getIdempotencyKey(), AppliedDeltaEntity.Target.ALL_TIME)) {
            log.debug("Delta {} already applied to all-time totals", delta.getIdempotencyKey());
            return false;
        }

        if (delta.getMetric().isWeaponMetric()) {
            incrementWeapon(WeaponUsageEntity.ALL_TIME, delta);
        } else {
            PlayerTotalStatsEntity row = totalStatsRepository.findForUpdate(delta.getIdentity())
                .orElseGet(() -> new PlayerTotalStatsEntity(delta.getIdentity(), delta.getDisplayName()));
            row.setDisplayName(delta.getDisplayName());
            row.getCounters().increment(delta.getMetric(), delta.getAmount());
            totalStatsRepository.save(row);
        }

        markApplied(delta, AppliedDeltaEntity.Target.ALL_TIME);
        return true;
    }

    private void incrementWeapon(String scope, StatDelta delta) {
        WeaponUsageEntity row = weaponUsageRepository
            .findForUpdate(scope, delta.getIdentity(), delta.getWeapon())
            .orElseGet(() -> new WeaponUsageEntity(scope, delta.getIdentity(), delta.getWeapon()));
        if (delta.getMetric() == StatMetric.WEAPON_ASSISTS) {
            row.setAssists(row.getAssists() + delta.getAmount());
        } else {
            row.setKills(row.getKills() + delta.getAmount());
        }
        weaponUsageRepository.save(row);
    }

    private void markApplied(StatDelta delta, AppliedDeltaEntity.Target target) {
        markApplied(delta.getIdempotencyKey(), target);
    }

    private void markApplied(String idempotencyKey, AppliedDeltaEntity.Target target) {
        appliedDeltaRepository.save(new AppliedDeltaEntity(
            AppliedDeltaEntity.idFor(idempotencyKey, target),
            idempotencyKey,
            target,
            System.currentTimeMillis()
        ));
    }

    // ==================== Sessions ====================

    @Override
    @Transactional
    public boolean recordSession(PlayerSession closed) {
        String key = closed.stayKey();
        if (isApplied(key, AppliedDeltaEntity.Target.SESSION)) {
            log.debug("Session {} already recorded", key);
            return false;
        }

        PlayerMatchStatsEntity row = matchStatsRepository
            .findForUpdate(closed.getMatchId(), closed.getIdentity())
            .orElseGet(() -> new PlayerMatchStatsEntity(
                closed.getMatchId(), closed.getIdentity(), closed.getDisplayName()));
        row.setDisplayName(closed.getDisplayName());
        if (closed.getTeam() != null) {
            row.setTeam(closed.getTeam());
        }
        row.setScore(closed.getLastScore());
        row.setSessionCount(row.getSessionCount() + 1);
        if (closed.getJoinedAt() != null && closed.getLeftAt() != null) {
            long seconds = Duration.between(closed.getJoinedAt(), closed.getLeftAt()).getSeconds();
            row.setTotalPlayTimeSeconds(row.getTotalPlayTimeSeconds() + Math.max(0, seconds));
        }
        if (closed.getJoinedAt() != null
                && (row.getFirstJoinedAt() == null || closed.getJoinedAt().isBefore(row.getFirstJoinedAt()))) {
            row.setFirstJoinedAt(closed.getJoinedAt());
        }
        if (closed.getLeftAt() != null
                && (row.getLastLeftAt() == null || closed.getLeftAt().isAfter(row.getLastLeftAt()))) {
            row.setLastLeftAt(closed.getLeftAt());
        }
        matchStatsRepository.save(row);

        markApplied(key, AppliedDeltaEntity.Target.SESSION);
        return true;
    }

    // ==================== Matches ====================

    @Override
    @Transactional
    public void openMatch(Match match) {
        if (matchRepository.existsById(match.getMatchId())) {
            return;
        }
        MatchEntity entity = new MatchEntity(
            match.getMatchId(),
            match.getServerId(),
            match.getMapName(),
            match.getScenario(),
            match.getPhase(),
            match.getRoundNumber(),
            match.getStartedAt(),
            null,
            null,
            match.isImplicit(),
            match.getDamageEvents(),
            match.getWarmupDamageEvents()
        );
        matchRepository.save(entity);
        log.info("Opened match {} on map {}", match.getMatchId(), match.getMapName());
    }

    @Override
    @Transactional
    public void updateMatchProgress(Match match) {
        Optional<MatchEntity> existing = matchRepository.findById(match.getMatchId());
        if (existing.isEmpty()) {
            openMatch(match);
            return;
        }
        MatchEntity entity = existing.get();
        if (entity.getPhase() == MatchPhase.CONCLUDED) {
            return;
        }
        entity.setPhase(match.getPhase());
        entity.setRoundNumber(match.getRoundNumber());
        if (match.getMapName() != null) {
            entity.setMapName(match.getMapName());
        }
        entity.setDamageEvents(match.getDamageEvents());
        entity.setWarmupDamageEvents(match.getWarmupDamageEvents());
        matchRepository.save(entity);
    }

    @Override
    @Transactional
    public void closeMatch(Match concluded) {
        Optional<MatchEntity> existing = matchRepository.findById(concluded.getMatchId());
        if (existing.isEmpty()) {
            log.warn("Cannot close unknown match {}", concluded.getMatchId());
            return;
        }
        MatchEntity entity = existing.get();
        if (entity.getEndedAt() != null) {
            return;
        }
        entity.setEndedAt(concluded.getEndedAt());
        entity.setWinnerTeam(concluded.getWinnerTeam());
        entity.setPhase(MatchPhase.CONCLUDED);
        entity.setDamageEvents(concluded.getDamageEvents());
        entity.setWarmupDamageEvents(concluded.getWarmupDamageEvents());
        matchRepository.save(entity);
        log.info("Closed match {} at {}, winner team {}", concluded.getMatchId(), concluded.getEndedAt(),
            concluded.getWinnerTeam());
    }
}
