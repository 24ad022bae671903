package com.example.sandstormtracker.persistence;

import com.example.sandstormtracker.model.Match;
import com.example.sandstormtracker.model.PlayerSession;
import com.example.sandstormtracker.model.StatDelta;

/**
 * Durable home of match rows and player counters.
 * <p>
 * Both upserts are idempotent per delta key: a delta already applied to a target is ignored
 * for that target. Callers may wrap several calls in one transaction.
 */
public interface StatsStore {

    boolean isApplied(String idempotencyKey, AppliedDeltaEntity.Target target);

    /**
     * @return false when the delta had already been applied to the match table
     */
    boolean upsertPlayerMatchStats(StatDelta delta);

    /**
     * @return false when the delta had already been applied to the all-time table
     */
    boolean upsertAllTimeStats(StatDelta delta);

    /**
     * Creates the match row if it does not exist yet.
     */
    void openMatch(Match match);

    /**
     * Records phase, round number, map and damage counts of an open match.
     */
    void updateMatchProgress(Match match);

    /**
     * Marks the match concluded with its end time, winner and final damage counts.
     */
    void closeMatch(Match concluded);

    /**
     * Folds a closed session into the player's row for its match: play time, session count,
     * first join, last leave, team and last score.
     *
     * @return false when this stay had already been recorded
     */
    boolean recordSession(PlayerSession closed);
}
