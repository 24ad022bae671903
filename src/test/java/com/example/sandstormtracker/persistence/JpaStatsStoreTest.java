package com.example.sandstormtracker.persistence;

import com.example.sandstormtracker.model.Match;
import com.example.sandstormtracker.model.MatchPhase;
import com.example.sandstormtracker.model.PlayerSession;
import com.example.sandstormtracker.model.StatDelta;
import com.example.sandstormtracker.model.StatMetric;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests JpaStatsStore against an embedded H2 database.
 */
@DataJpaTest
@Import(JpaStatsStore.class)
class JpaStatsStoreTest {

    private static final String ALICE = "steam:76561198000000001";
    private static final LocalDateTime START = LocalDateTime.of(2025, 10, 4, 21, 0);

    @Autowired
    private JpaStatsStore store;

    @Autowired
    private PlayerMatchStatsRepository matchStatsRepository;

    @Autowired
    private PlayerTotalStatsRepository totalStatsRepository;

    @Autowired
    private WeaponUsageRepository weaponUsageRepository;

    @Autowired
    private MatchRepository matchRepository;

    private static StatDelta delta(String matchId, StatMetric metric, String key) {
        return new StatDelta(matchId, ALICE, "Alice", metric, null, 1, key);
    }

    private static Match concluded(Match match, LocalDateTime endedAt, Integer winner) {
        Match copy = new Match();
        copy.setMatchId(match.getMatchId());
        copy.setEndedAt(endedAt);
        copy.setWinnerTeam(winner);
        copy.setDamageEvents(match.getDamageEvents());
        copy.setWarmupDamageEvents(match.getWarmupDamageEvents());
        return copy;
    }

    private static PlayerSession stay(String matchId, LocalDateTime joinedAt, LocalDateTime leftAt, int score) {
        PlayerSession session = new PlayerSession("srv", matchId, ALICE, "Alice", "76561198000000001", joinedAt,
                PlayerSession.SessionSource.LOG);
        session.setTeam(1);
        session.setLastScore(score);
        session.close(leftAt);
        return session;
    }

    @Test
    void testMatchCountersAccumulate() {
        assertTrue(store.upsertPlayerMatchStats(delta("m1", StatMetric.KILLS, "f:1#0")));
        assertTrue(store.upsertPlayerMatchStats(delta("m1", StatMetric.KILLS, "f:2#0")));
        assertTrue(store.upsertPlayerMatchStats(delta("m1", StatMetric.DEATHS, "f:3#0")));

        PlayerMatchStatsEntity row = matchStatsRepository.findByMatchIdAndIdentity("m1", ALICE).orElseThrow();
        assertEquals(2, row.getCounters().getKills());
        assertEquals(1, row.getCounters().getDeaths());
        assertEquals("Alice", row.getDisplayName());
        assertEquals(1, matchStatsRepository.findByMatchId("m1").size());
    }

    @Test
    void testReplayedDeltaIsIgnored() {
        StatDelta kill = delta("m1", StatMetric.KILLS, "f:1#0");
        store.upsertPlayerMatchStats(kill);
        store.upsertAllTimeStats(kill);

        assertFalse(store.upsertPlayerMatchStats(kill));
        assertFalse(store.upsertAllTimeStats(kill));

        assertTrue(store.isApplied("f:1#0", AppliedDeltaEntity.Target.MATCH));
        assertTrue(store.isApplied("f:1#0", AppliedDeltaEntity.Target.ALL_TIME));
        assertEquals(1, matchStatsRepository.findByMatchIdAndIdentity("m1", ALICE).orElseThrow()
                .getCounters().getKills());
        assertEquals(1, totalStatsRepository.findById(ALICE).orElseThrow().getCounters().getKills());
    }

    @Test
    void testMatchAndAllTimeTargetsAreIndependent() {
        StatDelta kill = delta("m1", StatMetric.KILLS, "f:1#0");
        store.upsertPlayerMatchStats(kill);

        assertFalse(store.isApplied("f:1#0", AppliedDeltaEntity.Target.ALL_TIME));
        assertTrue(store.upsertAllTimeStats(kill));
    }

    @Test
    void testAllTimeTotalsSpanMatches() {
        store.upsertAllTimeStats(delta("m1", StatMetric.KILLS, "f:1#0"));
        store.upsertAllTimeStats(delta("m2", StatMetric.KILLS, "f:9#0"));
        store.upsertAllTimeStats(delta("m2", StatMetric.OBJECTIVES_CAPTURED, "f:10#0"));

        StatCounters totals = totalStatsRepository.findById(ALICE).orElseThrow().getCounters();
        assertEquals(2, totals.getKills());
        assertEquals(1, totals.getObjectivesCaptured());
    }

    @Test
    void testWeaponKillsUseWeaponTable() {
        StatDelta weaponKill = new StatDelta("m1", ALICE, "Alice", StatMetric.WEAPON_KILLS, "AK74", 1, "f:1#1");
        store.upsertPlayerMatchStats(weaponKill);
        store.upsertAllTimeStats(weaponKill);
        store.upsertPlayerMatchStats(new StatDelta("m1", ALICE, "Alice", StatMetric.WEAPON_KILLS, "AK74", 1, "f:2#1"));

        assertEquals(2, weaponUsageRepository.findByScopeAndIdentityAndWeapon("m1", ALICE, "AK74")
                .orElseThrow().getKills());
        List<WeaponUsageEntity> allTime = weaponUsageRepository.findByScopeAndIdentity(WeaponUsageEntity.ALL_TIME, ALICE);
        assertEquals(1, allTime.size());
        assertEquals(1, allTime.get(0).getKills());
        assertTrue(matchStatsRepository.findByMatchId("m1").isEmpty());
    }

    @Test
    void testWeaponAssistsShareWeaponRow() {
        store.upsertPlayerMatchStats(new StatDelta("m1", ALICE, "Alice", StatMetric.WEAPON_KILLS, "AK74", 1, "f:1#1"));
        store.upsertPlayerMatchStats(new StatDelta("m1", ALICE, "Alice", StatMetric.WEAPON_ASSISTS, "AK74", 1, "f:2#2"));
        store.upsertPlayerMatchStats(new StatDelta("m1", ALICE, "Alice", StatMetric.WEAPON_ASSISTS, "AK74", 1, "f:3#2"));

        WeaponUsageEntity row = weaponUsageRepository.findByScopeAndIdentityAndWeapon("m1", ALICE, "AK74").orElseThrow();
        assertEquals(1, row.getKills());
        assertEquals(2, row.getAssists());
        assertTrue(matchStatsRepository.findByMatchId("m1").isEmpty());
    }

    @Test
    void testClosedSessionsAccumulateOnMatchRow() {
        store.upsertPlayerMatchStats(delta("m1", StatMetric.KILLS, "f:1#0"));

        assertTrue(store.recordSession(stay("m1", START, START.plusMinutes(10), 120)));
        assertTrue(store.recordSession(stay("m1", START.plusMinutes(15), START.plusMinutes(20), 340)));

        PlayerMatchStatsEntity row = matchStatsRepository.findByMatchIdAndIdentity("m1", ALICE).orElseThrow();
        assertEquals(1, row.getCounters().getKills());
        assertEquals(2, row.getSessionCount());
        assertEquals(15 * 60, row.getTotalPlayTimeSeconds());
        assertEquals(START, row.getFirstJoinedAt());
        assertEquals(START.plusMinutes(20), row.getLastLeftAt());
        assertEquals(340, row.getScore());
        assertEquals(Integer.valueOf(1), row.getTeam());
    }

    @Test
    void testRecordedSessionIsNotCountedTwice() {
        PlayerSession session = stay("m1", START, START.plusMinutes(10), 0);

        assertTrue(store.recordSession(session));
        assertFalse(store.recordSession(session));

        PlayerMatchStatsEntity row = matchStatsRepository.findByMatchIdAndIdentity("m1", ALICE).orElseThrow();
        assertEquals(1, row.getSessionCount());
        assertEquals(600, row.getTotalPlayTimeSeconds());
        assertTrue(store.isApplied(session.stayKey(), AppliedDeltaEntity.Target.SESSION));
    }

    @Test
    void testMatchLifecycle() {
        Match match = Match.open("srv", "Ministry", "Scenario_Ministry_Checkpoint_Security", START, false);
        store.openMatch(match);
        store.openMatch(match);
        assertEquals(1, matchRepository.count());

        match.setPhase(MatchPhase.ROUND_ACTIVE);
        match.setRoundNumber(2);
        match.setWarmupDamageEvents(4);
        match.setDamageEvents(7);
        store.updateMatchProgress(match);
        MatchEntity stored = matchRepository.findById(match.getMatchId()).orElseThrow();
        assertEquals(MatchPhase.ROUND_ACTIVE, stored.getPhase());
        assertEquals(2, stored.getRoundNumber());
        assertEquals(7, stored.getDamageEvents());
        assertEquals(4, stored.getWarmupDamageEvents());
        assertEquals(1, matchRepository.findByServerIdAndEndedAtIsNullOrderByStartedAtDesc("srv").size());

        match.setDamageEvents(12);
        store.closeMatch(concluded(match, START.plusMinutes(30), 1));
        match.setDamageEvents(20);
        store.closeMatch(concluded(match, START.plusMinutes(45), 0));
        match.setPhase(MatchPhase.WARMUP);
        store.updateMatchProgress(match);

        stored = matchRepository.findById(match.getMatchId()).orElseThrow();
        assertEquals(MatchPhase.CONCLUDED, stored.getPhase());
        assertEquals(START.plusMinutes(30), stored.getEndedAt());
        assertEquals(1, stored.getWinnerTeam());
        assertEquals(12, stored.getDamageEvents());
        assertEquals(4, stored.getWarmupDamageEvents());
        assertTrue(matchRepository.findByServerIdAndEndedAtIsNullOrderByStartedAtDesc("srv").isEmpty());
    }

    @Test
    void testProgressForUnknownMatchOpensIt() {
        Match match = Match.open("srv", null, null, START, true);
        match.setPhase(MatchPhase.ROUND_ACTIVE);

        store.updateMatchProgress(match);

        MatchEntity stored = matchRepository.findById(match.getMatchId()).orElseThrow();
        assertTrue(stored.isImplicit());
        assertEquals(MatchPhase.ROUND_ACTIVE, stored.getPhase());
    }

    @Test
    void testClosingUnknownMatchIsHarmless() {
        Match unknown = new Match();
        unknown.setMatchId("nope");
        unknown.setEndedAt(START);
        store.closeMatch(unknown);

        assertEquals(0, matchRepository.count());
    }
}
