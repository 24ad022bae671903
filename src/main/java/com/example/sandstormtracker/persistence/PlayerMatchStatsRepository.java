package com.example.sandstormtracker.persistence;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PlayerMatchStatsRepository extends JpaRepository<PlayerMatchStatsEntity, Long> {

    /**
     * Row lock so concurrent increments from other servers serialize in the database.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM PlayerMatchStatsEntity s WHERE s.matchId = ?1 AND s.identity = ?2")
    Optional<PlayerMatchStatsEntity> findForUpdate(String matchId, String identity);

    Optional<PlayerMatchStatsEntity> findByMatchIdAndIdentity(String matchId, String identity);

    List<PlayerMatchStatsEntity> findByMatchId(String matchId);
}
