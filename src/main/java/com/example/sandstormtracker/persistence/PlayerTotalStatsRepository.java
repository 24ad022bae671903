package com.example.sandstormtracker.persistence;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface PlayerTotalStatsRepository extends JpaRepository<PlayerTotalStatsEntity, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM PlayerTotalStatsEntity s WHERE s.identity = ?1")
    Optional<PlayerTotalStatsEntity> findForUpdate(String identity);
}
