package com.example.sandstormtracker.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface MatchRepository extends JpaRepository<MatchEntity, String> {

    /**
     * Matches not yet closed for a server, newest first.
     */
    List<MatchEntity> findByServerIdAndEndedAtIsNullOrderByStartedAtDesc(String serverId);
}
