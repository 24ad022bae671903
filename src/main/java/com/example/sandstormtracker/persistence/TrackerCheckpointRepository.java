package com.example.sandstormtracker.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TrackerCheckpointRepository extends JpaRepository<TrackerCheckpointEntity, String> {
}
