package com.example.sandstormtracker.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AppliedDeltaRepository extends JpaRepository<AppliedDeltaEntity, String> {
}
