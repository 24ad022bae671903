package com.example.sandstormtracker.persistence;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface WeaponUsageRepository extends JpaRepository<WeaponUsageEntity, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT w FROM WeaponUsageEntity w WHERE w.scope = ?1 AND w.identity = ?2 AND w.weapon = ?3")
    Optional<WeaponUsageEntity> findForUpdate(String scope, String identity, String weapon);

    Optional<WeaponUsageEntity> findByScopeAndIdentityAndWeapon(String scope, String identity, String weapon);

    List<WeaponUsageEntity> findByScopeAndIdentity(String scope, String identity);
}
