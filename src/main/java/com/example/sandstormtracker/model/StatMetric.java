package com.example.sandstormtracker.model;

public enum StatMetric {
    KILLS,
    DEATHS,
    HEADSHOTS,
    ASSISTS,
    TEAM_KILLS,
    SUICIDES,
    OBJECTIVES_CAPTURED,
    OBJECTIVES_DESTROYED,
    WARMUP_KILLS,
    WARMUP_DEATHS,
    /**
     * Per-weapon kill count; the delta names the weapon.
     */
    WEAPON_KILLS,
    /**
     * Per-weapon assist count; the delta names the weapon.
     */
    WEAPON_ASSISTS;

    public boolean isWeaponMetric() {
        return this == WEAPON_KILLS || this == WEAPON_ASSISTS;
    }
}
