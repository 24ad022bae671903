package com.example.sandstormtracker.persistence;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Kills and assists per weapon per player, either within one match or all-time.
 */
@Entity
@Table(name = "weapon_usage", uniqueConstraints = {
    @UniqueConstraint(name = "uk_weapon_usage", columnNames = {"scope", "identity", "weapon"})
})
@Data
@NoArgsConstructor
public class WeaponUsageEntity {

    public static final String ALL_TIME = "ALL_TIME";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Match id, or {@link #ALL_TIME}.
     */
    @Column(nullable = false)
    private String scope;

    @Column(nullable = false)
    private String identity;

    @Column(nullable = false)
    private String weapon;

    @Column(nullable = false)
    private long kills;

    @Column(nullable = false)
    private long assists;

    public WeaponUsageEntity(String scope, String identity, String weapon) {
        this.scope = scope;
        this.identity = identity;
        this.weapon = weapon;
    }
}
