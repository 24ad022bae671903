package com.example.sandstormtracker.persistence;

import com.example.sandstormtracker.model.StatMetric;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Counter columns shared by the per-match and all-time player tables.
 */
@Embeddable
@Data
@NoArgsConstructor
public class StatCounters {

    @Column(nullable = false)
    private long kills;

    @Column(nullable = false)
    private long deaths;

    @Column(nullable = false)
    private long headshots;

    @Column(nullable = false)
    private long assists;

    @Column(nullable = false)
    private long teamKills;

    @Column(nullable = false)
    private long suicides;

    @Column(nullable = false)
    private long objectivesCaptured;

    @Column(nullable = false)
    private long objectivesDestroyed;

    @Column(nullable = false)
    private long warmupKills;

    @Column(nullable = false)
    private long warmupDeaths;

    public void increment(StatMetric metric, long amount) {
        switch (metric) {
            case KILLS:
                kills += amount;
                break;
            case DEATHS:
                deaths += amount;
                break;
            case HEADSHOTS:
                headshots += amount;
                break;
            case ASSISTS:
                assists += amount;
                break;
            case TEAM_KILLS:
                teamKills += amount;
                break;
            case SUICIDES:
                suicides += amount;
                break;
            case OBJECTIVES_CAPTURED:
                objectivesCaptured += amount;
                break;
            case OBJECTIVES_DESTROYED:
                objectivesDestroyed += amount;
                break;
            case WARMUP_KILLS:
                warmupKills += amount;
                break;
            case WARMUP_DEATHS:
                warmupDeaths += amount;
                break;
            default:
                throw new IllegalArgumentException("Not a player counter: " + metric);
        }
    }
}
