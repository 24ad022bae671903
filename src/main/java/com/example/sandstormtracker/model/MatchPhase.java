package com.example.sandstormtracker.model;

public enum MatchPhase {
    IDLE,
    WARMUP,
    ROUND_ACTIVE,
    ROUND_END,
    CONCLUDED
}
