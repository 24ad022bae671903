package com.example.sandstormtracker.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SnapshotPlayer {
    private String name;
    private int score;
    private float durationSeconds;
}
