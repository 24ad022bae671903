package com.example.sandstormtracker.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Checkpointed in-memory state of one server's match tracker.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TrackerState implements Serializable {
    private static final long serialVersionUID = 1L;

    private Match currentMatch;
    private List<PlayerSession> sessions = new ArrayList<>();

    /**
     * Position of the last event folded into this state.
     */
    private String fileIdentity;
    private long offset = -1;
}
