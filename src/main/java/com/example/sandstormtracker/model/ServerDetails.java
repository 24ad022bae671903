package com.example.sandstormtracker.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Decoded A2S_INFO response. Only the fields the tracker reads are kept.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ServerDetails {
    private int protocol;
    private String name;
    private String map;
    private String folder;
    private String game;
    private int appId;
    private int players;
    private int maxPlayers;
    private int bots;
    private String version;
}
