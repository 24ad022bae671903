package com.example.sandstormtracker.model.event;

public enum EventType {
    PLAYER_CONNECT,
    PLAYER_DISCONNECT,
    KILL,
    DAMAGE,
    CHAT_MESSAGE,
    ROUND_START,
    ROUND_END,
    MAP_CHANGE,
    GAME_OVER,
    OBJECTIVE,
    UNRECOGNIZED
}
