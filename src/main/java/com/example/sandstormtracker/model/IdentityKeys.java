package com.example.sandstormtracker.model;

/**
 * Canonical identity keys shared by sessions, deltas and the stats tables.
 */
public final class IdentityKeys {

    public static final String STEAM_PREFIX = "steam:";
    public static final String NAME_PREFIX = "name:";

    private IdentityKeys() {
    }

    public static String forPlayerId(String playerId) {
        return STEAM_PREFIX + playerId;
    }

    public static String forName(String displayName) {
        return NAME_PREFIX + displayName;
    }

    public static String of(String playerId, String displayName) {
        if (isValidPlayerId(playerId)) {
            return forPlayerId(playerId);
        }
        return forName(displayName);
    }

    /**
     * Bots are logged with the id INVALID.
     */
    public static boolean isValidPlayerId(String playerId) {
        return playerId != null && !playerId.isBlank() && !"INVALID".equals(playerId);
    }
}
