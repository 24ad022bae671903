package com.example.sandstormtracker.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IdentityKeysTest {

    @Test
    void testPlayerIdWinsOverName() {
        assertEquals("steam:76561198000000001", IdentityKeys.of("76561198000000001", "Alice"));
        assertEquals("name:Alice", IdentityKeys.of(null, "Alice"));
        assertEquals("name:Alice", IdentityKeys.of("INVALID", "Alice"));
    }

    @Test
    void testBotIdIsInvalid() {
        assertFalse(IdentityKeys.isValidPlayerId("INVALID"));
        assertFalse(IdentityKeys.isValidPlayerId(" "));
        assertTrue(IdentityKeys.isValidPlayerId("76561198000000001"));
    }
}
