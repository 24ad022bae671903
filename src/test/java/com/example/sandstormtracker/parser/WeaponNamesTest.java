package com.example.sandstormtracker.parser;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class WeaponNamesTest {

    @Test
    void testBlueprintNamesAreCleaned() {
        assertEquals("M4A1", WeaponNames.clean("BP_Firearm_M4A1_C_2147480587"));
        assertEquals("AK74", WeaponNames.clean("BP_Firearm_AK74_C"));
        assertEquals("Kabar", WeaponNames.clean("BP_Melee_Kabar_C_12"));
        assertEquals("Molotov", WeaponNames.clean("BP_Projectile_Molotov_C_2147477530"));
    }

    @Test
    void testUnderscoresBecomeSpaces() {
        assertEquals("M16A4 Carry", WeaponNames.clean("BP_Weapon_M16A4_Carry_C_5"));
    }

    @Test
    void testCheckpointVariantsCollapse() {
        assertEquals("ODCheckpoint", WeaponNames.clean("BP_ODCheckpoint_A_C_2147"));
    }

    @Test
    void testPlainNamesUntouched() {
        assertEquals("Artillery", WeaponNames.clean("Artillery"));
    }
}
