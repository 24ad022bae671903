package com.example.sandstormtracker.parser;

/**
 * Turns blueprint class names such as BP_Firearm_M4A1_C_2147480587 into M4A1.
 */
public final class WeaponNames {

    private static final String[] CATEGORY_PREFIXES = {"Firearm_", "Weapon_", "Melee_", "Projectile_"};

    private WeaponNames() {
    }

    public static String clean(String raw) {
        String weapon = raw.trim();
        if (weapon.startsWith("BP_")) {
            weapon = weapon.substring(3);
        }

        // instance id suffix
        int lastUnderscore = weapon.lastIndexOf('_');
        if (lastUnderscore >= 0 && lastUnderscore < weapon.length() - 1
                && isDigits(weapon.substring(lastUnderscore + 1))) {
            weapon = weapon.substring(0, lastUnderscore);
        }
        if (weapon.endsWith("_C")) {
            weapon = weapon.substring(0, weapon.length() - 2);
        }
        for (String prefix : CATEGORY_PREFIXES) {
            if (weapon.startsWith(prefix)) {
                weapon = weapon.substring(prefix.length());
                break;
            }
        }
        weapon = weapon.replace('_', ' ');

        if (weapon.startsWith("ODCheckpoint ")) {
            weapon = "ODCheckpoint";
        }
        return weapon;
    }

    private static boolean isDigits(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) {
                return false;
            }
        }
        return !s.isEmpty();
    }
}
