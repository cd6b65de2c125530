package com.gacha.economy.card;

import java.util.Locale;

/**
 * Display name (trimmed, lower case) and rarity. Cards with equal keys are interchangeable
 * fusion material.
 */
public record IdentityKey(String name, Rarity rarity) {

    public static IdentityKey of(String displayName, Rarity rarity) {
        String name = displayName == null ? "" : displayName.strip().toLowerCase(Locale.ROOT);
        return new IdentityKey(name, rarity);
    }
}
