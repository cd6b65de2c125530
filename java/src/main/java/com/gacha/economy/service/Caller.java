package com.gacha.economy.service;

/**
 * Identity of the player behind a request, as supplied by the platform.
 */
public record Caller(long id, String displayName) {

    public static Caller of(long id) {
        return new Caller(id, null);
    }
}
