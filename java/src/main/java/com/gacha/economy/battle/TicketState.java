package com.gacha.economy.battle;

/**
 * Per-account matchmaking state: IDLE, then QUEUED, then PAIRED or CANCELLED.
 */
public enum TicketState {
    IDLE,
    QUEUED,
    PAIRED,
    CANCELLED
}
