package com.gacha.economy.battle;

import java.time.Instant;

/**
 * A pending battle request. Lives only in memory until paired or cancelled.
 */
public record MatchmakingTicket(long accountId, Lineup lineup, int power, Instant enqueuedAt) {
}
