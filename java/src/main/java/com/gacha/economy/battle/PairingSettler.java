package com.gacha.economy.battle;

/**
 * Fights and pays out a freshly made pair. Called by {@link MatchmakingQueue} while it holds
 * its lock.
 */
@FunctionalInterface
public interface PairingSettler {
    BattleOutcome settle(MatchmakingTicket requester, MatchmakingTicket opponent);
}
