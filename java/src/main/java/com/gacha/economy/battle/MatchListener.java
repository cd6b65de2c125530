package com.gacha.economy.battle;

/**
 * Notified once per participant when a PvP battle is settled, so the platform can tell the
 * side that was waiting in the queue.
 */
@FunctionalInterface
public interface MatchListener {
    void onPaired(long accountId, BattleOutcome outcome);
}
