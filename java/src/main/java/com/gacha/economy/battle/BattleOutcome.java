package com.gacha.economy.battle;

import com.gacha.economy.ledger.Currency;

/**
 * What a resolved battle did to both sides. For scripted battles {@code opponentId} is null,
 * {@code opponentLevel} names the level and the opponent deltas are zero.
 * Currency deltas are the amounts actually applied, so a floored loss can be smaller than
 * the configured penalty.
 */
public record BattleOutcome(
        BattleMode mode,
        long requesterId,
        Long opponentId,
        String opponentLevel,
        int requesterPower,
        int opponentPower,
        boolean requesterWon,
        Currency currency,
        long requesterCurrencyDelta,
        long opponentCurrencyDelta,
        int requesterRatingDelta,
        int opponentRatingDelta) {

    /**
     * True if the given account is on the winning side.
     */
    public boolean wonBy(long accountId) {
        if (accountId == requesterId) {
            return requesterWon;
        }
        return opponentId != null && opponentId == accountId && !requesterWon;
    }
}
