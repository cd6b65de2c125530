package com.gacha.economy.fusion;

import com.gacha.economy.card.CardInstance;
import com.gacha.economy.card.Rarity;
import com.gacha.economy.ledger.Currency;

/**
 * Result of fusing duplicates. Only {@link Fused} means anything changed.
 */
public sealed interface FusionResult
        permits FusionResult.Fused, FusionResult.NotFound, FusionResult.MaxRarity, FusionResult.InsufficientDuplicates {

    record Fused(String sourceName, Rarity sourceRarity, CardInstance newCard,
                 Currency rewardCurrency, int reward) implements FusionResult {
    }

    record NotFound(long cardId) implements FusionResult {
    }

    record MaxRarity(long cardId, Rarity rarity) implements FusionResult {
    }

    record InsufficientDuplicates(int required, int owned) implements FusionResult {
    }
}
