package com.gacha.economy.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gacha.economy.card.Rarity;

/**
 * Inclusive fusion reward range for fusing cards of {@code rarity}.
 */
public record RewardRange(
        @JsonProperty("rarity") Rarity rarity,
        @JsonProperty("min") int min,
        @JsonProperty("max") int max) {
}
