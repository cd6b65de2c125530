package com.gacha.economy.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gacha.economy.card.Rarity;

/**
 * One entry of a pack's ordered probability table. Weights are percentages of [0, 100).
 */
public record RarityWeight(
        @JsonProperty("rarity") Rarity rarity,
        @JsonProperty("weight") double weight) {
}
