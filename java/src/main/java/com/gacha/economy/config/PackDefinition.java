package com.gacha.economy.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A purchasable pack: its price and the ordered rarity table it draws from.
 * The order of {@code weights} decides which rarity wins a tie and must not be changed.
 */
public record PackDefinition(
        @JsonProperty("name") String name,
        @JsonProperty("price") Price price,
        @JsonProperty("weights") List<RarityWeight> weights) {

    public PackDefinition {
        weights = weights == null ? List.of() : List.copyOf(weights);
    }
}
