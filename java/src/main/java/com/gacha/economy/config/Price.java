package com.gacha.economy.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gacha.economy.ledger.Currency;

public record Price(
        @JsonProperty("currency") Currency currency,
        @JsonProperty("amount") long amount) {
}
