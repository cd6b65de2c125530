package com.gacha.economy.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gacha.economy.ledger.Currency;

/**
 * Spend {@code cost} of one currency to gain {@code amount} of another.
 */
public record ExchangeOffer(
        @JsonProperty("id") String id,
        @JsonProperty("pay_currency") Currency payCurrency,
        @JsonProperty("cost") long cost,
        @JsonProperty("gain_currency") Currency gainCurrency,
        @JsonProperty("amount") long amount) {
}
