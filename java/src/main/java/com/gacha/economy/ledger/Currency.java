package com.gacha.economy.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The four independent account currencies. There is no implicit conversion between them.
 */
public enum Currency {
    COINS("coins"),
    GEMS("gems"),
    CANDIES("candies"),
    STARS("stars");

    private final String jsonValue;

    Currency(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    @JsonCreator
    public static Currency fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Currency cannot be null");
        }
        return switch (value.strip().toLowerCase(Locale.ROOT)) {
            case "coins" -> COINS;
            case "gems" -> GEMS;
            case "candies" -> CANDIES;
            case "stars" -> STARS;
            default -> throw new IllegalArgumentException("Unknown currency: " + value);
        };
    }
}
