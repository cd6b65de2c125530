package com.gacha.economy.card;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The four roles a battle lineup must fill, in lineup order.
 */
public enum Position {
    GOALKEEPER("goalkeeper", "вратарь"),
    DEFENDER("defender", "защитник"),
    MIDFIELDER("midfielder", "полузащитник"),
    FORWARD("forward", "нападающий");

    private final String jsonValue;
    private final String russianName;

    Position(String jsonValue, String russianName) {
        this.jsonValue = jsonValue;
        this.russianName = russianName;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    @JsonCreator
    public static Position fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Position cannot be null");
        }
        String normalized = value.strip().toLowerCase(Locale.ROOT);
        for (Position position : values()) {
            if (position.jsonValue.equals(normalized) || position.russianName.equals(normalized)) {
                return position;
            }
        }
        throw new IllegalArgumentException("Unknown position: " + value);
    }
}
