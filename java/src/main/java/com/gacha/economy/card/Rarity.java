package com.gacha.economy.card;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Card rarity tiers, lowest first.
 * Declaration order is the rarity ladder: common &lt; rare &lt; epic &lt; legendary &lt; mythic.
 */
public enum Rarity {
    COMMON("common"),
    RARE("rare"),
    EPIC("epic"),
    LEGENDARY("legendary"),
    MYTHIC("mythic");

    /**
     * Tier order walked when the selected tier has no catalog entries.
     */
    public static final List<Rarity> FALLBACK_ORDER = List.of(MYTHIC, LEGENDARY, EPIC, RARE, COMMON);

    // Spellings seen in catalog files
    private static final Map<String, Rarity> ALIASES = Map.ofEntries(
            Map.entry("common", COMMON),
            Map.entry("обычная", COMMON),
            Map.entry("обыкновенная", COMMON),
            Map.entry("обычный", COMMON),
            Map.entry("rare", RARE),
            Map.entry("редкая", RARE),
            Map.entry("редкий", RARE),
            Map.entry("epic", EPIC),
            Map.entry("эпическая", EPIC),
            Map.entry("эпик", EPIC),
            Map.entry("legendary", LEGENDARY),
            Map.entry("легендарная", LEGENDARY),
            Map.entry("лега", LEGENDARY),
            Map.entry("mythic", MYTHIC),
            Map.entry("мифическая", MYTHIC),
            Map.entry("мифик", MYTHIC)
    );

    private final String jsonValue;

    Rarity(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    /**
     * The tier a fusion of this rarity produces, empty for mythic.
     */
    public Optional<Rarity> upgrade() {
        return switch (this) {
            case COMMON -> Optional.of(RARE);
            case RARE -> Optional.of(EPIC);
            case EPIC -> Optional.of(LEGENDARY);
            case LEGENDARY -> Optional.of(MYTHIC);
            case MYTHIC -> Optional.empty();
        };
    }

    /**
     * Parse a rarity, accepting English and Russian spellings and ignoring case.
     */
    @JsonCreator
    public static Rarity fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Rarity cannot be null");
        }
        Rarity rarity = ALIASES.get(value.strip().toLowerCase(Locale.ROOT));
        if (rarity == null) {
            throw new IllegalArgumentException("Unknown rarity: " + value);
        }
        return rarity;
    }
}
