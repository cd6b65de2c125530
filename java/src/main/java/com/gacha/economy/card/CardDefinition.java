package com.gacha.economy.card;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A catalog card: rarity, rating and role plus the text the presentation layer shows.
 * Fields are only written by Jackson at load time.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CardDefinition {
    @JsonProperty("id")
    private long id;

    @JsonProperty("name_en")
    private String nameEn;

    @JsonProperty("name_ru")
    private String nameRu;

    @JsonProperty("rarity")
    private Rarity rarity;

    @JsonProperty("position")
    private Position position;

    @JsonProperty("ovr")
    private int ovr;

    @JsonProperty("country")
    private String country;

    @JsonProperty("description")
    private String description;

    @JsonProperty("image")
    private String image;

    public CardDefinition() {
    }

    public CardDefinition(long id, String nameEn, String nameRu, Rarity rarity, Position position, int ovr) {
        this.id = id;
        this.nameEn = nameEn;
        this.nameRu = nameRu;
        this.rarity = rarity;
        this.position = position;
        this.ovr = ovr;
    }

    public long getId() {
        return id;
    }

    public String getNameEn() {
        return nameEn;
    }

    public String getNameRu() {
        return nameRu;
    }

    public Rarity getRarity() {
        return rarity;
    }

    /**
     * Role this card can fill in a lineup; null for cards that fill none.
     */
    public Position getPosition() {
        return position;
    }

    public int getOvr() {
        return ovr;
    }

    public String getCountry() {
        return country;
    }

    public String getDescription() {
        return description;
    }

    public String getImage() {
        return image;
    }

    /**
     * English name, falling back to the Russian one.
     */
    public String displayName() {
        if (nameEn != null && !nameEn.isBlank()) {
            return nameEn;
        }
        return nameRu != null ? nameRu : "";
    }

    /**
     * Key under which copies of this card count as duplicates for fusion.
     */
    public IdentityKey identityKey() {
        return IdentityKey.of(displayName(), rarity);
    }
}
