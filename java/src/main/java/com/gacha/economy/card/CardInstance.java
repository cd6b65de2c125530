package com.gacha.economy.card;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * An owned copy of a catalog card inside one account's collection.
 */
public class CardInstance {
    @JsonProperty("user_card_id")
    private Long userCardId;

    @JsonProperty("card")
    private CardDefinition definition;

    @JsonProperty("acquired_at")
    private Instant acquiredAt;

    @JsonProperty("media_ref")
    private String mediaRef;

    public CardInstance() {
    }

    /**
     * A freshly drawn card. The id stays unset until the owning account inserts it.
     */
    public CardInstance(CardDefinition definition, Instant acquiredAt) {
        this.definition = definition;
        this.acquiredAt = acquiredAt;
    }

    public Long getUserCardId() {
        return userCardId;
    }

    public CardDefinition getDefinition() {
        return definition;
    }

    public Instant getAcquiredAt() {
        return acquiredAt;
    }

    public String getMediaRef() {
        return mediaRef;
    }

    @JsonIgnore
    public Rarity getRarity() {
        return definition.getRarity();
    }

    @JsonIgnore
    public int getOvr() {
        return definition.getOvr();
    }

    @JsonIgnore
    public IdentityKey identityKey() {
        return definition.identityKey();
    }

    /**
     * Assign the per-account id. Only the collection calls this, once, on insertion.
     */
    public void assignId(long id) {
        if (userCardId != null) {
            throw new IllegalStateException("Card already has id " + userCardId);
        }
        this.userCardId = id;
    }

    public void setMediaRef(String mediaRef) {
        this.mediaRef = mediaRef;
    }
}
