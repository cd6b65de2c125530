package com.gacha.economy.account;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gacha.economy.card.CardInstance;
import com.gacha.economy.config.EconomyConfig;
import com.gacha.economy.ledger.Currency;

import java.time.Instant;
import java.util.List;

/**
 * A player's persisted economy state: balances, collection, free-pack timer and rating.
 * Mutators enforce the field invariants; the engines decide when to call them.
 */
public class Account {
    @JsonProperty("user_id")
    private long userId;

    @JsonProperty("username")
    private String username;

    @JsonProperty("coins")
    private long coins;

    @JsonProperty("gems")
    private long gems;

    @JsonProperty("candies")
    private long candies;

    @JsonProperty("stars")
    private long stars;

    @JsonProperty("collection")
    private CardCollection collection = new CardCollection();

    @JsonProperty("card_id_counter")
    private long cardIdCounter = 1;

    @JsonProperty("free_packs")
    private int freePacks;

    @JsonProperty("last_free_pack_time")
    private Instant lastFreePackTime;

    @JsonProperty("rating")
    private int rating;

    @JsonProperty("dice_wins")
    private int diceWins;

    @JsonProperty("dice_losses")
    private int diceLosses;

    @JsonProperty("dice_total")
    private int diceTotal;

    public Account() {
    }

    /**
     * A new account with the configured starting balances and a full set of free packs.
     */
    public static Account create(long userId, String username, EconomyConfig config, Instant now) {
        Account account = new Account();
        account.userId = userId;
        account.username = username;
        account.rating = config.defaults().rating();
        account.applyDefaults(config, now);
        return account;
    }

    /**
     * Wipe progress back to starting values. Id, name and rating are kept.
     */
    void reset(EconomyConfig config, Instant now) {
        applyDefaults(config, now);
    }

    private void applyDefaults(EconomyConfig config, Instant now) {
        coins = config.defaults().coins();
        gems = config.defaults().gems();
        candies = config.defaults().candies();
        stars = config.defaults().stars();
        collection.clear();
        cardIdCounter = 1;
        freePacks = config.freePacks().max();
        lastFreePackTime = now;
        diceWins = 0;
        diceLosses = 0;
        diceTotal = 0;
    }

    public long getUserId() {
        return userId;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public long getBalance(Currency currency) {
        return switch (currency) {
            case COINS -> coins;
            case GEMS -> gems;
            case CANDIES -> candies;
            case STARS -> stars;
        };
    }

    /**
     * Overwrite one balance. Rejects negative values so no path can store a debt.
     */
    public void setBalance(Currency currency, long balance) {
        if (balance < 0) {
            throw new IllegalStateException(currency.getJsonValue() + " balance would become negative: " + balance);
        }
        switch (currency) {
            case COINS -> coins = balance;
            case GEMS -> gems = balance;
            case CANDIES -> candies = balance;
            case STARS -> stars = balance;
        }
    }

    public CardCollection getCollection() {
        return collection;
    }

    /**
     * Give a drawn card its per-account id and append it to the collection.
     */
    public CardInstance addCard(CardInstance card) {
        card.assignId(cardIdCounter++);
        collection.add(card);
        return card;
    }

    /**
     * Swap fusion material for the fused card in one step.
     */
    public CardInstance replaceCards(List<CardInstance> consumed, CardInstance produced) {
        collection.removeAll(consumed);
        return addCard(produced);
    }

    @JsonIgnore
    public long getNextCardId() {
        return cardIdCounter;
    }

    public int getFreePacks() {
        return freePacks;
    }

    public Instant getLastFreePackTime() {
        return lastFreePackTime;
    }

    /**
     * Start the refill window at {@code now} if the stored state carried no timestamp.
     * @return true if the timestamp was missing
     */
    boolean ensureFreePackTime(Instant now) {
        if (lastFreePackTime != null) {
            return false;
        }
        lastFreePackTime = now;
        return true;
    }

    /**
     * Refill free packs to {@code max} and restart the refill window at {@code now}.
     */
    public void refillFreePacks(int max, Instant now) {
        this.freePacks = max;
        this.lastFreePackTime = now;
    }

    /**
     * Use one free pack.
     * @throws IllegalStateException if none are left
     */
    public void consumeFreePack() {
        if (freePacks <= 0) {
            throw new IllegalStateException("No free packs left for account " + userId);
        }
        freePacks--;
    }

    public int getRating() {
        return rating;
    }

    /**
     * Shift the battle rating, never below zero.
     */
    public void adjustRating(int delta) {
        rating = Math.max(0, rating + delta);
    }

    public int getDiceWins() {
        return diceWins;
    }

    public int getDiceLosses() {
        return diceLosses;
    }

    public int getDiceTotal() {
        return diceTotal;
    }

    public void recordDiceRoll(boolean won) {
        if (won) {
            diceWins++;
        } else {
            diceLosses++;
        }
        diceTotal++;
    }
}
