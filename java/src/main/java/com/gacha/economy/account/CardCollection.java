package com.gacha.economy.account;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.gacha.economy.card.CardInstance;
import com.gacha.economy.card.IdentityKey;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * An account's owned cards in acquisition order.
 */
public class CardCollection {
    private final List<CardInstance> cards;

    public CardCollection() {
        this.cards = new ArrayList<>();
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public CardCollection(List<CardInstance> cards) {
        this.cards = cards == null ? new ArrayList<>() : new ArrayList<>(cards);
    }

    @JsonValue
    public List<CardInstance> getCards() {
        return Collections.unmodifiableList(cards);
    }

    public int size() {
        return cards.size();
    }

    public boolean isEmpty() {
        return cards.isEmpty();
    }

    void add(CardInstance card) {
        cards.add(card);
    }

    void clear() {
        cards.clear();
    }

    public Optional<CardInstance> findById(long userCardId) {
        for (CardInstance card : cards) {
            if (card.getUserCardId() != null && card.getUserCardId() == userCardId) {
                return Optional.of(card);
            }
        }
        return Optional.empty();
    }

    /**
     * Number of owned cards sharing the given identity key.
     */
    public int countDuplicates(IdentityKey key) {
        int count = 0;
        for (CardInstance card : cards) {
            if (card.identityKey().equals(key)) {
                count++;
            }
        }
        return count;
    }

    /**
     * The first {@code limit} cards matching the key, in collection order.
     */
    public List<CardInstance> duplicatesOf(IdentityKey key, int limit) {
        List<CardInstance> result = new ArrayList<>();
        for (CardInstance card : cards) {
            if (result.size() == limit) {
                break;
            }
            if (card.identityKey().equals(key)) {
                result.add(card);
            }
        }
        return result;
    }

    /**
     * Remove exactly the given instances (compared by reference).
     */
    void removeAll(List<CardInstance> toRemove) {
        Set<CardInstance> doomed = Collections.newSetFromMap(new IdentityHashMap<>());
        doomed.addAll(toRemove);
        cards.removeIf(doomed::contains);
    }

    /**
     * Cards whose English or Russian name contains the query, ignoring case.
     */
    public List<CardInstance> search(String query) {
        String needle = query == null ? "" : query.strip().toLowerCase(Locale.ROOT);
        List<CardInstance> results = new ArrayList<>();
        for (CardInstance card : cards) {
            if (contains(card.getDefinition().getNameEn(), needle)
                    || contains(card.getDefinition().getNameRu(), needle)) {
                results.add(card);
            }
        }
        return results;
    }

    /**
     * A copy ordered by per-account id, newest first.
     */
    public List<CardInstance> newestFirst() {
        List<CardInstance> sorted = new ArrayList<>(cards);
        sorted.sort(Comparator.comparing(CardInstance::getUserCardId,
                Comparator.nullsLast(Comparator.reverseOrder())));
        return sorted;
    }

    private static boolean contains(String name, String needle) {
        return name != null && name.toLowerCase(Locale.ROOT).contains(needle);
    }
}
