package com.gacha.economy.account;

import com.gacha.economy.card.CardDefinition;
import com.gacha.economy.card.CardInstance;
import com.gacha.economy.card.Position;
import com.gacha.economy.card.Rarity;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CardCollection listing and search.
 */
class CardCollectionTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private static CardInstance card(String nameEn, String nameRu, Long id) {
        CardInstance card = new CardInstance(new CardDefinition(1, nameEn, nameRu, Rarity.COMMON, Position.FORWARD, 70), NOW);
        if (id != null) {
            card.assignId(id);
        }
        return card;
    }

    @Test
    void testNewestFirstOrdersByIdDescending() {
        CardInstance two = card("Two", null, 2L);
        CardInstance ten = card("Ten", null, 10L);
        CardInstance seven = card("Seven", null, 7L);
        CardCollection collection = new CardCollection(List.of(two, ten, seven));

        assertEquals(List.of(ten, seven, two), collection.newestFirst());
        assertEquals(List.of(two, ten, seven), collection.getCards(), "Listing must not reorder the collection");
    }

    @Test
    void testNewestFirstPutsUnnumberedCardsLast() {
        CardInstance firstUnnumbered = card("A", null, null);
        CardInstance three = card("Three", null, 3L);
        CardInstance secondUnnumbered = card("B", null, null);
        CardInstance five = card("Five", null, 5L);
        CardCollection collection = new CardCollection(List.of(firstUnnumbered, three, secondUnnumbered, five));

        List<CardInstance> sorted = collection.newestFirst();
        assertEquals(List.of(five, three, firstUnnumbered, secondUnnumbered), sorted,
                "Cards without an id go last and keep their collection order");
    }

    @Test
    void testNewestFirstOfEmptyCollection() {
        assertTrue(new CardCollection().newestFirst().isEmpty());
    }

    @Test
    void testSearchMatchesEitherNameIgnoringCase() {
        CardInstance keeper = card("Goalkeeper", "Вратарь", 1L);
        CardInstance striker = card("Striker", "Нападающий", 2L);
        CardInstance unnamed = card(null, "Защитник", 3L);
        CardCollection collection = new CardCollection(List.of(keeper, striker, unnamed));

        assertEquals(List.of(keeper), collection.search("  GOAL "));
        assertEquals(List.of(striker), collection.search("нападающий"));
        assertEquals(List.of(unnamed), collection.search("защ"), "A card with only a Russian name is searchable");
        assertEquals(3, collection.search("").size(), "Empty query matches everything");
        assertTrue(collection.search("midfielder").isEmpty());
    }
}
