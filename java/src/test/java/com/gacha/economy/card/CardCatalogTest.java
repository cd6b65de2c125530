package com.gacha.economy.card;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CardCatalog.
 */
class CardCatalogTest {

    private static CardCatalog catalog;

    @BeforeAll
    static void loadCatalog() throws CatalogException {
        catalog = CardCatalog.fromResource("test-cards.json");
    }

    @Test
    void testLoadCards() {
        assertEquals(9, catalog.cardCount(), "Should have loaded every fixture card");
        assertEquals(4, catalog.cardsOf(Rarity.COMMON).size());
        assertEquals(1, catalog.cardsOf(Rarity.MYTHIC).size());
    }

    @Test
    void testGetCard() throws CatalogException {
        CardDefinition card = catalog.getCard(8);
        assertEquals("Legend", card.getNameEn());
        assertEquals("Легенда", card.getNameRu());
        assertEquals(Rarity.LEGENDARY, card.getRarity());
        assertEquals(Position.MIDFIELDER, card.getPosition());
        assertEquals(90, card.getOvr());
    }

    @Test
    void testGetUnknownCardThrows() {
        assertThrows(CatalogException.class, () -> catalog.getCard(999));
    }

    @Test
    void testRussianRarityAndPositionNames() throws CatalogException {
        CardCatalog commons = CardCatalog.fromResource("commons-only-cards.json");
        CardDefinition back = commons.getCard(2);
        assertEquals(Rarity.COMMON, back.getRarity(), "обычная should map to common");
        assertEquals(Position.DEFENDER, back.getPosition(), "защитник should map to defender");
    }

    @Test
    void testUnknownRarityRejected() {
        String json = "[{\"id\": 1, \"name_en\": \"Shiny\", \"rarity\": \"shiny\", \"ovr\": 50}]";
        assertThrows(CatalogException.class, () -> CardCatalog.fromJson(json));
    }

    @Test
    void testEmptyCatalogRejected() {
        assertThrows(CatalogException.class, () -> CardCatalog.fromJson("[]"));
    }

    @Test
    void testDuplicateIdRejected() {
        String json = "[{\"id\": 1, \"name_en\": \"A\", \"rarity\": \"common\", \"ovr\": 50},"
                + "{\"id\": 1, \"name_en\": \"B\", \"rarity\": \"rare\", \"ovr\": 60}]";
        assertThrows(CatalogException.class, () -> CardCatalog.fromJson(json));
    }

    @Test
    void testMissingResource() {
        assertThrows(CatalogException.class, () -> CardCatalog.fromResource("no-such-cards.json"));
    }

    @Test
    void testDisplayNameFallsBackToRussian() {
        CardDefinition card = new CardDefinition(1, null, "Вратарь", Rarity.COMMON, Position.GOALKEEPER, 60);
        assertEquals("Вратарь", card.displayName());
    }

    @Test
    void testIdentityKeyIgnoresCaseAndPadding() {
        CardDefinition a = new CardDefinition(1, "  Keeper ", null, Rarity.COMMON, Position.GOALKEEPER, 60);
        CardDefinition b = new CardDefinition(2, "KEEPER", null, Rarity.COMMON, Position.GOALKEEPER, 65);
        CardDefinition c = new CardDefinition(3, "Keeper", null, Rarity.RARE, Position.GOALKEEPER, 70);

        assertEquals(a.identityKey(), b.identityKey(), "Same name and rarity should be duplicates");
        assertNotEquals(a.identityKey(), c.identityKey(), "Different rarity should not be duplicates");
    }

    @Test
    void testRarityUpgradeLadder() {
        assertEquals(Rarity.RARE, Rarity.COMMON.upgrade().orElseThrow());
        assertEquals(Rarity.EPIC, Rarity.RARE.upgrade().orElseThrow());
        assertEquals(Rarity.LEGENDARY, Rarity.EPIC.upgrade().orElseThrow());
        assertEquals(Rarity.MYTHIC, Rarity.LEGENDARY.upgrade().orElseThrow());
        assertTrue(Rarity.MYTHIC.upgrade().isEmpty(), "Mythic has no upgrade");
    }
}
