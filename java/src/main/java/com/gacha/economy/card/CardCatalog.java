package com.gacha.economy.card;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only card catalog grouped by rarity, loaded from a JSON array of card definitions.
 */
public class CardCatalog {
    private static final Logger logger = LoggerFactory.getLogger(CardCatalog.class);

    private final List<CardDefinition> cards;
    private final Map<Long, CardDefinition> byId;
    private final Map<Rarity, List<CardDefinition>> byRarity;

    private CardCatalog(List<CardDefinition> cards) {
        this.cards = List.copyOf(cards);
        this.byId = new HashMap<>();
        this.byRarity = new EnumMap<>(Rarity.class);
        for (Rarity rarity : Rarity.values()) {
            byRarity.put(rarity, new ArrayList<>());
        }
        for (CardDefinition card : cards) {
            byId.put(card.getId(), card);
            byRarity.get(card.getRarity()).add(card);
        }
        byRarity.replaceAll((rarity, list) -> Collections.unmodifiableList(list));
    }

    /**
     * Load the catalog from a JSON file.
     */
    public static CardCatalog fromFile(String path) throws CatalogException {
        try {
            String content = Files.readString(Path.of(path));
            return fromJson(content);
        } catch (IOException e) {
            throw new CatalogException("IO error: " + e.getMessage(), e);
        }
    }

    /**
     * Load the catalog from a classpath resource.
     */
    public static CardCatalog fromResource(String resourcePath) throws CatalogException {
        try (InputStream is = CardCatalog.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new CatalogException("Resource not found: " + resourcePath);
            }
            ObjectMapper mapper = new ObjectMapper();
            List<CardDefinition> cardList = mapper.readValue(is, new TypeReference<List<CardDefinition>>() {});
            return fromCardList(cardList);
        } catch (IOException e) {
            throw new CatalogException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    /**
     * Load the catalog from a JSON string.
     */
    public static CardCatalog fromJson(String json) throws CatalogException {
        try {
            ObjectMapper mapper = new ObjectMapper();
            List<CardDefinition> cardList = mapper.readValue(json, new TypeReference<List<CardDefinition>>() {});
            return fromCardList(cardList);
        } catch (IOException e) {
            throw new CatalogException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    /**
     * Build a catalog from already constructed definitions, applying the same validation as
     * the JSON loaders.
     */
    public static CardCatalog of(List<CardDefinition> cardList) throws CatalogException {
        return fromCardList(cardList);
    }

    private static CardCatalog fromCardList(List<CardDefinition> cardList) throws CatalogException {
        if (cardList == null || cardList.isEmpty()) {
            throw new CatalogException("Catalog is empty");
        }
        Map<Long, CardDefinition> seen = new HashMap<>();
        for (CardDefinition card : cardList) {
            if (card.getRarity() == null) {
                throw new CatalogException("Card " + card.getId() + " has no rarity");
            }
            if (card.getOvr() < 0) {
                throw new CatalogException("Card " + card.getId() + " has negative ovr " + card.getOvr());
            }
            if (card.displayName().isBlank()) {
                throw new CatalogException("Card " + card.getId() + " has no name");
            }
            if (seen.put(card.getId(), card) != null) {
                throw new CatalogException("Duplicate card id: " + card.getId());
            }
        }
        CardCatalog catalog = new CardCatalog(cardList);
        logger.info("card catalog loaded cards={} perRarity={}", catalog.cardCount(), catalog.rarityCounts());
        return catalog;
    }

    /**
     * Get a card by catalog id.
     * @throws CatalogException if the card is not found
     */
    public CardDefinition getCard(long id) throws CatalogException {
        CardDefinition card = byId.get(id);
        if (card == null) {
            throw new CatalogException("Card not found: " + id);
        }
        return card;
    }

    /**
     * Cards of one rarity, possibly empty.
     */
    public List<CardDefinition> cardsOf(Rarity rarity) {
        return byRarity.get(rarity);
    }

    public List<CardDefinition> allCards() {
        return cards;
    }

    public int cardCount() {
        return cards.size();
    }

    private Map<Rarity, Integer> rarityCounts() {
        Map<Rarity, Integer> counts = new EnumMap<>(Rarity.class);
        byRarity.forEach((rarity, list) -> counts.put(rarity, list.size()));
        return counts;
    }
}
