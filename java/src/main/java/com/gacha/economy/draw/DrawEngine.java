package com.gacha.economy.draw;

import com.gacha.economy.card.CardCatalog;
import com.gacha.economy.card.CardDefinition;
import com.gacha.economy.card.CardInstance;
import com.gacha.economy.card.Rarity;
import com.gacha.economy.config.PackDefinition;
import com.gacha.economy.config.RarityWeight;
import com.gacha.economy.rng.GameRng;

import java.time.Clock;
import java.util.List;

/**
 * Weighted rarity sampling with tier fallback.
 *
 * <p>A roll in [0, 100) walks the pack's weights in declared order; the first rarity whose
 * running sum exceeds the roll is selected, common if none does. The card comes from the
 * first non-empty tier of {@link Rarity#FALLBACK_ORDER} starting at the selected rarity,
 * and from the whole catalog if every tier in that walk is empty.
 */
public class DrawEngine {
    private final CardCatalog catalog;
    private final GameRng rng;
    private final Clock clock;

    public DrawEngine(CardCatalog catalog, GameRng rng, Clock clock) {
        this.catalog = catalog;
        this.rng = rng;
        this.clock = clock;
    }

    /**
     * Draw one card from a pack. The result has a fresh timestamp and no per-account id.
     */
    public CardInstance draw(PackDefinition pack) {
        Rarity selected = selectRarity(pack.weights(), rng.next() * 100.0);
        return drawAtRarity(selected);
    }

    /**
     * Draw one card of the given rarity, walking down the fallback ladder when the catalog
     * has none of it.
     */
    public CardInstance drawAtRarity(Rarity rarity) {
        return new CardInstance(pickDefinition(rarity), clock.instant());
    }

    /**
     * Map a roll in [0, 100) to a rarity using the ordered weight table.
     */
    public static Rarity selectRarity(List<RarityWeight> weights, double roll) {
        double cumulative = 0.0;
        for (RarityWeight entry : weights) {
            cumulative += entry.weight();
            if (roll < cumulative) {
                return entry.rarity();
            }
        }
        return Rarity.COMMON;
    }

    private CardDefinition pickDefinition(Rarity selected) {
        int start = Rarity.FALLBACK_ORDER.indexOf(selected);
        for (Rarity tier : Rarity.FALLBACK_ORDER.subList(start, Rarity.FALLBACK_ORDER.size())) {
            List<CardDefinition> pool = catalog.cardsOf(tier);
            if (!pool.isEmpty()) {
                return rng.pick(pool);
            }
        }
        return rng.pick(catalog.allCards());
    }
}
