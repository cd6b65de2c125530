package com.gacha.economy.draw;

import com.gacha.economy.card.CardInstance;
import com.gacha.economy.ledger.Currency;

import java.time.Duration;

/**
 * Result of opening a pack.
 */
public sealed interface PackOpening
        permits PackOpening.Opened, PackOpening.InsufficientFunds, PackOpening.NoFreePacks, PackOpening.UnknownPack {

    /**
     * The card was drawn and added to the collection.
     */
    record Opened(CardInstance card, String pack, int freePacksLeft) implements PackOpening {
    }

    /**
     * The price could not be paid; nothing changed.
     */
    record InsufficientFunds(Currency currency, long required, long available) implements PackOpening {
    }

    /**
     * No free packs are left until the next refill.
     */
    record NoFreePacks(Duration timeUntilRefill) implements PackOpening {
    }

    record UnknownPack(String name) implements PackOpening {
    }
}
