package com.gacha.economy.draw;

import com.gacha.economy.account.Account;
import com.gacha.economy.card.CardInstance;
import com.gacha.economy.config.EconomyConfig;
import com.gacha.economy.config.PackDefinition;
import com.gacha.economy.config.Price;
import com.gacha.economy.ledger.CurrencyLedger;
import com.gacha.economy.ledger.InsufficientFundsException;
import com.gacha.economy.regen.FreePackRegenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;

/**
 * Buys packs with currency or free-pack allowance and puts the drawn card in the collection.
 * Payment is checked before the draw so a refused purchase changes nothing.
 */
public class PackOpener {
    private static final Logger logger = LoggerFactory.getLogger(PackOpener.class);

    private final EconomyConfig config;
    private final DrawEngine drawEngine;
    private final FreePackRegenerator regenerator;

    public PackOpener(EconomyConfig config, DrawEngine drawEngine, FreePackRegenerator regenerator) {
        this.config = config;
        this.drawEngine = drawEngine;
        this.regenerator = regenerator;
    }

    /**
     * Pay the pack's price and draw one card from it.
     */
    public PackOpening openPack(Account account, String packName) {
        Optional<PackDefinition> found = config.pack(packName);
        if (found.isEmpty()) {
            return new PackOpening.UnknownPack(packName);
        }
        PackDefinition pack = found.get();
        Price price = pack.price();
        try {
            CurrencyLedger.debit(account, price.currency(), price.amount());
        } catch (InsufficientFundsException e) {
            return new PackOpening.InsufficientFunds(e.getCurrency(), e.getRequired(), e.getAvailable());
        }
        CardInstance card = account.addCard(drawEngine.draw(pack));
        logger.info("pack opened userId={} pack={} cardId={} rarity={}",
                account.getUserId(), pack.name(), card.getUserCardId(), card.getRarity().getJsonValue());
        return new PackOpening.Opened(card, pack.name(), account.getFreePacks());
    }

    /**
     * Spend one free pack, refilling first if the window has elapsed.
     */
    public PackOpening openFreePack(Account account, Instant now) {
        regenerator.checkRefill(account, now);
        if (account.getFreePacks() <= 0) {
            return new PackOpening.NoFreePacks(regenerator.timeUntilRefill(account, now));
        }
        PackDefinition pack = config.pack(config.freePacks().pack()).orElseThrow();
        account.consumeFreePack();
        CardInstance card = account.addCard(drawEngine.draw(pack));
        logger.info("free pack opened userId={} cardId={} rarity={} left={}",
                account.getUserId(), card.getUserCardId(), card.getRarity().getJsonValue(), account.getFreePacks());
        return new PackOpening.Opened(card, pack.name(), account.getFreePacks());
    }
}
