package com.gacha.economy.casino;

import com.gacha.economy.account.Account;
import com.gacha.economy.config.EconomyConfig;
import com.gacha.economy.ledger.Currency;
import com.gacha.economy.ledger.CurrencyLedger;
import com.gacha.economy.ledger.InsufficientFundsException;
import com.gacha.economy.rng.GameRng;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stake coins on a six-sided die; a roll at or above the threshold pays coins and gems.
 */
public class DiceGame {
    private static final Logger logger = LoggerFactory.getLogger(DiceGame.class);

    private final EconomyConfig.Dice settings;
    private final GameRng rng;

    public DiceGame(EconomyConfig.Dice settings, GameRng rng) {
        this.settings = settings;
        this.rng = rng;
    }

    public DiceResult roll(Account account) {
        try {
            CurrencyLedger.requireAffordable(account, Currency.COINS, settings.stake());
        } catch (InsufficientFundsException e) {
            return new DiceResult.InsufficientFunds(settings.stake(), e.getAvailable());
        }

        int value = rng.nextIntInclusive(1, 6);
        boolean won = value >= settings.winThreshold();
        long coinsWon = won ? settings.winCoins() : 0;
        long gemsWon = won ? settings.winGems() : 0;

        // The stake was checked above, the exchange cannot fail here
        try {
            CurrencyLedger.exchange(account, Currency.COINS, settings.stake(), Currency.COINS, coinsWon);
        } catch (InsufficientFundsException e) {
            throw new IllegalStateException("Stake vanished after check for account " + account.getUserId(), e);
        }
        CurrencyLedger.credit(account, Currency.GEMS, gemsWon);
        account.recordDiceRoll(won);

        logger.info("dice rolled userId={} value={} won={}", account.getUserId(), value, won);
        return new DiceResult.Rolled(value, won, coinsWon, gemsWon);
    }
}
