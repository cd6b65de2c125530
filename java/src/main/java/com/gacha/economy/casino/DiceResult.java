package com.gacha.economy.casino;

public sealed interface DiceResult permits DiceResult.Rolled, DiceResult.InsufficientFunds {

    record Rolled(int value, boolean won, long coinsWon, long gemsWon) implements DiceResult {
    }

    /**
     * The stake could not be paid; nothing was rolled.
     */
    record InsufficientFunds(long stake, long available) implements DiceResult {
    }
}
