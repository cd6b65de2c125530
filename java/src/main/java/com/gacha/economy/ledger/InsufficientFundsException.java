package com.gacha.economy.ledger;

/**
 * Thrown when a debit exceeds the available balance. Nothing has been changed when this is
 * thrown.
 */
public class InsufficientFundsException extends Exception {
    private final Currency currency;
    private final long required;
    private final long available;

    public InsufficientFundsException(Currency currency, long required, long available) {
        super("Insufficient " + currency.getJsonValue() + ": required " + required + ", available " + available);
        this.currency = currency;
        this.required = required;
        this.available = available;
    }

    public Currency getCurrency() {
        return currency;
    }

    public long getRequired() {
        return required;
    }

    public long getAvailable() {
        return available;
    }
}
