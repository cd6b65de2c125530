package com.gacha.economy.ledger;

import com.gacha.economy.account.Account;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Credits and debits on an account's four balances.
 * Every operation checks before it mutates, so a failed call leaves balances untouched.
 */
public final class CurrencyLedger {
    private static final Logger logger = LoggerFactory.getLogger(CurrencyLedger.class);

    private CurrencyLedger() {
        // Utility class - prevent instantiation
    }

    /**
     * Add {@code amount} to a balance.
     * @throws IllegalArgumentException if amount is negative
     */
    public static void credit(Account account, Currency currency, long amount) {
        requireNonNegative(amount);
        account.setBalance(currency, Math.addExact(account.getBalance(currency), amount));
        logger.debug("credit userId={} currency={} amount={} balance={}",
                account.getUserId(), currency.getJsonValue(), amount, account.getBalance(currency));
    }

    /**
     * Subtract {@code amount} from a balance.
     * @throws InsufficientFundsException if the balance is smaller than amount
     */
    public static void debit(Account account, Currency currency, long amount) throws InsufficientFundsException {
        requireAffordable(account, currency, amount);
        account.setBalance(currency, account.getBalance(currency) - amount);
        logger.debug("debit userId={} currency={} amount={} balance={}",
                account.getUserId(), currency.getJsonValue(), amount, account.getBalance(currency));
    }

    /**
     * Subtract up to {@code amount}, stopping at zero.
     * @return the amount actually taken
     */
    public static long debitFloored(Account account, Currency currency, long amount) {
        requireNonNegative(amount);
        long taken = Math.min(amount, account.getBalance(currency));
        account.setBalance(currency, account.getBalance(currency) - taken);
        return taken;
    }

    /**
     * Spend {@code cost} of one currency and gain {@code amount} of another.
     * The payer side is checked before either balance changes.
     */
    public static void exchange(Account account, Currency pay, long cost, Currency gain, long amount)
            throws InsufficientFundsException {
        requireNonNegative(amount);
        requireAffordable(account, pay, cost);
        account.setBalance(pay, account.getBalance(pay) - cost);
        account.setBalance(gain, Math.addExact(account.getBalance(gain), amount));
        logger.debug("exchange userId={} paid={} {} gained={} {}",
                account.getUserId(), cost, pay.getJsonValue(), amount, gain.getJsonValue());
    }

    /**
     * Check a debit without applying it.
     * @throws InsufficientFundsException if the balance is smaller than amount
     */
    public static void requireAffordable(Account account, Currency currency, long amount)
            throws InsufficientFundsException {
        requireNonNegative(amount);
        long balance = account.getBalance(currency);
        if (balance < amount) {
            throw new InsufficientFundsException(currency, amount, balance);
        }
    }

    private static void requireNonNegative(long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("amount must be >= 0: " + amount);
        }
    }
}
