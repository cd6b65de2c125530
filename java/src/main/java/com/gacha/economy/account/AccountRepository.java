package com.gacha.economy.account;

import java.util.Collection;
import java.util.Map;

/**
 * Durable storage for the account table.
 */
public interface AccountRepository {

    /**
     * Read every stored account keyed by user id. Empty when nothing has been stored yet.
     */
    Map<Long, Account> loadAll();

    /**
     * Replace the stored table with exactly these accounts.
     */
    void saveAll(Collection<Account> accounts);
}
