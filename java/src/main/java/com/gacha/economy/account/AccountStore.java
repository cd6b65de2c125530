package com.gacha.economy.account;

import com.gacha.economy.config.EconomyConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory account table backed by a repository.
 * Accounts are created on first contact; {@link #save()} writes the full table through.
 */
public class AccountStore {
    private static final Logger logger = LoggerFactory.getLogger(AccountStore.class);

    private final AccountRepository repository;
    private final EconomyConfig config;
    private final Map<Long, Account> accounts;

    public AccountStore(AccountRepository repository, EconomyConfig config) {
        this(repository, config, Clock.systemUTC());
    }

    /**
     * Loaded accounts without a free-pack timestamp start their refill window at the clock's now.
     */
    public AccountStore(AccountRepository repository, EconomyConfig config, Clock clock) {
        this.repository = repository;
        this.config = config;
        this.accounts = new ConcurrentHashMap<>(repository.loadAll());
        Instant now = clock.instant();
        for (Account account : accounts.values()) {
            if (account.ensureFreePackTime(now)) {
                logger.warn("missing free pack time, window restarted userId={}", account.getUserId());
            }
        }
    }

    /**
     * The account for a caller, created with default balances if this is their first contact.
     * A changed display name is recorded.
     */
    public Account getOrCreate(long userId, String username, Instant now) {
        Account account = accounts.computeIfAbsent(userId, id -> {
            logger.info("account created userId={}", id);
            return Account.create(id, username, config, now);
        });
        if (username != null && !username.equals(account.getUsername())) {
            synchronized (account) {
                account.setUsername(username);
            }
        }
        return account;
    }

    public Optional<Account> find(long userId) {
        return Optional.ofNullable(accounts.get(userId));
    }

    public int size() {
        return accounts.size();
    }

    /**
     * Wipe an account back to starting values and persist.
     */
    public void reset(Account account, Instant now) {
        synchronized (account) {
            account.reset(config, now);
        }
        logger.info("account reset userId={}", account.getUserId());
        save();
    }

    /**
     * Write the complete account table to the repository.
     * Must not be called while holding an account monitor.
     */
    public synchronized void save() {
        List<Account> snapshot = new ArrayList<>(accounts.values());
        repository.saveAll(snapshot);
    }
}
