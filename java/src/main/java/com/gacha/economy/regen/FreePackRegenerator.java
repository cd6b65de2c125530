package com.gacha.economy.regen;

import com.gacha.economy.account.Account;
import com.gacha.economy.config.EconomyConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * Refills free packs once a full interval has passed since the last refill.
 * There is no timer: the check runs whenever an account is touched.
 */
public class FreePackRegenerator {
    private static final Logger logger = LoggerFactory.getLogger(FreePackRegenerator.class);

    private final int maxPacks;
    private final Duration interval;

    public FreePackRegenerator(int maxPacks, Duration interval) {
        this.maxPacks = maxPacks;
        this.interval = interval;
    }

    public FreePackRegenerator(EconomyConfig.FreePacks settings) {
        this(settings.max(), settings.refillInterval());
    }

    /**
     * Refill to the maximum and restart the window if at least one interval has elapsed.
     * @return true if the account was refilled
     */
    public boolean checkRefill(Account account, Instant now) {
        Duration elapsed = Duration.between(account.getLastFreePackTime(), now);
        if (elapsed.compareTo(interval) < 0) {
            return false;
        }
        account.refillFreePacks(maxPacks, now);
        logger.debug("free packs refilled userId={} packs={}", account.getUserId(), maxPacks);
        return true;
    }

    /**
     * Time left until the next refill becomes due, zero if it already is.
     */
    public Duration timeUntilRefill(Account account, Instant now) {
        Duration remaining = interval.minus(Duration.between(account.getLastFreePackTime(), now));
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }
}
