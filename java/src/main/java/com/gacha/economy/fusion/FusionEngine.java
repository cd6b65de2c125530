package com.gacha.economy.fusion;

import com.gacha.economy.account.Account;
import com.gacha.economy.card.CardInstance;
import com.gacha.economy.card.IdentityKey;
import com.gacha.economy.card.Rarity;
import com.gacha.economy.config.EconomyConfig;
import com.gacha.economy.config.RewardRange;
import com.gacha.economy.draw.DrawEngine;
import com.gacha.economy.ledger.CurrencyLedger;
import com.gacha.economy.rng.GameRng;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Turns five copies of a card into one card of the next rarity plus a currency reward.
 *
 * <p>All preconditions are checked and every random choice (replacement card, reward) is
 * made before the collection or balances change; the commit step cannot fail, so a fusion
 * either lands completely or not at all.
 */
public class FusionEngine {
    private static final Logger logger = LoggerFactory.getLogger(FusionEngine.class);

    private final EconomyConfig.Fusion settings;
    private final DrawEngine drawEngine;
    private final GameRng rng;

    public FusionEngine(EconomyConfig.Fusion settings, DrawEngine drawEngine, GameRng rng) {
        this.settings = settings;
        this.drawEngine = drawEngine;
        this.rng = rng;
    }

    /**
     * Fuse the duplicates of the card with the given per-account id.
     */
    public FusionResult fuse(Account account, long targetCardId) {
        Optional<CardInstance> found = account.getCollection().findById(targetCardId);
        if (found.isEmpty()) {
            return new FusionResult.NotFound(targetCardId);
        }
        CardInstance target = found.get();
        Optional<Rarity> next = target.getRarity().upgrade();
        if (next.isEmpty()) {
            return new FusionResult.MaxRarity(targetCardId, target.getRarity());
        }

        int required = settings.duplicatesRequired();
        IdentityKey key = target.identityKey();
        int owned = account.getCollection().countDuplicates(key);
        if (owned < required) {
            return new FusionResult.InsufficientDuplicates(required, owned);
        }

        List<CardInstance> consumed = account.getCollection().duplicatesOf(key, required);
        int reward = rollReward(target.getRarity());
        CardInstance produced = drawEngine.drawAtRarity(next.get());

        account.replaceCards(consumed, produced);
        CurrencyLedger.credit(account, settings.rewardCurrency(), reward);

        logger.info("fusion done userId={} source={} rarity={} newCardId={} newRarity={} reward={} {}",
                account.getUserId(), target.getDefinition().displayName(), target.getRarity().getJsonValue(),
                produced.getUserCardId(), produced.getRarity().getJsonValue(), reward,
                settings.rewardCurrency().getJsonValue());
        return new FusionResult.Fused(target.getDefinition().displayName(), target.getRarity(), produced,
                settings.rewardCurrency(), reward);
    }

    /**
     * Uniform integer from the rarity's range, clamped to the global cap.
     */
    int rollReward(Rarity rarity) {
        RewardRange range = settings.rewardFor(rarity)
                .orElseThrow(() -> new IllegalStateException("No fusion reward range for " + rarity));
        int reward = rng.nextIntInclusive(range.min(), range.max());
        return Math.min(reward, settings.rewardCap());
    }
}
