package com.gacha.economy.battle;

import com.gacha.economy.account.Account;
import com.gacha.economy.config.EconomyConfig;
import com.gacha.economy.config.OpponentLevel;
import com.gacha.economy.ledger.Currency;
import com.gacha.economy.ledger.CurrencyLedger;
import com.gacha.economy.rng.GameRng;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides battles and applies their payouts.
 *
 * <p>The requester wins with the "stronger" chance only when its lineup power strictly
 * exceeds the opponent's, and with the "weaker" chance otherwise, so every battle can go
 * either way.
 */
public class BattleResolver {
    private static final Logger logger = LoggerFactory.getLogger(BattleResolver.class);

    private final EconomyConfig.Battle settings;
    private final GameRng rng;

    public BattleResolver(EconomyConfig.Battle settings, GameRng rng) {
        this.settings = settings;
        this.rng = rng;
    }

    /**
     * Probability that the requester wins.
     */
    public double winChance(int requesterPower, int opponentPower) {
        return requesterPower > opponentPower ? settings.winChanceStronger() : settings.winChanceWeaker();
    }

    /**
     * Roll one battle between two powers.
     */
    public boolean requesterWins(int requesterPower, int opponentPower) {
        return rng.chance(winChance(requesterPower, opponentPower));
    }

    /**
     * Fight a scripted opponent and pay out. Rating is not affected.
     */
    public BattleOutcome fightScripted(Account account, Lineup lineup, OpponentLevel level) {
        int power = lineup.totalPower();
        boolean won = requesterWins(power, level.ovr());
        Currency currency = settings.rewardCurrency();
        long delta;
        if (won) {
            CurrencyLedger.credit(account, currency, level.winReward());
            delta = level.winReward();
        } else {
            delta = -CurrencyLedger.debitFloored(account, currency, level.lossPenalty());
        }
        logger.info("scripted battle userId={} level={} power={} opponentPower={} won={} delta={}",
                account.getUserId(), level.level(), power, level.ovr(), won, delta);
        return new BattleOutcome(BattleMode.SCRIPTED, account.getUserId(), null, level.level(),
                power, level.ovr(), won, currency, delta, 0, 0, 0);
    }

    /**
     * Fight two players and pay out currency and rating to both.
     */
    public BattleOutcome settlePvp(Account requester, int requesterPower, Account opponent, int opponentPower) {
        boolean requesterWon = requesterWins(requesterPower, opponentPower);
        Account winner = requesterWon ? requester : opponent;
        Account loser = requesterWon ? opponent : requester;
        Currency currency = settings.rewardCurrency();

        CurrencyLedger.credit(winner, currency, settings.pvpWinReward());
        long taken = CurrencyLedger.debitFloored(loser, currency, settings.pvpLossPenalty());

        int winnerRatingBefore = winner.getRating();
        int loserRatingBefore = loser.getRating();
        winner.adjustRating(settings.pvpRatingGain());
        loser.adjustRating(-settings.pvpRatingLoss());
        int winnerRatingDelta = winner.getRating() - winnerRatingBefore;
        int loserRatingDelta = loser.getRating() - loserRatingBefore;

        logger.info("pvp battle requester={} power={} opponent={} power={} winner={}",
                requester.getUserId(), requesterPower, opponent.getUserId(), opponentPower, winner.getUserId());

        long winGain = settings.pvpWinReward();
        return new BattleOutcome(BattleMode.PVP, requester.getUserId(), opponent.getUserId(), null,
                requesterPower, opponentPower, requesterWon, currency,
                requesterWon ? winGain : -taken,
                requesterWon ? -taken : winGain,
                requesterWon ? winnerRatingDelta : loserRatingDelta,
                requesterWon ? loserRatingDelta : winnerRatingDelta);
    }
}
