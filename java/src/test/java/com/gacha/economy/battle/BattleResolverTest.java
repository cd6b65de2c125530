package com.gacha.economy.battle;

import com.gacha.economy.account.Account;
import com.gacha.economy.card.CardDefinition;
import com.gacha.economy.card.CardInstance;
import com.gacha.economy.card.Position;
import com.gacha.economy.card.Rarity;
import com.gacha.economy.config.EconomyConfig;
import com.gacha.economy.config.OpponentLevel;
import com.gacha.economy.ledger.Currency;
import com.gacha.economy.rng.GameRng;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for BattleResolver.
 */
class BattleResolverTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private EconomyConfig config;
    private BattleResolver resolver;
    private Account alice;
    private Account bob;

    @BeforeEach
    void setUp() {
        config = EconomyConfig.defaultConfig();
        resolver = new BattleResolver(config.battle(), new GameRng(2026));
        alice = Account.create(1, "alice", config, NOW);
        bob = Account.create(2, "bob", config, NOW);
    }

    @Test
    void testStrongerSideWinsAboutEightyFourPercent() {
        int simulations = 100_000;
        int wins = 0;
        for (int i = 0; i < simulations; i++) {
            if (resolver.requesterWins(301, 300)) {
                wins++;
            }
        }
        assertEquals(0.84, wins / (double) simulations, 0.01);
    }

    @Test
    void testWeakerSideWinsAboutSixteenPercent() {
        int simulations = 100_000;
        int wins = 0;
        for (int i = 0; i < simulations; i++) {
            if (resolver.requesterWins(200, 300)) {
                wins++;
            }
        }
        assertEquals(0.16, wins / (double) simulations, 0.01);
    }

    @Test
    void testEqualPowerCountsAsWeaker() {
        assertEquals(0.16, resolver.winChance(250, 250), 1e-9);
        assertEquals(0.84, resolver.winChance(251, 250), 1e-9);
    }

    @Test
    void testPvpPayouts() {
        BattleOutcome outcome = resolver.settlePvp(alice, 300, bob, 200);
        Account winner = outcome.requesterWon() ? alice : bob;
        Account loser = outcome.requesterWon() ? bob : alice;

        assertEquals(BattleMode.PVP, outcome.mode());
        assertEquals(1100, winner.getBalance(Currency.COINS));
        assertEquals(950, loser.getBalance(Currency.COINS));
        assertEquals(1030, winner.getRating());
        assertEquals(975, loser.getRating());
        assertTrue(outcome.wonBy(winner.getUserId()));
        assertFalse(outcome.wonBy(loser.getUserId()));
    }

    @Test
    void testPvpLossFlooredAtZero() {
        alice.setBalance(Currency.COINS, 20);
        bob.setBalance(Currency.COINS, 20);
        alice.adjustRating(-990);
        bob.adjustRating(-990);

        BattleOutcome outcome = resolver.settlePvp(alice, 300, bob, 200);
        Account loser = outcome.requesterWon() ? bob : alice;
        assertEquals(0, loser.getBalance(Currency.COINS), "Loss takes what is there and no more");
        assertEquals(0, loser.getRating(), "Rating never goes below zero");

        long loserDelta = outcome.requesterWon() ? outcome.opponentCurrencyDelta() : outcome.requesterCurrencyDelta();
        int loserRatingDelta = outcome.requesterWon() ? outcome.opponentRatingDelta() : outcome.requesterRatingDelta();
        assertEquals(-20, loserDelta, "Reported delta is what was actually taken");
        assertEquals(-10, loserRatingDelta);
    }

    @Test
    void testScriptedBattleLeavesRatingAlone() {
        Lineup lineup = lineupOf(90);
        OpponentLevel novice = config.battle().opponent("novice").orElseThrow();

        BattleOutcome outcome = resolver.fightScripted(alice, lineup, novice);
        assertEquals(BattleMode.SCRIPTED, outcome.mode());
        assertNull(outcome.opponentId());
        assertEquals("novice", outcome.opponentLevel());
        assertEquals(360, outcome.requesterPower());
        assertEquals(1000, alice.getRating());
        long expected = outcome.requesterWon() ? 1025 : 990;
        assertEquals(expected, alice.getBalance(Currency.COINS));
    }

    @Test
    void testScriptedLossFloored() {
        alice.setBalance(Currency.COINS, 0);
        OpponentLevel star = config.battle().opponent("star").orElseThrow();
        for (int i = 0; i < 100; i++) {
            resolver.fightScripted(alice, lineupOf(10), star);
            assertTrue(alice.getBalance(Currency.COINS) >= 0);
        }
    }

    private static Lineup lineupOf(int ovrEach) {
        Map<Position, CardInstance> members = new EnumMap<>(Position.class);
        for (Position position : Position.values()) {
            members.put(position, new CardInstance(
                    new CardDefinition(position.ordinal(), position.getJsonValue(), null, Rarity.EPIC, position, ovrEach), NOW));
        }
        return new Lineup(members);
    }
}
