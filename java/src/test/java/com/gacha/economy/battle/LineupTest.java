package com.gacha.economy.battle;

import com.gacha.economy.account.CardCollection;
import com.gacha.economy.card.CardDefinition;
import com.gacha.economy.card.CardInstance;
import com.gacha.economy.card.Position;
import com.gacha.economy.card.Rarity;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Lineup selection.
 */
class LineupTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void testEmptyCollectionMissesEveryPosition() {
        LineupResult result = Lineup.best(new CardCollection());
        assertEquals(new LineupResult.IncompleteRoster(List.of(Position.values())), result);
    }

    @Test
    void testMissingPositionsReported() {
        CardCollection collection = collectionOf(
                card(1, Position.GOALKEEPER, 60),
                card(2, Position.MIDFIELDER, 70));
        LineupResult result = Lineup.best(collection);
        assertEquals(new LineupResult.IncompleteRoster(List.of(Position.DEFENDER, Position.FORWARD)), result);
    }

    @Test
    void testBestCardPerPosition() {
        CardInstance weakKeeper = card(1, Position.GOALKEEPER, 60);
        CardInstance strongKeeper = card(2, Position.GOALKEEPER, 84);
        CardInstance back = card(3, Position.DEFENDER, 70);
        CardInstance mid = card(4, Position.MIDFIELDER, 71);
        CardInstance forward = card(5, Position.FORWARD, 72);
        CardInstance weakForward = card(6, Position.FORWARD, 50);

        LineupResult result = Lineup.best(collectionOf(weakKeeper, strongKeeper, back, mid, forward, weakForward));
        assertInstanceOf(LineupResult.Ready.class, result);
        Lineup lineup = ((LineupResult.Ready) result).lineup();

        assertSame(strongKeeper, lineup.member(Position.GOALKEEPER));
        assertSame(forward, lineup.member(Position.FORWARD));
        assertEquals(84 + 70 + 71 + 72, lineup.totalPower());
    }

    @Test
    void testFirstCardWinsTie() {
        CardInstance first = card(1, Position.GOALKEEPER, 60);
        CardInstance second = card(2, Position.GOALKEEPER, 60);
        LineupResult result = Lineup.best(collectionOf(first, second,
                card(3, Position.DEFENDER, 60), card(4, Position.MIDFIELDER, 60), card(5, Position.FORWARD, 60)));

        Lineup lineup = ((LineupResult.Ready) result).lineup();
        assertSame(first, lineup.member(Position.GOALKEEPER));
    }

    @Test
    void testCardsWithoutPositionIgnored() {
        CardInstance unplaced = new CardInstance(new CardDefinition(9, "Coach", null, Rarity.MYTHIC, null, 99), NOW);
        LineupResult result = Lineup.best(collectionOf(unplaced));
        assertInstanceOf(LineupResult.IncompleteRoster.class, result);
    }

    private static CardInstance card(long id, Position position, int ovr) {
        return new CardInstance(new CardDefinition(id, "Player " + id, null, Rarity.COMMON, position, ovr), NOW);
    }

    private static CardCollection collectionOf(CardInstance... cards) {
        return new CardCollection(new ArrayList<>(List.of(cards)));
    }
}
