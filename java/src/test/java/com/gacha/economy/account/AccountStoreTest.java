package com.gacha.economy.account;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gacha.economy.card.CardDefinition;
import com.gacha.economy.card.CardInstance;
import com.gacha.economy.card.Position;
import com.gacha.economy.card.Rarity;
import com.gacha.economy.config.EconomyConfig;
import com.gacha.economy.ledger.Currency;
import com.gacha.economy.regen.FreePackRegenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for AccountStore and its JSON file repository.
 */
class AccountStoreTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @TempDir
    Path tempDir;

    private EconomyConfig config;
    private Path stateFile;

    @BeforeEach
    void setUp() {
        config = EconomyConfig.defaultConfig();
        stateFile = tempDir.resolve("accounts.json");
    }

    @Test
    void testMissingFileStartsEmpty() {
        AccountStore store = new AccountStore(new JsonFileAccountRepository(stateFile), config);
        assertEquals(0, store.size());
        assertTrue(store.find(1).isEmpty());
    }

    @Test
    void testFirstContactCreatesDefaults() {
        AccountStore store = new AccountStore(new JsonFileAccountRepository(stateFile), config);
        Account account = store.getOrCreate(7, "alice", NOW);

        assertEquals(7, account.getUserId());
        assertEquals("alice", account.getUsername());
        assertEquals(1000, account.getBalance(Currency.COINS));
        assertEquals(0, account.getBalance(Currency.GEMS));
        assertEquals(0, account.getBalance(Currency.CANDIES));
        assertEquals(0, account.getBalance(Currency.STARS));
        assertEquals(5, account.getFreePacks());
        assertEquals(NOW, account.getLastFreePackTime());
        assertEquals(1000, account.getRating());
        assertEquals(1, account.getNextCardId());
        assertTrue(account.getCollection().isEmpty());

        assertSame(account, store.getOrCreate(7, null, NOW.plusSeconds(60)), "Second contact returns the same account");
    }

    @Test
    void testDisplayNameUpdated() {
        AccountStore store = new AccountStore(new JsonFileAccountRepository(stateFile), config);
        store.getOrCreate(7, "alice", NOW);
        assertEquals("alicia", store.getOrCreate(7, "alicia", NOW).getUsername());
    }

    @Test
    void testStateSurvivesRestart() {
        AccountStore store = new AccountStore(new JsonFileAccountRepository(stateFile), config);
        Account account = store.getOrCreate(7, "alice", NOW);
        account.setBalance(Currency.GEMS, 42);
        account.consumeFreePack();
        account.adjustRating(30);
        CardInstance card = account.addCard(new CardInstance(
                new CardDefinition(3, "Striker", "Нападающий", Rarity.EPIC, Position.FORWARD, 84), NOW));
        card.setMediaRef("file-123");
        store.getOrCreate(8, "bob", NOW);
        store.save();

        AccountStore reloaded = new AccountStore(new JsonFileAccountRepository(stateFile), config);
        assertEquals(2, reloaded.size());
        Account restored = reloaded.find(7).orElseThrow();
        assertEquals("alice", restored.getUsername());
        assertEquals(42, restored.getBalance(Currency.GEMS));
        assertEquals(1000, restored.getBalance(Currency.COINS));
        assertEquals(4, restored.getFreePacks());
        assertEquals(NOW, restored.getLastFreePackTime());
        assertEquals(1030, restored.getRating());
        assertEquals(2, restored.getNextCardId(), "The id counter must survive so ids are never reused");

        CardInstance restoredCard = restored.getCollection().findById(1).orElseThrow();
        assertEquals("Striker", restoredCard.getDefinition().getNameEn());
        assertEquals(Rarity.EPIC, restoredCard.getRarity());
        assertEquals(Position.FORWARD, restoredCard.getDefinition().getPosition());
        assertEquals(NOW, restoredCard.getAcquiredAt());
        assertEquals("file-123", restoredCard.getMediaRef());
    }

    @Test
    void testStateFileIsReadableJson() throws IOException {
        AccountStore store = new AccountStore(new JsonFileAccountRepository(stateFile), config);
        store.getOrCreate(7, "alice", NOW);
        store.save();

        String json = Files.readString(stateFile);
        assertTrue(json.contains("\"2026-01-01T00:00:00Z\""), "Timestamps should be ISO-8601 text");
        assertFalse(Files.exists(tempDir.resolve("accounts.json.tmp")), "Temp file should be moved into place");
    }

    @Test
    void testMissingFreePackTimeStartsWindowAtLoad() throws IOException {
        AccountStore store = new AccountStore(new JsonFileAccountRepository(stateFile), config);
        store.getOrCreate(7, "alice", NOW).consumeFreePack();
        store.save();

        ObjectMapper mapper = new ObjectMapper();
        ObjectNode table = (ObjectNode) mapper.readTree(stateFile.toFile());
        ((ObjectNode) table.get("7")).remove("last_free_pack_time");
        mapper.writeValue(stateFile.toFile(), table);

        Instant loadTime = NOW.plusSeconds(86400);
        AccountStore reloaded = new AccountStore(new JsonFileAccountRepository(stateFile), config,
                Clock.fixed(loadTime, ZoneOffset.UTC));
        Account account = reloaded.find(7).orElseThrow();
        assertEquals(loadTime, account.getLastFreePackTime(), "Missing timestamp defaults to the load time");

        FreePackRegenerator regenerator = new FreePackRegenerator(config.freePacks());
        assertFalse(regenerator.checkRefill(account, loadTime.plusSeconds(60)), "Window restarts at load");
        assertEquals(4, account.getFreePacks());
        assertEquals(Duration.ofHours(4).minusSeconds(60), regenerator.timeUntilRefill(account, loadTime.plusSeconds(60)));
    }

    @Test
    void testCorruptFileFails() throws IOException {
        Files.writeString(stateFile, "{ broken");
        assertThrows(StorageException.class, () -> new AccountStore(new JsonFileAccountRepository(stateFile), config));
    }

    @Test
    void testReset() {
        AccountStore store = new AccountStore(new JsonFileAccountRepository(stateFile), config);
        Account account = store.getOrCreate(7, "alice", NOW);
        account.setBalance(Currency.COINS, 5);
        account.setBalance(Currency.STARS, 9);
        account.adjustRating(100);
        account.addCard(new CardInstance(new CardDefinition(1, "Keeper", null, Rarity.COMMON, Position.GOALKEEPER, 60), NOW));
        account.consumeFreePack();
        account.recordDiceRoll(true);

        Instant later = NOW.plusSeconds(3600);
        store.reset(account, later);

        assertEquals(1000, account.getBalance(Currency.COINS));
        assertEquals(0, account.getBalance(Currency.STARS));
        assertTrue(account.getCollection().isEmpty());
        assertEquals(1, account.getNextCardId());
        assertEquals(5, account.getFreePacks());
        assertEquals(later, account.getLastFreePackTime());
        assertEquals(0, account.getDiceTotal());
        assertEquals(1100, account.getRating(), "Rating is kept across a reset");
        assertEquals("alice", account.getUsername());

        Account persisted = new AccountStore(new JsonFileAccountRepository(stateFile), config).find(7).orElseThrow();
        assertEquals(1000, persisted.getBalance(Currency.COINS), "Reset is written through");
    }
}
