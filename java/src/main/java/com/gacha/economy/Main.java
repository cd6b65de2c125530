package com.gacha.economy;

import com.gacha.economy.account.Account;
import com.gacha.economy.account.AccountStore;
import com.gacha.economy.account.JsonFileAccountRepository;
import com.gacha.economy.battle.BattleOutcome;
import com.gacha.economy.battle.CancelResult;
import com.gacha.economy.battle.Lineup;
import com.gacha.economy.battle.MatchRequestResult;
import com.gacha.economy.battle.ScriptedBattleResult;
import com.gacha.economy.card.CardCatalog;
import com.gacha.economy.card.CardInstance;
import com.gacha.economy.card.CatalogException;
import com.gacha.economy.card.Position;
import com.gacha.economy.card.Rarity;
import com.gacha.economy.casino.DiceResult;
import com.gacha.economy.config.ConfigException;
import com.gacha.economy.config.EconomyConfig;
import com.gacha.economy.config.ExchangeOffer;
import com.gacha.economy.config.PackDefinition;
import com.gacha.economy.draw.DrawEngine;
import com.gacha.economy.draw.PackOpening;
import com.gacha.economy.fusion.FusionResult;
import com.gacha.economy.ledger.Currency;
import com.gacha.economy.ledger.ExchangeResult;
import com.gacha.economy.rng.GameRng;
import com.gacha.economy.service.Caller;
import com.gacha.economy.service.GachaService;
import picocli.CommandLine;
import picocli.CommandLine.*;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Gacha economy CLI - Main entry point.
 * Each subcommand runs one player action against a JSON state file.
 */
@Command(name = "gacha-economy",
        mixinStandardHelpOptions = true,
        version = "1.0",
        description = "Card gacha economy: packs, fusion, battles and currencies",
        subcommands = {
                Main.DrawCommand.class,
                Main.FreeCommand.class,
                Main.FuseCommand.class,
                Main.BattleCommand.class,
                Main.PvpCommand.class,
                Main.BalanceCommand.class,
                Main.CollectionCommand.class,
                Main.ExchangeCommand.class,
                Main.DiceCommand.class,
                Main.ResetCommand.class,
                Main.SimulateCommand.class
        })
public class Main implements Runnable {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public void run() {
        // Show help if no subcommand
        CommandLine.usage(this, System.out);
    }

    /**
     * Options shared by every command that acts on a player.
     */
    abstract static class PlayerCommand implements Callable<Integer> {
        @Option(names = {"-c", "--cards"}, defaultValue = "cards.json",
                description = "Path to the card catalog")
        String cardsPath;

        @Option(names = {"--state"}, defaultValue = "accounts.json",
                description = "Path to the account state file")
        String statePath;

        @Option(names = {"--config"},
                description = "Path to an economy config (defaults to the bundled one)")
        String configPath;

        @Option(names = {"-s", "--seed"},
                description = "Random seed (optional)")
        Long seed;

        @Option(names = {"-u", "--user"}, required = true,
                description = "Player id")
        long userId;

        @Option(names = {"--name"},
                description = "Player display name")
        String name;

        @Override
        public Integer call() throws Exception {
            CardCatalog catalog;
            try {
                catalog = CardCatalog.fromFile(cardsPath);
                System.err.println("✓ Loaded " + catalog.cardCount() + " cards from " + cardsPath);
            } catch (CatalogException e) {
                System.err.println("✗ Failed to load cards: " + e.getMessage());
                return 1;
            }

            EconomyConfig config;
            try {
                config = configPath == null ? EconomyConfig.defaultConfig() : EconomyConfig.fromFile(configPath);
            } catch (ConfigException e) {
                System.err.println("✗ Failed to load config '" + configPath + "': " + e.getMessage());
                return 1;
            }

            Clock clock = Clock.systemUTC();
            AccountStore store = new AccountStore(new JsonFileAccountRepository(Path.of(statePath)), config, clock);
            GameRng rng = seed != null ? new GameRng(seed) : new GameRng();
            GachaService service = new GachaService(catalog, config, store, rng, clock);
            return execute(service, new Caller(userId, name));
        }

        abstract int execute(GachaService service, Caller caller);
    }

    // ========== DRAW COMMAND ==========
    @Command(name = "draw", description = "Buy and open a pack")
    static class DrawCommand extends PlayerCommand {
        @Option(names = {"-p", "--pack"}, defaultValue = "basic",
                description = "Pack name")
        String pack;

        @Override
        int execute(GachaService service, Caller caller) {
            return printOpening(service.openPack(caller, pack));
        }
    }

    // ========== FREE COMMAND ==========
    @Command(name = "free", description = "Open a free pack")
    static class FreeCommand extends PlayerCommand {
        @Override
        int execute(GachaService service, Caller caller) {
            return printOpening(service.openFreePack(caller));
        }
    }

    // ========== FUSE COMMAND ==========
    @Command(name = "fuse", description = "Fuse duplicates of an owned card into a higher rarity")
    static class FuseCommand extends PlayerCommand {
        @Parameters(index = "0", description = "Id of one of the duplicates")
        long cardId;

        @Override
        int execute(GachaService service, Caller caller) {
            FusionResult result = service.fuse(caller, cardId);
            if (result instanceof FusionResult.Fused fused) {
                System.out.println("Fused 5 x " + fused.sourceName() + " (" + fused.sourceRarity().getJsonValue() + ")");
                System.out.println("  New card: " + describe(fused.newCard()));
                System.out.println("  Reward: " + fused.reward() + " " + fused.rewardCurrency().getJsonValue());
                return 0;
            } else if (result instanceof FusionResult.NotFound notFound) {
                System.err.println("No card with id " + notFound.cardId());
            } else if (result instanceof FusionResult.MaxRarity max) {
                System.err.println("Card " + max.cardId() + " is already " + max.rarity().getJsonValue());
            } else if (result instanceof FusionResult.InsufficientDuplicates dups) {
                System.err.println("Need " + dups.required() + " duplicates, you own " + dups.owned());
            }
            return 1;
        }
    }

    // ========== BATTLE COMMAND ==========
    @Command(name = "battle", description = "Fight a scripted opponent")
    static class BattleCommand extends PlayerCommand {
        @Option(names = {"-l", "--level"}, defaultValue = "novice",
                description = "Opponent level")
        String level;

        @Override
        int execute(GachaService service, Caller caller) {
            ScriptedBattleResult result = service.battleScripted(caller, level);
            if (result instanceof ScriptedBattleResult.Fought fought) {
                printLineup(fought.lineup());
                printOutcome(caller.id(), fought.outcome());
                return 0;
            } else if (result instanceof ScriptedBattleResult.IncompleteRoster roster) {
                printMissing(roster.missing());
            } else if (result instanceof ScriptedBattleResult.UnknownOpponent unknown) {
                System.err.println("Unknown opponent level '" + unknown.level() + "'");
            }
            return 1;
        }
    }

    // ========== PVP COMMAND ==========
    @Command(name = "pvp", description = "Queue two players for PvP; they battle as soon as both are queued")
    static class PvpCommand extends PlayerCommand {
        @Option(names = {"-o", "--opponent"}, required = true,
                description = "Opponent player id")
        long opponentId;

        @Override
        int execute(GachaService service, Caller caller) {
            Caller opponent = Caller.of(opponentId);
            MatchRequestResult first = service.requestPvp(opponent);
            if (first instanceof MatchRequestResult.IncompleteRoster roster) {
                System.err.println("Opponent cannot battle:");
                printMissing(roster.missing());
                return 1;
            }

            MatchRequestResult second = service.requestPvp(caller);
            if (second instanceof MatchRequestResult.Paired paired) {
                printOutcome(caller.id(), paired.outcome());
                return 0;
            }
            if (second instanceof MatchRequestResult.IncompleteRoster roster) {
                printMissing(roster.missing());
            }
            if (service.cancelPvp(opponent) == CancelResult.CANCELLED) {
                System.err.println("Opponent ticket withdrawn");
            }
            return 1;
        }
    }

    // ========== BALANCE COMMAND ==========
    @Command(name = "balance", description = "Show balances, free packs and rating")
    static class BalanceCommand extends PlayerCommand {
        @Override
        int execute(GachaService service, Caller caller) {
            Account account = service.account(caller);
            Duration countdown = service.freePackCountdown(caller);
            System.out.println("\n=== " + (account.getUsername() != null ? account.getUsername() : "Player " + account.getUserId()) + " ===\n");
            for (Currency currency : Currency.values()) {
                System.out.printf("%-8s %d%n", currency.getJsonValue() + ":", account.getBalance(currency));
            }
            System.out.println("Free packs: " + account.getFreePacks()
                    + " (refill in " + countdown.toHours() + "h " + countdown.toMinutesPart() + "m)");
            System.out.println("Rating: " + account.getRating());
            System.out.println("Cards: " + account.getCollection().size());
            System.out.println("Dice: " + account.getDiceWins() + " won / " + account.getDiceLosses() + " lost");
            return 0;
        }
    }

    // ========== COLLECTION COMMAND ==========
    @Command(name = "collection", description = "List owned cards, newest first")
    static class CollectionCommand extends PlayerCommand {
        @Option(names = {"-q", "--query"},
                description = "Only cards whose name contains this text")
        String query;

        @Override
        int execute(GachaService service, Caller caller) {
            List<CardInstance> cards = query != null
                    ? service.search(caller, query)
                    : service.account(caller).getCollection().newestFirst();
            if (cards.isEmpty()) {
                System.out.println("No cards");
            }
            cards.forEach(card -> System.out.println("  " + describe(card)));
            return 0;
        }
    }

    // ========== EXCHANGE COMMAND ==========
    @Command(name = "exchange", description = "Trade one currency for another")
    static class ExchangeCommand extends PlayerCommand {
        @Parameters(index = "0", description = "Offer id, e.g. stars-to-gems")
        String offerId;

        @Override
        int execute(GachaService service, Caller caller) {
            ExchangeResult result = service.exchange(caller, offerId);
            if (result instanceof ExchangeResult.Exchanged exchanged) {
                ExchangeOffer offer = exchanged.offer();
                System.out.println("Paid " + offer.cost() + " " + offer.payCurrency().getJsonValue()
                        + ", received " + offer.amount() + " " + offer.gainCurrency().getJsonValue());
                return 0;
            } else if (result instanceof ExchangeResult.InsufficientFunds funds) {
                System.err.println("Need " + funds.required() + " " + funds.currency().getJsonValue()
                        + ", you have " + funds.available());
            } else if (result instanceof ExchangeResult.UnknownOffer unknown) {
                System.err.println("Unknown offer '" + unknown.id() + "'");
            }
            return 1;
        }
    }

    // ========== DICE COMMAND ==========
    @Command(name = "dice", description = "Stake coins on a dice roll")
    static class DiceCommand extends PlayerCommand {
        @Override
        int execute(GachaService service, Caller caller) {
            DiceResult result = service.rollDice(caller);
            if (result instanceof DiceResult.Rolled rolled) {
                System.out.println("Rolled " + rolled.value() + (rolled.won()
                        ? " - won " + rolled.coinsWon() + " coins and " + rolled.gemsWon() + " gems"
                        : " - lost"));
                return 0;
            }
            DiceResult.InsufficientFunds funds = (DiceResult.InsufficientFunds) result;
            System.err.println("Stake is " + funds.stake() + " coins, you have " + funds.available());
            return 1;
        }
    }

    // ========== RESET COMMAND ==========
    @Command(name = "reset", description = "Wipe a player's progress")
    static class ResetCommand extends PlayerCommand {
        @Override
        int execute(GachaService service, Caller caller) {
            service.reset(caller);
            System.out.println("Account " + caller.id() + " reset");
            return 0;
        }
    }

    // ========== SIMULATE COMMAND ==========
    @Command(name = "simulate", description = "Open many packs and report the rarity distribution")
    static class SimulateCommand implements Callable<Integer> {
        @Option(names = {"-n", "--num-packs"}, defaultValue = "10000",
                description = "Number of packs to open")
        int numPacks;

        @Option(names = {"-p", "--pack"}, defaultValue = "basic",
                description = "Pack name")
        String pack;

        @Option(names = {"-s", "--seed"},
                description = "Random seed (optional)")
        Long seed;

        @Option(names = {"-c", "--cards"}, defaultValue = "cards.json",
                description = "Path to the card catalog")
        String cardsPath;

        @Option(names = {"--config"},
                description = "Path to an economy config (defaults to the bundled one)")
        String configPath;

        @Override
        public Integer call() throws Exception {
            CardCatalog catalog;
            try {
                catalog = CardCatalog.fromFile(cardsPath);
                System.err.println("✓ Loaded " + catalog.cardCount() + " cards from " + cardsPath);
            } catch (CatalogException e) {
                System.err.println("✗ Failed to load cards: " + e.getMessage());
                return 1;
            }

            EconomyConfig config;
            try {
                config = configPath == null ? EconomyConfig.defaultConfig() : EconomyConfig.fromFile(configPath);
            } catch (ConfigException e) {
                System.err.println("✗ Failed to load config '" + configPath + "': " + e.getMessage());
                return 1;
            }

            Optional<PackDefinition> definition = config.pack(pack);
            if (definition.isEmpty()) {
                System.err.println("Unknown pack '" + pack + "'");
                return 1;
            }

            System.out.println("\n=== Pack Simulation ===\n");
            System.out.println("Pack: " + pack);
            System.out.println("Packs: " + numPacks);
            if (seed != null) {
                System.out.println("Seed: " + seed);
            }
            System.out.println();

            long startTime = System.currentTimeMillis();
            DrawEngine engine = new DrawEngine(catalog, seed != null ? new GameRng(seed) : new GameRng(),
                    Clock.systemUTC());
            Map<Rarity, Integer> counts = new EnumMap<>(Rarity.class);
            for (int i = 0; i < numPacks; i++) {
                counts.merge(engine.draw(definition.get()).getRarity(), 1, Integer::sum);
            }
            long elapsed = System.currentTimeMillis() - startTime;

            for (Rarity rarity : Rarity.values()) {
                int count = counts.getOrDefault(rarity, 0);
                System.out.printf("%-10s %7d  %6.2f%%%n", rarity.getJsonValue(), count, count * 100.0 / numPacks);
            }
            System.out.printf("%nTime: %.2fs%n", elapsed / 1000.0);
            return 0;
        }
    }

    private static int printOpening(PackOpening opening) {
        if (opening instanceof PackOpening.Opened opened) {
            System.out.println("Opened " + opened.pack() + ": " + describe(opened.card()));
            System.out.println("Free packs left: " + opened.freePacksLeft());
            return 0;
        } else if (opening instanceof PackOpening.InsufficientFunds funds) {
            System.err.println("Need " + funds.required() + " " + funds.currency().getJsonValue()
                    + ", you have " + funds.available());
        } else if (opening instanceof PackOpening.NoFreePacks none) {
            Duration wait = none.timeUntilRefill();
            System.err.println("No free packs, next refill in " + wait.toHours() + "h " + wait.toMinutesPart() + "m");
        } else if (opening instanceof PackOpening.UnknownPack unknown) {
            System.err.println("Unknown pack '" + unknown.name() + "'");
        }
        return 1;
    }

    private static void printLineup(Lineup lineup) {
        System.out.println("Lineup (power " + lineup.totalPower() + "):");
        for (Position position : Position.values()) {
            System.out.println("  " + position.getJsonValue() + ": " + describe(lineup.member(position)));
        }
    }

    private static void printOutcome(long viewerId, BattleOutcome outcome) {
        String opponent = outcome.opponentId() != null ? "player " + outcome.opponentId() : outcome.opponentLevel();
        System.out.println("\n" + outcome.requesterPower() + " vs " + outcome.opponentPower() + " (" + opponent + ")");
        System.out.println(outcome.wonBy(viewerId) ? "Victory!" : "Defeat");
        long delta = viewerId == outcome.requesterId()
                ? outcome.requesterCurrencyDelta()
                : outcome.opponentCurrencyDelta();
        System.out.printf("%+d %s%n", delta, outcome.currency().getJsonValue());
    }

    private static void printMissing(List<Position> missing) {
        System.err.println("Lineup incomplete, missing:");
        missing.forEach(p -> System.err.println("  " + p.getJsonValue()));
    }

    private static String describe(CardInstance card) {
        return "#" + card.getUserCardId() + " " + card.getDefinition().displayName()
                + " [" + card.getRarity().getJsonValue() + ", " + card.getOvr() + "]";
    }
}
