package com.gacha.economy.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gacha.economy.card.Rarity;
import com.gacha.economy.ledger.Currency;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Tunable economy numbers: account defaults, pack tables and prices, fusion rewards,
 * battle payouts, the dice game and exchange offers.
 * Loaded from JSON and validated once.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EconomyConfig(
        @JsonProperty("defaults") Defaults defaults,
        @JsonProperty("free_packs") FreePacks freePacks,
        @JsonProperty("packs") List<PackDefinition> packs,
        @JsonProperty("fusion") Fusion fusion,
        @JsonProperty("battle") Battle battle,
        @JsonProperty("dice") Dice dice,
        @JsonProperty("exchange") List<ExchangeOffer> exchange) {

    public static final String DEFAULT_RESOURCE = "economy.json";

    public EconomyConfig {
        packs = packs == null ? List.of() : List.copyOf(packs);
        exchange = exchange == null ? List.of() : List.copyOf(exchange);
    }

    /**
     * Balances and counters of a newly created account.
     */
    public record Defaults(
            @JsonProperty("coins") long coins,
            @JsonProperty("gems") long gems,
            @JsonProperty("candies") long candies,
            @JsonProperty("stars") long stars,
            @JsonProperty("rating") int rating) {

        public long balance(Currency currency) {
            return switch (currency) {
                case COINS -> coins;
                case GEMS -> gems;
                case CANDIES -> candies;
                case STARS -> stars;
            };
        }
    }

    public record FreePacks(
            @JsonProperty("max") int max,
            @JsonProperty("refill_hours") int refillHours,
            @JsonProperty("pack") String pack) {

        public Duration refillInterval() {
            return Duration.ofHours(refillHours);
        }
    }

    public record Fusion(
            @JsonProperty("duplicates_required") int duplicatesRequired,
            @JsonProperty("reward_currency") Currency rewardCurrency,
            @JsonProperty("reward_cap") int rewardCap,
            @JsonProperty("rewards") List<RewardRange> rewards) {

        public Fusion {
            rewards = rewards == null ? List.of() : List.copyOf(rewards);
        }

        public Optional<RewardRange> rewardFor(Rarity rarity) {
            return rewards.stream().filter(r -> r.rarity() == rarity).findFirst();
        }
    }

    public record Battle(
            @JsonProperty("win_chance_stronger") double winChanceStronger,
            @JsonProperty("win_chance_weaker") double winChanceWeaker,
            @JsonProperty("reward_currency") Currency rewardCurrency,
            @JsonProperty("pvp_win_reward") long pvpWinReward,
            @JsonProperty("pvp_loss_penalty") long pvpLossPenalty,
            @JsonProperty("pvp_rating_gain") int pvpRatingGain,
            @JsonProperty("pvp_rating_loss") int pvpRatingLoss,
            @JsonProperty("opponents") List<OpponentLevel> opponents) {

        public Battle {
            opponents = opponents == null ? List.of() : List.copyOf(opponents);
        }

        public Optional<OpponentLevel> opponent(String level) {
            return opponents.stream().filter(o -> o.level().equalsIgnoreCase(level)).findFirst();
        }
    }

    public record Dice(
            @JsonProperty("stake") long stake,
            @JsonProperty("win_threshold") int winThreshold,
            @JsonProperty("win_coins") long winCoins,
            @JsonProperty("win_gems") long winGems) {
    }

    /**
     * Load the bundled configuration.
     */
    public static EconomyConfig defaultConfig() {
        try {
            return fromResource(DEFAULT_RESOURCE);
        } catch (ConfigException e) {
            throw new IllegalStateException("Bundled " + DEFAULT_RESOURCE + " is invalid", e);
        }
    }

    /**
     * Load the configuration from a JSON file.
     */
    public static EconomyConfig fromFile(String path) throws ConfigException {
        try {
            return fromJson(Files.readString(Path.of(path)));
        } catch (IOException e) {
            throw new ConfigException("IO error: " + e.getMessage(), e);
        }
    }

    /**
     * Load the configuration from a classpath resource.
     */
    public static EconomyConfig fromResource(String resourcePath) throws ConfigException {
        try (InputStream is = EconomyConfig.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new ConfigException("Resource not found: " + resourcePath);
            }
            return validate(new ObjectMapper().readValue(is, EconomyConfig.class));
        } catch (IOException e) {
            throw new ConfigException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    /**
     * Load the configuration from a JSON string.
     */
    public static EconomyConfig fromJson(String json) throws ConfigException {
        try {
            return validate(new ObjectMapper().readValue(json, EconomyConfig.class));
        } catch (IOException e) {
            throw new ConfigException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    public Optional<PackDefinition> pack(String name) {
        return packs.stream().filter(p -> p.name().equalsIgnoreCase(name)).findFirst();
    }

    public Optional<ExchangeOffer> exchangeOffer(String id) {
        return exchange.stream().filter(o -> o.id().equalsIgnoreCase(id)).findFirst();
    }

    private static EconomyConfig validate(EconomyConfig config) throws ConfigException {
        if (config.defaults() == null || config.freePacks() == null || config.fusion() == null
                || config.battle() == null || config.dice() == null) {
            throw new ConfigException("defaults, free_packs, fusion, battle and dice sections are required");
        }
        for (Currency currency : Currency.values()) {
            if (config.defaults().balance(currency) < 0) {
                throw new ConfigException("Default " + currency.getJsonValue() + " balance is negative");
            }
        }

        Set<String> names = new HashSet<>();
        for (PackDefinition pack : config.packs()) {
            if (pack.name() == null || !names.add(pack.name().toLowerCase())) {
                throw new ConfigException("Pack names must be present and unique: " + pack.name());
            }
            if (pack.price() == null || pack.price().currency() == null || pack.price().amount() < 0) {
                throw new ConfigException("Pack " + pack.name() + " needs a non-negative price");
            }
            if (pack.weights().isEmpty()) {
                throw new ConfigException("Pack " + pack.name() + " has no rarity weights");
            }
            for (RarityWeight weight : pack.weights()) {
                if (weight.rarity() == null || weight.weight() < 0) {
                    throw new ConfigException("Pack " + pack.name() + " has an invalid weight entry");
                }
            }
        }

        FreePacks free = config.freePacks();
        if (free.max() <= 0 || free.refillHours() <= 0) {
            throw new ConfigException("free_packs.max and free_packs.refill_hours must be positive");
        }
        if (config.pack(free.pack()).isEmpty()) {
            throw new ConfigException("free_packs.pack refers to unknown pack: " + free.pack());
        }

        Fusion fusion = config.fusion();
        if (fusion.duplicatesRequired() < 2 || fusion.rewardCurrency() == null || fusion.rewardCap() < 0) {
            throw new ConfigException("fusion needs duplicates_required >= 2, a reward currency and a cap >= 0");
        }
        Map<Rarity, RewardRange> ranges = new EnumMap<>(Rarity.class);
        for (RewardRange range : fusion.rewards()) {
            if (range.rarity() == null || range.min() < 0 || range.max() < range.min()) {
                throw new ConfigException("Invalid fusion reward range: " + range);
            }
            ranges.put(range.rarity(), range);
        }
        for (Rarity rarity : Rarity.values()) {
            if (rarity.upgrade().isPresent() && !ranges.containsKey(rarity)) {
                throw new ConfigException("Missing fusion reward range for " + rarity.getJsonValue());
            }
        }

        Battle battle = config.battle();
        if (!isProbability(battle.winChanceStronger()) || !isProbability(battle.winChanceWeaker())
                || battle.rewardCurrency() == null) {
            throw new ConfigException("battle win chances must lie in [0, 1] and a reward currency is required");
        }
        for (OpponentLevel opponent : battle.opponents()) {
            if (opponent.level() == null || opponent.winReward() < 0 || opponent.lossPenalty() < 0) {
                throw new ConfigException("Invalid opponent level: " + opponent);
            }
        }

        for (ExchangeOffer offer : config.exchange()) {
            if (offer.id() == null || offer.payCurrency() == null || offer.gainCurrency() == null
                    || offer.cost() <= 0 || offer.amount() < 0) {
                throw new ConfigException("Invalid exchange offer: " + offer);
            }
        }
        return config;
    }

    private static boolean isProbability(double value) {
        return value >= 0.0 && value <= 1.0;
    }
}
