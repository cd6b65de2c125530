package com.gacha.economy.service;

import com.gacha.economy.account.Account;
import com.gacha.economy.account.AccountStore;
import com.gacha.economy.battle.BattleOutcome;
import com.gacha.economy.battle.BattleResolver;
import com.gacha.economy.battle.CancelResult;
import com.gacha.economy.battle.Lineup;
import com.gacha.economy.battle.LineupResult;
import com.gacha.economy.battle.MatchListener;
import com.gacha.economy.battle.MatchRequestResult;
import com.gacha.economy.battle.MatchmakingQueue;
import com.gacha.economy.battle.MatchmakingTicket;
import com.gacha.economy.battle.ScriptedBattleResult;
import com.gacha.economy.battle.TicketState;
import com.gacha.economy.card.CardCatalog;
import com.gacha.economy.card.CardInstance;
import com.gacha.economy.casino.DiceGame;
import com.gacha.economy.casino.DiceResult;
import com.gacha.economy.config.EconomyConfig;
import com.gacha.economy.config.ExchangeOffer;
import com.gacha.economy.config.OpponentLevel;
import com.gacha.economy.draw.DrawEngine;
import com.gacha.economy.draw.PackOpener;
import com.gacha.economy.draw.PackOpening;
import com.gacha.economy.fusion.FusionEngine;
import com.gacha.economy.fusion.FusionResult;
import com.gacha.economy.ledger.CurrencyLedger;
import com.gacha.economy.ledger.ExchangeResult;
import com.gacha.economy.ledger.InsufficientFundsException;
import com.gacha.economy.regen.FreePackRegenerator;
import com.gacha.economy.rng.GameRng;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for the platform adapter. Each method is one player action.
 *
 * <p>Every access runs the free-pack refill check first. Mutations of one account are
 * serialized on the account object and the full account table is written through after
 * every change. Account monitors are always released before the table is saved or the
 * matchmaking lock is taken; PvP settlement takes both account monitors in id order.
 */
public class GachaService {
    private final EconomyConfig config;
    private final AccountStore store;
    private final Clock clock;
    private final FreePackRegenerator regenerator;
    private final PackOpener packOpener;
    private final FusionEngine fusionEngine;
    private final BattleResolver battleResolver;
    private final DiceGame diceGame;
    private final MatchmakingQueue matchmaking;

    public GachaService(CardCatalog catalog, EconomyConfig config, AccountStore store, GameRng rng, Clock clock) {
        this.config = config;
        this.store = store;
        this.clock = clock;
        DrawEngine drawEngine = new DrawEngine(catalog, rng, clock);
        this.regenerator = new FreePackRegenerator(config.freePacks());
        this.packOpener = new PackOpener(config, drawEngine, regenerator);
        this.fusionEngine = new FusionEngine(config.fusion(), drawEngine, rng);
        this.battleResolver = new BattleResolver(config.battle(), rng);
        this.diceGame = new DiceGame(config.dice(), rng);
        this.matchmaking = new MatchmakingQueue(this::settlePair, clock);
    }

    /**
     * The caller's account, created on first contact and refilled if its window elapsed.
     */
    public Account account(Caller caller) {
        Instant now = clock.instant();
        Account account = store.getOrCreate(caller.id(), caller.displayName(), now);
        boolean refilled;
        synchronized (account) {
            refilled = regenerator.checkRefill(account, now);
        }
        if (refilled) {
            store.save();
        }
        return account;
    }

    public PackOpening openPack(Caller caller, String packName) {
        Account account = account(caller);
        PackOpening result;
        synchronized (account) {
            result = packOpener.openPack(account, packName);
        }
        saveIf(result instanceof PackOpening.Opened);
        return result;
    }

    public PackOpening openFreePack(Caller caller) {
        Account account = account(caller);
        PackOpening result;
        synchronized (account) {
            result = packOpener.openFreePack(account, clock.instant());
        }
        saveIf(result instanceof PackOpening.Opened);
        return result;
    }

    /**
     * Time until the caller's free packs refill, zero if a refill is already due.
     */
    public Duration freePackCountdown(Caller caller) {
        Account account = account(caller);
        synchronized (account) {
            return regenerator.timeUntilRefill(account, clock.instant());
        }
    }

    public FusionResult fuse(Caller caller, long cardId) {
        Account account = account(caller);
        FusionResult result;
        synchronized (account) {
            result = fusionEngine.fuse(account, cardId);
        }
        saveIf(result instanceof FusionResult.Fused);
        return result;
    }

    public LineupResult bestLineup(Caller caller) {
        Account account = account(caller);
        synchronized (account) {
            return Lineup.best(account.getCollection());
        }
    }

    /**
     * Fight a scripted opponent of the given level.
     */
    public ScriptedBattleResult battleScripted(Caller caller, String level) {
        Optional<OpponentLevel> opponent = config.battle().opponent(level);
        if (opponent.isEmpty()) {
            return new ScriptedBattleResult.UnknownOpponent(level);
        }
        Account account = account(caller);
        ScriptedBattleResult result;
        synchronized (account) {
            LineupResult lineup = Lineup.best(account.getCollection());
            if (lineup instanceof LineupResult.IncompleteRoster missing) {
                return new ScriptedBattleResult.IncompleteRoster(missing.missing());
            }
            Lineup team = ((LineupResult.Ready) lineup).lineup();
            result = new ScriptedBattleResult.Fought(team, battleResolver.fightScripted(account, team, opponent.get()));
        }
        store.save();
        return result;
    }

    /**
     * Ask for a PvP battle: fights immediately if someone is waiting, otherwise queues.
     */
    public MatchRequestResult requestPvp(Caller caller) {
        Account account = account(caller);
        LineupResult lineup;
        synchronized (account) {
            lineup = Lineup.best(account.getCollection());
        }
        if (lineup instanceof LineupResult.IncompleteRoster missing) {
            return new MatchRequestResult.IncompleteRoster(missing.missing());
        }
        Lineup team = ((LineupResult.Ready) lineup).lineup();
        return matchmaking.requestMatch(account.getUserId(), team, team.totalPower());
    }

    public CancelResult cancelPvp(Caller caller) {
        return matchmaking.cancel(caller.id());
    }

    public TicketState pvpState(Caller caller) {
        return matchmaking.state(caller.id());
    }

    /**
     * The outcome of a battle fought while the caller was waiting in the queue.
     */
    public Optional<BattleOutcome> takePvpResult(Caller caller) {
        return matchmaking.takeResult(caller.id());
    }

    public void addMatchListener(MatchListener listener) {
        matchmaking.addListener(listener);
    }

    public ExchangeResult exchange(Caller caller, String offerId) {
        Optional<ExchangeOffer> found = config.exchangeOffer(offerId);
        if (found.isEmpty()) {
            return new ExchangeResult.UnknownOffer(offerId);
        }
        ExchangeOffer offer = found.get();
        Account account = account(caller);
        synchronized (account) {
            try {
                CurrencyLedger.exchange(account, offer.payCurrency(), offer.cost(), offer.gainCurrency(), offer.amount());
            } catch (InsufficientFundsException e) {
                return new ExchangeResult.InsufficientFunds(e.getCurrency(), e.getRequired(), e.getAvailable());
            }
        }
        store.save();
        return new ExchangeResult.Exchanged(offer);
    }

    public DiceResult rollDice(Caller caller) {
        Account account = account(caller);
        DiceResult result;
        synchronized (account) {
            result = diceGame.roll(account);
        }
        saveIf(result instanceof DiceResult.Rolled);
        return result;
    }

    /**
     * Wipe the caller's progress back to starting values.
     */
    public void reset(Caller caller) {
        store.reset(account(caller), clock.instant());
    }

    /**
     * Remember the platform's media handle for an owned card.
     * @return false if the caller owns no card with that id
     */
    public boolean attachMedia(Caller caller, long cardId, String mediaRef) {
        Account account = account(caller);
        boolean attached;
        synchronized (account) {
            Optional<CardInstance> card = account.getCollection().findById(cardId);
            card.ifPresent(c -> c.setMediaRef(mediaRef));
            attached = card.isPresent();
        }
        saveIf(attached);
        return attached;
    }

    public List<CardInstance> search(Caller caller, String query) {
        Account account = account(caller);
        synchronized (account) {
            return account.getCollection().search(query);
        }
    }

    private BattleOutcome settlePair(MatchmakingTicket requester, MatchmakingTicket opponent) {
        Account requesterAccount = store.find(requester.accountId()).orElseThrow();
        Account opponentAccount = store.find(opponent.accountId()).orElseThrow();
        Account first = requesterAccount.getUserId() < opponentAccount.getUserId() ? requesterAccount : opponentAccount;
        Account second = first == requesterAccount ? opponentAccount : requesterAccount;

        BattleOutcome outcome;
        synchronized (first) {
            synchronized (second) {
                outcome = battleResolver.settlePvp(requesterAccount, requester.power(),
                        opponentAccount, opponent.power());
            }
        }
        store.save();
        return outcome;
    }

    private void saveIf(boolean changed) {
        if (changed) {
            store.save();
        }
    }
}
