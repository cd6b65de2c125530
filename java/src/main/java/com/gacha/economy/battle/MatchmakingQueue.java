package com.gacha.economy.battle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The PvP waiting queue and its per-account state.
 *
 * <p>Every operation runs under one lock from start to finish: stale-ticket removal, the
 * opponent scan, pairing with settlement, enqueue and cancel. Two requesters can therefore
 * never take the same waiting ticket, and a ticket cannot be paired and cancelled at once.
 * The scan is linear in queue order; the queue is expected to stay short.
 */
public class MatchmakingQueue {
    private static final Logger logger = LoggerFactory.getLogger(MatchmakingQueue.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final List<MatchmakingTicket> queue = new ArrayList<>();
    private final Map<Long, TicketState> states = new HashMap<>();
    private final Map<Long, BattleOutcome> results = new HashMap<>();
    private final List<MatchListener> listeners = new CopyOnWriteArrayList<>();
    private final PairingSettler settler;
    private final Clock clock;

    public MatchmakingQueue(PairingSettler settler, Clock clock) {
        this.settler = settler;
        this.clock = clock;
    }

    public void addListener(MatchListener listener) {
        listeners.add(listener);
    }

    /**
     * Pair with the first waiting opponent, or queue this account if nobody else waits.
     * An older ticket of the same account is dropped first.
     */
    public MatchRequestResult requestMatch(long accountId, Lineup lineup, int power) {
        BattleOutcome outcome;
        lock.lock();
        try {
            if (removeTicketOf(accountId)) {
                logger.debug("stale ticket replaced accountId={}", accountId);
            }
            if (results.remove(accountId) != null) {
                logger.debug("uncollected result dropped accountId={}", accountId);
            }

            MatchmakingTicket opponent = null;
            for (MatchmakingTicket ticket : queue) {
                if (ticket.accountId() != accountId) {
                    opponent = ticket;
                    break;
                }
            }

            MatchmakingTicket request = new MatchmakingTicket(accountId, lineup, power, clock.instant());
            if (opponent == null) {
                queue.add(request);
                states.put(accountId, TicketState.QUEUED);
                logger.info("ticket queued accountId={} power={} depth={}", accountId, power, queue.size());
                return new MatchRequestResult.Searching(request);
            }

            queue.remove(opponent);
            try {
                outcome = settler.settle(request, opponent);
            } catch (RuntimeException e) {
                // The opponent's ticket is already consumed; there is no recovery path here
                logger.warn("pairing settlement failed requester={} opponent={}",
                        accountId, opponent.accountId(), e);
                states.put(opponent.accountId(), TicketState.IDLE);
                throw e;
            }
            states.put(accountId, TicketState.PAIRED);
            states.put(opponent.accountId(), TicketState.PAIRED);
            results.put(opponent.accountId(), outcome);
            logger.info("tickets paired requester={} opponent={} depth={}",
                    accountId, opponent.accountId(), queue.size());
        } finally {
            lock.unlock();
        }

        for (MatchListener listener : listeners) {
            listener.onPaired(outcome.requesterId(), outcome);
            listener.onPaired(outcome.opponentId(), outcome);
        }

        // The requester holds its outcome now; a request made meanwhile keeps its own state
        lock.lock();
        try {
            states.replace(accountId, TicketState.PAIRED, TicketState.IDLE);
        } finally {
            lock.unlock();
        }
        return new MatchRequestResult.Paired(outcome);
    }

    /**
     * Withdraw this account's waiting ticket.
     */
    public CancelResult cancel(long accountId) {
        lock.lock();
        try {
            if (results.remove(accountId) != null) {
                states.replace(accountId, TicketState.PAIRED, TicketState.IDLE);
            }
            if (!removeTicketOf(accountId)) {
                return CancelResult.NOT_QUEUED;
            }
            states.put(accountId, TicketState.CANCELLED);
            logger.info("ticket cancelled accountId={} depth={}", accountId, queue.size());
            return CancelResult.CANCELLED;
        } finally {
            lock.unlock();
        }
    }

    public TicketState state(long accountId) {
        lock.lock();
        try {
            return states.getOrDefault(accountId, TicketState.IDLE);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Hand the outcome of a battle to the side that was waiting, once. A result is dropped
     * when its account queues again or cancels before collecting it.
     */
    public Optional<BattleOutcome> takeResult(long accountId) {
        lock.lock();
        try {
            BattleOutcome outcome = results.remove(accountId);
            if (outcome != null) {
                states.replace(accountId, TicketState.PAIRED, TicketState.IDLE);
            }
            return Optional.ofNullable(outcome);
        } finally {
            lock.unlock();
        }
    }

    public int depth() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    private boolean removeTicketOf(long accountId) {
        boolean removed = false;
        Iterator<MatchmakingTicket> it = queue.iterator();
        while (it.hasNext()) {
            if (it.next().accountId() == accountId) {
                it.remove();
                removed = true;
            }
        }
        return removed;
    }
}
