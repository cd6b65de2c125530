package com.gacha.economy.battle;

import com.gacha.economy.card.Position;

import java.util.List;

public sealed interface MatchRequestResult
        permits MatchRequestResult.Searching, MatchRequestResult.Paired, MatchRequestResult.IncompleteRoster {

    /**
     * No opponent was waiting; the request is queued.
     */
    record Searching(MatchmakingTicket ticket) implements MatchRequestResult {
    }

    /**
     * An opponent was waiting and the battle has been fought.
     */
    record Paired(BattleOutcome outcome) implements MatchRequestResult {
    }

    record IncompleteRoster(List<Position> missing) implements MatchRequestResult {
        public IncompleteRoster {
            missing = List.copyOf(missing);
        }
    }
}
