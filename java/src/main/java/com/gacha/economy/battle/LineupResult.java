package com.gacha.economy.battle;

import com.gacha.economy.card.Position;

import java.util.List;

public sealed interface LineupResult permits LineupResult.Ready, LineupResult.IncompleteRoster {

    record Ready(Lineup lineup) implements LineupResult {
    }

    /**
     * The collection has no card for these positions; no battle can start.
     */
    record IncompleteRoster(List<Position> missing) implements LineupResult {
        public IncompleteRoster {
            missing = List.copyOf(missing);
        }
    }
}
