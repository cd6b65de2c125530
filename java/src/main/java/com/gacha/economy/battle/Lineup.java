package com.gacha.economy.battle;

import com.gacha.economy.account.CardCollection;
import com.gacha.economy.card.CardInstance;
import com.gacha.economy.card.Position;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * One card per position, used to compare two sides in a battle.
 */
public record Lineup(Map<Position, CardInstance> members) {

    public Lineup {
        members = Collections.unmodifiableMap(new EnumMap<>(members));
    }

    /**
     * Sum of the members' ratings.
     */
    public int totalPower() {
        int total = 0;
        for (CardInstance card : members.values()) {
            total += card.getOvr();
        }
        return total;
    }

    public CardInstance member(Position position) {
        return members.get(position);
    }

    /**
     * Pick the highest rated owned card for every position. The first card seen wins a tie.
     * Fails with the list of positions nobody in the collection can fill.
     */
    public static LineupResult best(CardCollection collection) {
        Map<Position, CardInstance> best = new EnumMap<>(Position.class);
        for (CardInstance card : collection.getCards()) {
            Position position = card.getDefinition().getPosition();
            if (position == null) {
                continue;
            }
            CardInstance current = best.get(position);
            if (current == null || card.getOvr() > current.getOvr()) {
                best.put(position, card);
            }
        }

        List<Position> missing = new ArrayList<>();
        for (Position position : Position.values()) {
            if (!best.containsKey(position)) {
                missing.add(position);
            }
        }
        if (!missing.isEmpty()) {
            return new LineupResult.IncompleteRoster(missing);
        }
        return new LineupResult.Ready(new Lineup(best));
    }
}
