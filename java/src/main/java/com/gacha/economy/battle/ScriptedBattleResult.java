package com.gacha.economy.battle;

import com.gacha.economy.card.Position;

import java.util.List;

public sealed interface ScriptedBattleResult
        permits ScriptedBattleResult.Fought, ScriptedBattleResult.IncompleteRoster, ScriptedBattleResult.UnknownOpponent {

    record Fought(Lineup lineup, BattleOutcome outcome) implements ScriptedBattleResult {
    }

    record IncompleteRoster(List<Position> missing) implements ScriptedBattleResult {
        public IncompleteRoster {
            missing = List.copyOf(missing);
        }
    }

    record UnknownOpponent(String level) implements ScriptedBattleResult {
    }
}
