package com.gacha.economy.battle;

public enum BattleMode {
    PVP,
    SCRIPTED
}
