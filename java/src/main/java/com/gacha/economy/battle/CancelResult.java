package com.gacha.economy.battle;

public enum CancelResult {
    CANCELLED,
    NOT_QUEUED
}
