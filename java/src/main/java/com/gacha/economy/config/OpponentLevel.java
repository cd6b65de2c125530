package com.gacha.economy.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A scripted opponent: fixed lineup rating and the coin swing of a win or a loss.
 */
public record OpponentLevel(
        @JsonProperty("level") String level,
        @JsonProperty("ovr") int ovr,
        @JsonProperty("win_reward") long winReward,
        @JsonProperty("loss_penalty") long lossPenalty) {
}
