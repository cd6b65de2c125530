package com.gacha.economy.ledger;

import com.gacha.economy.config.ExchangeOffer;

public sealed interface ExchangeResult
        permits ExchangeResult.Exchanged, ExchangeResult.InsufficientFunds, ExchangeResult.UnknownOffer {

    record Exchanged(ExchangeOffer offer) implements ExchangeResult {
    }

    record InsufficientFunds(Currency currency, long required, long available) implements ExchangeResult {
    }

    record UnknownOffer(String id) implements ExchangeResult {
    }
}
