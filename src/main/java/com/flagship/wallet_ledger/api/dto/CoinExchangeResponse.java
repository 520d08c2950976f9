package com.flagship.wallet_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wallet_ledger.movement.exchange.CoinExchange;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class CoinExchangeResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("coins_used")
    int coinsUsed;

    @JsonProperty("balance_received")
    BigDecimal balanceReceived;

    @JsonProperty("exchange_rate")
    BigDecimal exchangeRate;

    @JsonProperty("created_at")
    Instant createdAt;

    public static CoinExchangeResponse from(CoinExchange exchange) {
        return CoinExchangeResponse.builder()
            .id(exchange.getId())
            .coinsUsed(exchange.getCoinsUsed())
            .balanceReceived(exchange.getBalanceReceived())
            .exchangeRate(exchange.getExchangeRate())
            .createdAt(exchange.getCreatedAt())
            .build();
    }
}
