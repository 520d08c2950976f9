package com.flagship.wallet_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Value;

@Value
public class ExchangeCoinsRequest {

    @NotNull(message = "Coins is required")
    @Positive(message = "Coins must be positive")
    @JsonProperty("coins")
    Integer coins;
}
