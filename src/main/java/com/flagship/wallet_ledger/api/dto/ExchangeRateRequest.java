package com.flagship.wallet_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class ExchangeRateRequest {

    @NotNull(message = "Rate is required")
    @JsonProperty("rate")
    BigDecimal rate;
}
