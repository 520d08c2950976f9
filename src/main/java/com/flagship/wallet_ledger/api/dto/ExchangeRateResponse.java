package com.flagship.wallet_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExchangeRateResponse {

    @JsonProperty("exchange_rate")
    BigDecimal exchangeRate;

    @JsonProperty("minimum_exchange")
    int minimumExchange;

    /** Set only in the response to a rate change. */
    @JsonProperty("previous_rate")
    BigDecimal previousRate;
}
