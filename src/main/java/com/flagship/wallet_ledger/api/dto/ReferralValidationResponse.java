package com.flagship.wallet_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReferralValidationResponse {

    @JsonProperty("valid")
    boolean valid;

    @JsonProperty("referrer_name")
    String referrerName;
}
