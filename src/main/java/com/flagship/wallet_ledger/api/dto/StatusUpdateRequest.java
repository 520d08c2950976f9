package com.flagship.wallet_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class StatusUpdateRequest {

    @NotBlank(message = "Status is required")
    @JsonProperty("status")
    String status;

    /** Only read for purchases. */
    @JsonProperty("provider_transaction_id")
    String providerTransactionId;
}
