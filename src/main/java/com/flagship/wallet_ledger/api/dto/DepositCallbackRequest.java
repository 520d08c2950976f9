package com.flagship.wallet_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

/**
 * Payment gateway notification. {@code status} uses the gateway's vocabulary
 * (success, completed, failed, ...), not ours.
 */
@Value
public class DepositCallbackRequest {

    @NotBlank(message = "Payment reference is required")
    @JsonProperty("payment_reference")
    String paymentReference;

    @NotBlank(message = "Status is required")
    @JsonProperty("status")
    String status;
}
