package com.flagship.wallet_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wallet_ledger.ledger.KycStatus;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class KycReviewRequest {

    @NotNull(message = "Decision is required")
    @JsonProperty("decision")
    KycStatus decision;

    @JsonProperty("rejection_reason")
    String rejectionReason;
}
