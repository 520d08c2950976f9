package com.flagship.wallet_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wallet_ledger.ledger.KycStatus;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class KycStatusResponse {

    @JsonProperty("kyc_status")
    KycStatus kycStatus;

    @JsonProperty("latest_submission")
    KycDocumentResponse latestSubmission;
}
