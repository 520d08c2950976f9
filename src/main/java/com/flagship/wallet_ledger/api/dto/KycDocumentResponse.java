package com.flagship.wallet_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wallet_ledger.kyc.KycDocument;
import com.flagship.wallet_ledger.ledger.KycStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class KycDocumentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("id_card_url")
    String idCardUrl;

    @JsonProperty("selfie_url")
    String selfieUrl;

    @JsonProperty("status")
    KycStatus status;

    @JsonProperty("rejection_reason")
    String rejectionReason;

    @JsonProperty("submitted_at")
    Instant submittedAt;

    @JsonProperty("reviewed_at")
    Instant reviewedAt;

    public static KycDocumentResponse from(KycDocument document) {
        return KycDocumentResponse.builder()
            .id(document.getId())
            .userId(document.getUserId())
            .idCardUrl(document.getIdCardUrl())
            .selfieUrl(document.getSelfieUrl())
            .status(document.getStatus())
            .rejectionReason(document.getRejectionReason())
            .submittedAt(document.getSubmittedAt())
            .reviewedAt(document.getReviewedAt())
            .build();
    }
}
