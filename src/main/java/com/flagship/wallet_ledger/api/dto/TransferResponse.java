package com.flagship.wallet_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wallet_ledger.movement.MovementStatus;
import com.flagship.wallet_ledger.movement.transfer.Transfer;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class TransferResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("from_user_id")
    UUID fromUserId;

    @JsonProperty("to_user_id")
    UUID toUserId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("status")
    MovementStatus status;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static TransferResponse from(Transfer transfer) {
        return TransferResponse.builder()
            .id(transfer.getId())
            .fromUserId(transfer.getFromUserId())
            .toUserId(transfer.getToUserId())
            .amount(transfer.getAmount())
            .status(transfer.getStatus())
            .createdAt(transfer.getCreatedAt())
            .updatedAt(transfer.getUpdatedAt())
            .build();
    }
}
