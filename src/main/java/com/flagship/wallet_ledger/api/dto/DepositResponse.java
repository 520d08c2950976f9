package com.flagship.wallet_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wallet_ledger.movement.MovementStatus;
import com.flagship.wallet_ledger.movement.deposit.Deposit;
import com.flagship.wallet_ledger.movement.deposit.DepositMethod;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class DepositResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("method")
    DepositMethod method;

    @JsonProperty("status")
    MovementStatus status;

    @JsonProperty("payment_reference")
    String paymentReference;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static DepositResponse from(Deposit deposit) {
        return DepositResponse.builder()
            .id(deposit.getId())
            .amount(deposit.getAmount())
            .method(deposit.getMethod())
            .status(deposit.getStatus())
            .paymentReference(deposit.getPaymentReference())
            .createdAt(deposit.getCreatedAt())
            .updatedAt(deposit.getUpdatedAt())
            .build();
    }
}
