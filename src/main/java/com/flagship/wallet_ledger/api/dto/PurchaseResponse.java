package com.flagship.wallet_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wallet_ledger.movement.MovementStatus;
import com.flagship.wallet_ledger.movement.purchase.Purchase;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class PurchaseResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("product_id")
    UUID productId;

    @JsonProperty("target_number")
    String targetNumber;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("coins_earned")
    int coinsEarned;

    @JsonProperty("status")
    MovementStatus status;

    @JsonProperty("provider_transaction_id")
    String providerTransactionId;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static PurchaseResponse from(Purchase purchase) {
        return PurchaseResponse.builder()
            .id(purchase.getId())
            .productId(purchase.getProductId())
            .targetNumber(purchase.getTargetNumber())
            .amount(purchase.getAmount())
            .coinsEarned(purchase.getCoinsEarned())
            .status(purchase.getStatus())
            .providerTransactionId(purchase.getProviderTransactionId())
            .createdAt(purchase.getCreatedAt())
            .updatedAt(purchase.getUpdatedAt())
            .build();
    }
}
