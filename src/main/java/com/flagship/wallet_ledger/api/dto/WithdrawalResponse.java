package com.flagship.wallet_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wallet_ledger.movement.MovementStatus;
import com.flagship.wallet_ledger.movement.withdrawal.Withdrawal;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class WithdrawalResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("bank_name")
    String bankName;

    @JsonProperty("account_number")
    String accountNumber;

    @JsonProperty("account_name")
    String accountName;

    @JsonProperty("status")
    MovementStatus status;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static WithdrawalResponse from(Withdrawal withdrawal) {
        return WithdrawalResponse.builder()
            .id(withdrawal.getId())
            .amount(withdrawal.getAmount())
            .bankName(withdrawal.getBankDetails().getBankName())
            .accountNumber(withdrawal.getBankDetails().getAccountNumber())
            .accountName(withdrawal.getBankDetails().getAccountName())
            .status(withdrawal.getStatus())
            .createdAt(withdrawal.getCreatedAt())
            .updatedAt(withdrawal.getUpdatedAt())
            .build();
    }
}
