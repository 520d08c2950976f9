package com.flagship.wallet_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wallet_ledger.ledger.KycStatus;
import com.flagship.wallet_ledger.ledger.WalletAccount;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class AccountResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("name")
    String name;

    @JsonProperty("email")
    String email;

    @JsonProperty("phone")
    String phone;

    @JsonProperty("kyc_status")
    KycStatus kycStatus;

    @JsonProperty("wallet_balance")
    BigDecimal walletBalance;

    @JsonProperty("coins")
    int coins;

    @JsonProperty("referral_code")
    String referralCode;

    @JsonProperty("is_blocked")
    boolean blocked;

    @JsonProperty("created_at")
    Instant createdAt;

    public static AccountResponse from(WalletAccount account) {
        return AccountResponse.builder()
            .id(account.getId())
            .name(account.getName())
            .email(account.getEmail())
            .phone(account.getPhone())
            .kycStatus(account.getKycStatus())
            .walletBalance(account.getBalance())
            .coins(account.getCoins())
            .referralCode(account.getReferralCode())
            .blocked(account.isBlocked())
            .createdAt(account.getCreatedAt())
            .build();
    }
}
