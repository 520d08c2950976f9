package com.flagship.wallet_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wallet_ledger.ledger.WalletAccount;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class BalanceResponse {

    @JsonProperty("wallet_balance")
    BigDecimal walletBalance;

    @JsonProperty("coins")
    int coins;

    public static BalanceResponse from(WalletAccount account) {
        return BalanceResponse.builder()
            .walletBalance(account.getBalance())
            .coins(account.getCoins())
            .build();
    }
}
