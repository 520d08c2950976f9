package com.flagship.wallet_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wallet_ledger.movement.withdrawal.BankDetails;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class CreateWithdrawalRequest {

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @Digits(integer = 13, fraction = 2, message = "Amount must have at most 2 decimal places")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotBlank(message = "Bank name is required")
    @JsonProperty("bank_name")
    String bankName;

    @NotBlank(message = "Account number is required")
    @JsonProperty("account_number")
    String accountNumber;

    @NotBlank(message = "Account name is required")
    @JsonProperty("account_name")
    String accountName;

    public BankDetails toBankDetails() {
        return new BankDetails(bankName.trim(), accountNumber.trim(), accountName.trim());
    }
}
