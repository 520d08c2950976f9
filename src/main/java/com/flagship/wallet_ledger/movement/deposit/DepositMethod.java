package com.flagship.wallet_ledger.movement.deposit;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DepositMethod {
    BANK_TRANSFER,
    E_WALLET,
    VIRTUAL_ACCOUNT;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static DepositMethod fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Deposit method is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown deposit method: " + value);
        }
    }
}
