package com.flagship.wallet_ledger.catalog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ProductType {
    PULSA,
    DATA,
    PLN,
    VOUCHER_GAME;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ProductType fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Product type is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown product type: " + value);
        }
    }
}
