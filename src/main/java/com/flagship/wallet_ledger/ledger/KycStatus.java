package com.flagship.wallet_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * KYC state of an account. Only {@link #VERIFIED} opens the gated operations
 * (transfer-send and withdrawal).
 */
public enum KycStatus {
    NOT_SUBMITTED,
    PENDING,
    VERIFIED,
    REJECTED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static KycStatus fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("KYC status is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown KYC status: " + value);
        }
    }
}
