package com.flagship.wallet_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Snapshot of a user's account row.
 *
 * Immutable: a snapshot read under a row lock is what the balance guard
 * evaluates, and it must not drift while the guard runs.
 */
@Value
public class WalletAccount {
    UUID id;
    String name;
    String email;
    String phone;
    KycStatus kycStatus;
    BigDecimal balance;
    int coins;
    String referralCode;
    String referredBy;
    boolean blocked;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a freshly registered account: zero balance, zero coins, no KYC.
     */
    public static WalletAccount register(UUID id, String name, String email, String phone,
                                         String referralCode, String referredBy) {
        Instant now = Instant.now();
        return new WalletAccount(
            id,
            name,
            email,
            phone,
            KycStatus.NOT_SUBMITTED,
            Money.ZERO,
            0,
            referralCode,
            referredBy,
            false,
            now,
            now
        );
    }

    public boolean isKycVerified() {
        return kycStatus == KycStatus.VERIFIED;
    }
}
