package com.flagship.wallet_ledger.event;

import com.flagship.wallet_ledger.ledger.WalletAccount;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a new account is registered.
 * Carries the referral code the new user signed up with, if any;
 * the referral consumer uses it to reward the referrer.
 */
@Value
public class AccountRegisteredEvent implements WalletEvent {
    UUID eventId;
    UUID accountId;
    String email;
    String referredBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "AccountRegistered";
    public static final String AGGREGATE_TYPE = "Account";

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    @Override
    public UUID getAggregateId() {
        return accountId;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static AccountRegisteredEvent fromAccount(WalletAccount account) {
        return new AccountRegisteredEvent(
            UUID.randomUUID(),
            account.getId(),
            account.getEmail(),
            account.getReferredBy(),
            Instant.now()
        );
    }
}
