package com.flagship.wallet_ledger.movement.withdrawal;

import com.flagship.wallet_ledger.movement.MovementStatus;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Payout to a bank account. Debited at creation; completion leaves the
 * balance alone (the money has left the platform), failure or cancellation
 * refunds it.
 */
@Value
public class Withdrawal {
    UUID id;
    UUID userId;
    BigDecimal amount;
    BankDetails bankDetails;
    MovementStatus status;
    Instant createdAt;
    Instant updatedAt;

    public static Withdrawal create(UUID userId, BigDecimal amount, BankDetails bankDetails) {
        Instant now = Instant.now();
        return new Withdrawal(UUID.randomUUID(), userId, amount, bankDetails, MovementStatus.PENDING, now, now);
    }

    public Withdrawal transitionTo(MovementStatus target) {
        MovementStatus next = status.transitionTo(target, "withdrawal " + id);
        return new Withdrawal(id, userId, amount, bankDetails, next, createdAt, Instant.now());
    }
}
