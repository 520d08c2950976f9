package com.flagship.wallet_ledger.movement.deposit;

import com.flagship.wallet_ledger.movement.MovementStatus;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A request to fund the wallet through a payment gateway.
 *
 * Nothing is credited at creation. The gateway later reports the outcome
 * against {@code paymentReference}; only a completed callback credits the
 * balance, and a reference is consumed at most once.
 */
@Value
public class Deposit {
    UUID id;
    UUID userId;
    BigDecimal amount;
    DepositMethod method;
    MovementStatus status;
    String paymentReference;
    Instant createdAt;
    Instant updatedAt;

    public static Deposit create(UUID userId, BigDecimal amount, DepositMethod method, String paymentReference) {
        Instant now = Instant.now();
        return new Deposit(
            UUID.randomUUID(),
            userId,
            amount,
            method,
            MovementStatus.PENDING,
            paymentReference,
            now,
            now
        );
    }

    public Deposit transitionTo(MovementStatus target) {
        MovementStatus next = status.transitionTo(target, "deposit " + paymentReference);
        return new Deposit(id, userId, amount, method, next, paymentReference, createdAt, Instant.now());
    }
}
