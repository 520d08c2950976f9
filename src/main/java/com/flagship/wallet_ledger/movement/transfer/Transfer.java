package com.flagship.wallet_ledger.movement.transfer;

import com.flagship.wallet_ledger.movement.MovementStatus;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Wallet-to-wallet transfer. The sender is debited at creation; completion
 * credits the recipient, failure or cancellation refunds the sender.
 */
@Value
public class Transfer {
    UUID id;
    UUID fromUserId;
    UUID toUserId;
    BigDecimal amount;
    MovementStatus status;
    Instant createdAt;
    Instant updatedAt;

    public static Transfer create(UUID fromUserId, UUID toUserId, BigDecimal amount) {
        if (fromUserId.equals(toUserId)) {
            throw new IllegalArgumentException("Sender and recipient must be different");
        }
        Instant now = Instant.now();
        return new Transfer(UUID.randomUUID(), fromUserId, toUserId, amount, MovementStatus.PENDING, now, now);
    }

    public Transfer transitionTo(MovementStatus target) {
        MovementStatus next = status.transitionTo(target, "transfer " + id);
        return new Transfer(id, fromUserId, toUserId, amount, next, createdAt, Instant.now());
    }
}
