package com.flagship.wallet_ledger.movement.purchase;

import com.flagship.wallet_ledger.movement.MovementStatus;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A digital-goods purchase (airtime, data, utility token, game voucher).
 *
 * The price is debited when the purchase is created. Completion awards
 * {@code coinsEarned}; failure or cancellation refunds {@code amount}.
 */
@Value
public class Purchase {
    UUID id;
    UUID userId;
    UUID productId;
    String targetNumber;
    BigDecimal amount;
    int coinsEarned;
    MovementStatus status;
    String providerTransactionId;
    Instant createdAt;
    Instant updatedAt;

    public static Purchase create(UUID userId, UUID productId, String targetNumber,
                                  BigDecimal amount, int coinsEarned) {
        Instant now = Instant.now();
        return new Purchase(
            UUID.randomUUID(),
            userId,
            productId,
            targetNumber,
            amount,
            coinsEarned,
            MovementStatus.PENDING,
            null,
            now,
            now
        );
    }

    /**
     * Moves the purchase to a terminal state, keeping the existing provider id
     * when none is supplied.
     *
     * @throws com.flagship.wallet_ledger.error.LedgerException INVALID_STATE if not pending
     */
    public Purchase transitionTo(MovementStatus target, String providerTransactionId) {
        MovementStatus next = status.transitionTo(target, "purchase " + id);
        return new Purchase(
            id,
            userId,
            productId,
            targetNumber,
            amount,
            coinsEarned,
            next,
            providerTransactionId != null ? providerTransactionId : this.providerTransactionId,
            createdAt,
            Instant.now()
        );
    }
}
