package com.flagship.wallet_ledger.event;

import com.flagship.wallet_ledger.movement.MovementKind;
import com.flagship.wallet_ledger.movement.MovementStatus;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Fact about a movement: it was created, or it reached a terminal state.
 *
 * {@code amount} is the monetary amount of the movement; for coin exchanges
 * it is the balance received and {@code coins} holds the coins spent.
 */
@Value
public class MovementEvent implements WalletEvent {
    UUID eventId;
    String eventType;
    MovementKind kind;
    UUID movementId;
    UUID userId;
    UUID counterpartyId;
    BigDecimal amount;
    int coins;
    MovementStatus status;
    Instant occurredAt;

    public static final String MOVEMENT_CREATED = "MovementCreated";
    public static final String MOVEMENT_COMPLETED = "MovementCompleted";
    public static final String MOVEMENT_FAILED = "MovementFailed";
    public static final String MOVEMENT_CANCELLED = "MovementCancelled";

    @Override
    public String getAggregateType() {
        return kind.aggregateType();
    }

    @Override
    public UUID getAggregateId() {
        return movementId;
    }

    public static MovementEvent created(MovementKind kind, UUID movementId, UUID userId, UUID counterpartyId,
                                        BigDecimal amount, int coins, MovementStatus status) {
        return new MovementEvent(UUID.randomUUID(), MOVEMENT_CREATED, kind, movementId, userId, counterpartyId,
            amount, coins, status, Instant.now());
    }

    /**
     * Event for a transition into {@code status}, which must be terminal.
     */
    public static MovementEvent transitioned(MovementKind kind, UUID movementId, UUID userId, UUID counterpartyId,
                                             BigDecimal amount, int coins, MovementStatus status) {
        String eventType = switch (status) {
            case COMPLETED -> MOVEMENT_COMPLETED;
            case FAILED -> MOVEMENT_FAILED;
            case CANCELLED -> MOVEMENT_CANCELLED;
            case PENDING -> throw new IllegalArgumentException("PENDING is not a transition target");
        };
        return new MovementEvent(UUID.randomUUID(), eventType, kind, movementId, userId, counterpartyId,
            amount, coins, status, Instant.now());
    }
}
