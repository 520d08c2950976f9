package com.flagship.wallet_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A wallet event waiting in {@code outbox_events} to be shipped to Kafka.
 *
 * Written in the same database transaction as the balance change it
 * describes, published later by {@link OutboxPublisher}.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // Purchase, Deposit, Transfer, Withdrawal, CoinExchange, Account
    UUID aggregateId;
    String eventType;          // MovementCreated, MovementCompleted, AccountRegistered, ...
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    /**
     * The outbox row id is the event id, so a consumer can deduplicate on it.
     */
    public static OutboxEvent create(UUID eventId, String aggregateType, UUID aggregateId,
                                     String eventType, String payload) {
        return new OutboxEvent(
            eventId,
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null,
            null
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean isDeadLettered(int maxRetries) {
        return !isPublished() && retryCount >= maxRetries;
    }
}
