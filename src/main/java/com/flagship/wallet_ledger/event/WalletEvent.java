package com.flagship.wallet_ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Common shape of every event written to the outbox.
 *
 * The aggregate id is the Kafka key, so all events of one movement
 * (or one account) land on the same partition in order.
 */
public interface WalletEvent {

    /**
     * Unique id of this event instance, used by consumers for deduplication.
     */
    UUID getEventId();

    /**
     * "Account" or one of the movement kinds ("Purchase", "Deposit", ...).
     */
    String getAggregateType();

    UUID getAggregateId();

    String getEventType();

    Instant getOccurredAt();
}
