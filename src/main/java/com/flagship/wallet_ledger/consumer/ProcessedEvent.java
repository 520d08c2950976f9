package com.flagship.wallet_ledger.consumer;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Record that a consumer group has handled an event.
 *
 * The pair (eventId, consumerGroup) is the primary key of
 * {@code processed_events}; a second insert for the same pair fails, which
 * makes a racing duplicate delivery roll back instead of applying twice.
 */
@Value
public class ProcessedEvent {
    UUID eventId;
    String consumerGroup;
    String eventType;
    String aggregateType;
    UUID aggregateId;
    Instant processedAt;
    ProcessingResult result;
    String note;

    public enum ProcessingResult {
        SUCCESS,
        SKIPPED
    }

    public static ProcessedEvent success(UUID eventId, String consumerGroup, String eventType,
                                         String aggregateType, UUID aggregateId) {
        return new ProcessedEvent(eventId, consumerGroup, eventType, aggregateType, aggregateId,
            Instant.now(), ProcessingResult.SUCCESS, null);
    }

    public static ProcessedEvent skipped(UUID eventId, String consumerGroup, String eventType,
                                         String aggregateType, UUID aggregateId, String reason) {
        return new ProcessedEvent(eventId, consumerGroup, eventType, aggregateType, aggregateId,
            Instant.now(), ProcessingResult.SKIPPED, reason);
    }
}
