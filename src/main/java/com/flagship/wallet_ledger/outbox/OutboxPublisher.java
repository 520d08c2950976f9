package com.flagship.wallet_ledger.outbox;

import com.flagship.wallet_ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Polls the outbox and ships wallet events to Kafka.
 *
 * Records are keyed by aggregate id and carry {@code event_type} and
 * {@code aggregate_type} headers. Within a batch, once an event of a movement
 * fails to send, the later events of that movement wait for the next poll, so a
 * consumer never sees "completed" before "created". A row is marked published
 * only after the broker acknowledged it; after {@code outbox.publisher.max-retries}
 * failed sends it stays in the table as dead-lettered.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    static final String EVENT_TYPE_HEADER = "event_type";
    static final String AGGREGATE_TYPE_HEADER = "aggregate_type";

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.wallet-events:wallet-events}")
    private String walletEventsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Value("${outbox.publisher.send-timeout-ms:10000}")
    private long sendTimeoutMs;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        List<OutboxEvent> events;
        try {
            events = outboxService.findPublishableEvents(maxRetries, batchSize);
        } catch (Exception e) {
            log.error("Could not read the outbox, will retry on the next poll", e);
            return;
        }
        if (events.isEmpty()) {
            return;
        }

        Set<UUID> heldBack = new HashSet<>();
        int published = 0;
        for (OutboxEvent event : events) {
            if (heldBack.contains(event.getAggregateId())) {
                continue;
            }
            if (publishEvent(event)) {
                published++;
            } else {
                heldBack.add(event.getAggregateId());
            }
        }
        log.debug("Outbox poll: fetched={}, published={}, aggregatesHeldBack={}",
            events.size(), published, heldBack.size());
    }

    boolean publishEvent(OutboxEvent event) {
        ProducerRecord<String, String> record =
            new ProducerRecord<>(walletEventsTopic, event.getAggregateId().toString(), event.getPayload());
        record.headers()
            .add(EVENT_TYPE_HEADER, event.getEventType().getBytes(StandardCharsets.UTF_8))
            .add(AGGREGATE_TYPE_HEADER, event.getAggregateType().getBytes(StandardCharsets.UTF_8));

        try {
            SendResult<String, String> result = kafkaTemplate.send(record).get(sendTimeoutMs, TimeUnit.MILLISECONDS);
            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());
            log.debug("Published {} {} for {} {} at partition={}, offset={}",
                event.getEventType(), event.getId(), event.getAggregateType(), event.getAggregateId(),
                result.getRecordMetadata().partition(), result.getRecordMetadata().offset());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while publishing event {}", event.getId());
            return false;
        } catch (Exception e) {
            recordFailure(event, e);
            return false;
        }
    }

    private void recordFailure(OutboxEvent event, Exception e) {
        log.error("Failed to publish {} {} for {} {}: {}",
            event.getEventType(), event.getId(), event.getAggregateType(), event.getAggregateId(), e.getMessage());
        outboxService.markFailed(event.getId(), e.getMessage());
        outboxMetrics.recordEventPublishFailed(event.getEventType());
        if (event.getRetryCount() + 1 >= maxRetries) {
            log.warn("Event {} dead-lettered after {} attempts, aggregate {} {} needs a manual replay",
                event.getId(), maxRetries, event.getAggregateType(), event.getAggregateId());
            outboxMetrics.recordEventDeadLettered(event.getEventType());
        }
    }
}
