package com.flagship.wallet_ledger.consumer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.wallet_ledger.event.AccountRegisteredEvent;
import com.flagship.wallet_ledger.referral.ReferralService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Consumes the wallet-events topic and pays referral rewards.
 *
 * Only {@code AccountRegistered} events matter here; movement events are
 * acknowledged and ignored. The offset is committed after the handler's
 * transaction, and {@link IdempotentEventProcessor} makes a redelivered event
 * a no-op, so a reward is credited once however often Kafka replays it.
 * A handler failure is rethrown without acknowledging, and the container's
 * error handler redelivers the record.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class WalletEventConsumer {

    static final String CONSUMER_GROUP = "referral-rewards";

    private final IdempotentEventProcessor eventProcessor;
    private final ReferralService referralService;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.wallet-events:wallet-events}",
        groupId = CONSUMER_GROUP
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: partition={}, offset={}, key={}", record.partition(), record.offset(), record.key());

        JsonNode event = parse(record.value());
        if (event == null) {
            log.warn("Could not parse event at offset {}, acknowledging to skip", record.offset());
            ack.acknowledge();
            return;
        }

        if (AccountRegisteredEvent.EVENT_TYPE.equals(event.path("event_type").asText())) {
            handleAccountRegistered(event);
        }
        ack.acknowledge();
    }

    void handleAccountRegistered(JsonNode event) {
        UUID eventId = UUID.fromString(event.path("event_id").asText());
        UUID accountId = UUID.fromString(event.path("account_id").asText());
        String referredBy = event.path("referred_by").isTextual() ? event.path("referred_by").asText() : null;

        if (referredBy == null || referredBy.isBlank()) {
            eventProcessor.skipEvent(eventId, AccountRegisteredEvent.EVENT_TYPE, AccountRegisteredEvent.AGGREGATE_TYPE,
                accountId, CONSUMER_GROUP, "No referral code");
            return;
        }

        boolean processed = eventProcessor.processEvent(
            eventId, AccountRegisteredEvent.EVENT_TYPE, AccountRegisteredEvent.AGGREGATE_TYPE, accountId,
            CONSUMER_GROUP,
            () -> referralService.processReferralReward(referredBy, accountId)
        );
        if (processed) {
            log.info("Processed AccountRegistered: eventId={}, accountId={}, referredBy={}",
                eventId, accountId, referredBy);
        }
    }

    private JsonNode parse(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            return node.hasNonNull("event_id") && node.hasNonNull("event_type") ? node : null;
        } catch (Exception e) {
            log.error("Failed to parse event: {}", e.getMessage());
            return null;
        }
    }
}
