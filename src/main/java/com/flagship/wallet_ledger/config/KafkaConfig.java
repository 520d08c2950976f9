package com.flagship.wallet_ledger.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.listener.CommonErrorHandler;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.util.backoff.FixedBackOff;

/**
 * Kafka wiring for the wallet-events topic.
 *
 * Events are keyed by aggregate id, so all events of one movement or account
 * land on one partition in outbox order.
 */
@Configuration
@Slf4j
public class KafkaConfig {

    @Value("${kafka.topic.wallet-events:wallet-events}")
    private String walletEventsTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    @Bean
    public NewTopic walletEventsTopic() {
        return TopicBuilder.name(walletEventsTopic)
            .partitions(partitions)
            .replicas(1)
            .build();
    }

    /**
     * A listener that throws (say the database is down while a referral reward is
     * credited) gets the same record again after a pause. After the last attempt
     * the record is logged and skipped so one poisoned event cannot stall the
     * partition; nothing was recorded as processed, so an operator can replay it.
     */
    @Bean
    public CommonErrorHandler walletListenerErrorHandler(
            @Value("${consumer.retry.interval-ms:1000}") long intervalMs,
            @Value("${consumer.retry.max-attempts:3}") long maxAttempts) {
        return new DefaultErrorHandler(
            (record, e) -> log.error("Giving up on wallet event at partition={}, offset={}, key={}: {}",
                record.partition(), record.offset(), record.key(), e.getMessage()),
            new FixedBackOff(intervalMs, maxAttempts));
    }
}
