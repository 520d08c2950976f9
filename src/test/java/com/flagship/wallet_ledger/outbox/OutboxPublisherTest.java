package com.flagship.wallet_ledger.outbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.wallet_ledger.event.AccountRegisteredEvent;
import com.flagship.wallet_ledger.ledger.AccountService;
import com.flagship.wallet_ledger.ledger.WalletAccount;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.KafkaContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox rows reach the wallet-events topic, keyed by aggregate id, and are
 * marked published only after the broker acknowledged them.
 */
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers
class OutboxPublisherTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("wallet_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @Container
    static KafkaContainer kafka = new KafkaContainer(DockerImageName.parse("confluentinc/cp-kafka:7.5.0"));

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", kafka::getBootstrapServers);
        registry.add("spring.kafka.admin.auto-create", () -> "true");
        // Publisher bean enabled, but polled by hand
        registry.add("outbox.publisher.enabled", () -> "true");
        registry.add("outbox.publisher.poll-interval-ms", () -> "3600000");
    }

    @Autowired
    private OutboxPublisher outboxPublisher;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private ObjectMapper objectMapper;

    @Value("${kafka.topic.wallet-events}")
    private String topic;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private KafkaConsumer<String, String> createConsumer() {
        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers());
        props.put(ConsumerConfig.GROUP_ID_CONFIG, "publisher-test-" + UUID.randomUUID());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        return new KafkaConsumer<>(props);
    }

    private List<ConsumerRecord<String, String>> pollFor(KafkaConsumer<String, String> consumer, String key,
                                                         Duration timeout) {
        List<ConsumerRecord<String, String>> matching = new ArrayList<>();
        long deadline = System.currentTimeMillis() + timeout.toMillis();
        while (matching.isEmpty() && System.currentTimeMillis() < deadline) {
            consumer.poll(Duration.ofMillis(500)).forEach(record -> {
                if (key.equals(record.key())) {
                    matching.add(record);
                }
            });
        }
        return matching;
    }

    @Test
    @DisplayName("Registration event is published to Kafka and marked published")
    void publishesRegistrationEvent() throws Exception {
        printTestHeader("Outbox -> Kafka");

        WalletAccount account = accountService.register("Kafka User",
            "kafka-" + UUID.randomUUID() + "@example.com", null, null);

        outboxPublisher.publishPendingEvents();

        OutboxEvent event = outboxService.getEventsForAggregate(AccountRegisteredEvent.AGGREGATE_TYPE, account.getId())
            .get(0);
        assertTrue(event.isPublished(), "Event should be marked published after the send was acknowledged");

        try (KafkaConsumer<String, String> consumer = createConsumer()) {
            consumer.subscribe(Collections.singletonList(topic));
            List<ConsumerRecord<String, String>> records =
                pollFor(consumer, account.getId().toString(), Duration.ofSeconds(20));

            assertEquals(1, records.size(), "Exactly one record keyed by the account id");
            JsonNode payload = objectMapper.readTree(records.get(0).value());
            assertEquals(AccountRegisteredEvent.EVENT_TYPE, payload.path("event_type").asText());
            assertEquals(event.getId().toString(), payload.path("event_id").asText());
            assertEquals(AccountRegisteredEvent.EVENT_TYPE, new String(
                records.get(0).headers().lastHeader(OutboxPublisher.EVENT_TYPE_HEADER).value(), StandardCharsets.UTF_8));
        }
    }

    @Test
    @DisplayName("Published events are not sent again")
    void publishedEventsAreNotResent() {
        accountService.register("Once", "once-" + UUID.randomUUID() + "@example.com", null, null);

        outboxPublisher.publishPendingEvents();
        long backlogAfterFirst = outboxService.countUnpublished();
        outboxPublisher.publishPendingEvents();

        assertEquals(0, backlogAfterFirst);
        assertEquals(0, outboxService.countUnpublished());
    }
}
