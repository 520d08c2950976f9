package com.flagship.wallet_ledger.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.wallet_ledger.event.AccountRegisteredEvent;
import com.flagship.wallet_ledger.ledger.AccountService;
import com.flagship.wallet_ledger.ledger.WalletAccount;
import com.flagship.wallet_ledger.outbox.OutboxEvent;
import com.flagship.wallet_ledger.outbox.OutboxService;
import com.flagship.wallet_ledger.referral.ReferralService;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * At-most-once handling per consumer group, and the referral reward built on it.
 */
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers
class IdempotentEventProcessorTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("wallet_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private IdempotentEventProcessor eventProcessor;

    @Autowired
    private ProcessedEventRepository repository;

    @Autowired
    private AccountService accountService;

    @Autowired
    private ReferralService referralService;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private ObjectMapper objectMapper;

    private WalletEventConsumer consumer;

    private static final String CONSUMER_GROUP = "test-consumer";
    private static final String EVENT_TYPE = "TestEvent";
    private static final String AGGREGATE_TYPE = "TestAggregate";

    @BeforeEach
    void setUp() {
        repository.deleteAll();
        // The listener bean is off in tests; drive the same class directly
        consumer = new WalletEventConsumer(eventProcessor, referralService, objectMapper);
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private WalletAccount register(String referralCode) {
        return accountService.register("Consumer User", "consumer-" + UUID.randomUUID() + "@example.com", null,
            referralCode);
    }

    private ConsumerRecord<String, String> recordOf(OutboxEvent event) {
        return new ConsumerRecord<>("wallet-events", 0, 0L, event.getAggregateId().toString(), event.getPayload());
    }

    private OutboxEvent registrationEventOf(WalletAccount account) {
        return outboxService.getEventsForAggregate(AccountRegisteredEvent.AGGREGATE_TYPE, account.getId()).get(0);
    }

    @Test
    @DisplayName("Duplicate event runs the handler once")
    void duplicateEventSkipsHandler() {
        printTestHeader("Duplicate Event - Skips Handler");

        UUID eventId = UUID.randomUUID();
        UUID aggregateId = UUID.randomUUID();
        AtomicInteger handlerCallCount = new AtomicInteger(0);

        boolean first = eventProcessor.processEvent(eventId, EVENT_TYPE, AGGREGATE_TYPE, aggregateId, CONSUMER_GROUP,
            handlerCallCount::incrementAndGet);
        boolean second = eventProcessor.processEvent(eventId, EVENT_TYPE, AGGREGATE_TYPE, aggregateId, CONSUMER_GROUP,
            handlerCallCount::incrementAndGet);

        assertTrue(first, "First event should be processed");
        assertFalse(second, "Duplicate should be skipped");
        assertEquals(1, handlerCallCount.get(), "Handler should only be called once");
        assertTrue(repository.existsByEventIdAndConsumerGroup(eventId, CONSUMER_GROUP));

        printSuccess("Duplicate events correctly skipped");
    }

    @Test
    @DisplayName("Consumer groups are tracked independently")
    void differentConsumerGroups() {
        UUID eventId = UUID.randomUUID();
        UUID aggregateId = UUID.randomUUID();
        AtomicInteger totalCalls = new AtomicInteger(0);

        assertTrue(eventProcessor.processEvent(eventId, EVENT_TYPE, AGGREGATE_TYPE, aggregateId, "notifications",
            totalCalls::incrementAndGet));
        assertTrue(eventProcessor.processEvent(eventId, EVENT_TYPE, AGGREGATE_TYPE, aggregateId, "analytics",
            totalCalls::incrementAndGet));

        assertEquals(2, totalCalls.get());
    }

    @Test
    @DisplayName("A failing handler leaves no record, so the redelivery runs it again")
    void failedHandlerIsRetried() {
        UUID eventId = UUID.randomUUID();
        UUID aggregateId = UUID.randomUUID();

        assertThrows(IllegalStateException.class, () -> eventProcessor.processEvent(
            eventId, EVENT_TYPE, AGGREGATE_TYPE, aggregateId, CONSUMER_GROUP,
            () -> {
                throw new IllegalStateException("downstream unavailable");
            }));
        assertFalse(eventProcessor.isAlreadyProcessed(eventId, CONSUMER_GROUP));

        AtomicInteger calls = new AtomicInteger();
        assertTrue(eventProcessor.processEvent(eventId, EVENT_TYPE, AGGREGATE_TYPE, aggregateId, CONSUMER_GROUP,
            calls::incrementAndGet));
        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("Replayed AccountRegistered rewards the referrer once")
    void referralRewardedOnce() {
        printTestHeader("Referral reward under replay");

        WalletAccount referrer = register(null);
        WalletAccount referred = register(referrer.getReferralCode());
        OutboxEvent event = registrationEventOf(referred);
        AtomicInteger acks = new AtomicInteger();

        for (int delivery = 0; delivery < 3; delivery++) {
            consumer.consume(recordOf(event), acks::incrementAndGet);
        }

        assertEquals(3, acks.get(), "Every delivery is acknowledged");
        assertEquals(50, accountService.getAccount(referrer.getId()).getCoins(), "Reward credited exactly once");
        assertTrue(eventProcessor.isAlreadyProcessed(event.getId(), WalletEventConsumer.CONSUMER_GROUP));
        assertEquals(1, repository.countByConsumerGroupAndProcessingResult(
            WalletEventConsumer.CONSUMER_GROUP, ProcessedEvent.ProcessingResult.SUCCESS));

        printSuccess("Referrer has 50 coins after three deliveries");
    }

    @Test
    @DisplayName("Registration without a referral is recorded as skipped and rewards nobody")
    void noReferralIsSkipped() {
        WalletAccount account = register(null);
        OutboxEvent event = registrationEventOf(account);

        consumer.consume(recordOf(event), () -> { });

        ProcessedEvent processed = repository.findByConsumerGroupAndAggregateIdOrderByProcessedAtAsc(
            WalletEventConsumer.CONSUMER_GROUP, account.getId()).get(0).toDomain();
        assertEquals(ProcessedEvent.ProcessingResult.SKIPPED, processed.getResult());
        assertEquals(0, accountService.getAccount(account.getId()).getCoins());
    }

    @Test
    @DisplayName("Unparseable messages are acknowledged and dropped")
    void garbageIsAcknowledged() {
        AtomicInteger acks = new AtomicInteger();

        consumer.consume(new ConsumerRecord<>("wallet-events", 0, 1L, "key", "not json"), acks::incrementAndGet);
        consumer.consume(new ConsumerRecord<>("wallet-events", 0, 2L, "key", "{\"foo\":1}"), acks::incrementAndGet);

        assertEquals(2, acks.get());
        assertEquals(0, repository.count());
    }
}
