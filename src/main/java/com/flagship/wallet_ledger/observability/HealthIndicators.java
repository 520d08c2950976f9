package com.flagship.wallet_ledger.observability;

import com.flagship.wallet_ledger.outbox.OutboxEventRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * Actuator health indicators for the wallet's moving parts.
 */
public class HealthIndicators {

    /**
     * DOWN when the outbox backlog or the dead-letter pile is large:
     * balances still change, but downstream consumers are falling behind.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;
        private final int maxRetries;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository,
                                     @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
            this.outboxRepository = outboxRepository;
            this.maxRetries = maxRetries;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();
                long deadLettered = outboxRepository.countDeadLettered(maxRetries);

                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                    ? Health.up()
                    : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                    ? Health.status("WARNING")
                    : Health.down();

                return builder
                    .withDetail("backlogSize", backlogSize)
                    .withDetail("deadLettered", deadLettered)
                    .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                    .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                    .build();
            } catch (Exception e) {
                return Health.down().withDetail("error", e.getMessage()).build();
            }
        }
    }

    /**
     * Redis only backs the deposit-callback fast path, so an outage is DEGRADED, not DOWN.
     */
    @Component("callbackCacheHealth")
    public static class CallbackCacheHealthIndicator implements HealthIndicator {

        private static final String NOTE = "Deposit callbacks fall back to the database";

        private final StringRedisTemplate redisTemplate;

        public CallbackCacheHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            var connectionFactory = redisTemplate.getConnectionFactory();
            if (connectionFactory == null) {
                return Health.status("DEGRADED")
                    .withDetail("error", "No connection factory configured")
                    .withDetail("note", NOTE)
                    .build();
            }
            try (var connection = connectionFactory.getConnection()) {
                String result = connection.ping();
                return "PONG".equals(result)
                    ? Health.up().withDetail("response", result).build()
                    : Health.status("DEGRADED").withDetail("response", String.valueOf(result)).build();
            } catch (Exception e) {
                return Health.status("DEGRADED")
                    .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .withDetail("note", NOTE)
                    .build();
            }
        }
    }

    /**
     * Counts movements still pending after {@code wallet.health.stale-pending-after}.
     * A stuck purchase, transfer or withdrawal holds the user's money until a
     * provider or operator settles it, so a growing count needs attention.
     * Reported as WARNING rather than DOWN: new operations are unaffected.
     */
    @Component("pendingMovementsHealth")
    public static class PendingMovementsHealthIndicator implements HealthIndicator {

        private static final Map<String, String> TABLES = Map.of(
            "purchases", "transactions",
            "deposits", "deposits",
            "transfers", "transfers",
            "withdrawals", "withdrawals");

        private final JdbcTemplate jdbcTemplate;
        private final Duration staleAfter;

        public PendingMovementsHealthIndicator(JdbcTemplate jdbcTemplate,
                                               @Value("${wallet.health.stale-pending-after:PT24H}") Duration staleAfter) {
            this.jdbcTemplate = jdbcTemplate;
            this.staleAfter = staleAfter;
        }

        @Override
        public Health health() {
            Timestamp cutoff = Timestamp.from(Instant.now().minus(staleAfter));
            Map<String, Long> stale = new TreeMap<>();
            try {
                TABLES.forEach((kind, table) -> stale.put(kind, jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM " + table + " WHERE status = 'PENDING' AND created_at < ?",
                    Long.class, cutoff)));
            } catch (Exception e) {
                return Health.down().withDetail("error", e.getMessage()).build();
            }

            long total = stale.values().stream().mapToLong(Long::longValue).sum();
            return (total == 0 ? Health.up() : Health.status("WARNING"))
                .withDetail("staleAfter", staleAfter.toString())
                .withDetail("stalePending", stale)
                .build();
        }
    }
}
