package com.flagship.wallet_ledger.health;

import com.flagship.wallet_ledger.movement.deposit.DepositCallbackCache;
import com.flagship.wallet_ledger.outbox.OutboxService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unauthenticated liveness check for load balancers.
 *
 * The database is the only hard dependency: without it no balance can be read
 * or changed, so a failed check answers 503. Outbox and callback-cache state
 * are reported for operators but never fail the check.
 */
@RestController
@Slf4j
public class HealthController {

    private final DataSource dataSource;
    private final OutboxService outboxService;
    private final DepositCallbackCache callbackCache;
    private final int maxRetries;

    public HealthController(DataSource dataSource,
                            OutboxService outboxService,
                            DepositCallbackCache callbackCache,
                            @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
        this.dataSource = dataSource;
        this.outboxService = outboxService;
        this.callbackCache = callbackCache;
        this.maxRetries = maxRetries;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean databaseUp = databaseReachable();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", databaseUp ? "UP" : "DOWN");
        body.put("timestamp", Instant.now().toString());
        body.put("database", databaseUp ? "UP" : "DOWN");
        body.put("callback_cache", callbackCache.isActive() ? "redis" : "database_only");
        if (!databaseUp) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
        }

        body.put("outbox_backlog", outboxService.countUnpublished());
        body.put("outbox_dead_lettered", outboxService.countDeadLettered(maxRetries));
        return ResponseEntity.ok(body);
    }

    private boolean databaseReachable() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (SQLException e) {
            log.warn("Wallet database unreachable: {}", e.getMessage());
            return false;
        }
    }
}
