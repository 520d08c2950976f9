package com.flagship.wallet_ledger.movement.deposit;

import com.flagship.wallet_ledger.movement.MovementStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis fast-path for replayed deposit callbacks.
 *
 * Strategy:
 * 1. After a callback commits, remember its reference and final status in Redis
 * 2. A later delivery of the same reference is rejected without touching the database
 * 3. On a Redis miss or outage, the locked database read decides
 *
 * Redis is never the source of truth: a missing entry only costs a database
 * round trip, and every write here happens after the database commit.
 */
@Service
@Slf4j
public class DepositCallbackCache {

    private static final String REDIS_KEY_PREFIX = "deposit-callback:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final Optional<StringRedisTemplate> redisTemplate;
    private final boolean enabled;

    public DepositCallbackCache(Optional<StringRedisTemplate> redisTemplate,
                                @Value("${wallet.callback-cache.enabled:true}") boolean enabled) {
        this.redisTemplate = redisTemplate;
        this.enabled = enabled;
    }

    /**
     * False when switched off or when no Redis template is configured; every
     * callback then goes to the database.
     */
    public boolean isActive() {
        return enabled && redisTemplate.isPresent();
    }

    /**
     * Returns the terminal status recorded for a reference, if Redis knows it.
     */
    public Optional<MovementStatus> findProcessed(String paymentReference) {
        if (!isActive()) {
            return Optional.empty();
        }
        try {
            String status = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + paymentReference);
            if (status != null) {
                log.debug("Deposit callback reference found in Redis: {} -> {}", paymentReference, status);
                return Optional.of(MovementStatus.valueOf(status));
            }
        } catch (Exception e) {
            log.warn("Redis lookup failed for deposit reference {}. Falling back to database. Error: {}",
                paymentReference, e.getMessage());
        }
        return Optional.empty();
    }

    /**
     * Records a processed reference. Best effort: a failure is logged and ignored,
     * the database row still rejects any replay.
     */
    public void rememberProcessed(String paymentReference, MovementStatus status) {
        if (!isActive()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + paymentReference, status.name(), REDIS_TTL);
            log.debug("Stored processed deposit reference in Redis: {} -> {}", paymentReference, status);
        } catch (Exception e) {
            log.warn("Failed to store deposit reference {} in Redis. Error: {}", paymentReference, e.getMessage());
        }
    }
}
