package com.flagship.wallet_ledger.observability;

import com.flagship.wallet_ledger.error.LedgerErrorCode;
import com.flagship.wallet_ledger.movement.MovementKind;
import com.flagship.wallet_ledger.movement.MovementStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;

/**
 * Micrometer meters for money movements.
 *
 * <ul>
 *   <li>{@code wallet.movements.created} by kind</li>
 *   <li>{@code wallet.movements.settled} by kind and terminal status</li>
 *   <li>{@code wallet.operations.rejected} by operation and error code</li>
 *   <li>{@code wallet.callbacks.replayed}, duplicate gateway deliveries</li>
 *   <li>{@code wallet.operations.latency} by operation</li>
 * </ul>
 */
@Component
public class WalletMetrics {

    private final MeterRegistry registry;
    private final Counter callbackReplays;

    public WalletMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.callbackReplays = Counter.builder("wallet.callbacks.replayed")
            .description("Deposit callbacks rejected because the reference was already processed")
            .register(registry);
    }

    public void recordMovementCreated(MovementKind kind) {
        registry.counter("wallet.movements.created", "kind", tag(kind.name())).increment();
    }

    public void recordMovementSettled(MovementKind kind, MovementStatus status) {
        registry.counter("wallet.movements.settled",
            "kind", tag(kind.name()),
            "status", tag(status.name())
        ).increment();
    }

    public void recordRejection(String operation, LedgerErrorCode code) {
        registry.counter("wallet.operations.rejected",
            "operation", operation,
            "code", code.reason()
        ).increment();
    }

    public void recordCallbackReplay() {
        callbackReplays.increment();
    }

    /**
     * A broker redelivery that the processed-events table turned into a no-op.
     */
    public void recordEventReplay(String consumerGroup, String eventType) {
        registry.counter("wallet.events.replayed",
            "consumer_group", consumerGroup,
            "event_type", eventType
        ).increment();
    }

    public void recordLatency(String operation, long startNanos) {
        Timer.builder("wallet.operations.latency")
            .tag("operation", operation)
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(registry)
            .record(Duration.ofNanos(System.nanoTime() - startNanos));
    }

    private static String tag(String value) {
        return value.toLowerCase(Locale.ROOT);
    }
}
