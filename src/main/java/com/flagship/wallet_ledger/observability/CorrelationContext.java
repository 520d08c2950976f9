package com.flagship.wallet_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Thread-local correlation id plus the MDC keys the log pattern prints.
 *
 * The id comes from the {@code X-Correlation-ID} request header, or is minted
 * when the caller sent none, and is echoed back on the response.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String USER_ID_MDC_KEY = "userId";
    public static final String MOVEMENT_ID_MDC_KEY = "movementId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        correlationId.set(id != null && !id.isBlank() ? id : generateCorrelationId());
    }

    /**
     * Tags subsequent log lines of this thread with the movement being processed.
     */
    public static void putMovementId(UUID movementId) {
        MDC.put(MOVEMENT_ID_MDC_KEY, movementId.toString());
    }

    public static void putUserId(UUID userId) {
        MDC.put(USER_ID_MDC_KEY, userId.toString());
    }

    public static void clear() {
        correlationId.remove();
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(USER_ID_MDC_KEY);
        MDC.remove(MOVEMENT_ID_MDC_KEY);
    }

    /**
     * Short form, readable in log lines.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
