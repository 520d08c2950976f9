package com.flagship.wallet_ledger.api.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Error body for every failed request. {@code code} is the stable reason
 * string clients switch on; {@code error} is the human-readable HTTP reason.
 * {@code correlation_id} matches the {@code X-Correlation-ID} response header
 * and the server's log lines for the same call.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {
    String error;
    String code;
    String message;
    Map<String, String> details;
    String correlationId;
    Instant timestamp;
}
