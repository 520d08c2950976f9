package com.flagship.wallet_ledger.api.exception;

import com.flagship.wallet_ledger.error.LedgerErrorCode;
import com.flagship.wallet_ledger.error.LedgerException;
import com.flagship.wallet_ledger.identity.UnauthenticatedException;
import com.flagship.wallet_ledger.observability.CorrelationContext;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps every failure to an {@link ApiError}.
 *
 * Ledger rejections keep their reason code and status. Storage failures are
 * reported as {@code storage_error} without the driver message. Anything
 * unexpected is a 500 and logged with its stack trace.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private static final String STORAGE_ERROR = "storage_error";

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<ApiError> handleLedgerException(LedgerException e) {
        LedgerErrorCode code = e.getCode();
        log.warn("Request rejected: code={}, message={}", code.reason(), e.getMessage());
        return respond(code.httpStatus(), code.reason(), e.getMessage(), null);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ApiError> handleStorageError(DataAccessException e) {
        log.error("Storage error", e);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, STORAGE_ERROR, "Storage is unavailable, try again later", null);
    }

    @ExceptionHandler(UnauthenticatedException.class)
    public ResponseEntity<ApiError> handleUnauthenticated(UnauthenticatedException e) {
        log.warn("Unauthenticated request: {}", e.getMessage());
        return respond(HttpStatus.UNAUTHORIZED, "unauthenticated", e.getMessage(), null);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ApiError> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return respond(HttpStatus.BAD_REQUEST, "invalid_request",
            "Required header '" + e.getHeaderName() + "' is missing", null);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiError> handleMissingParameter(MissingServletRequestParameterException e) {
        log.warn("Missing required parameter: {}", e.getParameterName());
        return respond(HttpStatus.BAD_REQUEST, "invalid_request",
            "Required parameter '" + e.getParameterName() + "' is missing", null);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Malformed parameter: {}", e.getName());
        return respond(HttpStatus.BAD_REQUEST, "invalid_request", "Malformed value for '" + e.getName() + "'", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        return respond(HttpStatus.BAD_REQUEST, "validation_failed", "Request validation failed", errors);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMostSpecificCause().getMessage());
        return respond(HttpStatus.BAD_REQUEST, "invalid_request", "Malformed request body", null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "invalid_request", e.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "An unexpected error occurred", null);
    }

    private static ResponseEntity<ApiError> respond(HttpStatus status, String code, String message,
                                                    Map<String, String> details) {
        ApiError error = ApiError.builder()
            .error(status.getReasonPhrase())
            .code(code)
            .message(message)
            .details(details)
            .correlationId(MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY))
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(status).body(error);
    }
}
