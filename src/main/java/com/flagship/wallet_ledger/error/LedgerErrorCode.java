package com.flagship.wallet_ledger.error;

import org.springframework.http.HttpStatus;

/**
 * Failure taxonomy for wallet operations.
 *
 * Each code carries a stable reason string that clients can switch on
 * and the HTTP status used when the failure reaches the REST layer.
 */
public enum LedgerErrorCode {
    NOT_FOUND("not_found", HttpStatus.NOT_FOUND),
    PRODUCT_NOT_FOUND("product_not_found", HttpStatus.NOT_FOUND),
    PRODUCT_INACTIVE("product_inactive", HttpStatus.UNPROCESSABLE_ENTITY),
    RECIPIENT_NOT_FOUND("recipient_not_found", HttpStatus.NOT_FOUND),
    BLOCKED("account_blocked", HttpStatus.FORBIDDEN),
    RECIPIENT_BLOCKED("recipient_blocked", HttpStatus.UNPROCESSABLE_ENTITY),
    KYC_REQUIRED("kyc_required", HttpStatus.FORBIDDEN),
    INSUFFICIENT_BALANCE("insufficient_balance", HttpStatus.PAYMENT_REQUIRED),
    INSUFFICIENT_COINS("insufficient_coins", HttpStatus.UNPROCESSABLE_ENTITY),
    BELOW_MINIMUM_THRESHOLD("below_minimum_threshold", HttpStatus.UNPROCESSABLE_ENTITY),
    SELF_OPERATION("self_operation", HttpStatus.UNPROCESSABLE_ENTITY),
    ALREADY_PROCESSED("already_processed", HttpStatus.CONFLICT),
    INVALID_STATE("invalid_state", HttpStatus.CONFLICT),
    INVALID_AMOUNT("invalid_amount", HttpStatus.BAD_REQUEST),
    GENERATION_EXHAUSTED("generation_exhausted", HttpStatus.SERVICE_UNAVAILABLE);

    private final String reason;
    private final HttpStatus httpStatus;

    LedgerErrorCode(String reason, HttpStatus httpStatus) {
        this.reason = reason;
        this.httpStatus = httpStatus;
    }

    public String reason() {
        return reason;
    }

    public HttpStatus httpStatus() {
        return httpStatus;
    }
}
