package com.flagship.wallet_ledger.error;

import lombok.Getter;

/**
 * Typed failure of a wallet operation.
 *
 * Thrown before any write is flushed, so the surrounding transaction
 * rolls back and nothing is partially applied.
 */
@Getter
public class LedgerException extends RuntimeException {

    private final LedgerErrorCode code;

    public LedgerException(LedgerErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public static LedgerException of(LedgerErrorCode code, String format, Object... args) {
        return new LedgerException(code, String.format(format, args));
    }
}
