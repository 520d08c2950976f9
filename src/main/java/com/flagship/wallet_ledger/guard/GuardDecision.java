package com.flagship.wallet_ledger.guard;

import com.flagship.wallet_ledger.error.LedgerErrorCode;
import com.flagship.wallet_ledger.error.LedgerException;
import lombok.Value;

/**
 * Outcome of a guard check: allowed, or rejected with the first failing rule.
 */
@Value
public class GuardDecision {
    private static final GuardDecision ALLOWED = new GuardDecision(null, null);

    LedgerErrorCode rejection;
    String message;

    public static GuardDecision allowed() {
        return ALLOWED;
    }

    public static GuardDecision rejected(LedgerErrorCode code, String message) {
        return new GuardDecision(code, message);
    }

    public boolean isAllowed() {
        return rejection == null;
    }

    /**
     * @throws LedgerException carrying the rejection, if there is one
     */
    public void orThrow() {
        if (!isAllowed()) {
            throw new LedgerException(rejection, message);
        }
    }
}
