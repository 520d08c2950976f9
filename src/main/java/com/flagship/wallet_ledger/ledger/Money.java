package com.flagship.wallet_ledger.ledger;

import com.flagship.wallet_ledger.error.LedgerErrorCode;
import com.flagship.wallet_ledger.error.LedgerException;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Currency arithmetic for wallet balances: two fractional digits, never floating point.
 */
public final class Money {

    public static final int SCALE = 2;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_EVEN;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE, ROUNDING);

    private Money() {
    }

    /**
     * Validates a caller-supplied amount: present, strictly positive, at most two decimals.
     *
     * @return the amount at currency scale
     * @throws LedgerException with {@link LedgerErrorCode#INVALID_AMOUNT} otherwise
     */
    public static BigDecimal requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new LedgerException(LedgerErrorCode.INVALID_AMOUNT, "Amount must be positive");
        }
        if (amount.stripTrailingZeros().scale() > SCALE) {
            throw LedgerException.of(LedgerErrorCode.INVALID_AMOUNT,
                "Amount %s has more than %d decimal places", amount.toPlainString(), SCALE);
        }
        return amount.setScale(SCALE, ROUNDING);
    }

    public static BigDecimal of(BigDecimal amount) {
        return amount == null ? ZERO : amount.setScale(SCALE, ROUNDING);
    }
}
