package com.flagship.wallet_ledger.guard;

/**
 * Operations the balance guard knows how to check, with the rules each one triggers.
 */
public enum GuardedOperation {
    PURCHASE(false, true),
    DEPOSIT(false, false),
    TRANSFER(true, true),
    WITHDRAWAL(true, true),
    COIN_EXCHANGE(false, false),
    COIN_CREDIT(false, false);

    private final boolean requiresKyc;
    private final boolean debitsBalance;

    GuardedOperation(boolean requiresKyc, boolean debitsBalance) {
        this.requiresKyc = requiresKyc;
        this.debitsBalance = debitsBalance;
    }

    public boolean requiresKyc() {
        return requiresKyc;
    }

    public boolean debitsBalance() {
        return debitsBalance;
    }
}
