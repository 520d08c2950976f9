package com.flagship.wallet_ledger.guard;

import com.flagship.wallet_ledger.ledger.WalletAccount;
import lombok.Value;

import java.math.BigDecimal;

/**
 * What is about to happen to an account.
 *
 * {@code recipient} is only read for transfers, where null means the
 * recipient could not be resolved. {@code coinsRequested} and
 * {@code minimumCoins} are only read for coin exchanges.
 */
@Value
public class GuardRequest {
    GuardedOperation operation;
    BigDecimal amount;
    WalletAccount recipient;
    int coinsRequested;
    int minimumCoins;

    public static GuardRequest purchase(BigDecimal price) {
        return new GuardRequest(GuardedOperation.PURCHASE, price, null, 0, 0);
    }

    public static GuardRequest deposit(BigDecimal amount) {
        return new GuardRequest(GuardedOperation.DEPOSIT, amount, null, 0, 0);
    }

    public static GuardRequest transfer(BigDecimal amount, WalletAccount recipient) {
        return new GuardRequest(GuardedOperation.TRANSFER, amount, recipient, 0, 0);
    }

    public static GuardRequest withdrawal(BigDecimal amount) {
        return new GuardRequest(GuardedOperation.WITHDRAWAL, amount, null, 0, 0);
    }

    public static GuardRequest coinExchange(int coinsRequested, int minimumCoins) {
        return new GuardRequest(GuardedOperation.COIN_EXCHANGE, null, null, coinsRequested, minimumCoins);
    }

    public static GuardRequest coinCredit() {
        return new GuardRequest(GuardedOperation.COIN_CREDIT, null, null, 0, 0);
    }
}
