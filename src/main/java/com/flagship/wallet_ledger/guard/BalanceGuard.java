package com.flagship.wallet_ledger.guard;

import com.flagship.wallet_ledger.error.LedgerErrorCode;
import com.flagship.wallet_ledger.ledger.WalletAccount;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Eligibility rules for every balance-affecting operation.
 *
 * Pure: it only looks at the snapshot it is given. Callers read that snapshot
 * with a row lock in the same transaction as the write that follows, so the
 * answer cannot go stale between check and mutation.
 *
 * Rules run in a fixed order and the first failure wins:
 * <ol>
 *   <li>account exists</li>
 *   <li>account not blocked</li>
 *   <li>KYC verified, for transfers and withdrawals</li>
 *   <li>balance covers the amount, for debits</li>
 *   <li>recipient exists, is not blocked and is not the sender, for transfers</li>
 *   <li>enough coins and at least the minimum, for coin exchanges</li>
 * </ol>
 */
@Component
public class BalanceGuard {

    public GuardDecision check(Optional<WalletAccount> snapshot, GuardRequest request) {
        if (snapshot.isEmpty()) {
            return GuardDecision.rejected(LedgerErrorCode.NOT_FOUND, "User not found");
        }
        WalletAccount account = snapshot.get();
        GuardedOperation operation = request.getOperation();

        if (account.isBlocked()) {
            return GuardDecision.rejected(LedgerErrorCode.BLOCKED, "Account is blocked");
        }
        if (operation.requiresKyc() && !account.isKycVerified()) {
            return GuardDecision.rejected(LedgerErrorCode.KYC_REQUIRED, "KYC verification required");
        }
        if (operation.debitsBalance() && account.getBalance().compareTo(request.getAmount()) < 0) {
            return GuardDecision.rejected(LedgerErrorCode.INSUFFICIENT_BALANCE,
                "Insufficient wallet balance: available " + account.getBalance().toPlainString()
                    + ", required " + request.getAmount().toPlainString());
        }
        if (operation == GuardedOperation.TRANSFER) {
            return checkRecipient(account, request.getRecipient());
        }
        if (operation == GuardedOperation.COIN_EXCHANGE) {
            return checkCoins(account, request.getCoinsRequested(), request.getMinimumCoins());
        }
        return GuardDecision.allowed();
    }

    /**
     * Runs {@link #check} and returns the account when allowed.
     *
     * @throws com.flagship.wallet_ledger.error.LedgerException with the first failing rule
     */
    public WalletAccount enforce(Optional<WalletAccount> snapshot, GuardRequest request) {
        check(snapshot, request).orThrow();
        return snapshot.orElseThrow();
    }

    /**
     * Runs only the first two rules (exists, not blocked). Used before looking up
     * anything else the full check needs, such as a product price.
     */
    public WalletAccount requireActive(Optional<WalletAccount> snapshot) {
        return enforce(snapshot, GuardRequest.coinCredit());
    }

    private GuardDecision checkRecipient(WalletAccount sender, WalletAccount recipient) {
        if (recipient == null) {
            return GuardDecision.rejected(LedgerErrorCode.RECIPIENT_NOT_FOUND, "Recipient not found");
        }
        if (recipient.isBlocked()) {
            return GuardDecision.rejected(LedgerErrorCode.RECIPIENT_BLOCKED, "Recipient account is blocked");
        }
        if (recipient.getId().equals(sender.getId())) {
            return GuardDecision.rejected(LedgerErrorCode.SELF_OPERATION, "Cannot transfer to yourself");
        }
        return GuardDecision.allowed();
    }

    private GuardDecision checkCoins(WalletAccount account, int coinsRequested, int minimumCoins) {
        if (account.getCoins() < coinsRequested) {
            return GuardDecision.rejected(LedgerErrorCode.INSUFFICIENT_COINS,
                "Insufficient coins: available " + account.getCoins() + ", requested " + coinsRequested);
        }
        if (coinsRequested < minimumCoins) {
            return GuardDecision.rejected(LedgerErrorCode.BELOW_MINIMUM_THRESHOLD,
                "Minimum " + minimumCoins + " coins required for exchange");
        }
        return GuardDecision.allowed();
    }
}
