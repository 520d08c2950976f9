package com.flagship.wallet_ledger.guard;

import com.flagship.wallet_ledger.error.LedgerErrorCode;
import com.flagship.wallet_ledger.error.LedgerException;
import com.flagship.wallet_ledger.ledger.KycStatus;
import com.flagship.wallet_ledger.ledger.WalletAccount;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Rule order and outcomes of the balance guard. No Spring context: the guard
 * only looks at the snapshot it is handed.
 */
class BalanceGuardTest {

    private final BalanceGuard guard = new BalanceGuard();

    private static WalletAccount account(String balance, int coins, KycStatus kyc, boolean blocked) {
        Instant now = Instant.now();
        return new WalletAccount(UUID.randomUUID(), "Test User", UUID.randomUUID() + "@example.com", null,
            kyc, new BigDecimal(balance), coins, "REFTEST0001", null, blocked, now, now);
    }

    private static LedgerErrorCode rejection(Optional<WalletAccount> snapshot, GuardRequest request) {
        GuardDecision decision = new BalanceGuard().check(snapshot, request);
        assertFalse(decision.isAllowed(), "Expected a rejection");
        return decision.getRejection();
    }

    @Test
    @DisplayName("Missing account is rejected before anything else")
    void missingAccount() {
        assertEquals(LedgerErrorCode.NOT_FOUND,
            rejection(Optional.empty(), GuardRequest.purchase(new BigDecimal("10.00"))));
    }

    @Test
    @DisplayName("Blocked account fails even a deposit")
    void blockedAccountFailsEveryOperation() {
        WalletAccount blocked = account("1000.00", 1000, KycStatus.VERIFIED, true);

        assertEquals(LedgerErrorCode.BLOCKED,
            rejection(Optional.of(blocked), GuardRequest.deposit(new BigDecimal("10.00"))));
        assertEquals(LedgerErrorCode.BLOCKED,
            rejection(Optional.of(blocked), GuardRequest.coinCredit()));
    }

    @Test
    @DisplayName("Blocked wins over insufficient balance")
    void blockedIsCheckedBeforeBalance() {
        WalletAccount blocked = account("0.00", 0, KycStatus.NOT_SUBMITTED, true);

        assertEquals(LedgerErrorCode.BLOCKED,
            rejection(Optional.of(blocked), GuardRequest.purchase(new BigDecimal("10.00"))));
    }

    @Test
    @DisplayName("Purchase needs no KYC but does need funds")
    void purchaseChecksBalanceOnly() {
        WalletAccount unverified = account("20.00", 0, KycStatus.NOT_SUBMITTED, false);

        assertTrue(guard.check(Optional.of(unverified), GuardRequest.purchase(new BigDecimal("20.00"))).isAllowed(),
            "Exact balance should be enough");
        assertEquals(LedgerErrorCode.INSUFFICIENT_BALANCE,
            rejection(Optional.of(unverified), GuardRequest.purchase(new BigDecimal("20.01"))));
    }

    @Test
    @DisplayName("Withdrawal requires verified KYC before the balance is looked at")
    void withdrawalRequiresKyc() {
        WalletAccount pending = account("0.00", 0, KycStatus.PENDING, false);

        assertEquals(LedgerErrorCode.KYC_REQUIRED,
            rejection(Optional.of(pending), GuardRequest.withdrawal(new BigDecimal("50.00"))));
    }

    @Test
    @DisplayName("Transfer recipient rules: missing, blocked, self")
    void transferRecipientRules() {
        WalletAccount sender = account("100.00", 0, KycStatus.VERIFIED, false);
        WalletAccount blockedRecipient = account("0.00", 0, KycStatus.NOT_SUBMITTED, true);
        WalletAccount recipient = account("0.00", 0, KycStatus.NOT_SUBMITTED, false);
        BigDecimal amount = new BigDecimal("25.00");

        assertEquals(LedgerErrorCode.RECIPIENT_NOT_FOUND,
            rejection(Optional.of(sender), GuardRequest.transfer(amount, null)));
        assertEquals(LedgerErrorCode.RECIPIENT_BLOCKED,
            rejection(Optional.of(sender), GuardRequest.transfer(amount, blockedRecipient)));
        assertEquals(LedgerErrorCode.SELF_OPERATION,
            rejection(Optional.of(sender), GuardRequest.transfer(amount, sender)));
        assertTrue(guard.check(Optional.of(sender), GuardRequest.transfer(amount, recipient)).isAllowed());
    }

    @Test
    @DisplayName("Unverified sender is rejected for KYC even when the recipient is missing")
    void transferKycBeforeRecipient() {
        WalletAccount sender = account("100.00", 0, KycStatus.REJECTED, false);

        assertEquals(LedgerErrorCode.KYC_REQUIRED,
            rejection(Optional.of(sender), GuardRequest.transfer(new BigDecimal("1.00"), null)));
    }

    @Test
    @DisplayName("Coin exchange: insufficient coins before minimum threshold")
    void coinExchangeRules() {
        WalletAccount fewCoins = account("0.00", 50, KycStatus.NOT_SUBMITTED, false);
        WalletAccount manyCoins = account("0.00", 500, KycStatus.NOT_SUBMITTED, false);

        assertEquals(LedgerErrorCode.INSUFFICIENT_COINS,
            rejection(Optional.of(fewCoins), GuardRequest.coinExchange(60, 100)));
        assertEquals(LedgerErrorCode.BELOW_MINIMUM_THRESHOLD,
            rejection(Optional.of(manyCoins), GuardRequest.coinExchange(99, 100)));
        assertTrue(guard.check(Optional.of(manyCoins), GuardRequest.coinExchange(100, 100)).isAllowed());
    }

    @Test
    @DisplayName("enforce throws the first failing rule as a LedgerException")
    void enforceThrows() {
        WalletAccount poor = account("5.00", 0, KycStatus.VERIFIED, false);

        LedgerException e = assertThrows(LedgerException.class,
            () -> guard.enforce(Optional.of(poor), GuardRequest.withdrawal(new BigDecimal("10.00"))));
        assertEquals(LedgerErrorCode.INSUFFICIENT_BALANCE, e.getCode());
        assertTrue(e.getMessage().contains("5.00"), "Message should name the available balance");
    }

    @Test
    @DisplayName("requireActive returns the account when it exists and is not blocked")
    void requireActive() {
        WalletAccount active = account("0.00", 0, KycStatus.NOT_SUBMITTED, false);

        assertSame(active, guard.requireActive(Optional.of(active)));
        assertThrows(LedgerException.class, () -> guard.requireActive(Optional.empty()));
    }
}
