package com.flagship.wallet_ledger.movement;

import com.flagship.wallet_ledger.error.LedgerErrorCode;
import com.flagship.wallet_ledger.error.LedgerException;
import com.flagship.wallet_ledger.event.WalletEvent;
import com.flagship.wallet_ledger.ledger.AccountRepository;
import com.flagship.wallet_ledger.movement.deposit.Deposit;
import com.flagship.wallet_ledger.movement.deposit.DepositCallbackCache;
import com.flagship.wallet_ledger.movement.deposit.DepositEntity;
import com.flagship.wallet_ledger.movement.deposit.DepositMethod;
import com.flagship.wallet_ledger.movement.deposit.DepositRepository;
import com.flagship.wallet_ledger.movement.purchase.Purchase;
import com.flagship.wallet_ledger.movement.purchase.PurchaseEntity;
import com.flagship.wallet_ledger.movement.purchase.PurchaseRepository;
import com.flagship.wallet_ledger.movement.transfer.Transfer;
import com.flagship.wallet_ledger.movement.transfer.TransferEntity;
import com.flagship.wallet_ledger.movement.transfer.TransferRepository;
import com.flagship.wallet_ledger.movement.withdrawal.BankDetails;
import com.flagship.wallet_ledger.movement.withdrawal.Withdrawal;
import com.flagship.wallet_ledger.movement.withdrawal.WithdrawalEntity;
import com.flagship.wallet_ledger.movement.withdrawal.WithdrawalRepository;
import com.flagship.wallet_ledger.observability.WalletMetrics;
import com.flagship.wallet_ledger.outbox.OutboxService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Side effects of each terminal transition, checked against mocked storage.
 * Locking and trigger behaviour are covered by the Postgres-backed scenario tests.
 */
@ExtendWith(MockitoExtension.class)
class StatusTransitionServiceTest {

    @Mock
    private DepositRepository depositRepository;
    @Mock
    private PurchaseRepository purchaseRepository;
    @Mock
    private TransferRepository transferRepository;
    @Mock
    private WithdrawalRepository withdrawalRepository;
    @Mock
    private AccountRepository accountRepository;
    @Mock
    private DepositCallbackCache callbackCache;
    @Mock
    private OutboxService outboxService;

    private SimpleMeterRegistry meterRegistry;
    private StatusTransitionService service;

    private final UUID userId = UUID.randomUUID();
    private final BigDecimal amount = new BigDecimal("50.00");

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        service = new StatusTransitionService(depositRepository, purchaseRepository, transferRepository,
            withdrawalRepository, accountRepository, callbackCache, outboxService, new WalletMetrics(meterRegistry));
    }

    private Deposit pendingDeposit(String reference) {
        return Deposit.create(userId, amount, DepositMethod.BANK_TRANSFER, reference);
    }

    @Test
    @DisplayName("Successful callback credits the deposit amount and remembers the reference")
    void depositSuccessCredits() {
        Deposit deposit = pendingDeposit("PAY_1_000001");
        when(callbackCache.findProcessed("PAY_1_000001")).thenReturn(Optional.empty());
        when(depositRepository.findByPaymentReferenceForUpdate("PAY_1_000001"))
            .thenReturn(Optional.of(DepositEntity.fromDomain(deposit)));

        Deposit result = service.applyDepositCallback("PAY_1_000001", "success");

        assertEquals(MovementStatus.COMPLETED, result.getStatus());
        verify(accountRepository).adjustBalance(userId, amount);
        verify(outboxService).saveEvent(any(WalletEvent.class));
        verify(callbackCache).rememberProcessed("PAY_1_000001", MovementStatus.COMPLETED);
    }

    @Test
    @DisplayName("Failed callback settles the deposit without touching the balance")
    void depositFailureDoesNotCredit() {
        when(callbackCache.findProcessed(anyString())).thenReturn(Optional.empty());
        when(depositRepository.findByPaymentReferenceForUpdate("PAY_1_000002"))
            .thenReturn(Optional.of(DepositEntity.fromDomain(pendingDeposit("PAY_1_000002"))));

        Deposit result = service.applyDepositCallback("PAY_1_000002", "failed");

        assertEquals(MovementStatus.FAILED, result.getStatus());
        verify(accountRepository, never()).adjustBalance(any(), any());
    }

    @Test
    @DisplayName("Pending callback cancels the deposit without touching the balance")
    void pendingCallbackCancels() {
        when(callbackCache.findProcessed(anyString())).thenReturn(Optional.empty());
        when(depositRepository.findByPaymentReferenceForUpdate("PAY_1_000005"))
            .thenReturn(Optional.of(DepositEntity.fromDomain(pendingDeposit("PAY_1_000005"))));

        Deposit result = service.applyDepositCallback("PAY_1_000005", "pending");

        assertEquals(MovementStatus.CANCELLED, result.getStatus());
        verify(accountRepository, never()).adjustBalance(any(), any());
        verify(callbackCache).rememberProcessed("PAY_1_000005", MovementStatus.CANCELLED);
    }

    @Test
    @DisplayName("Cache hit rejects the replay without reading the database")
    void cachedReplayIsRejected() {
        when(callbackCache.findProcessed("PAY_1_000003")).thenReturn(Optional.of(MovementStatus.COMPLETED));

        LedgerException e = assertThrows(LedgerException.class,
            () -> service.applyDepositCallback("PAY_1_000003", "success"));

        assertEquals(LedgerErrorCode.ALREADY_PROCESSED, e.getCode());
        verifyNoInteractions(depositRepository, accountRepository, outboxService);
        assertEquals(1.0, meterRegistry.counter("wallet.callbacks.replayed").count());
    }

    @Test
    @DisplayName("Settled deposit found in the database is ALREADY_PROCESSED, not INVALID_STATE")
    void settledDepositIsAlreadyProcessed() {
        Deposit settled = pendingDeposit("PAY_1_000004").transitionTo(MovementStatus.COMPLETED);
        when(callbackCache.findProcessed(anyString())).thenReturn(Optional.empty());
        when(depositRepository.findByPaymentReferenceForUpdate("PAY_1_000004"))
            .thenReturn(Optional.of(DepositEntity.fromDomain(settled)));

        LedgerException e = assertThrows(LedgerException.class,
            () -> service.applyDepositCallback("PAY_1_000004", "success"));

        assertEquals(LedgerErrorCode.ALREADY_PROCESSED, e.getCode());
        verify(accountRepository, never()).adjustBalance(any(), any());
        assertEquals(1.0, meterRegistry.counter("wallet.operations.rejected",
            "operation", "deposit_callback", "code", "already_processed").count());
    }

    @Test
    @DisplayName("Unknown payment reference is NOT_FOUND")
    void unknownReference() {
        when(callbackCache.findProcessed(anyString())).thenReturn(Optional.empty());
        when(depositRepository.findByPaymentReferenceForUpdate("PAY_404")).thenReturn(Optional.empty());

        LedgerException e = assertThrows(LedgerException.class,
            () -> service.applyDepositCallback("PAY_404", "success"));

        assertEquals(LedgerErrorCode.NOT_FOUND, e.getCode());
    }

    @Test
    @DisplayName("Completed purchase awards the coins it earned; failed purchase refunds the price")
    void purchaseEffects() {
        Purchase completedLater = Purchase.create(userId, UUID.randomUUID(), "08123456789", new BigDecimal("250.00"), 2);
        Purchase failedLater = Purchase.create(userId, UUID.randomUUID(), "08123456789", new BigDecimal("30.00"), 0);
        when(purchaseRepository.findByIdForUpdate(completedLater.getId()))
            .thenReturn(Optional.of(PurchaseEntity.fromDomain(completedLater)));
        when(purchaseRepository.findByIdForUpdate(failedLater.getId()))
            .thenReturn(Optional.of(PurchaseEntity.fromDomain(failedLater)));

        Purchase completed = service.applyPurchaseStatus(completedLater.getId(), "completed", "PRV-77");
        Purchase failed = service.applyPurchaseStatus(failedLater.getId(), "failed", null);

        assertEquals(MovementStatus.COMPLETED, completed.getStatus());
        assertEquals("PRV-77", completed.getProviderTransactionId());
        verify(accountRepository).adjustCoins(userId, 2);
        assertEquals(MovementStatus.FAILED, failed.getStatus());
        verify(accountRepository).adjustBalance(userId, new BigDecimal("30.00"));
    }

    @Test
    @DisplayName("Completed purchase with zero coins earned changes no balance")
    void purchaseWithoutCoins() {
        Purchase purchase = Purchase.create(userId, UUID.randomUUID(), "08123456789", new BigDecimal("20.00"), 0);
        when(purchaseRepository.findByIdForUpdate(purchase.getId()))
            .thenReturn(Optional.of(PurchaseEntity.fromDomain(purchase)));

        service.applyPurchaseStatus(purchase.getId(), "success", null);

        verify(accountRepository, never()).adjustCoins(any(), anyInt());
        verify(accountRepository, never()).adjustBalance(any(), any());
    }

    @Test
    @DisplayName("Transfer: completed credits the recipient, cancelled refunds the sender")
    void transferEffects() {
        UUID recipient = UUID.randomUUID();
        Transfer toComplete = Transfer.create(userId, recipient, amount);
        Transfer toCancel = Transfer.create(userId, recipient, new BigDecimal("7.50"));
        when(transferRepository.findByIdForUpdate(toComplete.getId()))
            .thenReturn(Optional.of(TransferEntity.fromDomain(toComplete)));
        when(transferRepository.findByIdForUpdate(toCancel.getId()))
            .thenReturn(Optional.of(TransferEntity.fromDomain(toCancel)));

        service.applyTransferStatus(toComplete.getId(), "completed");
        Transfer cancelled = service.applyTransferStatus(toCancel.getId(), "rejected-by-bank");

        verify(accountRepository).adjustBalance(recipient, amount);
        assertEquals(MovementStatus.CANCELLED, cancelled.getStatus());
        verify(accountRepository).adjustBalance(userId, new BigDecimal("7.50"));
    }

    @Test
    @DisplayName("Withdrawal: completed keeps the debit, failed refunds it")
    void withdrawalEffects() {
        BankDetails bank = new BankDetails("BCA", "1234567890", "Test User");
        Withdrawal paidOut = Withdrawal.create(userId, amount, bank);
        Withdrawal bounced = Withdrawal.create(userId, new BigDecimal("12.00"), bank);
        when(withdrawalRepository.findByIdForUpdate(paidOut.getId()))
            .thenReturn(Optional.of(WithdrawalEntity.fromDomain(paidOut)));
        when(withdrawalRepository.findByIdForUpdate(bounced.getId()))
            .thenReturn(Optional.of(WithdrawalEntity.fromDomain(bounced)));

        service.applyWithdrawalStatus(paidOut.getId(), "success");
        service.applyWithdrawalStatus(bounced.getId(), "failed");

        verify(accountRepository, never()).adjustBalance(userId, amount);
        verify(accountRepository).adjustBalance(userId, new BigDecimal("12.00"));
    }

    @Test
    @DisplayName("Status for a missing movement is NOT_FOUND")
    void missingMovement() {
        UUID id = UUID.randomUUID();
        when(transferRepository.findByIdForUpdate(id)).thenReturn(Optional.empty());

        LedgerException e = assertThrows(LedgerException.class, () -> service.applyTransferStatus(id, "completed"));

        assertEquals(LedgerErrorCode.NOT_FOUND, e.getCode());
    }
}
