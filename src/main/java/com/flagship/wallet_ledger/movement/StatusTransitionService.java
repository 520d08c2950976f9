package com.flagship.wallet_ledger.movement;

import com.flagship.wallet_ledger.error.LedgerErrorCode;
import com.flagship.wallet_ledger.error.LedgerException;
import com.flagship.wallet_ledger.event.MovementEvent;
import com.flagship.wallet_ledger.ledger.AccountRepository;
import com.flagship.wallet_ledger.movement.deposit.Deposit;
import com.flagship.wallet_ledger.movement.deposit.DepositCallbackCache;
import com.flagship.wallet_ledger.movement.deposit.DepositEntity;
import com.flagship.wallet_ledger.movement.deposit.DepositRepository;
import com.flagship.wallet_ledger.movement.purchase.Purchase;
import com.flagship.wallet_ledger.movement.purchase.PurchaseEntity;
import com.flagship.wallet_ledger.movement.purchase.PurchaseRepository;
import com.flagship.wallet_ledger.movement.transfer.Transfer;
import com.flagship.wallet_ledger.movement.transfer.TransferEntity;
import com.flagship.wallet_ledger.movement.transfer.TransferRepository;
import com.flagship.wallet_ledger.movement.withdrawal.Withdrawal;
import com.flagship.wallet_ledger.movement.withdrawal.WithdrawalEntity;
import com.flagship.wallet_ledger.movement.withdrawal.WithdrawalRepository;
import com.flagship.wallet_ledger.observability.CorrelationContext;
import com.flagship.wallet_ledger.observability.WalletMetrics;
import com.flagship.wallet_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * Moves pending movements into a terminal state and applies the compensating
 * balance change that goes with it.
 *
 * <pre>
 *   movement     completed                 failed / cancelled
 *   deposit      credit amount             nothing
 *   purchase     award coins_earned        refund amount
 *   transfer     credit the recipient      refund the sender
 *   withdrawal   nothing                   refund amount
 * </pre>
 *
 * Each call locks the movement row first, then checks it is still pending,
 * then writes status and balance in the same transaction. A second call for
 * the same movement sees the terminal status and is rejected, so no side
 * effect can be applied twice. Database triggers enforce the same one-way
 * rule underneath.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StatusTransitionService {

    private final DepositRepository depositRepository;
    private final PurchaseRepository purchaseRepository;
    private final TransferRepository transferRepository;
    private final WithdrawalRepository withdrawalRepository;
    private final AccountRepository accountRepository;
    private final DepositCallbackCache callbackCache;
    private final OutboxService outboxService;
    private final WalletMetrics walletMetrics;

    /**
     * Applies a payment gateway notification.
     *
     * The payment reference is the idempotency key: a reference that is no longer
     * pending is rejected with ALREADY_PROCESSED, never applied again.
     *
     * @param externalStatus gateway vocabulary, see {@link MovementStatus#fromGatewayCallback}
     */
    @Transactional
    public Deposit applyDepositCallback(String paymentReference, String externalStatus) {
        return measured("deposit_callback", () -> {
            callbackCache.findProcessed(paymentReference).ifPresent(status -> {
                throw alreadyProcessed(paymentReference, status);
            });

            DepositEntity entity = depositRepository.findByPaymentReferenceForUpdate(paymentReference)
                .orElseThrow(() -> LedgerException.of(LedgerErrorCode.NOT_FOUND,
                    "Deposit not found: %s", paymentReference));
            Deposit deposit = entity.toDomain();
            CorrelationContext.putMovementId(deposit.getId());

            if (deposit.getStatus().isTerminal()) {
                throw alreadyProcessed(paymentReference, deposit.getStatus());
            }

            Deposit updated = deposit.transitionTo(MovementStatus.fromGatewayCallback(externalStatus));
            entity.updateFromDomain(updated);
            depositRepository.saveAndFlush(entity);

            if (updated.getStatus() == MovementStatus.COMPLETED) {
                accountRepository.adjustBalance(updated.getUserId(), updated.getAmount());
            }
            outboxService.saveEvent(MovementEvent.transitioned(MovementKind.DEPOSIT, updated.getId(),
                updated.getUserId(), null, updated.getAmount(), 0, updated.getStatus()));
            rememberAfterCommit(paymentReference, updated.getStatus());

            walletMetrics.recordMovementSettled(MovementKind.DEPOSIT, updated.getStatus());
            log.info("Deposit callback applied: reference={}, externalStatus={}, status={}, amount={}",
                paymentReference, externalStatus, updated.getStatus(), updated.getAmount());
            return updated;
        });
    }

    /**
     * Applies a provider (or operator) outcome to a pending purchase.
     *
     * @param providerTransactionId optional provider correlation id, kept if already set and none given
     */
    @Transactional
    public Purchase applyPurchaseStatus(UUID purchaseId, String externalStatus, String providerTransactionId) {
        return measured("purchase_status", () -> {
            PurchaseEntity entity = purchaseRepository.findByIdForUpdate(purchaseId)
                .orElseThrow(() -> LedgerException.of(LedgerErrorCode.NOT_FOUND, "Transaction not found: %s", purchaseId));
            CorrelationContext.putMovementId(purchaseId);

            Purchase updated = entity.toDomain()
                .transitionTo(MovementStatus.fromExternal(externalStatus), providerTransactionId);
            entity.updateFromDomain(updated);
            purchaseRepository.saveAndFlush(entity);

            if (updated.getStatus() == MovementStatus.COMPLETED) {
                if (updated.getCoinsEarned() > 0) {
                    accountRepository.adjustCoins(updated.getUserId(), updated.getCoinsEarned());
                }
            } else {
                accountRepository.adjustBalance(updated.getUserId(), updated.getAmount());
            }
            outboxService.saveEvent(MovementEvent.transitioned(MovementKind.PURCHASE, purchaseId,
                updated.getUserId(), null, updated.getAmount(), updated.getCoinsEarned(), updated.getStatus()));

            walletMetrics.recordMovementSettled(MovementKind.PURCHASE, updated.getStatus());
            log.info("Purchase status applied: status={}, amount={}, coinsEarned={}, providerRef={}",
                updated.getStatus(), updated.getAmount(), updated.getCoinsEarned(),
                updated.getProviderTransactionId());
            return updated;
        });
    }

    @Transactional
    public Transfer applyTransferStatus(UUID transferId, String externalStatus) {
        return measured("transfer_status", () -> {
            TransferEntity entity = transferRepository.findByIdForUpdate(transferId)
                .orElseThrow(() -> LedgerException.of(LedgerErrorCode.NOT_FOUND, "Transfer not found: %s", transferId));
            CorrelationContext.putMovementId(transferId);

            Transfer updated = entity.toDomain().transitionTo(MovementStatus.fromExternal(externalStatus));
            entity.updateFromDomain(updated);
            transferRepository.saveAndFlush(entity);

            UUID creditedAccount = updated.getStatus() == MovementStatus.COMPLETED
                ? updated.getToUserId()
                : updated.getFromUserId();
            accountRepository.adjustBalance(creditedAccount, updated.getAmount());
            outboxService.saveEvent(MovementEvent.transitioned(MovementKind.TRANSFER, transferId,
                updated.getFromUserId(), updated.getToUserId(), updated.getAmount(), 0, updated.getStatus()));

            walletMetrics.recordMovementSettled(MovementKind.TRANSFER, updated.getStatus());
            log.info("Transfer status applied: status={}, amount={}, credited={}",
                updated.getStatus(), updated.getAmount(), creditedAccount);
            return updated;
        });
    }

    @Transactional
    public Withdrawal applyWithdrawalStatus(UUID withdrawalId, String externalStatus) {
        return measured("withdrawal_status", () -> {
            WithdrawalEntity entity = withdrawalRepository.findByIdForUpdate(withdrawalId)
                .orElseThrow(() -> LedgerException.of(LedgerErrorCode.NOT_FOUND,
                    "Withdrawal not found: %s", withdrawalId));
            CorrelationContext.putMovementId(withdrawalId);

            Withdrawal updated = entity.toDomain().transitionTo(MovementStatus.fromExternal(externalStatus));
            entity.updateFromDomain(updated);
            withdrawalRepository.saveAndFlush(entity);

            if (updated.getStatus() != MovementStatus.COMPLETED) {
                accountRepository.adjustBalance(updated.getUserId(), updated.getAmount());
            }
            outboxService.saveEvent(MovementEvent.transitioned(MovementKind.WITHDRAWAL, withdrawalId,
                updated.getUserId(), null, updated.getAmount(), 0, updated.getStatus()));

            walletMetrics.recordMovementSettled(MovementKind.WITHDRAWAL, updated.getStatus());
            log.info("Withdrawal status applied: status={}, amount={}", updated.getStatus(), updated.getAmount());
            return updated;
        });
    }

    private LedgerException alreadyProcessed(String paymentReference, MovementStatus status) {
        walletMetrics.recordCallbackReplay();
        return LedgerException.of(LedgerErrorCode.ALREADY_PROCESSED,
            "Deposit already processed: %s is %s", paymentReference, status);
    }

    private void rememberAfterCommit(String paymentReference, MovementStatus status) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            callbackCache.rememberProcessed(paymentReference, status);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                callbackCache.rememberProcessed(paymentReference, status);
            }
        });
    }

    private <T> T measured(String operation, Supplier<T> body) {
        long start = System.nanoTime();
        try {
            return body.get();
        } catch (LedgerException e) {
            walletMetrics.recordRejection(operation, e.getCode());
            log.warn("{} rejected: code={}, message={}", operation, e.getCode().reason(), e.getMessage());
            throw e;
        } finally {
            walletMetrics.recordLatency(operation, start);
            MDC.remove(CorrelationContext.MOVEMENT_ID_MDC_KEY);
        }
    }
}
