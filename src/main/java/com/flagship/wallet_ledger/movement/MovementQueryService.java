package com.flagship.wallet_ledger.movement;

import com.flagship.wallet_ledger.error.LedgerErrorCode;
import com.flagship.wallet_ledger.error.LedgerException;
import com.flagship.wallet_ledger.movement.deposit.Deposit;
import com.flagship.wallet_ledger.movement.deposit.DepositEntity;
import com.flagship.wallet_ledger.movement.deposit.DepositRepository;
import com.flagship.wallet_ledger.movement.exchange.CoinExchange;
import com.flagship.wallet_ledger.movement.exchange.CoinExchangeEntity;
import com.flagship.wallet_ledger.movement.exchange.CoinExchangeRepository;
import com.flagship.wallet_ledger.movement.purchase.Purchase;
import com.flagship.wallet_ledger.movement.purchase.PurchaseEntity;
import com.flagship.wallet_ledger.movement.purchase.PurchaseRepository;
import com.flagship.wallet_ledger.movement.transfer.TransferEntity;
import com.flagship.wallet_ledger.movement.transfer.TransferHistory;
import com.flagship.wallet_ledger.movement.transfer.TransferRepository;
import com.flagship.wallet_ledger.movement.withdrawal.Withdrawal;
import com.flagship.wallet_ledger.movement.withdrawal.WithdrawalEntity;
import com.flagship.wallet_ledger.movement.withdrawal.WithdrawalRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Read side of the movement tables. Everything is scoped to the owning user
 * and ordered newest first.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class MovementQueryService {

    public static final int DEFAULT_HISTORY_LIMIT = 50;
    static final int MAX_HISTORY_LIMIT = 200;

    private final PurchaseRepository purchaseRepository;
    private final DepositRepository depositRepository;
    private final TransferRepository transferRepository;
    private final WithdrawalRepository withdrawalRepository;
    private final CoinExchangeRepository coinExchangeRepository;

    /**
     * @param limit maximum number of rows; values outside 1..200 are clamped
     */
    public List<Purchase> purchaseHistory(UUID userId, int limit) {
        int pageSize = Math.max(1, Math.min(limit, MAX_HISTORY_LIMIT));
        return purchaseRepository.findByUserIdOrderByCreatedAtDesc(userId, PageRequest.of(0, pageSize))
            .stream()
            .map(PurchaseEntity::toDomain)
            .toList();
    }

    /**
     * A purchase that belongs to someone else is reported as missing, not forbidden.
     */
    public Purchase getPurchase(UUID userId, UUID purchaseId) {
        return purchaseRepository.findByIdAndUserId(purchaseId, userId)
            .map(PurchaseEntity::toDomain)
            .orElseThrow(() -> LedgerException.of(LedgerErrorCode.NOT_FOUND, "Transaction not found: %s", purchaseId));
    }

    public List<Deposit> depositHistory(UUID userId) {
        return depositRepository.findByUserIdOrderByCreatedAtDesc(userId)
            .stream()
            .map(DepositEntity::toDomain)
            .toList();
    }

    public TransferHistory transferHistory(UUID userId) {
        return new TransferHistory(
            transferRepository.findByFromUserIdOrderByCreatedAtDesc(userId).stream().map(TransferEntity::toDomain).toList(),
            transferRepository.findByToUserIdOrderByCreatedAtDesc(userId).stream().map(TransferEntity::toDomain).toList()
        );
    }

    public List<Withdrawal> withdrawalHistory(UUID userId) {
        return withdrawalRepository.findByUserIdOrderByCreatedAtDesc(userId)
            .stream()
            .map(WithdrawalEntity::toDomain)
            .toList();
    }

    public List<CoinExchange> coinExchangeHistory(UUID userId) {
        return coinExchangeRepository.findByUserIdOrderByCreatedAtDesc(userId)
            .stream()
            .map(CoinExchangeEntity::toDomain)
            .toList();
    }
}
