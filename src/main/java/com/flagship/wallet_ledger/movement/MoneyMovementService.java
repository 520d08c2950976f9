package com.flagship.wallet_ledger.movement;

import com.flagship.wallet_ledger.catalog.Product;
import com.flagship.wallet_ledger.catalog.ProductCatalog;
import com.flagship.wallet_ledger.config.CoinExchangeSettings;
import com.flagship.wallet_ledger.error.LedgerErrorCode;
import com.flagship.wallet_ledger.error.LedgerException;
import com.flagship.wallet_ledger.event.MovementEvent;
import com.flagship.wallet_ledger.guard.BalanceGuard;
import com.flagship.wallet_ledger.guard.GuardRequest;
import com.flagship.wallet_ledger.ledger.AccountRepository;
import com.flagship.wallet_ledger.ledger.Money;
import com.flagship.wallet_ledger.ledger.ReferenceGenerator;
import com.flagship.wallet_ledger.ledger.WalletAccount;
import com.flagship.wallet_ledger.movement.deposit.Deposit;
import com.flagship.wallet_ledger.movement.deposit.DepositEntity;
import com.flagship.wallet_ledger.movement.deposit.DepositMethod;
import com.flagship.wallet_ledger.movement.deposit.DepositRepository;
import com.flagship.wallet_ledger.movement.exchange.CoinExchange;
import com.flagship.wallet_ledger.movement.exchange.CoinExchangeEntity;
import com.flagship.wallet_ledger.movement.exchange.CoinExchangeRepository;
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
import com.flagship.wallet_ledger.observability.CorrelationContext;
import com.flagship.wallet_ledger.observability.WalletMetrics;
import com.flagship.wallet_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Creates movements and applies their synchronous balance effects.
 *
 * Every public method is one database transaction:
 * 1. Lock the acting account row (SELECT ... FOR UPDATE)
 * 2. Run the balance guard against that locked snapshot
 * 3. Insert the movement record
 * 4. Apply the balance change with a guarded UPDATE
 * 5. Write the MovementEvent to the outbox
 *
 * A rejection at any step throws {@link LedgerException} and rolls everything
 * back. Nothing here retries: repeating a debit without an idempotency key
 * could charge twice.
 *
 * Balance effects at creation:
 * <ul>
 *   <li>purchase, transfer, withdrawal: debit the amount</li>
 *   <li>deposit: none, the gateway callback credits it</li>
 *   <li>coin exchange: debit coins and credit balance, settled immediately</li>
 * </ul>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MoneyMovementService {

    private final AccountRepository accountRepository;
    private final BalanceGuard balanceGuard;
    private final ProductCatalog productCatalog;
    private final ReferenceGenerator referenceGenerator;
    private final CoinExchangeSettings coinSettings;
    private final PurchaseRepository purchaseRepository;
    private final DepositRepository depositRepository;
    private final TransferRepository transferRepository;
    private final WithdrawalRepository withdrawalRepository;
    private final CoinExchangeRepository coinExchangeRepository;
    private final OutboxService outboxService;
    private final WalletMetrics walletMetrics;

    /**
     * Buys a product from the wallet balance. Debits the price now; the provider
     * later reports the outcome through {@link StatusTransitionService#applyPurchaseStatus}.
     */
    @Transactional
    public Purchase createPurchase(UUID userId, UUID productId, String targetNumber) {
        return measured("create_purchase", userId, () -> {
            requireText(targetNumber, "Target number");
            WalletAccount account = balanceGuard.requireActive(accountRepository.findByIdForUpdate(userId));
            Product product = productCatalog.getActiveProduct(productId);
            balanceGuard.enforce(Optional.of(account), GuardRequest.purchase(product.getPrice()));

            int coinsEarned = coinSettings.coinsEarnedFor(product.getPrice());
            Purchase purchase = Purchase.create(userId, productId, targetNumber.trim(), product.getPrice(), coinsEarned);
            CorrelationContext.putMovementId(purchase.getId());

            purchaseRepository.save(PurchaseEntity.fromDomain(purchase));
            accountRepository.adjustBalance(userId, product.getPrice().negate());
            outboxService.saveEvent(MovementEvent.created(MovementKind.PURCHASE, purchase.getId(), userId, null,
                purchase.getAmount(), coinsEarned, purchase.getStatus()));

            walletMetrics.recordMovementCreated(MovementKind.PURCHASE);
            log.info("Purchase created: product={}, amount={}, coinsEarned={}",
                productId, purchase.getAmount(), coinsEarned);
            return purchase;
        });
    }

    /**
     * Opens a deposit and hands out the payment reference the gateway will call back with.
     * The balance is not touched until a completed callback arrives.
     */
    @Transactional
    public Deposit createDeposit(UUID userId, BigDecimal amount, DepositMethod method) {
        return measured("create_deposit", userId, () -> {
            BigDecimal validAmount = Money.requirePositive(amount);
            Objects.requireNonNull(method, "Deposit method is required");
            balanceGuard.enforce(accountRepository.findById(userId), GuardRequest.deposit(validAmount));

            String reference = referenceGenerator.paymentReference(depositRepository::existsByPaymentReference);
            Deposit deposit = Deposit.create(userId, validAmount, method, reference);
            CorrelationContext.putMovementId(deposit.getId());

            depositRepository.save(DepositEntity.fromDomain(deposit));
            outboxService.saveEvent(MovementEvent.created(MovementKind.DEPOSIT, deposit.getId(), userId, null,
                validAmount, 0, deposit.getStatus()));

            walletMetrics.recordMovementCreated(MovementKind.DEPOSIT);
            log.info("Deposit created: amount={}, method={}, reference={}", validAmount, method, reference);
            return deposit;
        });
    }

    /**
     * Sends money to the user registered under {@code recipientEmail}. The sender is
     * debited now; the recipient is credited when the transfer completes.
     */
    @Transactional
    public Transfer createTransfer(UUID fromUserId, String recipientEmail, BigDecimal amount) {
        return measured("create_transfer", fromUserId, () -> {
            BigDecimal validAmount = Money.requirePositive(amount);
            requireText(recipientEmail, "Recipient email");
            WalletAccount recipient = accountRepository.findByEmail(recipientEmail.trim()).orElse(null);
            WalletAccount sender = balanceGuard.enforce(accountRepository.findByIdForUpdate(fromUserId),
                GuardRequest.transfer(validAmount, recipient));

            Transfer transfer = Transfer.create(sender.getId(), recipient.getId(), validAmount);
            CorrelationContext.putMovementId(transfer.getId());

            transferRepository.save(TransferEntity.fromDomain(transfer));
            accountRepository.adjustBalance(sender.getId(), validAmount.negate());
            outboxService.saveEvent(MovementEvent.created(MovementKind.TRANSFER, transfer.getId(), sender.getId(),
                recipient.getId(), validAmount, 0, transfer.getStatus()));

            walletMetrics.recordMovementCreated(MovementKind.TRANSFER);
            log.info("Transfer created: to={}, amount={}", recipient.getId(), validAmount);
            return transfer;
        });
    }

    /**
     * Pays out to a bank account. Debited now, refunded if the payout fails.
     */
    @Transactional
    public Withdrawal createWithdrawal(UUID userId, BigDecimal amount, BankDetails bankDetails) {
        return measured("create_withdrawal", userId, () -> {
            BigDecimal validAmount = Money.requirePositive(amount);
            Objects.requireNonNull(bankDetails, "Bank details are required");
            balanceGuard.enforce(accountRepository.findByIdForUpdate(userId), GuardRequest.withdrawal(validAmount));

            Withdrawal withdrawal = Withdrawal.create(userId, validAmount, bankDetails);
            CorrelationContext.putMovementId(withdrawal.getId());

            withdrawalRepository.save(WithdrawalEntity.fromDomain(withdrawal));
            accountRepository.adjustBalance(userId, validAmount.negate());
            outboxService.saveEvent(MovementEvent.created(MovementKind.WITHDRAWAL, withdrawal.getId(), userId, null,
                validAmount, 0, withdrawal.getStatus()));

            walletMetrics.recordMovementCreated(MovementKind.WITHDRAWAL);
            log.info("Withdrawal created: amount={}, bank={}", validAmount, bankDetails.getBankName());
            return withdrawal;
        });
    }

    /**
     * Converts coins into balance at the current rate. Both balances change in
     * this transaction and the record keeps the rate that was used.
     */
    @Transactional
    public CoinExchange exchangeCoins(UUID userId, int coins) {
        return measured("exchange_coins", userId, () -> {
            requirePositiveCoins(coins);
            balanceGuard.enforce(accountRepository.findByIdForUpdate(userId),
                GuardRequest.coinExchange(coins, coinSettings.minimumExchange()));

            CoinExchange exchange = CoinExchange.of(userId, coins, coinSettings.exchangeRate());
            CorrelationContext.putMovementId(exchange.getId());

            coinExchangeRepository.save(CoinExchangeEntity.fromDomain(exchange));
            accountRepository.adjustCoins(userId, -coins);
            accountRepository.adjustBalance(userId, exchange.getBalanceReceived());
            outboxService.saveEvent(MovementEvent.created(MovementKind.COIN_EXCHANGE, exchange.getId(), userId, null,
                exchange.getBalanceReceived(), coins, MovementStatus.COMPLETED));

            walletMetrics.recordMovementCreated(MovementKind.COIN_EXCHANGE);
            walletMetrics.recordMovementSettled(MovementKind.COIN_EXCHANGE, MovementStatus.COMPLETED);
            log.info("Coins exchanged: coins={}, received={}, rate={}",
                coins, exchange.getBalanceReceived(), exchange.getExchangeRate());
            return exchange;
        });
    }

    /**
     * Adds coins outside of a purchase, e.g. a referral reward.
     *
     * @return the account after the credit
     */
    @Transactional
    public WalletAccount creditCoins(UUID userId, int coins, String reason) {
        return measured("credit_coins", userId, () -> {
            requirePositiveCoins(coins);
            balanceGuard.requireActive(accountRepository.findByIdForUpdate(userId));

            accountRepository.adjustCoins(userId, coins);

            log.info("Coins credited: coins={}, reason={}", coins, reason);
            return accountRepository.findById(userId).orElseThrow();
        });
    }

    private <T> T measured(String operation, UUID userId, Supplier<T> body) {
        long start = System.nanoTime();
        CorrelationContext.putUserId(userId);
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

    private static void requirePositiveCoins(int coins) {
        if (coins <= 0) {
            throw new LedgerException(LedgerErrorCode.INVALID_AMOUNT, "Coins must be positive");
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
    }
}
