package com.flagship.wallet_ledger.api;

import com.flagship.wallet_ledger.api.dto.BalanceResponse;
import com.flagship.wallet_ledger.api.dto.CreateDepositRequest;
import com.flagship.wallet_ledger.api.dto.CreateTransferRequest;
import com.flagship.wallet_ledger.api.dto.CreateWithdrawalRequest;
import com.flagship.wallet_ledger.api.dto.DepositResponse;
import com.flagship.wallet_ledger.api.dto.TransferHistoryResponse;
import com.flagship.wallet_ledger.api.dto.TransferResponse;
import com.flagship.wallet_ledger.api.dto.WithdrawalResponse;
import com.flagship.wallet_ledger.identity.CurrentUserProvider;
import com.flagship.wallet_ledger.ledger.AccountService;
import com.flagship.wallet_ledger.movement.MoneyMovementService;
import com.flagship.wallet_ledger.movement.MovementQueryService;
import com.flagship.wallet_ledger.movement.deposit.Deposit;
import com.flagship.wallet_ledger.movement.transfer.Transfer;
import com.flagship.wallet_ledger.movement.withdrawal.Withdrawal;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Balance, deposits, transfers and withdrawals for the acting user.
 *
 * Deposits only open a pending record here. The balance moves when the
 * payment gateway calls {@link DepositCallbackController}.
 */
@RestController
@RequestMapping("/api/wallet")
@RequiredArgsConstructor
@Slf4j
public class WalletController {

    private final MoneyMovementService movementService;
    private final MovementQueryService queryService;
    private final AccountService accountService;
    private final CurrentUserProvider currentUser;

    @GetMapping("/balance")
    public ResponseEntity<BalanceResponse> balance() {
        return ResponseEntity.ok(BalanceResponse.from(accountService.getAccount(currentUser.currentUserId())));
    }

    @PostMapping("/deposits")
    public ResponseEntity<DepositResponse> createDeposit(@Valid @RequestBody CreateDepositRequest request) {
        UUID userId = currentUser.currentUserId();
        log.info("Received deposit request: amount={}, method={}", request.getAmount(), request.getMethod());

        Deposit deposit = movementService.createDeposit(userId, request.getAmount(), request.getMethod());
        return ResponseEntity.status(HttpStatus.CREATED).body(DepositResponse.from(deposit));
    }

    @GetMapping("/deposits")
    public ResponseEntity<List<DepositResponse>> deposits() {
        return ResponseEntity.ok(queryService.depositHistory(currentUser.currentUserId()).stream()
            .map(DepositResponse::from)
            .toList());
    }

    @PostMapping("/transfers")
    public ResponseEntity<TransferResponse> createTransfer(@Valid @RequestBody CreateTransferRequest request) {
        UUID userId = currentUser.currentUserId();
        log.info("Received transfer request: amount={}", request.getAmount());

        Transfer transfer = movementService.createTransfer(userId, request.getRecipientEmail(), request.getAmount());
        return ResponseEntity.status(HttpStatus.CREATED).body(TransferResponse.from(transfer));
    }

    @GetMapping("/transfers")
    public ResponseEntity<TransferHistoryResponse> transfers() {
        return ResponseEntity.ok(TransferHistoryResponse.from(queryService.transferHistory(currentUser.currentUserId())));
    }

    @PostMapping("/withdrawals")
    public ResponseEntity<WithdrawalResponse> createWithdrawal(@Valid @RequestBody CreateWithdrawalRequest request) {
        UUID userId = currentUser.currentUserId();
        log.info("Received withdrawal request: amount={}, bank={}", request.getAmount(), request.getBankName());

        Withdrawal withdrawal = movementService.createWithdrawal(userId, request.getAmount(), request.toBankDetails());
        return ResponseEntity.status(HttpStatus.CREATED).body(WithdrawalResponse.from(withdrawal));
    }

    @GetMapping("/withdrawals")
    public ResponseEntity<List<WithdrawalResponse>> withdrawals() {
        return ResponseEntity.ok(queryService.withdrawalHistory(currentUser.currentUserId()).stream()
            .map(WithdrawalResponse::from)
            .toList());
    }
}
