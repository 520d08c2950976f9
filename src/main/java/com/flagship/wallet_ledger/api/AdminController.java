package com.flagship.wallet_ledger.api;

import com.flagship.wallet_ledger.api.dto.AccountResponse;
import com.flagship.wallet_ledger.api.dto.ExchangeRateRequest;
import com.flagship.wallet_ledger.api.dto.ExchangeRateResponse;
import com.flagship.wallet_ledger.api.dto.KycDocumentResponse;
import com.flagship.wallet_ledger.api.dto.KycReviewRequest;
import com.flagship.wallet_ledger.api.dto.PurchaseResponse;
import com.flagship.wallet_ledger.api.dto.StatusUpdateRequest;
import com.flagship.wallet_ledger.api.dto.TransferResponse;
import com.flagship.wallet_ledger.api.dto.WithdrawalResponse;
import com.flagship.wallet_ledger.config.CoinExchangeSettings;
import com.flagship.wallet_ledger.identity.CurrentUserProvider;
import com.flagship.wallet_ledger.kyc.KycService;
import com.flagship.wallet_ledger.ledger.AccountService;
import com.flagship.wallet_ledger.movement.StatusTransitionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Operator endpoints. Role checks happen upstream; the acting admin id is
 * taken from the same identity header as any other caller and logged with
 * each change.
 */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@Slf4j
public class AdminController {

    private final StatusTransitionService statusTransitionService;
    private final AccountService accountService;
    private final KycService kycService;
    private final CoinExchangeSettings coinSettings;
    private final CurrentUserProvider currentUser;

    @PostMapping("/purchases/{id}/status")
    public ResponseEntity<PurchaseResponse> updatePurchaseStatus(@PathVariable("id") UUID id,
                                                                 @Valid @RequestBody StatusUpdateRequest request) {
        log.info("Admin {} updating purchase status: status={}", currentUser.currentUserId(), request.getStatus());
        return ResponseEntity.ok(PurchaseResponse.from(statusTransitionService.applyPurchaseStatus(
            id, request.getStatus(), request.getProviderTransactionId())));
    }

    @PostMapping("/transfers/{id}/status")
    public ResponseEntity<TransferResponse> updateTransferStatus(@PathVariable("id") UUID id,
                                                                 @Valid @RequestBody StatusUpdateRequest request) {
        log.info("Admin {} updating transfer status: status={}", currentUser.currentUserId(), request.getStatus());
        return ResponseEntity.ok(TransferResponse.from(
            statusTransitionService.applyTransferStatus(id, request.getStatus())));
    }

    @PostMapping("/withdrawals/{id}/status")
    public ResponseEntity<WithdrawalResponse> updateWithdrawalStatus(@PathVariable("id") UUID id,
                                                                     @Valid @RequestBody StatusUpdateRequest request) {
        log.info("Admin {} updating withdrawal status: status={}", currentUser.currentUserId(), request.getStatus());
        return ResponseEntity.ok(WithdrawalResponse.from(
            statusTransitionService.applyWithdrawalStatus(id, request.getStatus())));
    }

    @PostMapping("/users/{id}/block")
    public ResponseEntity<AccountResponse> block(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(AccountResponse.from(accountService.setBlocked(currentUser.currentUserId(), id, true)));
    }

    @PostMapping("/users/{id}/unblock")
    public ResponseEntity<AccountResponse> unblock(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(AccountResponse.from(accountService.setBlocked(currentUser.currentUserId(), id, false)));
    }

    @GetMapping("/kyc/pending")
    public ResponseEntity<List<KycDocumentResponse>> pendingKyc() {
        return ResponseEntity.ok(kycService.pendingReviews().stream().map(KycDocumentResponse::from).toList());
    }

    @PostMapping("/kyc/{id}/review")
    public ResponseEntity<KycDocumentResponse> reviewKyc(@PathVariable("id") UUID id,
                                                         @Valid @RequestBody KycReviewRequest request) {
        return ResponseEntity.ok(KycDocumentResponse.from(kycService.review(
            currentUser.currentUserId(), id, request.getDecision(), request.getRejectionReason())));
    }

    /**
     * Applies to exchanges made from now on. Existing exchange records keep the
     * rate they were made at.
     */
    @PutMapping("/coins/exchange-rate")
    public ResponseEntity<ExchangeRateResponse> changeExchangeRate(@Valid @RequestBody ExchangeRateRequest request) {
        UUID adminId = currentUser.currentUserId();
        BigDecimal previous = coinSettings.changeExchangeRate(request.getRate());
        log.info("Exchange rate change applied by admin {}", adminId);

        return ResponseEntity.ok(ExchangeRateResponse.builder()
            .exchangeRate(coinSettings.exchangeRate())
            .minimumExchange(coinSettings.minimumExchange())
            .previousRate(previous)
            .build());
    }
}
