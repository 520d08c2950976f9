package com.flagship.wallet_ledger.api;

import com.flagship.wallet_ledger.api.dto.DepositCallbackRequest;
import com.flagship.wallet_ledger.api.dto.DepositResponse;
import com.flagship.wallet_ledger.movement.StatusTransitionService;
import com.flagship.wallet_ledger.movement.deposit.Deposit;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Payment gateway webhook.
 *
 * A redelivered callback for a reference that was already settled answers
 * 409 already_processed, which gateways treat as delivered. The balance is
 * never credited twice.
 */
@RestController
@RequestMapping("/api/callbacks/deposits")
@RequiredArgsConstructor
@Slf4j
public class DepositCallbackController {

    private final StatusTransitionService statusTransitionService;

    @PostMapping
    public ResponseEntity<DepositResponse> callback(@Valid @RequestBody DepositCallbackRequest request) {
        log.info("Received deposit callback: reference={}, status={}",
            request.getPaymentReference(), request.getStatus());

        Deposit deposit = statusTransitionService.applyDepositCallback(
            request.getPaymentReference(), request.getStatus());
        return ResponseEntity.ok(DepositResponse.from(deposit));
    }
}
