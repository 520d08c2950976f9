package com.flagship.wallet_ledger.api;

import com.flagship.wallet_ledger.api.dto.KycDocumentResponse;
import com.flagship.wallet_ledger.api.dto.KycStatusResponse;
import com.flagship.wallet_ledger.api.dto.SubmitKycRequest;
import com.flagship.wallet_ledger.identity.CurrentUserProvider;
import com.flagship.wallet_ledger.kyc.KycDocument;
import com.flagship.wallet_ledger.kyc.KycService;
import com.flagship.wallet_ledger.ledger.AccountService;
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

import java.util.UUID;

@RestController
@RequestMapping("/api/kyc")
@RequiredArgsConstructor
@Slf4j
public class KycController {

    private final KycService kycService;
    private final AccountService accountService;
    private final CurrentUserProvider currentUser;

    @PostMapping("/submit")
    public ResponseEntity<KycDocumentResponse> submit(@Valid @RequestBody SubmitKycRequest request) {
        UUID userId = currentUser.currentUserId();
        log.info("Received KYC submission");

        KycDocument document = kycService.submit(userId, request.getIdCardUrl(), request.getSelfieUrl());
        return ResponseEntity.status(HttpStatus.CREATED).body(KycDocumentResponse.from(document));
    }

    @GetMapping("/status")
    public ResponseEntity<KycStatusResponse> status() {
        UUID userId = currentUser.currentUserId();
        return ResponseEntity.ok(KycStatusResponse.builder()
            .kycStatus(accountService.getAccount(userId).getKycStatus())
            .latestSubmission(kycService.latestSubmission(userId).map(KycDocumentResponse::from).orElse(null))
            .build());
    }
}
