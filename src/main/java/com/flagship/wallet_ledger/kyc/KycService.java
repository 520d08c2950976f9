package com.flagship.wallet_ledger.kyc;

import com.flagship.wallet_ledger.error.LedgerErrorCode;
import com.flagship.wallet_ledger.error.LedgerException;
import com.flagship.wallet_ledger.ledger.AccountRepository;
import com.flagship.wallet_ledger.ledger.KycStatus;
import com.flagship.wallet_ledger.ledger.WalletAccount;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * KYC submission and review. The money path only ever reads the outcome,
 * {@code kyc_status == VERIFIED} on the account row.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class KycService {

    private final KycDocumentRepository documentRepository;
    private final AccountRepository accountRepository;

    /**
     * Stores a document for review and marks the account PENDING.
     *
     * @throws LedgerException NOT_FOUND for an unknown user, ALREADY_PROCESSED if the
     *                         user is already verified, INVALID_STATE if a review is pending
     */
    @Transactional
    public KycDocument submit(UUID userId, String idCardUrl, String selfieUrl) {
        WalletAccount account = accountRepository.findByIdForUpdate(userId)
            .orElseThrow(() -> LedgerException.of(LedgerErrorCode.NOT_FOUND, "User not found: %s", userId));
        if (account.isKycVerified()) {
            throw new LedgerException(LedgerErrorCode.ALREADY_PROCESSED, "KYC is already verified");
        }
        if (documentRepository.existsByUserIdAndStatus(userId, KycStatus.PENDING)) {
            throw new LedgerException(LedgerErrorCode.INVALID_STATE, "A KYC submission is already pending review");
        }

        KycDocument document = KycDocument.submit(userId, idCardUrl, selfieUrl);
        documentRepository.save(KycDocumentEntity.fromDomain(document));
        accountRepository.setKycStatus(userId, KycStatus.PENDING);

        log.info("KYC submitted: userId={}, documentId={}", userId, document.getId());
        return document;
    }

    /**
     * Records the one and only review of a document and copies the decision to the account.
     *
     * @throws LedgerException NOT_FOUND for an unknown reviewer or document,
     *                         ALREADY_PROCESSED if the document was reviewed before
     */
    @Transactional
    public KycDocument review(UUID reviewerId, UUID documentId, KycStatus decision, String rejectionReason) {
        if (accountRepository.findById(reviewerId).isEmpty()) {
            throw LedgerException.of(LedgerErrorCode.NOT_FOUND, "Reviewer not found: %s", reviewerId);
        }
        KycDocumentEntity entity = documentRepository.findByIdForUpdate(documentId)
            .orElseThrow(() -> LedgerException.of(LedgerErrorCode.NOT_FOUND, "KYC document not found: %s", documentId));

        KycDocument reviewed = entity.toDomain().review(reviewerId, decision, rejectionReason);
        entity.updateFromDomain(reviewed);
        documentRepository.saveAndFlush(entity);
        accountRepository.setKycStatus(reviewed.getUserId(), decision);

        log.info("KYC reviewed: documentId={}, userId={}, decision={}, reviewer={}",
            documentId, reviewed.getUserId(), decision, reviewerId);
        return reviewed;
    }

    @Transactional(readOnly = true)
    public Optional<KycDocument> latestSubmission(UUID userId) {
        return documentRepository.findFirstByUserIdOrderBySubmittedAtDesc(userId).map(KycDocumentEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<KycDocument> pendingReviews() {
        return documentRepository.findByStatusOrderBySubmittedAtAsc(KycStatus.PENDING)
            .stream()
            .map(KycDocumentEntity::toDomain)
            .toList();
    }

    /**
     * The gate the money path relies on.
     */
    @Transactional(readOnly = true)
    public boolean isVerified(UUID userId) {
        return accountRepository.findById(userId).map(WalletAccount::isKycVerified).orElse(false);
    }
}
