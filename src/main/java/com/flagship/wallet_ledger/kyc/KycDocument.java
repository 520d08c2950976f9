package com.flagship.wallet_ledger.kyc;

import com.flagship.wallet_ledger.error.LedgerErrorCode;
import com.flagship.wallet_ledger.error.LedgerException;
import com.flagship.wallet_ledger.ledger.KycStatus;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Identity documents submitted for review.
 *
 * A review is one-shot: once {@code reviewedAt}/{@code reviewedBy} are set they
 * never change. A rejected user submits a new document instead.
 */
@Value
public class KycDocument {
    UUID id;
    UUID userId;
    String idCardUrl;
    String selfieUrl;
    KycStatus status;
    String rejectionReason;
    Instant submittedAt;
    Instant reviewedAt;
    UUID reviewedBy;

    public static KycDocument submit(UUID userId, String idCardUrl, String selfieUrl) {
        return new KycDocument(UUID.randomUUID(), userId, idCardUrl, selfieUrl, KycStatus.PENDING,
            null, Instant.now(), null, null);
    }

    public boolean isReviewed() {
        return reviewedAt != null;
    }

    /**
     * @param decision {@link KycStatus#VERIFIED} or {@link KycStatus#REJECTED}
     * @throws LedgerException ALREADY_PROCESSED if the document was reviewed before
     */
    public KycDocument review(UUID reviewerId, KycStatus decision, String reason) {
        if (decision != KycStatus.VERIFIED && decision != KycStatus.REJECTED) {
            throw new IllegalArgumentException("Review decision must be verified or rejected");
        }
        if (isReviewed()) {
            throw LedgerException.of(LedgerErrorCode.ALREADY_PROCESSED,
                "KYC document %s was already reviewed as %s", id, status);
        }
        String storedReason = decision == KycStatus.REJECTED ? reason : null;
        return new KycDocument(id, userId, idCardUrl, selfieUrl, decision, storedReason,
            submittedAt, Instant.now(), reviewerId);
    }
}
