package com.flagship.wallet_ledger.kyc;

import com.flagship.wallet_ledger.ledger.KycStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "kyc_documents")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class KycDocumentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "id_card_url", nullable = false, updatable = false)
    private String idCardUrl;

    @Column(name = "selfie_url", nullable = false, updatable = false)
    private String selfieUrl;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private KycStatus status;

    @Column(name = "rejection_reason")
    private String rejectionReason;

    @Column(name = "submitted_at", nullable = false, updatable = false)
    private Instant submittedAt;

    @Column(name = "reviewed_at")
    private Instant reviewedAt;

    @Column(name = "reviewed_by")
    private UUID reviewedBy;

    public static KycDocumentEntity fromDomain(KycDocument document) {
        return new KycDocumentEntity(
            document.getId(),
            document.getUserId(),
            document.getIdCardUrl(),
            document.getSelfieUrl(),
            document.getStatus(),
            document.getRejectionReason(),
            document.getSubmittedAt(),
            document.getReviewedAt(),
            document.getReviewedBy()
        );
    }

    public KycDocument toDomain() {
        return new KycDocument(id, userId, idCardUrl, selfieUrl, status, rejectionReason,
            submittedAt, reviewedAt, reviewedBy);
    }

    public void updateFromDomain(KycDocument document) {
        this.status = document.getStatus();
        this.rejectionReason = document.getRejectionReason();
        this.reviewedAt = document.getReviewedAt();
        this.reviewedBy = document.getReviewedBy();
    }
}
