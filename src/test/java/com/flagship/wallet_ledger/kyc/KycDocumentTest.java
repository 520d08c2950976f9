package com.flagship.wallet_ledger.kyc;

import com.flagship.wallet_ledger.error.LedgerErrorCode;
import com.flagship.wallet_ledger.error.LedgerException;
import com.flagship.wallet_ledger.ledger.KycStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class KycDocumentTest {

    private final UUID reviewer = UUID.randomUUID();

    @Test
    @DisplayName("Approval sets review markers and drops any rejection reason")
    void approve() {
        KycDocument document = KycDocument.submit(UUID.randomUUID(), "https://files/id.jpg", "https://files/selfie.jpg");

        KycDocument reviewed = document.review(reviewer, KycStatus.VERIFIED, "ignored");

        assertEquals(KycStatus.VERIFIED, reviewed.getStatus());
        assertEquals(reviewer, reviewed.getReviewedBy());
        assertNotNull(reviewed.getReviewedAt());
        assertNull(reviewed.getRejectionReason());
        assertFalse(document.isReviewed(), "Original document is immutable");
    }

    @Test
    @DisplayName("A reviewed document cannot be reviewed again")
    void reviewOnce() {
        KycDocument rejected = KycDocument.submit(UUID.randomUUID(), "id", "selfie")
            .review(reviewer, KycStatus.REJECTED, "Blurry photo");

        assertEquals("Blurry photo", rejected.getRejectionReason());
        LedgerException e = assertThrows(LedgerException.class,
            () -> rejected.review(reviewer, KycStatus.VERIFIED, null));
        assertEquals(LedgerErrorCode.ALREADY_PROCESSED, e.getCode());
    }

    @Test
    @DisplayName("Only verified or rejected are review decisions")
    void invalidDecision() {
        KycDocument document = KycDocument.submit(UUID.randomUUID(), "id", "selfie");

        assertThrows(IllegalArgumentException.class, () -> document.review(reviewer, KycStatus.PENDING, null));
        assertThrows(IllegalArgumentException.class, () -> document.review(reviewer, KycStatus.NOT_SUBMITTED, null));
    }
}
