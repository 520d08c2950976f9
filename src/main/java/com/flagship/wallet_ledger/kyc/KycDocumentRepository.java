package com.flagship.wallet_ledger.kyc;

import com.flagship.wallet_ledger.ledger.KycStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface KycDocumentRepository extends JpaRepository<KycDocumentEntity, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT k FROM KycDocumentEntity k WHERE k.id = :id")
    Optional<KycDocumentEntity> findByIdForUpdate(@Param("id") UUID id);

    Optional<KycDocumentEntity> findFirstByUserIdOrderBySubmittedAtDesc(UUID userId);

    boolean existsByUserIdAndStatus(UUID userId, KycStatus status);

    List<KycDocumentEntity> findByStatusOrderBySubmittedAtAsc(KycStatus status);
}
