package com.flagship.wallet_ledger.movement.purchase;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PurchaseRepository extends JpaRepository<PurchaseEntity, UUID> {

    /**
     * Loads a purchase with a row lock (SELECT ... FOR UPDATE) so that two status
     * notifications for the same purchase serialize.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM PurchaseEntity p WHERE p.id = :id")
    Optional<PurchaseEntity> findByIdForUpdate(@Param("id") UUID id);

    Optional<PurchaseEntity> findByIdAndUserId(UUID id, UUID userId);

    List<PurchaseEntity> findByUserIdOrderByCreatedAtDesc(UUID userId, Pageable pageable);
}
