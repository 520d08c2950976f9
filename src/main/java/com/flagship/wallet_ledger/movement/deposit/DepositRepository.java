package com.flagship.wallet_ledger.movement.deposit;

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
public interface DepositRepository extends JpaRepository<DepositEntity, UUID> {

    /**
     * Loads a deposit by gateway reference with a row lock, so concurrent
     * deliveries of the same callback serialize and only the first one
     * sees the deposit as pending.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM DepositEntity d WHERE d.paymentReference = :reference")
    Optional<DepositEntity> findByPaymentReferenceForUpdate(@Param("reference") String paymentReference);

    Optional<DepositEntity> findByPaymentReference(String paymentReference);

    boolean existsByPaymentReference(String paymentReference);

    List<DepositEntity> findByUserIdOrderByCreatedAtDesc(UUID userId);
}
