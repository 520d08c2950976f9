package com.flagship.wallet_ledger.movement.withdrawal;

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
public interface WithdrawalRepository extends JpaRepository<WithdrawalEntity, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT w FROM WithdrawalEntity w WHERE w.id = :id")
    Optional<WithdrawalEntity> findByIdForUpdate(@Param("id") UUID id);

    List<WithdrawalEntity> findByUserIdOrderByCreatedAtDesc(UUID userId);
}
