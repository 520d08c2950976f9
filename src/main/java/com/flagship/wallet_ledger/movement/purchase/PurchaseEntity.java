package com.flagship.wallet_ledger.movement.purchase;

import com.flagship.wallet_ledger.movement.MovementStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for the {@code transactions} table.
 *
 * No setters: the only mutable columns (status, provider id) change through
 * {@link #updateFromDomain(Purchase)}, which the status transition handler
 * calls after the domain object has validated the transition.
 */
@Entity
@Table(name = "transactions")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PurchaseEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "product_id", nullable = false, updatable = false)
    private UUID productId;

    @Column(name = "target_number", nullable = false, updatable = false)
    private String targetNumber;

    @Column(nullable = false, updatable = false, precision = 15, scale = 2)
    private BigDecimal amount;

    @Column(name = "coins_earned", nullable = false, updatable = false)
    private int coinsEarned;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private MovementStatus status;

    @Column(name = "provider_transaction_id")
    private String providerTransactionId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        updatedAt = createdAt;
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
    }

    public static PurchaseEntity fromDomain(Purchase purchase) {
        return new PurchaseEntity(
            purchase.getId(),
            purchase.getUserId(),
            purchase.getProductId(),
            purchase.getTargetNumber(),
            purchase.getAmount(),
            purchase.getCoinsEarned(),
            purchase.getStatus(),
            purchase.getProviderTransactionId(),
            purchase.getCreatedAt(),
            purchase.getUpdatedAt()
        );
    }

    public Purchase toDomain() {
        return new Purchase(
            id,
            userId,
            productId,
            targetNumber,
            amount,
            coinsEarned,
            status,
            providerTransactionId,
            createdAt,
            updatedAt
        );
    }

    public void updateFromDomain(Purchase purchase) {
        this.status = purchase.getStatus();
        this.providerTransactionId = purchase.getProviderTransactionId();
    }
}
