package com.flagship.wallet_ledger.movement.deposit;

import com.flagship.wallet_ledger.movement.MovementStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
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
 * JPA entity for the {@code deposits} table.
 * The payment reference is unique in the database and never updated.
 */
@Entity
@Table(
    name = "deposits",
    indexes = @Index(name = "uq_deposits_payment_reference", columnList = "payment_reference", unique = true)
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DepositEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(nullable = false, updatable = false, precision = 15, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private DepositMethod method;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private MovementStatus status;

    @Column(name = "payment_reference", nullable = false, updatable = false, unique = true, length = 64)
    private String paymentReference;

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

    public static DepositEntity fromDomain(Deposit deposit) {
        return new DepositEntity(
            deposit.getId(),
            deposit.getUserId(),
            deposit.getAmount(),
            deposit.getMethod(),
            deposit.getStatus(),
            deposit.getPaymentReference(),
            deposit.getCreatedAt(),
            deposit.getUpdatedAt()
        );
    }

    public Deposit toDomain() {
        return new Deposit(id, userId, amount, method, status, paymentReference, createdAt, updatedAt);
    }

    public void updateFromDomain(Deposit deposit) {
        this.status = deposit.getStatus();
    }
}
