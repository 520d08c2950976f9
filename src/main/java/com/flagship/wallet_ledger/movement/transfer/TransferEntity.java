package com.flagship.wallet_ledger.movement.transfer;

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

@Entity
@Table(name = "transfers")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TransferEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "from_user_id", nullable = false, updatable = false)
    private UUID fromUserId;

    @Column(name = "to_user_id", nullable = false, updatable = false)
    private UUID toUserId;

    @Column(nullable = false, updatable = false, precision = 15, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private MovementStatus status;

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

    public static TransferEntity fromDomain(Transfer transfer) {
        return new TransferEntity(
            transfer.getId(),
            transfer.getFromUserId(),
            transfer.getToUserId(),
            transfer.getAmount(),
            transfer.getStatus(),
            transfer.getCreatedAt(),
            transfer.getUpdatedAt()
        );
    }

    public Transfer toDomain() {
        return new Transfer(id, fromUserId, toUserId, amount, status, createdAt, updatedAt);
    }

    public void updateFromDomain(Transfer transfer) {
        this.status = transfer.getStatus();
    }
}
