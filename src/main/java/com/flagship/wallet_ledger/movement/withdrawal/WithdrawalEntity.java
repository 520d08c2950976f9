package com.flagship.wallet_ledger.movement.withdrawal;

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
@Table(name = "withdrawals")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class WithdrawalEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(nullable = false, updatable = false, precision = 15, scale = 2)
    private BigDecimal amount;

    @Column(name = "bank_name", nullable = false, updatable = false)
    private String bankName;

    @Column(name = "account_number", nullable = false, updatable = false)
    private String accountNumber;

    @Column(name = "account_name", nullable = false, updatable = false)
    private String accountName;

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

    public static WithdrawalEntity fromDomain(Withdrawal withdrawal) {
        BankDetails bank = withdrawal.getBankDetails();
        return new WithdrawalEntity(
            withdrawal.getId(),
            withdrawal.getUserId(),
            withdrawal.getAmount(),
            bank.getBankName(),
            bank.getAccountNumber(),
            bank.getAccountName(),
            withdrawal.getStatus(),
            withdrawal.getCreatedAt(),
            withdrawal.getUpdatedAt()
        );
    }

    public Withdrawal toDomain() {
        return new Withdrawal(
            id,
            userId,
            amount,
            new BankDetails(bankName, accountNumber, accountName),
            status,
            createdAt,
            updatedAt
        );
    }

    public void updateFromDomain(Withdrawal withdrawal) {
        this.status = withdrawal.getStatus();
    }
}
