package com.flagship.wallet_ledger.movement.exchange;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for {@code coin_exchanges}. Insert-only; a database trigger
 * rejects updates as well.
 */
@Entity
@Immutable
@Table(name = "coin_exchanges")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CoinExchangeEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "coins_used", nullable = false, updatable = false)
    private int coinsUsed;

    @Column(name = "balance_received", nullable = false, updatable = false, precision = 15, scale = 2)
    private BigDecimal balanceReceived;

    @Column(name = "exchange_rate", nullable = false, updatable = false, precision = 10, scale = 4)
    private BigDecimal exchangeRate;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static CoinExchangeEntity fromDomain(CoinExchange exchange) {
        return new CoinExchangeEntity(
            exchange.getId(),
            exchange.getUserId(),
            exchange.getCoinsUsed(),
            exchange.getBalanceReceived(),
            exchange.getExchangeRate(),
            exchange.getCreatedAt()
        );
    }

    public CoinExchange toDomain() {
        return new CoinExchange(id, userId, coinsUsed, balanceReceived, exchangeRate, createdAt);
    }
}
