package com.flagship.wallet_ledger.movement.exchange;

import com.flagship.wallet_ledger.ledger.Money;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Conversion of loyalty coins into wallet balance.
 *
 * Settled synchronously, so there is no status. The rate is a snapshot taken
 * at exchange time; later rate changes never touch existing records.
 */
@Value
public class CoinExchange {
    UUID id;
    UUID userId;
    int coinsUsed;
    BigDecimal balanceReceived;
    BigDecimal exchangeRate;
    Instant createdAt;

    /**
     * Creates an exchange record for {@code coins} at {@code rate};
     * the balance received is rounded to currency precision.
     */
    public static CoinExchange of(UUID userId, int coins, BigDecimal rate) {
        BigDecimal received = rate.multiply(BigDecimal.valueOf(coins)).setScale(Money.SCALE, Money.ROUNDING);
        return new CoinExchange(UUID.randomUUID(), userId, coins, received, rate, Instant.now());
    }
}
