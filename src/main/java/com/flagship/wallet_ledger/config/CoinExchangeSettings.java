package com.flagship.wallet_ledger.config;

import com.flagship.wallet_ledger.error.LedgerErrorCode;
import com.flagship.wallet_ledger.error.LedgerException;
import com.flagship.wallet_ledger.movement.exchange.ExchangeRateRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;

/**
 * Coin economy parameters.
 *
 * The exchange rate is stored in {@code coin_exchange_settings} so every
 * instance exchanges at the same rate and an admin change survives a restart.
 * Until a rate is stored, {@code wallet.coins.exchange-rate} applies. Every
 * exchange snapshots the rate it used, so changing it never rewrites history.
 */
@Component
@Slf4j
public class CoinExchangeSettings {

    private static final int RATE_SCALE = 4;
    private static final BigDecimal MAX_COINS = BigDecimal.valueOf(Integer.MAX_VALUE);

    private final ExchangeRateRepository exchangeRateRepository;
    private final BigDecimal defaultExchangeRate;
    private final int minimumExchange;
    private final int earnDivisor;

    public CoinExchangeSettings(ExchangeRateRepository exchangeRateRepository,
                                @Value("${wallet.coins.exchange-rate:0.1}") BigDecimal defaultExchangeRate,
                                @Value("${wallet.coins.minimum-exchange:100}") int minimumExchange,
                                @Value("${wallet.coins.earn-divisor:100}") int earnDivisor) {
        if (minimumExchange < 1 || earnDivisor < 1) {
            throw new IllegalArgumentException("minimum-exchange and earn-divisor must be positive");
        }
        this.exchangeRateRepository = exchangeRateRepository;
        this.defaultExchangeRate = validRate(defaultExchangeRate);
        this.minimumExchange = minimumExchange;
        this.earnDivisor = earnDivisor;
    }

    /**
     * The rate in force. Called inside a coin exchange's transaction, it reads
     * the rate that transaction will snapshot.
     */
    public BigDecimal exchangeRate() {
        return exchangeRateRepository.findCurrent()
            .map(CoinExchangeSettings::normalized)
            .orElse(defaultExchangeRate);
    }

    public int minimumExchange() {
        return minimumExchange;
    }

    /**
     * Coins awarded for a purchase of {@code amount}: whole multiples of the divisor,
     * rounded down and capped at {@link Integer#MAX_VALUE}.
     */
    public int coinsEarnedFor(BigDecimal amount) {
        BigDecimal coins = amount.divideToIntegralValue(BigDecimal.valueOf(earnDivisor));
        return coins.compareTo(MAX_COINS) > 0 ? Integer.MAX_VALUE : coins.intValueExact();
    }

    /**
     * Replaces the stored rate. Returns the previous one.
     *
     * @throws LedgerException INVALID_AMOUNT if the rate is not positive or has more than four decimals
     */
    @Transactional
    public BigDecimal changeExchangeRate(BigDecimal newRate) {
        BigDecimal rate = validRate(newRate);
        BigDecimal previous = exchangeRateRepository.findCurrentForUpdate()
            .map(CoinExchangeSettings::normalized)
            .orElse(defaultExchangeRate);
        exchangeRateRepository.save(rate);
        log.info("Coin exchange rate changed: {} -> {}", previous.toPlainString(), rate.toPlainString());
        return previous;
    }

    private static BigDecimal validRate(BigDecimal rate) {
        if (rate == null || rate.signum() <= 0) {
            throw new LedgerException(LedgerErrorCode.INVALID_AMOUNT, "Exchange rate must be positive");
        }
        if (rate.stripTrailingZeros().scale() > RATE_SCALE) {
            throw LedgerException.of(LedgerErrorCode.INVALID_AMOUNT,
                "Exchange rate %s has more than %d decimal places", rate.toPlainString(), RATE_SCALE);
        }
        return normalized(rate);
    }

    // 0.1000 from the NUMERIC(10,4) column reads back as 0.1
    private static BigDecimal normalized(BigDecimal rate) {
        BigDecimal stripped = rate.stripTrailingZeros();
        return stripped.scale() < 1 ? stripped.setScale(1) : stripped;
    }
}
