package com.flagship.wallet_ledger.config;

import com.flagship.wallet_ledger.error.LedgerErrorCode;
import com.flagship.wallet_ledger.error.LedgerException;
import com.flagship.wallet_ledger.movement.exchange.CoinExchange;
import com.flagship.wallet_ledger.movement.exchange.ExchangeRateRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CoinExchangeSettingsTest {

    @Mock
    private ExchangeRateRepository exchangeRateRepository;

    private CoinExchangeSettings settings;

    @BeforeEach
    void setUp() {
        settings = new CoinExchangeSettings(exchangeRateRepository, new BigDecimal("0.1"), 100, 100);
    }

    @Test
    @DisplayName("Coins earned are floor(amount / 100)")
    void coinsEarned() {
        assertEquals(0, settings.coinsEarnedFor(new BigDecimal("20.00")));
        assertEquals(0, settings.coinsEarnedFor(new BigDecimal("99.99")));
        assertEquals(1, settings.coinsEarnedFor(new BigDecimal("100.00")));
        assertEquals(15, settings.coinsEarnedFor(new BigDecimal("1550.50")));
    }

    @Test
    @DisplayName("Coins earned for a price past the int range are capped instead of failing")
    void coinsEarnedCapped() {
        assertEquals(Integer.MAX_VALUE, settings.coinsEarnedFor(new BigDecimal("214748364700.00")));
        assertEquals(Integer.MAX_VALUE, settings.coinsEarnedFor(new BigDecimal("214748364800.00")));
        assertEquals(Integer.MAX_VALUE, settings.coinsEarnedFor(new BigDecimal("9999999999999.99")));
    }

    @Test
    @DisplayName("Configured rate applies until one is stored")
    void defaultRate() {
        when(exchangeRateRepository.findCurrent()).thenReturn(Optional.empty());

        assertEquals(new BigDecimal("0.1"), settings.exchangeRate());
    }

    @Test
    @DisplayName("Stored rate wins over the configured one and reads back without padding")
    void storedRate() {
        when(exchangeRateRepository.findCurrent()).thenReturn(Optional.of(new BigDecimal("0.2500")));

        assertEquals(new BigDecimal("0.25"), settings.exchangeRate());
    }

    @Test
    @DisplayName("Exchange snapshots the rate and rounds half-even to cents")
    void exchangeMath() {
        CoinExchange exchange = CoinExchange.of(UUID.randomUUID(), 100, settings.exchangeRate());

        assertEquals(0, new BigDecimal("10.00").compareTo(exchange.getBalanceReceived()));
        assertEquals(2, exchange.getBalanceReceived().scale());
        assertEquals(0, new BigDecimal("0.1").compareTo(exchange.getExchangeRate()));

        CoinExchange odd = CoinExchange.of(UUID.randomUUID(), 125, new BigDecimal("0.0125"));
        // 125 * 0.0125 = 1.5625 -> 1.56
        assertEquals(new BigDecimal("1.56"), odd.getBalanceReceived());
    }

    @Test
    @DisplayName("Changing the rate stores it, returns the old one and leaves earlier snapshots alone")
    void changeRate() {
        CoinExchange before = CoinExchange.of(UUID.randomUUID(), 200, settings.exchangeRate());
        when(exchangeRateRepository.findCurrentForUpdate()).thenReturn(Optional.of(new BigDecimal("0.1000")));

        BigDecimal previous = settings.changeExchangeRate(new BigDecimal("0.25"));

        assertEquals(0, new BigDecimal("0.1").compareTo(previous));
        verify(exchangeRateRepository).save(new BigDecimal("0.25"));
        assertEquals(0, new BigDecimal("20.00").compareTo(before.getBalanceReceived()),
            "Earlier exchange keeps the rate it was made at");
    }

    @Test
    @DisplayName("First change reports the configured rate as the previous one")
    void firstChange() {
        when(exchangeRateRepository.findCurrentForUpdate()).thenReturn(Optional.empty());

        assertEquals(new BigDecimal("0.1"), settings.changeExchangeRate(new BigDecimal("0.5")));
        verify(exchangeRateRepository).save(new BigDecimal("0.5"));
    }

    @Test
    @DisplayName("Non-positive or over-precise rates are refused")
    void invalidRates() {
        assertEquals(LedgerErrorCode.INVALID_AMOUNT, assertThrows(LedgerException.class,
            () -> settings.changeExchangeRate(BigDecimal.ZERO)).getCode());
        assertEquals(LedgerErrorCode.INVALID_AMOUNT, assertThrows(LedgerException.class,
            () -> settings.changeExchangeRate(new BigDecimal("-0.5"))).getCode());
        assertEquals(LedgerErrorCode.INVALID_AMOUNT, assertThrows(LedgerException.class,
            () -> settings.changeExchangeRate(new BigDecimal("0.12345"))).getCode());
        verify(exchangeRateRepository, never()).save(any());
    }
}
