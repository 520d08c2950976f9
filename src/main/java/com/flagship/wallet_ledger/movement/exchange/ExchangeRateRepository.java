package com.flagship.wallet_ledger.movement.exchange;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * JDBC access to the single {@code coin_exchange_settings} row.
 */
@Repository
public class ExchangeRateRepository {

    private static final int SETTINGS_ROW = 1;

    private final JdbcTemplate jdbcTemplate;

    public ExchangeRateRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * The stored rate, or empty if no admin has set one yet.
     */
    public Optional<BigDecimal> findCurrent() {
        return queryRate("SELECT exchange_rate FROM coin_exchange_settings WHERE id = ?");
    }

    /**
     * Same as {@link #findCurrent()} but locks the row until the transaction ends,
     * so two concurrent changes each see the rate the other replaced.
     */
    public Optional<BigDecimal> findCurrentForUpdate() {
        return queryRate("SELECT exchange_rate FROM coin_exchange_settings WHERE id = ? FOR UPDATE");
    }

    public void save(BigDecimal rate) {
        jdbcTemplate.update(
            "INSERT INTO coin_exchange_settings (id, exchange_rate, updated_at) VALUES (?, ?, ?) " +
            "ON CONFLICT (id) DO UPDATE SET exchange_rate = EXCLUDED.exchange_rate, updated_at = EXCLUDED.updated_at",
            SETTINGS_ROW, rate, Timestamp.from(Instant.now()));
    }

    private Optional<BigDecimal> queryRate(String sql) {
        List<BigDecimal> rates = jdbcTemplate.query(sql, (rs, rowNum) -> rs.getBigDecimal("exchange_rate"), SETTINGS_ROW);
        return rates.stream().findFirst();
    }
}
