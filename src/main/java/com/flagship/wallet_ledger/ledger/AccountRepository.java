package com.flagship.wallet_ledger.ledger;

import com.flagship.wallet_ledger.error.LedgerErrorCode;
import com.flagship.wallet_ledger.error.LedgerException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to account rows (the {@code users} table).
 *
 * Balance and coin columns are only changed through {@link #adjustBalance}
 * and {@link #adjustCoins}. Both are guarded updates: the row is changed only
 * if the result stays non-negative, so even a caller that skipped the row lock
 * cannot drive a balance below zero. The CHECK constraints on the table are
 * the last line behind that.
 */
@Repository
public class AccountRepository {

    private static final String SELECT_COLUMNS =
        "SELECT id, name, email, phone, kyc_status, wallet_balance, coins, referral_code, " +
        "referred_by, is_blocked, created_at, updated_at FROM users ";

    private final JdbcTemplate jdbcTemplate;

    public AccountRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<WalletAccount> findById(UUID accountId) {
        return queryOne(SELECT_COLUMNS + "WHERE id = ?", accountId);
    }

    /**
     * Reads the account and takes a row lock held until the surrounding transaction ends.
     * Every check-then-mutate on a balance starts here.
     */
    public Optional<WalletAccount> findByIdForUpdate(UUID accountId) {
        return queryOne(SELECT_COLUMNS + "WHERE id = ? FOR UPDATE", accountId);
    }

    public Optional<WalletAccount> findByEmail(String email) {
        return queryOne(SELECT_COLUMNS + "WHERE LOWER(email) = LOWER(?)", email);
    }

    public Optional<WalletAccount> findByReferralCode(String referralCode) {
        return queryOne(SELECT_COLUMNS + "WHERE referral_code = ?", referralCode);
    }

    public boolean existsByEmail(String email) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM users WHERE LOWER(email) = LOWER(?)", Integer.class, email);
        return count != null && count > 0;
    }

    public boolean existsByReferralCode(String referralCode) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM users WHERE referral_code = ?", Integer.class, referralCode);
        return count != null && count > 0;
    }

    public void insert(WalletAccount account) {
        jdbcTemplate.update(
            "INSERT INTO users (id, name, email, phone, kyc_status, wallet_balance, coins, referral_code, " +
            "referred_by, is_blocked, created_at, updated_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            account.getId(),
            account.getName(),
            account.getEmail(),
            account.getPhone(),
            account.getKycStatus().name(),
            account.getBalance(),
            account.getCoins(),
            account.getReferralCode(),
            account.getReferredBy(),
            account.isBlocked(),
            Timestamp.from(account.getCreatedAt()),
            Timestamp.from(account.getUpdatedAt())
        );
    }

    /**
     * Adds {@code delta} (negative for a debit) to the wallet balance.
     *
     * @throws LedgerException {@link LedgerErrorCode#INSUFFICIENT_BALANCE} if the result would be negative,
     *                         {@link LedgerErrorCode#NOT_FOUND} if the account does not exist
     */
    public void adjustBalance(UUID accountId, BigDecimal delta) {
        int updated = jdbcTemplate.update(
            "UPDATE users SET wallet_balance = wallet_balance + ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE id = ? AND wallet_balance + ? >= 0",
            delta, accountId, delta);
        if (updated == 0) {
            throw rejectedAdjustment(accountId, LedgerErrorCode.INSUFFICIENT_BALANCE, "balance", delta.toPlainString());
        }
    }

    /**
     * Adds {@code delta} (negative for a debit) to the coin balance.
     *
     * @throws LedgerException {@link LedgerErrorCode#INSUFFICIENT_COINS} if the result would be negative,
     *                         {@link LedgerErrorCode#NOT_FOUND} if the account does not exist
     */
    public void adjustCoins(UUID accountId, int delta) {
        int updated = jdbcTemplate.update(
            "UPDATE users SET coins = coins + ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE id = ? AND coins + ? >= 0",
            delta, accountId, delta);
        if (updated == 0) {
            throw rejectedAdjustment(accountId, LedgerErrorCode.INSUFFICIENT_COINS, "coins", String.valueOf(delta));
        }
    }

    public boolean setBlocked(UUID accountId, boolean blocked) {
        return jdbcTemplate.update(
            "UPDATE users SET is_blocked = ?, updated_at = CURRENT_TIMESTAMP WHERE id = ?",
            blocked, accountId) == 1;
    }

    public boolean setKycStatus(UUID accountId, KycStatus kycStatus) {
        return jdbcTemplate.update(
            "UPDATE users SET kyc_status = ?, updated_at = CURRENT_TIMESTAMP WHERE id = ?",
            kycStatus.name(), accountId) == 1;
    }

    public long countByReferredBy(String referralCode) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM users WHERE referred_by = ?", Long.class, referralCode);
        return count == null ? 0 : count;
    }

    public List<WalletAccount> findRecentByReferredBy(String referralCode, int limit) {
        return jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE referred_by = ? ORDER BY created_at DESC LIMIT ?",
            accountRowMapper(), referralCode, limit);
    }

    private LedgerException rejectedAdjustment(UUID accountId, LedgerErrorCode code, String column, String delta) {
        Integer exists = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM users WHERE id = ?", Integer.class, accountId);
        if (exists == null || exists == 0) {
            return LedgerException.of(LedgerErrorCode.NOT_FOUND, "User not found: %s", accountId);
        }
        return LedgerException.of(code, "Adjusting %s by %s would make it negative for account %s",
            column, delta, accountId);
    }

    private Optional<WalletAccount> queryOne(String sql, Object arg) {
        List<WalletAccount> rows = jdbcTemplate.query(sql, accountRowMapper(), arg);
        return rows.stream().findFirst();
    }

    private RowMapper<WalletAccount> accountRowMapper() {
        return (rs, rowNum) -> new WalletAccount(
            rs.getObject("id", UUID.class),
            rs.getString("name"),
            rs.getString("email"),
            rs.getString("phone"),
            KycStatus.valueOf(rs.getString("kyc_status")),
            Money.of(rs.getBigDecimal("wallet_balance")),
            rs.getInt("coins"),
            rs.getString("referral_code"),
            rs.getString("referred_by"),
            rs.getBoolean("is_blocked"),
            rs.getTimestamp("created_at").toInstant(),
            rs.getTimestamp("updated_at").toInstant()
        );
    }
}
