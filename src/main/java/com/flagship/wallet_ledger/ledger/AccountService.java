package com.flagship.wallet_ledger.ledger;

import com.flagship.wallet_ledger.error.LedgerErrorCode;
import com.flagship.wallet_ledger.error.LedgerException;
import com.flagship.wallet_ledger.event.AccountRegisteredEvent;
import com.flagship.wallet_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;
import java.util.UUID;

/**
 * Account lifecycle outside of money movement: registration, lookup, blocking.
 *
 * Nothing here writes balance or coins. A new account starts at zero and only
 * the movement services change it afterwards.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    // Postgres' default name for the UNIQUE constraint on users.email
    static final String EMAIL_UNIQUE_CONSTRAINT = "users_email_key";

    private final AccountRepository accountRepository;
    private final ReferenceGenerator referenceGenerator;
    private final OutboxService outboxService;

    /**
     * Registers a user with an empty wallet and a fresh referral code.
     *
     * @param referralCode optional code of the user who referred this one. An unknown
     *                     code is rejected; a blocked referrer is simply not attributed.
     * @throws LedgerException INVALID_STATE if the email is taken, NOT_FOUND for an unknown
     *                         referral code, GENERATION_EXHAUSTED if no unique code could be drawn
     */
    @Transactional
    public WalletAccount register(String name, String email, String phone, String referralCode) {
        if (name == null || name.isBlank() || email == null || email.isBlank()) {
            throw new IllegalArgumentException("Name and email are required");
        }
        String normalizedEmail = email.trim().toLowerCase(Locale.ROOT);
        if (accountRepository.existsByEmail(normalizedEmail)) {
            throw LedgerException.of(LedgerErrorCode.INVALID_STATE, "Email already registered: %s", normalizedEmail);
        }

        String referredBy = resolveReferrer(referralCode);
        String ownCode = referenceGenerator.referralCode(accountRepository::existsByReferralCode);

        WalletAccount account = WalletAccount.register(
            UUID.randomUUID(), name.trim(), normalizedEmail, blankToNull(phone), ownCode, referredBy);
        try {
            accountRepository.insert(account);
        } catch (DuplicateKeyException e) {
            // a concurrent registration with the same email committed first
            if (isEmailConflict(e)) {
                throw LedgerException.of(LedgerErrorCode.INVALID_STATE, "Email already registered: %s", normalizedEmail);
            }
            throw e;
        }
        outboxService.saveEvent(AccountRegisteredEvent.fromAccount(account));

        log.info("Account registered: accountId={}, referralCode={}, referredBy={}",
            account.getId(), ownCode, referredBy);
        return account;
    }

    @Transactional(readOnly = true)
    public WalletAccount getAccount(UUID accountId) {
        return accountRepository.findById(accountId)
            .orElseThrow(() -> LedgerException.of(LedgerErrorCode.NOT_FOUND, "User not found: %s", accountId));
    }

    /**
     * Blocks or unblocks an account. A blocked account fails every balance guard,
     * including as a transfer recipient.
     */
    @Transactional
    public WalletAccount setBlocked(UUID adminId, UUID accountId, boolean blocked) {
        if (!accountRepository.setBlocked(accountId, blocked)) {
            throw LedgerException.of(LedgerErrorCode.NOT_FOUND, "User not found: %s", accountId);
        }
        log.info("Account {} by admin {}: accountId={}", blocked ? "blocked" : "unblocked", adminId, accountId);
        return getAccount(accountId);
    }

    private String resolveReferrer(String referralCode) {
        if (referralCode == null || referralCode.isBlank()) {
            return null;
        }
        String code = referralCode.trim().toUpperCase(Locale.ROOT);
        WalletAccount referrer = accountRepository.findByReferralCode(code)
            .orElseThrow(() -> LedgerException.of(LedgerErrorCode.NOT_FOUND, "Referral code not found: %s", code));
        if (referrer.isBlocked()) {
            log.info("Referral code {} belongs to a blocked account, not attributing", code);
            return null;
        }
        return code;
    }

    private static boolean isEmailConflict(DuplicateKeyException e) {
        String message = e.getMostSpecificCause().getMessage();
        return message != null && message.contains(EMAIL_UNIQUE_CONSTRAINT);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
