package com.flagship.wallet_ledger.referral;

import com.flagship.wallet_ledger.error.LedgerErrorCode;
import com.flagship.wallet_ledger.error.LedgerException;
import com.flagship.wallet_ledger.ledger.AccountRepository;
import com.flagship.wallet_ledger.ledger.WalletAccount;
import com.flagship.wallet_ledger.movement.MoneyMovementService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Referral rewards and statistics. Rewards go through the engine's coin credit;
 * this class never touches the coin column itself.
 */
@Service
@Slf4j
public class ReferralService {

    static final int RECENT_REFERRALS = 5;

    private final AccountRepository accountRepository;
    private final MoneyMovementService moneyMovementService;
    private final int rewardCoins;

    public ReferralService(AccountRepository accountRepository,
                           MoneyMovementService moneyMovementService,
                           @Value("${wallet.referral.reward-coins:50}") int rewardCoins) {
        this.accountRepository = accountRepository;
        this.moneyMovementService = moneyMovementService;
        this.rewardCoins = rewardCoins;
    }

    /**
     * Returns the referrer behind {@code code} if it exists and is not blocked.
     */
    @Transactional(readOnly = true)
    public Optional<WalletAccount> validateReferralCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        return accountRepository.findByReferralCode(code.trim().toUpperCase(Locale.ROOT))
            .filter(referrer -> !referrer.isBlocked());
    }

    /**
     * Credits the referral reward to the owner of {@code referrerCode}.
     *
     * Called once per registration event; replays are filtered out before this
     * point. A referrer that vanished or got blocked in the meantime earns nothing.
     *
     * @return coins awarded, 0 when no reward was due
     */
    @Transactional
    public int processReferralReward(String referrerCode, UUID newAccountId) {
        Optional<WalletAccount> referrer = validateReferralCode(referrerCode);
        if (referrer.isEmpty()) {
            log.info("No eligible referrer for code {}, account {} earns its referrer nothing",
                referrerCode, newAccountId);
            return 0;
        }
        moneyMovementService.creditCoins(referrer.get().getId(), rewardCoins, "referral of " + newAccountId);
        log.info("Referral reward credited: referrer={}, newAccount={}, coins={}",
            referrer.get().getId(), newAccountId, rewardCoins);
        return rewardCoins;
    }

    @Transactional(readOnly = true)
    public ReferralStats stats(UUID userId) {
        WalletAccount account = accountRepository.findById(userId)
            .orElseThrow(() -> LedgerException.of(LedgerErrorCode.NOT_FOUND, "User not found: %s", userId));
        long total = accountRepository.countByReferredBy(account.getReferralCode());
        return new ReferralStats(
            account.getReferralCode(),
            total,
            total * rewardCoins,
            accountRepository.findRecentByReferredBy(account.getReferralCode(), RECENT_REFERRALS)
        );
    }
}
