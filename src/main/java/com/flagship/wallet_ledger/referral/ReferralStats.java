package com.flagship.wallet_ledger.referral;

import com.flagship.wallet_ledger.ledger.WalletAccount;
import lombok.Value;

import java.util.List;

@Value
public class ReferralStats {
    String referralCode;
    long totalReferrals;
    long coinsEarnedFromReferrals;
    List<WalletAccount> recentReferrals;
}
