package com.flagship.wallet_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wallet_ledger.ledger.WalletAccount;
import com.flagship.wallet_ledger.referral.ReferralStats;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class ReferralStatsResponse {

    @JsonProperty("referral_code")
    String referralCode;

    @JsonProperty("total_referrals")
    long totalReferrals;

    @JsonProperty("coins_earned")
    long coinsEarned;

    @JsonProperty("recent_referrals")
    List<ReferredUser> recentReferrals;

    public static ReferralStatsResponse from(ReferralStats stats) {
        return ReferralStatsResponse.builder()
            .referralCode(stats.getReferralCode())
            .totalReferrals(stats.getTotalReferrals())
            .coinsEarned(stats.getCoinsEarnedFromReferrals())
            .recentReferrals(stats.getRecentReferrals().stream().map(ReferredUser::from).toList())
            .build();
    }

    /**
     * Only name and join date: a referrer does not get to see the referred user's contact details.
     */
    @Value
    public static class ReferredUser {
        @JsonProperty("name")
        String name;

        @JsonProperty("joined_at")
        Instant joinedAt;

        static ReferredUser from(WalletAccount account) {
            return new ReferredUser(account.getName(), account.getCreatedAt());
        }
    }
}
