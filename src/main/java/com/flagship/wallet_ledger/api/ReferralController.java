package com.flagship.wallet_ledger.api;

import com.flagship.wallet_ledger.api.dto.ReferralStatsResponse;
import com.flagship.wallet_ledger.api.dto.ReferralValidationResponse;
import com.flagship.wallet_ledger.identity.CurrentUserProvider;
import com.flagship.wallet_ledger.referral.ReferralService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/referrals")
@RequiredArgsConstructor
public class ReferralController {

    private final ReferralService referralService;
    private final CurrentUserProvider currentUser;

    @GetMapping("/stats")
    public ResponseEntity<ReferralStatsResponse> stats() {
        return ResponseEntity.ok(ReferralStatsResponse.from(referralService.stats(currentUser.currentUserId())));
    }

    /**
     * Lets the sign-up form check a code before submitting. Unauthenticated.
     */
    @GetMapping("/validate")
    public ResponseEntity<ReferralValidationResponse> validate(@RequestParam("code") String code) {
        return ResponseEntity.ok(referralService.validateReferralCode(code)
            .map(referrer -> new ReferralValidationResponse(true, referrer.getName()))
            .orElseGet(() -> new ReferralValidationResponse(false, null)));
    }
}
