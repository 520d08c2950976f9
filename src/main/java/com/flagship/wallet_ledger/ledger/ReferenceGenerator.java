package com.flagship.wallet_ledger.ledger;

import com.flagship.wallet_ledger.error.LedgerErrorCode;
import com.flagship.wallet_ledger.error.LedgerException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Generates store-unique codes (referral codes, deposit payment references).
 *
 * Candidates are drawn at random and checked against the store; the unique
 * constraint on the column is the final arbiter. Gives up after a bounded
 * number of attempts instead of looping forever.
 */
@Component
@Slf4j
public class ReferenceGenerator {

    private static final String ALPHANUMERIC = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";
    private static final int REFERRAL_SUFFIX_LENGTH = 8;

    private final SecureRandom random = new SecureRandom();
    private final Clock clock;
    private final int maxAttempts;

    @Autowired
    public ReferenceGenerator(@Value("${wallet.referral.code-max-attempts:5}") int maxAttempts) {
        this(Clock.systemUTC(), maxAttempts);
    }

    ReferenceGenerator(Clock clock, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.clock = clock;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Referral code of the form {@code REF} followed by eight unambiguous alphanumerics.
     */
    public String referralCode(Predicate<String> alreadyTaken) {
        return generate("referral code", this::referralCandidate, alreadyTaken);
    }

    /**
     * Payment reference of the form {@code PAY_<epochMillis>_<6 digits>}.
     */
    public String paymentReference(Predicate<String> alreadyTaken) {
        return generate("payment reference", this::paymentReferenceCandidate, alreadyTaken);
    }

    String generate(String what, Supplier<String> candidates, Predicate<String> alreadyTaken) {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String candidate = candidates.get();
            if (!alreadyTaken.test(candidate)) {
                return candidate;
            }
            log.debug("Generated {} collided on attempt {}: {}", what, attempt, candidate);
        }
        log.error("Could not generate a unique {} after {} attempts", what, maxAttempts);
        throw LedgerException.of(LedgerErrorCode.GENERATION_EXHAUSTED,
            "Could not generate a unique %s after %d attempts", what, maxAttempts);
    }

    private String referralCandidate() {
        StringBuilder code = new StringBuilder("REF");
        for (int i = 0; i < REFERRAL_SUFFIX_LENGTH; i++) {
            code.append(ALPHANUMERIC.charAt(random.nextInt(ALPHANUMERIC.length())));
        }
        return code.toString();
    }

    private String paymentReferenceCandidate() {
        return String.format("PAY_%d_%06d", clock.millis(), random.nextInt(1_000_000));
    }
}
