package com.flagship.wallet_ledger.ledger;

import com.flagship.wallet_ledger.error.LedgerErrorCode;
import com.flagship.wallet_ledger.error.LedgerException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceGeneratorTest {

    private static final Instant FIXED = Instant.parse("2026-01-15T10:00:00Z");

    private final ReferenceGenerator generator =
        new ReferenceGenerator(Clock.fixed(FIXED, ZoneOffset.UTC), 5);

    @Test
    @DisplayName("Referral codes are REF plus eight unambiguous characters")
    void referralCodeFormat() {
        for (int i = 0; i < 200; i++) {
            String code = generator.referralCode(candidate -> false);
            assertTrue(code.matches("REF[A-HJ-NP-Z2-9]{8}"), "Unexpected code: " + code);
        }
    }

    @Test
    @DisplayName("Payment references carry the clock millis and six digits")
    void paymentReferenceFormat() {
        String reference = generator.paymentReference(candidate -> false);

        assertTrue(reference.matches("PAY_" + FIXED.toEpochMilli() + "_\\d{6}"), "Unexpected reference: " + reference);
    }

    @Test
    @DisplayName("Collisions are retried until a free value is found")
    void retriesOnCollision() {
        AtomicInteger attempts = new AtomicInteger();
        Set<String> seen = new HashSet<>();

        String code = generator.referralCode(candidate -> {
            seen.add(candidate);
            return attempts.incrementAndGet() < 3;
        });

        assertEquals(3, attempts.get());
        assertTrue(seen.contains(code));
    }

    @Test
    @DisplayName("Gives up with GENERATION_EXHAUSTED after the configured attempts")
    void exhaustion() {
        AtomicInteger attempts = new AtomicInteger();

        LedgerException e = assertThrows(LedgerException.class,
            () -> generator.paymentReference(candidate -> {
                attempts.incrementAndGet();
                return true;
            }));

        assertEquals(LedgerErrorCode.GENERATION_EXHAUSTED, e.getCode());
        assertEquals(5, attempts.get());
    }

    @Test
    @DisplayName("At least one attempt must be allowed")
    void rejectsZeroAttempts() {
        assertThrows(IllegalArgumentException.class, () -> new ReferenceGenerator(Clock.systemUTC(), 0));
    }
}
