package com.flagship.wallet_ledger.scenario;

import com.flagship.wallet_ledger.error.LedgerErrorCode;
import com.flagship.wallet_ledger.error.LedgerException;
import com.flagship.wallet_ledger.ledger.AccountService;
import com.flagship.wallet_ledger.ledger.WalletAccount;
import com.flagship.wallet_ledger.movement.MoneyMovementService;
import com.flagship.wallet_ledger.movement.StatusTransitionService;
import com.flagship.wallet_ledger.movement.deposit.Deposit;
import com.flagship.wallet_ledger.movement.deposit.DepositMethod;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Many threads racing on one account. The row lock serialises them, so the
 * number of successful debits is exactly what the balance can cover and the
 * balance never goes negative.
 */
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers
class ConcurrentDebitTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("wallet_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.datasource.hikari.maximum-pool-size", () -> "20");
    }

    private static final int THREADS = 10;

    @Autowired
    private AccountService accountService;

    @Autowired
    private MoneyMovementService movementService;

    @Autowired
    private StatusTransitionService statusTransitionService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private WalletAccount fundedAccount(String balance) {
        WalletAccount account = accountService.register("Racer", "racer-" + UUID.randomUUID() + "@example.com",
            null, null);
        jdbcTemplate.update("UPDATE users SET wallet_balance = ? WHERE id = ?", new BigDecimal(balance), account.getId());
        return account;
    }

    /**
     * Runs {@code task} on {@link #THREADS} threads released at the same moment and
     * counts outcomes by error code, "ok" for success.
     */
    private Map<String, AtomicInteger> race(Runnable task) throws InterruptedException {
        Map<String, AtomicInteger> outcomes = new ConcurrentHashMap<>();
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(THREADS);
        ExecutorService executor = Executors.newFixedThreadPool(THREADS);

        for (int i = 0; i < THREADS; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    task.run();
                    outcomes.computeIfAbsent("ok", k -> new AtomicInteger()).incrementAndGet();
                } catch (LedgerException e) {
                    outcomes.computeIfAbsent(e.getCode().reason(), k -> new AtomicInteger()).incrementAndGet();
                } catch (Exception e) {
                    outcomes.computeIfAbsent("unexpected", k -> new AtomicInteger()).incrementAndGet();
                    e.printStackTrace();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(60, TimeUnit.SECONDS), "Racers did not finish in time");
        executor.shutdown();
        System.out.println("Outcomes: " + outcomes);
        return outcomes;
    }

    private static int count(Map<String, AtomicInteger> outcomes, String key) {
        AtomicInteger value = outcomes.get(key);
        return value == null ? 0 : value.get();
    }

    @Test
    @DisplayName("Ten 20.00 purchases against 100.00: exactly five succeed")
    void concurrentPurchases() throws InterruptedException {
        printTestHeader("Concurrent purchases");

        WalletAccount user = fundedAccount("100.00");
        UUID productId = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO products (id, name, type, price, provider_code, is_active) VALUES (?, ?, ?, ?, ?, ?)",
            productId, "Data 20k", "DATA", new BigDecimal("20.00"), "XL", true);

        Map<String, AtomicInteger> outcomes = race(
            () -> movementService.createPurchase(user.getId(), productId, "0817000000"));

        assertEquals(5, count(outcomes, "ok"));
        assertEquals(5, count(outcomes, LedgerErrorCode.INSUFFICIENT_BALANCE.reason()));
        assertEquals(0, count(outcomes, "unexpected"));
        assertEquals(0, new BigDecimal("0.00").compareTo(accountService.getAccount(user.getId()).getBalance()));

        Integer rows = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM transactions WHERE user_id = ?", Integer.class, user.getId());
        assertEquals(5, rows, "One transaction row per successful debit");
    }

    @Test
    @DisplayName("Ten deliveries of the same deposit callback credit once")
    void concurrentCallbackReplays() throws InterruptedException {
        printTestHeader("Concurrent callback replays");

        WalletAccount user = fundedAccount("0.00");
        Deposit deposit = movementService.createDeposit(user.getId(), new BigDecimal("75.00"), DepositMethod.VIRTUAL_ACCOUNT);

        Map<String, AtomicInteger> outcomes = race(
            () -> statusTransitionService.applyDepositCallback(deposit.getPaymentReference(), "success"));

        assertEquals(1, count(outcomes, "ok"));
        assertEquals(THREADS - 1, count(outcomes, LedgerErrorCode.ALREADY_PROCESSED.reason()));
        assertEquals(new BigDecimal("75.00"), accountService.getAccount(user.getId()).getBalance());
    }

    @Test
    @DisplayName("Concurrent coin exchanges never overdraw coins")
    void concurrentCoinExchanges() throws InterruptedException {
        WalletAccount user = fundedAccount("0.00");
        jdbcTemplate.update("UPDATE users SET coins = 350 WHERE id = ?", user.getId());

        Map<String, AtomicInteger> outcomes = race(() -> movementService.exchangeCoins(user.getId(), 100));

        assertEquals(3, count(outcomes, "ok"));
        assertEquals(7, count(outcomes, LedgerErrorCode.INSUFFICIENT_COINS.reason()));
        WalletAccount after = accountService.getAccount(user.getId());
        assertEquals(50, after.getCoins());
        assertEquals(new BigDecimal("30.00"), after.getBalance());
    }

    @Test
    @DisplayName("Ten registrations with one email: one account, nine INVALID_STATE, no storage error")
    void concurrentDuplicateRegistrations() throws InterruptedException {
        printTestHeader("Concurrent duplicate registrations");

        String email = "twin-" + UUID.randomUUID() + "@example.com";

        Map<String, AtomicInteger> outcomes = race(() -> accountService.register("Twin", email, null, null));

        assertEquals(1, count(outcomes, "ok"));
        assertEquals(THREADS - 1, count(outcomes, LedgerErrorCode.INVALID_STATE.reason()));
        assertEquals(0, count(outcomes, "unexpected"));
        Integer rows = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM users WHERE email = ?", Integer.class, email);
        assertEquals(1, rows);
    }
}
