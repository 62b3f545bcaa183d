package com.flagship.wager_engine.ledger;

import com.flagship.wager_engine.exception.InsufficientFundsException;
import com.flagship.wager_engine.support.IntegrationTestBase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.IllegalTransactionStateException;

import java.math.BigDecimal;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tries to break the locked-balance invariant {@code 0 <= locked <= balance}.
 */
class LedgerServiceTest extends IntegrationTestBase {

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Test
    @DisplayName("Unknown address is created with a zero balance on first lookup")
    void testBalanceOfUnknownAddress() {
        String player = newPlayer();

        BalanceSnapshot snapshot = ledgerService.getBalance(player);

        assertAmount("0", snapshot.getBalance());
        assertAmount("0", snapshot.getLockedBalance());
        assertAmount("0", snapshot.getAvailableBalance());
    }

    @Test
    @DisplayName("Lock reserves part of the balance without changing it")
    void testLockReducesAvailable() {
        String player = fundedPlayer("100");

        ledgerService.lock(player, new BigDecimal("40"));

        BalanceSnapshot snapshot = ledgerService.getBalance(player);
        assertAmount("100", snapshot.getBalance());
        assertAmount("40", snapshot.getLockedBalance());
        assertAmount("60", snapshot.getAvailableBalance());
    }

    @Test
    @DisplayName("Locking more than the available balance fails and locks nothing")
    void testLockBeyondAvailable() {
        String player = fundedPlayer("100");
        ledgerService.lock(player, new BigDecimal("70"));

        assertThrows(InsufficientFundsException.class,
                () -> ledgerService.lock(player, new BigDecimal("30.00000001")));

        assertAmount("70", ledgerService.getBalance(player).getLockedBalance());
    }

    @Test
    @DisplayName("Unlocking more than is locked is rejected")
    void testUnlockBeyondLocked() {
        String player = fundedPlayer("100");
        ledgerService.lock(player, new BigDecimal("10"));

        assertThrows(IllegalStateException.class, () -> ledgerService.unlock(player, new BigDecimal("11")));
        assertAmount("10", ledgerService.getBalance(player).getLockedBalance());
    }

    @Test
    @DisplayName("Debit cannot take locked funds")
    void testDebitRespectsLock() {
        String player = fundedPlayer("100");
        ledgerService.lock(player, new BigDecimal("80"));

        assertThrows(InsufficientFundsException.class, () -> ledgerService.debit(player, new BigDecimal("21")));

        ledgerService.debit(player, new BigDecimal("20"));
        BalanceSnapshot snapshot = ledgerService.getBalance(player);
        assertAmount("80", snapshot.getBalance());
        assertAmount("80", snapshot.getLockedBalance());
    }

    @Test
    @DisplayName("Settling a locked stake releases it and applies the payout in one step")
    void testSettleLocked() {
        String player = fundedPlayer("100");
        ledgerService.lock(player, new BigDecimal("40"));

        ledgerService.settleLocked(player, new BigDecimal("40"), new BigDecimal("100"));

        BalanceSnapshot snapshot = ledgerService.getBalance(player);
        assertAmount("160", snapshot.getBalance());
        assertAmount("0", snapshot.getLockedBalance());
    }

    @Test
    @DisplayName("Database rejects a row with more locked than balance")
    void testCheckConstraint() {
        String player = fundedPlayer("10");

        assertThrows(DataIntegrityViolationException.class, () -> jdbcTemplate.update(
                "UPDATE users SET locked_balance = 11 WHERE address = ?", player));
    }

    @Test
    @DisplayName("Concurrent locks never reserve more than the balance")
    void testConcurrentLocks() throws InterruptedException {
        String player = fundedPlayer("100");
        int threads = 10;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger succeeded = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    ledgerService.lock(player, new BigDecimal("20"));
                    succeeded.incrementAndGet();
                } catch (InsufficientFundsException e) {
                    rejected.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertTrue(done.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        assertEquals(5, succeeded.get());
        assertEquals(5, rejected.get());
        assertAmount("100", ledgerService.getBalance(player).getLockedBalance());
    }

    @Test
    @DisplayName("Player row lock is only taken inside a caller's transaction")
    void testLockPlayerRequiresTransaction() {
        String player = newPlayer();

        assertThrows(IllegalTransactionStateException.class, () -> ledgerService.lockPlayer(player));
    }
}
