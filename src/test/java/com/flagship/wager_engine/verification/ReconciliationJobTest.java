package com.flagship.wager_engine.verification;

import com.flagship.wager_engine.support.IntegrationTestBase;
import com.flagship.wager_engine.transaction.LedgerTransaction;
import com.flagship.wager_engine.transaction.LedgerTransactionPersistenceService;
import com.flagship.wager_engine.transaction.TransactionStatus;
import com.flagship.wager_engine.transaction.TransactionType;
import com.flagship.wager_engine.wallet.WithdrawalService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

/**
 * Integration tests for ReconciliationJob: pending proofs are confirmed or expired exactly once,
 * and withdrawals that never got a proof release their lock.
 */
class ReconciliationJobTest extends IntegrationTestBase {

    @Autowired
    private ReconciliationJob reconciliationJob;

    @Autowired
    private LedgerTransactionPersistenceService transactionPersistenceService;

    @Autowired
    private WithdrawalService withdrawalService;

    private LedgerTransaction pendingDeposit(String player, String amount, String proof) {
        return transactionPersistenceService.save(LedgerTransaction.deposit(player, new BigDecimal(amount), proof, false));
    }

    private void onLedger(String proof, String from, String to, String amount) {
        when(externalLedgerClient.fetchTransaction(anyString(), eq(proof)))
            .thenReturn(Optional.of(new ExternalTransactionRecord(proof, from, to, new BigDecimal(amount), true)));
    }

    @Test
    @DisplayName("Pending deposit is credited once the ledger confirms it")
    void testConfirmDeposit() {
        // Given
        String player = newPlayer();
        String proof = "late-" + UUID.randomUUID();
        LedgerTransaction tx = pendingDeposit(player, "40", proof);
        onLedger(proof, player, HOUSE, "40");

        // When
        reconciliationJob.reconcile();
        reconciliationJob.reconcile();

        // Then
        assertEquals(TransactionStatus.CONFIRMED, transactionPersistenceService.findById(tx.getId()).orElseThrow().getStatus());
        assertAmount("40", ledgerService.getBalance(player).getBalance());
    }

    @Test
    @DisplayName("Unconfirmed deposit stays pending")
    void testStillPending() {
        String player = newPlayer();
        String proof = "unknown-" + UUID.randomUUID();
        LedgerTransaction tx = pendingDeposit(player, "40", proof);

        reconciliationJob.reconcile();

        assertEquals(TransactionStatus.PENDING, transactionPersistenceService.findById(tx.getId()).orElseThrow().getStatus());
        assertAmount("0", ledgerService.getBalance(player).getBalance());
    }

    @Test
    @DisplayName("Deposit older than the max age expires without credit")
    void testExpireDeposit() {
        String player = newPlayer();
        String proof = "old-" + UUID.randomUUID();
        Instant created = Instant.now().minus(Duration.ofMinutes(30));
        LedgerTransaction old = new LedgerTransaction(UUID.randomUUID(), player, TransactionType.DEPOSIT,
            TransactionStatus.PENDING, new BigDecimal("40"), null, proof, null, null, null, null, null, created, created);
        transactionPersistenceService.save(old);
        onLedger(proof, player, HOUSE, "40");

        reconciliationJob.reconcile();

        LedgerTransaction expired = transactionPersistenceService.findById(old.getId()).orElseThrow();
        assertEquals(TransactionStatus.FAILED, expired.getStatus());
        assertNotNull(expired.getFailureReason());
        assertAmount("0", ledgerService.getBalance(player).getBalance());
    }

    @Test
    @DisplayName("Confirmed withdrawal leaves the balance and releases the lock")
    void testConfirmWithdrawal() {
        // Given
        String player = fundedPlayer("100");
        String destination = newPlayer();
        LedgerTransaction tx = withdrawalService.request(player, new BigDecimal("30"), destination);
        String proof = "out-" + UUID.randomUUID();
        withdrawalService.attachProof(tx.getId(), proof);
        onLedger(proof, HOUSE, destination, "30");

        // When
        reconciliationJob.reconcile();

        // Then
        assertEquals(TransactionStatus.CONFIRMED, transactionPersistenceService.findById(tx.getId()).orElseThrow().getStatus());
        assertAmount("70", ledgerService.getBalance(player).getBalance());
        assertAmount("0", ledgerService.getBalance(player).getLockedBalance());
    }

    private LedgerTransaction oldWithdrawal(String player, String amount, String proof, Instant signedAt) {
        ledgerService.lock(player, new BigDecimal(amount));
        Instant created = Instant.now().minus(Duration.ofMinutes(30));
        return transactionPersistenceService.save(new LedgerTransaction(UUID.randomUUID(), player,
            TransactionType.WITHDRAWAL, TransactionStatus.PENDING, new BigDecimal(amount), null, proof,
            null, null, newPlayer(), null, signedAt, created, created));
    }

    @Test
    @DisplayName("Expired withdrawal with a proof fails and releases the locked amount")
    void testExpireWithdrawal() {
        // Given
        String player = fundedPlayer("100");
        LedgerTransaction tx = oldWithdrawal(player, "30", "stale-" + UUID.randomUUID(), Instant.now());
        assertAmount("30", ledgerService.getBalance(player).getLockedBalance());

        // When
        reconciliationJob.reconcile();

        // Then
        assertEquals(TransactionStatus.FAILED, transactionPersistenceService.findById(tx.getId()).orElseThrow().getStatus());
        assertAmount("100", ledgerService.getBalance(player).getBalance());
        assertAmount("0", ledgerService.getBalance(player).getLockedBalance());
    }

    @Test
    @DisplayName("Withdrawal that never received a proof expires and releases the locked amount")
    void testExpireWithdrawalWithoutProof() {
        String player = fundedPlayer("100");
        LedgerTransaction tx = oldWithdrawal(player, "25", null, null);

        reconciliationJob.reconcile();
        reconciliationJob.reconcile();

        LedgerTransaction expired = transactionPersistenceService.findById(tx.getId()).orElseThrow();
        assertEquals(TransactionStatus.FAILED, expired.getStatus());
        assertTrue(expired.getFailureReason().startsWith("No proof attached"));
        assertAmount("100", ledgerService.getBalance(player).getBalance());
        assertAmount("0", ledgerService.getBalance(player).getLockedBalance());
    }

    @Test
    @DisplayName("Signed withdrawal without a proof keeps its lock until the hash is attached")
    void testSignedWithdrawalWaitsForHash() {
        String player = fundedPlayer("100");
        LedgerTransaction tx = oldWithdrawal(player, "25", null, Instant.now().minus(Duration.ofMinutes(29)));

        reconciliationJob.reconcile();

        assertEquals(TransactionStatus.PENDING, transactionPersistenceService.findById(tx.getId()).orElseThrow().getStatus());
        assertAmount("25", ledgerService.getBalance(player).getLockedBalance());
    }

    @Test
    @DisplayName("The external ledger is queried with no store transaction open")
    void testVerifiesOutsideTransaction() {
        String player = newPlayer();
        String proof = "late-" + UUID.randomUUID();
        LedgerTransaction tx = pendingDeposit(player, "15", proof);
        AtomicBoolean transactionOpen = new AtomicBoolean(true);
        when(externalLedgerClient.fetchTransaction(anyString(), eq(proof))).thenAnswer(inv -> {
            transactionOpen.set(TransactionSynchronizationManager.isActualTransactionActive());
            return Optional.of(new ExternalTransactionRecord(proof, player, HOUSE, new BigDecimal("15"), true));
        });

        reconciliationJob.reconcile();

        assertFalse(transactionOpen.get());
        assertEquals(TransactionStatus.CONFIRMED, transactionPersistenceService.findById(tx.getId()).orElseThrow().getStatus());
        assertAmount("15", ledgerService.getBalance(player).getBalance());
    }

    @Test
    @DisplayName("A pass started while another runs is skipped")
    void testOverlappingPassSkipped() throws Exception {
        // Given - the first pass blocks inside the external ledger lookup
        String player = newPlayer();
        String proof = "slow-" + UUID.randomUUID();
        LedgerTransaction tx = pendingDeposit(player, "20", proof);
        CountDownLatch inLookup = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(externalLedgerClient.fetchTransaction(anyString(), eq(proof))).thenAnswer(inv -> {
            inLookup.countDown();
            release.await(30, TimeUnit.SECONDS);
            return Optional.of(new ExternalTransactionRecord(proof, player, HOUSE, new BigDecimal("20"), true));
        });
        ExecutorService executor = Executors.newSingleThreadExecutor();
        Future<ReconciliationSummary> first = executor.submit(() -> reconciliationJob.reconcile());
        assertTrue(inLookup.await(30, TimeUnit.SECONDS));

        // When
        ReconciliationSummary overlapping = reconciliationJob.reconcile();
        release.countDown();
        ReconciliationSummary completed = first.get(30, TimeUnit.SECONDS);
        executor.shutdown();

        // Then
        assertEquals(0, overlapping.getExamined());
        assertTrue(completed.getConfirmed() >= 1);
        assertEquals(TransactionStatus.CONFIRMED, transactionPersistenceService.findById(tx.getId()).orElseThrow().getStatus());
        assertAmount("20", ledgerService.getBalance(player).getBalance());
    }
}
