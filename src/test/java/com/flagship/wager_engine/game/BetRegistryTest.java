package com.flagship.wager_engine.game;

import com.flagship.wager_engine.exception.DuplicateBetException;
import com.flagship.wager_engine.exception.DuplicateProofException;
import com.flagship.wager_engine.exception.InsufficientFundsException;
import com.flagship.wager_engine.exception.InvalidPhaseException;
import com.flagship.wager_engine.support.IntegrationTestBase;
import com.flagship.wager_engine.transaction.LedgerTransaction;
import com.flagship.wager_engine.transaction.LedgerTransactionPersistenceService;
import com.flagship.wager_engine.transaction.TransactionStatus;
import com.flagship.wager_engine.transaction.TransactionType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class BetRegistryTest extends IntegrationTestBase {

    @Autowired
    private BetRegistry betRegistry;

    @Autowired
    private RoundPersistenceService roundPersistenceService;

    @Autowired
    private LedgerTransactionPersistenceService transactionPersistenceService;

    @Test
    @DisplayName("Registration locks the stake and records an open bet")
    void testRegister() {
        // Given
        String player = fundedPlayer("100");
        Round round = roundPersistenceService.open(GameType.CRASH);

        // When
        Bet bet = betRegistry.register(round.getId(), player, new BigDecimal("25"), new BigDecimal("2.00"), null, false);

        // Then
        assertEquals(BetStatus.OPEN, bet.getStatus());
        assertEquals(GameType.CRASH, bet.getGameType());
        assertAmount("25", ledgerService.getBalance(player).getLockedBalance());
        assertAmount("75", ledgerService.getBalance(player).getAvailableBalance());
        assertEquals(1, betRegistry.openBets(round.getId()).size());
        assertTrue(betRegistry.findBet(round.getId(), player).isPresent());
    }

    @Test
    @DisplayName("Registration outside the betting phase is rejected without locking")
    void testWrongPhase() {
        String player = fundedPlayer("100");
        Round round = roundPersistenceService.open(GameType.SLIDE);

        assertThrows(InvalidPhaseException.class, () ->
            betRegistry.register(round.getId(), player, new BigDecimal("10"), null, null, false));
        assertAmount("0", ledgerService.getBalance(player).getLockedBalance());
    }

    @Test
    @DisplayName("Second bet of a player on the same round is rejected")
    void testDuplicateBet() {
        String player = fundedPlayer("100");
        Round round = roundPersistenceService.open(GameType.CRASH);
        betRegistry.register(round.getId(), player, new BigDecimal("10"), null, null, false);

        assertThrows(DuplicateBetException.class, () ->
            betRegistry.register(round.getId(), player, new BigDecimal("10"), null, null, false));
        assertAmount("10", ledgerService.getBalance(player).getLockedBalance());
    }

    @Test
    @DisplayName("Stake above the available balance is rejected")
    void testInsufficientFunds() {
        String player = fundedPlayer("30");
        Round round = roundPersistenceService.open(GameType.CRASH);

        assertThrows(InsufficientFundsException.class, () ->
            betRegistry.register(round.getId(), player, new BigDecimal("30.01"), null, null, false));
        assertTrue(betRegistry.findBet(round.getId(), player).isEmpty());
    }

    @Test
    @DisplayName("A proof backs one bet only")
    void testDuplicateProof() {
        String first = fundedPlayer("100");
        String second = fundedPlayer("100");
        String proof = "bet-proof-" + UUID.randomUUID();
        Round round = roundPersistenceService.open(GameType.CRASH);

        Bet bet = betRegistry.register(round.getId(), first, new BigDecimal("10"), null, proof, true);

        LedgerTransaction tx = transactionPersistenceService.findByExternalProof(proof).orElseThrow();
        assertEquals(TransactionType.BET, tx.getType());
        assertEquals(TransactionStatus.CONFIRMED, tx.getStatus());
        assertEquals(bet.getId(), tx.getBetId());
        assertThrows(DuplicateProofException.class, () ->
            betRegistry.register(round.getId(), second, new BigDecimal("10"), null, proof, true));
    }

    @Test
    @DisplayName("Unverified proof is recorded as pending")
    void testPendingProof() {
        String player = fundedPlayer("100");
        String proof = "bet-proof-" + UUID.randomUUID();
        Round round = roundPersistenceService.open(GameType.CRASH);

        betRegistry.register(round.getId(), player, new BigDecimal("10"), null, proof, false);

        assertEquals(TransactionStatus.PENDING,
            transactionPersistenceService.findByExternalProof(proof).orElseThrow().getStatus());
    }

    @Test
    @DisplayName("A player's open session bet is found by game")
    void testFindOpenBet() {
        String player = fundedPlayer("100");
        Round round = roundPersistenceService.open(GameType.MINES);
        Bet bet = betRegistry.register(round.getId(), player, new BigDecimal("5"), null, null, false);

        assertEquals(bet.getId(), betRegistry.findOpenBet(player, GameType.MINES).orElseThrow().getId());
        assertTrue(betRegistry.findOpenBet(player, GameType.VIDEO_POKER).isEmpty());
    }
}
