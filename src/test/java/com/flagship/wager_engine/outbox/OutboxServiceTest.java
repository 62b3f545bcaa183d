package com.flagship.wager_engine.outbox;

import com.flagship.wager_engine.game.Bet;
import com.flagship.wager_engine.game.BetRegistry;
import com.flagship.wager_engine.game.GameType;
import com.flagship.wager_engine.game.Round;
import com.flagship.wager_engine.game.RoundPersistenceService;
import com.flagship.wager_engine.game.RoundPhase;
import com.flagship.wager_engine.game.SettlementEngine;
import com.flagship.wager_engine.game.SettlementRule;
import com.flagship.wager_engine.support.IntegrationTestBase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for the transactional outbox.
 */
class OutboxServiceTest extends IntegrationTestBase {

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    @Autowired
    private BetRegistry betRegistry;

    @Autowired
    private SettlementEngine settlementEngine;

    @Autowired
    private RoundPersistenceService roundPersistenceService;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @Test
    @DisplayName("Placing and settling a bet writes BetPlaced then BetSettled")
    void testBetEventsInOrder() {
        // Given
        String player = fundedPlayer("100");
        Round round = roundPersistenceService.open(GameType.CRASH);
        Bet bet = betRegistry.register(round.getId(), player, new BigDecimal("25"), null, null, false);
        assertTrue(roundPersistenceService.advance(round, RoundPhase.COUNTDOWN, RoundPhase.RUNNING));

        // When
        settlementEngine.cashout(bet.getId(), new BigDecimal("2.00"));

        // Then
        List<OutboxEvent> events = outboxService.getEventsForAggregate("Bet", bet.getId());
        assertEquals(List.of("BetPlaced", "BetSettled"),
            events.stream().map(OutboxEvent::getEventType).toList());
        assertTrue(events.get(1).getPayload().contains("CASHED_OUT"));
        assertTrue(events.get(0).getSequenceNumber() < events.get(1).getSequenceNumber());
    }

    @Test
    @DisplayName("A round resolved twice has a single RoundResolved event")
    void testRoundResolvedOnce() {
        // Given
        Round round = roundPersistenceService.open(GameType.CRASH);
        assertTrue(roundPersistenceService.advance(round, RoundPhase.COUNTDOWN, RoundPhase.RUNNING));

        // When
        settlementEngine.resolveRound(round.getId(), new BigDecimal("1.50"), SettlementRule.allLose());
        settlementEngine.resolveRound(round.getId(), new BigDecimal("1.50"), SettlementRule.allLose());

        // Then
        List<OutboxEvent> events = outboxService.getEventsForAggregate("Round", round.getId());
        assertEquals(1, events.size());
        assertEquals("RoundResolved", events.get(0).getEventType());
    }

    @Test
    @DisplayName("Saving outside a transaction is rejected")
    void testSaveRequiresTransaction() {
        assertThrows(IllegalTransactionStateException.class,
            () -> outboxService.saveEvent("Round", UUID.randomUUID(), "RoundResolved", Map.of()));
    }

    @Test
    @DisplayName("Failed publishes bump the retry count until the event becomes a dead letter")
    void testRetriesThenDeadLetter() {
        // Given
        UUID roundId = UUID.randomUUID();
        OutboxEvent saved = new TransactionTemplate(transactionManager).execute(status ->
            outboxService.saveEvent("Round", roundId, "RoundResolved", Map.of("result", "2.00")));

        // When
        boolean firstDead = outboxService.markFailed(saved.getId(), "broker unavailable", 2);
        boolean secondDead = outboxService.markFailed(saved.getId(), "broker unavailable", 2);

        // Then
        assertFalse(firstDead);
        assertTrue(secondDead);
        OutboxEventEntity failed = outboxEventRepository.findById(saved.getId()).orElseThrow();
        assertEquals(2, failed.getRetryCount());
        assertEquals("broker unavailable", failed.getLastError());
        assertNull(failed.getPublishedAt());
        assertTrue(outboxService.claimBatch(10_000, 2).stream().noneMatch(e -> e.getId().equals(saved.getId())));
    }

    @Test
    @DisplayName("A claimed event is published once")
    void testClaimAndPublish() {
        // Given
        UUID roundId = UUID.randomUUID();
        OutboxEvent saved = new TransactionTemplate(transactionManager).execute(status ->
            outboxService.saveEvent("Round", roundId, "RoundResolved", Map.of("result", "3.10")));
        assertTrue(outboxService.claimBatch(10_000, 5).stream().anyMatch(e -> e.getId().equals(saved.getId())));

        // When
        outboxService.markPublished(saved.getId());

        // Then
        assertTrue(outboxService.getEventsForAggregate("Round", roundId).get(0).isPublished());
        assertTrue(outboxService.claimBatch(10_000, 5).stream().noneMatch(e -> e.getId().equals(saved.getId())));
        assertThrows(IllegalStateException.class, () -> outboxService.markPublished(saved.getId()));
    }
}
