package com.flagship.wager_engine.game.poker;

import com.flagship.wager_engine.exception.InvalidPhaseException;
import com.flagship.wager_engine.exception.ResourceNotFoundException;
import com.flagship.wager_engine.game.BetStatus;
import com.flagship.wager_engine.game.RoundPhase;
import com.flagship.wager_engine.support.IntegrationTestBase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

class VideoPokerSessionServiceTest extends IntegrationTestBase {

    @Autowired
    private VideoPokerSessionService pokerService;

    @Test
    @DisplayName("Drawing into four of a kind pays 22x")
    void testWinningDraw() {
        // Given
        String player = fundedPlayer("100");
        when(outcomeGenerator.shuffledDeck())
            .thenReturn(HandEvaluatorTest.cards("JC JD 4H 7S 9C JH JS 2D 3D 5D 6D"));
        PokerSessionView dealt = pokerService.init(player, new BigDecimal("10"));
        assertEquals(List.of("JC", "JD", "4H", "7S", "9C"), dealt.getHand());
        assertEquals(RoundPhase.IN_PROGRESS, dealt.getPhase());

        // When
        PokerSessionView drawn = pokerService.draw(dealt.getSessionId(), List.of(true, true, false, false, true));

        // Then
        assertEquals(PokerHand.FOUR_OF_A_KIND, drawn.getHandRank());
        assertEquals(BetStatus.WON, drawn.getStatus());
        assertAmount("220", drawn.getWinAmount());
        assertAmount("310", ledgerService.getBalance(player).getBalance());
        assertAmount("0", ledgerService.getBalance(player).getLockedBalance());
    }

    @Test
    @DisplayName("A hand below jacks or better loses the stake")
    void testLosingDraw() {
        String player = fundedPlayer("100");
        when(outcomeGenerator.shuffledDeck())
            .thenReturn(HandEvaluatorTest.cards("2C 4D 6H 8S TC 3D 5D 7D 9D KD"));
        PokerSessionView dealt = pokerService.init(player, new BigDecimal("10"));
        assertEquals(dealt.getSessionId(), pokerService.fetch(player).getSessionId());

        PokerSessionView drawn = pokerService.draw(dealt.getSessionId(), List.of(true, true, true, true, true));

        assertEquals(PokerHand.NOTHING, drawn.getHandRank());
        assertEquals(BetStatus.LOST, drawn.getStatus());
        assertAmount("90", ledgerService.getBalance(player).getBalance());
        assertThrows(InvalidPhaseException.class,
            () -> pokerService.draw(dealt.getSessionId(), List.of(true, true, true, true, true)));
        assertThrows(ResourceNotFoundException.class, () -> pokerService.fetch(player));
    }

    @Test
    @DisplayName("A second session is rejected while one waits for its draw")
    void testOneActiveSession() {
        String player = fundedPlayer("100");
        when(outcomeGenerator.shuffledDeck()).thenReturn(Card.fullDeck());
        pokerService.init(player, new BigDecimal("10"));

        assertThrows(InvalidPhaseException.class, () -> pokerService.init(player, new BigDecimal("10")));
    }

    @Test
    @DisplayName("Concurrent deals for one player yield a single session")
    void testConcurrentCreate() throws InterruptedException {
        String player = fundedPlayer("100");
        when(outcomeGenerator.shuffledDeck())
            .thenReturn(HandEvaluatorTest.cards("2C 4D 6H 8S TC 3D 5D 7D 9D KD"));
        int threads = 5;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger created = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    pokerService.init(player, new BigDecimal("10"));
                    created.incrementAndGet();
                } catch (InvalidPhaseException e) {
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

        assertEquals(1, created.get());
        assertEquals(threads - 1, rejected.get());
        assertAmount("10", ledgerService.getBalance(player).getLockedBalance());
    }
}
