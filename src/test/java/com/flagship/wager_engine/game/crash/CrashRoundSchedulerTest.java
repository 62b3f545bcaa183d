package com.flagship.wager_engine.game.crash;

import com.flagship.wager_engine.exception.InvalidPhaseException;
import com.flagship.wager_engine.exception.RoundAlreadyResolvedException;
import com.flagship.wager_engine.game.Bet;
import com.flagship.wager_engine.game.BetRegistry;
import com.flagship.wager_engine.game.BetStatus;
import com.flagship.wager_engine.game.RoundPhase;
import com.flagship.wager_engine.game.Settlement;
import com.flagship.wager_engine.support.IntegrationTestBase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

/**
 * Drives crash rounds through the virtual timer: countdown 5s, ticks of 0.01 every 100ms,
 * cooldown 5s.
 */
class CrashRoundSchedulerTest extends IntegrationTestBase {

    private static final Duration COUNTDOWN = Duration.ofMillis(5000);
    private static final Duration COOLDOWN = Duration.ofMillis(5000);

    @Autowired
    private CrashRoundScheduler scheduler;

    @Autowired
    private BetRegistry betRegistry;

    @BeforeEach
    void setUp() {
        timer.clear();
        assertEquals(RoundPhase.IDLE, scheduler.currentPhase());
        when(outcomeGenerator.crashPoint()).thenReturn(new BigDecimal("1.05"));
    }

    @AfterEach
    void tearDown() {
        // Finish whatever round is left so the next test starts from IDLE
        timer.advance(Duration.ofMinutes(1));
        timer.clear();
    }

    private void ticks(int count) {
        timer.advance(Duration.ofMillis(100L * count));
    }

    @Test
    @DisplayName("First join opens a round; the countdown then starts the multiplier")
    void testRoundLifecycle() {
        String player = fundedPlayer("100");

        Bet bet = scheduler.join(player, new BigDecimal("40"), null, null);
        assertEquals(RoundPhase.COUNTDOWN, scheduler.currentPhase());
        assertEquals(1, scheduler.status().getPlayers());

        timer.advance(COUNTDOWN);
        assertEquals(RoundPhase.RUNNING, scheduler.currentPhase());
        ticks(2);
        assertAmount("1.02", scheduler.status().getMultiplier());

        ticks(3);
        assertEquals(RoundPhase.RESOLVED, scheduler.currentPhase());
        assertAmount("1.05", scheduler.history(1).get(0).getResult());
        assertEquals(BetStatus.LOST, betRegistry.findById(bet.getId()).orElseThrow().getStatus());
        assertAmount("60", ledgerService.getBalance(player).getBalance());

        timer.advance(COOLDOWN);
        assertEquals(RoundPhase.IDLE, scheduler.currentPhase());
    }

    @Test
    @DisplayName("Manual cashout pays at the multiplier of the last tick")
    void testManualCashout() {
        String player = fundedPlayer("100");
        scheduler.join(player, new BigDecimal("40"), null, null);
        timer.advance(COUNTDOWN);
        ticks(2);

        Settlement settlement = scheduler.cashout(player);

        assertAmount("1.02", settlement.getMultiplier());
        assertAmount("40.8", settlement.getWinAmount());
        assertAmount("100.8", ledgerService.getBalance(player).getBalance());
        assertAmount("0", ledgerService.getBalance(player).getLockedBalance());
    }

    @Test
    @DisplayName("A target is cashed out by the tick that reaches it")
    void testAutoCashout() {
        String reached = fundedPlayer("100");
        String missed = fundedPlayer("100");
        Bet autoBet = scheduler.join(reached, new BigDecimal("10"), new BigDecimal("1.03"), null);
        Bet highBet = scheduler.join(missed, new BigDecimal("10"), new BigDecimal("2.00"), null);

        timer.advance(COUNTDOWN);
        ticks(5);

        Bet auto = betRegistry.findById(autoBet.getId()).orElseThrow();
        assertEquals(BetStatus.CASHED_OUT, auto.getStatus());
        assertAmount("1.03", auto.getMultiplier());
        assertAmount("100.3", ledgerService.getBalance(reached).getBalance());
        assertEquals(BetStatus.LOST, betRegistry.findById(highBet.getId()).orElseThrow().getStatus());
        assertAmount("90", ledgerService.getBalance(missed).getBalance());
    }

    @Test
    @DisplayName("Bets are only taken during the countdown, cashouts only before the crash")
    void testPhaseRejections() {
        String early = fundedPlayer("100");
        String late = fundedPlayer("100");
        scheduler.join(early, new BigDecimal("10"), null, null);
        timer.advance(COUNTDOWN);

        assertThrows(InvalidPhaseException.class, () -> scheduler.join(late, new BigDecimal("10"), null, null));
        assertThrows(InvalidPhaseException.class, () -> scheduler.cashout(late));

        ticks(5);
        assertThrows(RoundAlreadyResolvedException.class, () -> scheduler.cashout(early));
        assertAmount("90", ledgerService.getBalance(early).getBalance());
        assertAmount("100", ledgerService.getBalance(late).getBalance());
    }

    @Test
    void testRejectsTargetBelowOne() {
        String player = fundedPlayer("100");

        assertThrows(IllegalArgumentException.class,
            () -> scheduler.join(player, new BigDecimal("10"), new BigDecimal("0.5"), null));
        assertEquals(RoundPhase.IDLE, scheduler.currentPhase());
    }
}
