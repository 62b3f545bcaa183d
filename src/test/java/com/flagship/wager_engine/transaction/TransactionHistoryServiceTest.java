package com.flagship.wager_engine.transaction;

import com.flagship.wager_engine.game.Bet;
import com.flagship.wager_engine.game.BetRegistry;
import com.flagship.wager_engine.game.GameType;
import com.flagship.wager_engine.game.Round;
import com.flagship.wager_engine.game.RoundPersistenceService;
import com.flagship.wager_engine.game.RoundPhase;
import com.flagship.wager_engine.game.SettlementEngine;
import com.flagship.wager_engine.game.SettlementRule;
import com.flagship.wager_engine.support.IntegrationTestBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TransactionHistoryServiceTest extends IntegrationTestBase {

    @Autowired
    private TransactionHistoryService historyService;

    @Autowired
    private BetRegistry betRegistry;

    @Autowired
    private RoundPersistenceService roundPersistenceService;

    @Autowired
    private SettlementEngine settlementEngine;

    private String player;

    @BeforeEach
    void playTwoRounds() {
        player = fundedPlayer("100");

        // 40 cashed out at 2.50
        Round won = roundPersistenceService.open(GameType.CRASH);
        Bet winning = betRegistry.register(won.getId(), player, new BigDecimal("40"), null, null, false);
        roundPersistenceService.advance(won, RoundPhase.COUNTDOWN, RoundPhase.RUNNING);
        settlementEngine.cashout(winning.getId(), new BigDecimal("2.50"));
        settlementEngine.resolveRound(won.getId(), new BigDecimal("3.00"), SettlementRule.allLose());

        // 20 lost
        Round lost = roundPersistenceService.open(GameType.CRASH);
        betRegistry.register(lost.getId(), player, new BigDecimal("20"), null, null, false);
        roundPersistenceService.advance(lost, RoundPhase.COUNTDOWN, RoundPhase.RUNNING);
        settlementEngine.resolveRound(lost.getId(), new BigDecimal("1.10"), SettlementRule.allLose());
    }

    @Test
    @DisplayName("Statistics aggregate the settled bets")
    void testStatistics() {
        TransactionStatistics stats = historyService.statistics(player);

        assertEquals(2, stats.getTotalBets());
        assertEquals(1, stats.getWins());
        assertEquals(1, stats.getLosses());
        assertAmount("60", stats.getTotalWagered());
        assertAmount("100", stats.getTotalWon());
        assertAmount("40", stats.getNetProfit());
        assertAmount("50.00", stats.getWinRate());
        assertAmount("30", stats.getAverageBet());
        assertAmount("60", stats.getBiggestWin());
        assertAmount("20", stats.getBiggestLoss());
    }

    @Test
    @DisplayName("History lists newest first and filters by type")
    void testHistory() {
        List<TransactionView> all = historyService.history(player, 50, 0, null, null);
        List<TransactionView> cashouts = historyService.history(player, 50, 0, TransactionType.CASHOUT, null);
        List<TransactionView> page = historyService.history(player, 1, 1, null, GameType.CRASH);

        assertEquals(3, all.size());
        assertEquals(TransactionType.BET, all.get(0).getType());
        assertAmount("20", all.get(0).getAmount());
        assertEquals(1, cashouts.size());
        assertAmount("100", cashouts.get(0).getWinAmount());
        assertEquals(1, page.size());
        assertEquals(TransactionType.CASHOUT, page.get(0).getType());
    }

    @Test
    void testStatisticsOfNewPlayer() {
        TransactionStatistics stats = historyService.statistics(newPlayer());

        assertEquals(0, stats.getTotalBets());
        assertAmount("0", stats.getWinRate());
    }

    @Test
    void testRejectsBadPaging() {
        assertThrows(IllegalArgumentException.class, () -> historyService.history(player, 0, 0, null, null));
        assertThrows(IllegalArgumentException.class, () -> historyService.history(player, 101, 0, null, null));
        assertThrows(IllegalArgumentException.class, () -> historyService.history(player, 10, -1, null, null));
    }
}
