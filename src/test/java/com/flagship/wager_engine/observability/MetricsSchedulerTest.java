package com.flagship.wager_engine.observability;

import com.flagship.wager_engine.game.BetRegistry;
import com.flagship.wager_engine.game.GameType;
import com.flagship.wager_engine.game.Round;
import com.flagship.wager_engine.game.RoundPersistenceService;
import com.flagship.wager_engine.support.IntegrationTestBase;
import com.flagship.wager_engine.transaction.LedgerTransaction;
import com.flagship.wager_engine.transaction.LedgerTransactionPersistenceService;
import com.flagship.wager_engine.wallet.WithdrawalService;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Database-backed gauges after a refresh. Publishing is disabled in tests, so every saved
 * event stays in the backlog.
 */
class MetricsSchedulerTest extends IntegrationTestBase {

    @Autowired
    private MetricsScheduler metricsScheduler;

    @Autowired
    private MeterRegistry meterRegistry;

    @Autowired
    private BetRegistry betRegistry;

    @Autowired
    private RoundPersistenceService roundPersistenceService;

    @Autowired
    private WithdrawalService withdrawalService;

    @Autowired
    private LedgerTransactionPersistenceService transactionPersistenceService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private double gauge(String name, String... tags) {
        return meterRegistry.get(name).tags(tags).gauge().value();
    }

    @Test
    @DisplayName("Bet events count toward the game stream backlog")
    void testBacklogPerStream() {
        String player = fundedPlayer("50");
        Round round = roundPersistenceService.open(GameType.CRASH);
        betRegistry.register(round.getId(), player, new BigDecimal("5"), null, null, false);

        metricsScheduler.refreshGauges();

        assertTrue(gauge("wager.events.backlog", "stream", "game") >= 1);
        assertTrue(gauge("wager.events.backlog.age.seconds") >= 0);
        assertTrue(gauge("bets.open.stake") >= 5);
    }

    @Test
    @DisplayName("A bet left open by a resolved round shows up as settlement backlog")
    void testSettlementBacklog() {
        String player = fundedPlayer("50");
        Round round = roundPersistenceService.open(GameType.CRASH);
        betRegistry.register(round.getId(), player, new BigDecimal("5"), null, null, false);
        jdbcTemplate.update("UPDATE rounds SET phase = 'RESOLVED' WHERE id = ?", round.getId());

        metricsScheduler.refreshGauges();

        assertTrue(gauge("settlement.backlog") >= 1);
    }

    @Test
    @DisplayName("A signed withdrawal without a stored hash is counted")
    void testWithdrawalsAwaitingHash() {
        String player = fundedPlayer("50");
        LedgerTransaction withdrawal = withdrawalService.request(player, new BigDecimal("5"), newPlayer());
        jdbcTemplate.update("UPDATE ledger_transactions SET signed_at = CURRENT_TIMESTAMP WHERE id = ?",
            withdrawal.getId());
        assertTrue(transactionPersistenceService.findById(withdrawal.getId()).orElseThrow().isSigned());

        metricsScheduler.refreshGauges();

        assertTrue(gauge("withdrawals.awaiting_hash") >= 1);
        assertTrue(meterRegistry.get("metrics.refresh.duration").timer().count() >= 1);
    }
}
