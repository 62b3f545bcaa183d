package com.flagship.wager_engine.observability;

import com.flagship.wager_engine.game.BetStatus;
import com.flagship.wager_engine.game.GameType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for the round engine.
 *
 * Metrics exposed:
 * - bets.registered: bets accepted, by game
 * - bets.settled: terminal bet transitions, by game and status
 * - cashout.race.lost: cashouts rejected because resolution won
 * - proofs.duplicate: external proofs rejected as reused
 * - verification.attempts: external verification attempts, by result
 * - reconciliation.outcomes: reconciled transactions, by outcome
 * - wallet.deposits / wallet.withdrawals: wallet operations, by result
 * - rounds.duration: open-to-resolved duration, by game
 * - wager.latency: engine operation latency
 */
@Component
public class GameMetrics {

    private final MeterRegistry registry;

    private final Counter duplicateProofs;
    private final Timer settlementTimer;

    public GameMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.duplicateProofs = Counter.builder("proofs.duplicate")
                .description("Number of external proofs rejected as already used")
                .register(registry);

        this.settlementTimer = Timer.builder("settlement.duration")
                .description("Time taken to settle a single bet")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordBetRegistered(GameType gameType) {
        registry.counter("bets.registered",
                "game", gameType.name()
        ).increment();
    }

    public void recordBetSettled(GameType gameType, BetStatus status) {
        registry.counter("bets.settled",
                "game", gameType.name(),
                "status", status.name()
        ).increment();
    }

    /**
     * Records a cashout that lost the race against round resolution.
     */
    public void recordCashoutRaceLost(GameType gameType) {
        registry.counter("cashout.race.lost",
                "game", gameType.name()
        ).increment();
    }

    public void incrementDuplicateProofs() {
        duplicateProofs.increment();
    }

    public void recordVerificationAttempt(String endpoint, String result) {
        registry.counter("verification.attempts",
                "endpoint", sanitizeTag(endpoint),
                "result", sanitizeTag(result)
        ).increment();
    }

    public void recordReconciliation(String type, String outcome) {
        registry.counter("reconciliation.outcomes",
                "type", sanitizeTag(type),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordDeposit(String result) {
        registry.counter("wallet.deposits",
                "result", sanitizeTag(result)
        ).increment();
    }

    public void recordWithdrawal(String result) {
        registry.counter("wallet.withdrawals",
                "result", sanitizeTag(result)
        ).increment();
    }

    public void recordRoundDuration(GameType gameType, Duration duration) {
        registry.timer("rounds.duration",
                "game", gameType.name()
        ).record(duration);
    }

    public void recordSettlementDuration(Duration duration) {
        settlementTimer.record(duration);
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("wager.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
