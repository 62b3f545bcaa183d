package com.flagship.wager_engine.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Refreshes the gauges backed by database queries and flags money stuck between states:
 * bets a resolved round never settled, and withdrawals signed without a stored hash.
 */
@Component
@ConditionalOnProperty(name = "metrics.refresh.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final LedgerGauges ledgerGauges;
    private final Timer refreshTimer;

    public MetricsScheduler(OutboxMetrics outboxMetrics, LedgerGauges ledgerGauges, MeterRegistry meterRegistry) {
        this.outboxMetrics = outboxMetrics;
        this.ledgerGauges = ledgerGauges;
        this.refreshTimer = Timer.builder("metrics.refresh.duration")
                .description("Time spent reloading database-backed gauges")
                .register(meterRegistry);
    }

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshGauges() {
        refreshTimer.record(() -> {
            outboxMetrics.refreshMetrics();
            ledgerGauges.refresh();
        });

        long unsettled = ledgerGauges.settlementBacklog();
        if (unsettled > 0) {
            log.warn("{} open bets belong to resolved rounds", unsettled);
        }
        long awaitingHash = ledgerGauges.withdrawalsAwaitingHash();
        if (awaitingHash > 0) {
            log.warn("{} signed withdrawals are waiting for their transfer hash", awaitingHash);
        }
    }
}
