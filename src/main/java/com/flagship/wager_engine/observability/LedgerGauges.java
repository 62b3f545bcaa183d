package com.flagship.wager_engine.observability;

import com.flagship.wager_engine.game.BetRepository;
import com.flagship.wager_engine.transaction.LedgerTransactionRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Gauges over money in flight: stakes of open bets, transactions awaiting external
 * confirmation, bets left open by a resolved round and signed withdrawals missing their hash.
 * Refreshed by {@link MetricsScheduler}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerGauges {

    private final BetRepository betRepository;
    private final LedgerTransactionRepository transactionRepository;
    private final MeterRegistry meterRegistry;

    private final AtomicReference<BigDecimal> openStake = new AtomicReference<>(BigDecimal.ZERO);
    private final AtomicLong pendingTransactions = new AtomicLong(0);
    private final AtomicLong settlementBacklog = new AtomicLong(0);
    private final AtomicLong withdrawalsAwaitingHash = new AtomicLong(0);

    @PostConstruct
    public void init() {
        Gauge.builder("bets.open.stake", openStake, ref -> ref.get().doubleValue())
                .description("Sum of stakes locked by open bets")
                .register(meterRegistry);

        Gauge.builder("transactions.pending", pendingTransactions, AtomicLong::get)
                .description("Transactions waiting for external confirmation")
                .register(meterRegistry);

        Gauge.builder("settlement.backlog", settlementBacklog, AtomicLong::get)
                .description("Open bets whose round is already resolved")
                .register(meterRegistry);

        Gauge.builder("withdrawals.awaiting_hash", withdrawalsAwaitingHash, AtomicLong::get)
                .description("Signed withdrawals whose transfer hash was never stored")
                .register(meterRegistry);
    }

    @Transactional(readOnly = true)
    public void refresh() {
        try {
            openStake.set(betRepository.sumOpenAmount());
            pendingTransactions.set(transactionRepository.countPending());
            settlementBacklog.set(betRepository.countOpenInResolvedRounds());
            withdrawalsAwaitingHash.set(transactionRepository.countSignedAwaitingProof());
        } catch (Exception e) {
            log.warn("Failed to refresh ledger gauges: {}", e.getMessage());
        }
    }

    public long settlementBacklog() {
        return settlementBacklog.get();
    }

    public long withdrawalsAwaitingHash() {
        return withdrawalsAwaitingHash.get();
    }
}
