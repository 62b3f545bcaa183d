package com.flagship.wager_engine.transaction;

import com.flagship.wager_engine.exception.DuplicateProofException;
import com.flagship.wager_engine.observability.GameMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.Optional;

/**
 * Double-spend barrier for external payment proofs.
 *
 * Strategy:
 * 1. Redis fast-path: proofs already consumed by a committed transaction are cached
 * 2. Database lookup: the unique external_proof column is the source of truth
 * 3. Concurrent first submissions are settled by the unique constraint at insert time
 *
 * Redis being unavailable only costs the fast path.
 */
@Service
@Slf4j
public class IdempotencyGuard {

    private static final String REDIS_KEY_PREFIX = "proof:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final LedgerTransactionPersistenceService persistenceService;
    private final Optional<StringRedisTemplate> redisTemplate;
    private final GameMetrics metrics;

    public IdempotencyGuard(LedgerTransactionPersistenceService persistenceService,
                            Optional<StringRedisTemplate> redisTemplate,
                            GameMetrics metrics) {
        this.persistenceService = persistenceService;
        this.redisTemplate = redisTemplate;
        this.metrics = metrics;
    }

    /**
     * Checks whether a proof can still be used.
     *
     * @return the existing PENDING transaction holding this proof, or empty if the proof is unseen
     * @throws DuplicateProofException if the proof is held by a CONFIRMED or FAILED transaction
     */
    public Optional<LedgerTransaction> checkProof(String proof) {
        if (proof == null || proof.isBlank()) {
            throw new IllegalArgumentException("External proof cannot be null or blank");
        }

        if (isCachedAsConsumed(proof)) {
            log.debug("Proof found in Redis: {}", proof);
            throw duplicate(proof);
        }

        Optional<LedgerTransaction> existing = persistenceService.findByExternalProof(proof);
        if (existing.isEmpty()) {
            return Optional.empty();
        }

        LedgerTransaction tx = existing.get();
        if (tx.isTerminal()) {
            cacheConsumed(proof);
            throw duplicate(proof);
        }
        log.debug("Proof {} is held by pending transaction {}", proof, tx.getId());
        return existing;
    }

    /**
     * Rejects any proof that is already held by a transaction, pending or not.
     */
    public void requireUnused(String proof) {
        if (checkProof(proof).isPresent()) {
            throw duplicate(proof);
        }
    }

    /**
     * Records that a proof was consumed. The Redis entry is written only after the
     * surrounding transaction commits, so a rollback never leaves a false positive.
     */
    public void markConsumed(String proof) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    cacheConsumed(proof);
                }
            });
        } else {
            cacheConsumed(proof);
        }
    }

    private boolean isCachedAsConsumed(String proof) {
        if (redisTemplate.isEmpty()) {
            return false;
        }
        try {
            return Boolean.TRUE.equals(redisTemplate.get().hasKey(REDIS_KEY_PREFIX + proof));
        } catch (Exception e) {
            log.warn("Redis lookup failed for proof {}. Falling back to database. Error: {}",
                    proof, e.getMessage());
            return false;
        }
    }

    private void cacheConsumed(String proof) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + proof, "1", REDIS_TTL);
        } catch (Exception e) {
            log.debug("Failed to cache proof in Redis: {}", e.getMessage());
        }
    }

    private DuplicateProofException duplicate(String proof) {
        metrics.incrementDuplicateProofs();
        return new DuplicateProofException("External proof already used: " + proof);
    }
}
