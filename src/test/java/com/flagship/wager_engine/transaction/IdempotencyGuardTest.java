package com.flagship.wager_engine.transaction;

import com.flagship.wager_engine.exception.DuplicateProofException;
import com.flagship.wager_engine.observability.GameMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests for IdempotencyGuard with the Redis fast path healthy, failing and absent.
 */
class IdempotencyGuardTest {

    private static final String PLAYER = "PLAYERPLAYERPLAYERPLAYERPLAYERPLAYERPLAYERPLAYERPLAYERP";

    private LedgerTransactionPersistenceService persistenceService;
    private StringRedisTemplate redisTemplate;
    private ValueOperations<String, String> valueOps;
    private GameMetrics metrics;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        persistenceService = mock(LedgerTransactionPersistenceService.class);
        redisTemplate = mock(StringRedisTemplate.class);
        valueOps = mock(ValueOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        metrics = new GameMetrics(new SimpleMeterRegistry());
    }

    private IdempotencyGuard guard(Optional<StringRedisTemplate> redis) {
        return new IdempotencyGuard(persistenceService, redis, metrics);
    }

    @Test
    @DisplayName("Proof cached in Redis is rejected without a database lookup")
    void testRedisHit() {
        when(redisTemplate.hasKey("proof:TX-1")).thenReturn(true);

        assertThrows(DuplicateProofException.class, () -> guard(Optional.of(redisTemplate)).checkProof("TX-1"));
        verifyNoInteractions(persistenceService);
    }

    @Test
    @DisplayName("Confirmed proof found in the database is rejected and cached")
    void testDatabaseHitIsCached() {
        // Given
        when(redisTemplate.hasKey(anyString())).thenReturn(false);
        when(persistenceService.findByExternalProof("TX-2"))
            .thenReturn(Optional.of(LedgerTransaction.deposit(PLAYER, BigDecimal.TEN, "TX-2", true)));

        // When / Then
        assertThrows(DuplicateProofException.class, () -> guard(Optional.of(redisTemplate)).checkProof("TX-2"));
        verify(valueOps).set(eq("proof:TX-2"), eq("1"), any(Duration.class));
    }

    @Test
    @DisplayName("Pending proof is handed back to the caller")
    void testPendingProofReturned() {
        LedgerTransaction pending = LedgerTransaction.deposit(PLAYER, BigDecimal.TEN, "TX-3", false);
        when(persistenceService.findByExternalProof("TX-3")).thenReturn(Optional.of(pending));

        Optional<LedgerTransaction> found = guard(Optional.of(redisTemplate)).checkProof("TX-3");

        assertEquals(pending.getId(), found.orElseThrow().getId());
        assertThrows(DuplicateProofException.class, () -> guard(Optional.of(redisTemplate)).requireUnused("TX-3"));
    }

    @Test
    @DisplayName("Redis failure falls back to the database")
    void testRedisDownFallsBackToDatabase() {
        // Given
        when(redisTemplate.hasKey(anyString())).thenThrow(new RedisConnectionFailureException("connection refused"));
        doThrow(new RedisConnectionFailureException("connection refused"))
            .when(valueOps).set(anyString(), anyString(), any(Duration.class));
        when(persistenceService.findByExternalProof("TX-4")).thenReturn(Optional.empty());
        when(persistenceService.findByExternalProof("TX-5"))
            .thenReturn(Optional.of(LedgerTransaction.deposit(PLAYER, BigDecimal.TEN, "TX-5", true)));
        IdempotencyGuard guard = guard(Optional.of(redisTemplate));

        // When / Then
        assertTrue(guard.checkProof("TX-4").isEmpty());
        assertThrows(DuplicateProofException.class, () -> guard.checkProof("TX-5"));
        assertDoesNotThrow(() -> guard.markConsumed("TX-4"));
    }

    @Test
    @DisplayName("Without Redis only the database decides")
    void testNoRedis() {
        when(persistenceService.findByExternalProof("TX-6")).thenReturn(Optional.empty());

        IdempotencyGuard guard = guard(Optional.empty());

        assertTrue(guard.checkProof("TX-6").isEmpty());
        guard.markConsumed("TX-6");
        verifyNoInteractions(redisTemplate);
    }

    @Test
    @DisplayName("Blank proof is rejected")
    void testBlankProof() {
        assertThrows(IllegalArgumentException.class, () -> guard(Optional.empty()).checkProof(" "));
    }
}
