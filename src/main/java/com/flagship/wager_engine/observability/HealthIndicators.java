package com.flagship.wager_engine.observability;

import com.flagship.wager_engine.outbox.OutboxEventRepository;
import com.flagship.wager_engine.transaction.LedgerTransactionRepository;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicators of the engine's dependencies.
 *
 * Redis only backs the proof cache, so its loss degrades the service without taking it down.
 */
public class HealthIndicators {

    private HealthIndicators() {
    }

    /**
     * Outbox backlog. A growing backlog means Kafka consumers see stale game state; dead
     * letters need an operator and are reported alongside.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;
        private final int maxRetries;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository,
                                     @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
            this.outboxRepository = outboxRepository;
            this.maxRetries = maxRetries;
        }

        @Override
        public Health health() {
            try {
                long backlog = outboxRepository.countPending(maxRetries);
                long deadLettered = outboxRepository.countDeadLettered(maxRetries);
                Health.Builder builder = backlog >= BACKLOG_CRITICAL_THRESHOLD ? Health.down()
                        : backlog >= BACKLOG_WARNING_THRESHOLD || deadLettered > 0 ? Health.status("WARNING")
                        : Health.up();
                return builder
                        .withDetail("backlogSize", backlog)
                        .withDetail("deadLettered", deadLettered)
                        .build();
            } catch (Exception e) {
                return Health.down(e).build();
            }
        }
    }

    /**
     * Transactions still waiting for external confirmation. Reported, never fatal:
     * reconciliation expires them.
     */
    @Component("pendingTransactionsHealth")
    public static class PendingTransactionsHealthIndicator implements HealthIndicator {

        private static final long PENDING_WARNING_THRESHOLD = 500;

        private final LedgerTransactionRepository transactionRepository;

        public PendingTransactionsHealthIndicator(LedgerTransactionRepository transactionRepository) {
            this.transactionRepository = transactionRepository;
        }

        @Override
        public Health health() {
            try {
                long pending = transactionRepository.countPending();
                Health.Builder builder = pending < PENDING_WARNING_THRESHOLD ? Health.up() : Health.status("WARNING");
                return builder.withDetail("pending", pending).build();
            } catch (Exception e) {
                return Health.down(e).build();
            }
        }
    }

    @Component("proofCacheHealth")
    public static class ProofCacheHealthIndicator implements HealthIndicator {

        private final ObjectProvider<StringRedisTemplate> redisTemplate;

        public ProofCacheHealthIndicator(ObjectProvider<StringRedisTemplate> redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            StringRedisTemplate template = redisTemplate.getIfAvailable();
            RedisConnectionFactory factory = template != null ? template.getConnectionFactory() : null;
            if (factory == null) {
                return Health.status("DEGRADED").withDetail("note", "Proof cache disabled, database lookups only").build();
            }
            try (RedisConnection connection = factory.getConnection()) {
                String pong = connection.ping();
                return "PONG".equals(pong)
                        ? Health.up().build()
                        : Health.status("DEGRADED").withDetail("response", String.valueOf(pong)).build();
            } catch (Exception e) {
                return Health.status("DEGRADED")
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }

    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                var metrics = kafkaTemplate.metrics();
                if (metrics.isEmpty()) {
                    return Health.down().withDetail("error", "No Kafka producer connection yet").build();
                }
                return Health.up().withDetail("metricsCount", metrics.size()).build();
            } catch (Exception e) {
                return Health.down(e).build();
            }
        }
    }
}
