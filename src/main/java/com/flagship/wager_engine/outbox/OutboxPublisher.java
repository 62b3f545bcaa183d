package com.flagship.wager_engine.outbox;

import com.flagship.wager_engine.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drains the outbox to Kafka.
 *
 * Bet and round events go to the game events topic and transaction events to the wallet
 * events topic, keyed by aggregate id so one bet's BetPlaced and BetSettled share a
 * partition. Delivery is at-least-once: an event is marked only after the broker acked it.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.game-events:game-events}")
    private String gameEventsTopic;

    @Value("${kafka.topic.wallet-events:wallet-events}")
    private String walletEventsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Value("${outbox.publisher.send-timeout-ms:10000}")
    private long sendTimeoutMs;

    @Scheduled(fixedDelayString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        List<OutboxEvent> batch;
        try {
            batch = outboxService.claimBatch(batchSize, maxRetries);
        } catch (RuntimeException e) {
            log.error("Could not claim outbox events", e);
            return;
        }
        if (!batch.isEmpty()) {
            log.debug("Publishing {} outbox events", batch.size());
        }
        for (OutboxEvent event : batch) {
            publish(event);
        }
    }

    String getTopicForEvent(OutboxEvent event) {
        return event.isWalletEvent() ? walletEventsTopic : gameEventsTopic;
    }

    private void publish(OutboxEvent event) {
        String topic = getTopicForEvent(event);
        try {
            RecordMetadata ack = kafkaTemplate.send(topic, event.getAggregateId().toString(), event.getPayload())
                .get(sendTimeoutMs, TimeUnit.MILLISECONDS)
                .getRecordMetadata();
            outboxService.markPublished(event.getId());
            outboxMetrics.recordPublished(event);
            log.debug("{} {} -> {}-{}@{}", event.getEventType(), event.getAggregateId(),
                ack.topic(), ack.partition(), ack.offset());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failed(event, "interrupted");
        } catch (ExecutionException | TimeoutException e) {
            Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
            failed(event, cause.getClass().getSimpleName() + ": " + cause.getMessage());
        }
    }

    private void failed(OutboxEvent event, String error) {
        outboxMetrics.recordPublishFailed(event);
        if (outboxService.markFailed(event.getId(), error, maxRetries)) {
            outboxMetrics.recordDeadLettered(event);
        }
    }
}
