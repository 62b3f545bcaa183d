package com.flagship.wager_engine.observability;

import com.flagship.wager_engine.outbox.OutboxEvent;
import com.flagship.wager_engine.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics of the event streams leaving through the outbox: round and bet events on the game
 * stream, transaction finalizations on the wallet stream.
 *
 * Backlog gauges are tagged by stream and read cached values that {@link MetricsScheduler}
 * refreshes, so a scrape never queries the database.
 */
@Component
@Slf4j
public class OutboxMetrics {

    /** Stream tag of an outbox event; follows the topic the event is published to. */
    enum Stream {
        GAME, WALLET;

        static Stream of(OutboxEvent event) {
            return event.isWalletEvent() ? WALLET : GAME;
        }

        static Stream ofAggregate(String aggregateType) {
            return OutboxEvent.isWalletAggregate(aggregateType) ? WALLET : GAME;
        }

        String tag() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final OutboxEventRepository outboxRepository;
    private final MeterRegistry meterRegistry;
    private final int maxRetries;

    private final Map<Stream, AtomicLong> backlog = new EnumMap<>(Stream.class);
    private final AtomicLong oldestPendingSeconds = new AtomicLong();
    private final AtomicLong deadLettered = new AtomicLong();

    public OutboxMetrics(OutboxEventRepository outboxRepository,
                         MeterRegistry meterRegistry,
                         @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
        this.outboxRepository = outboxRepository;
        this.meterRegistry = meterRegistry;
        this.maxRetries = maxRetries;
        for (Stream stream : Stream.values()) {
            backlog.put(stream, new AtomicLong());
        }
    }

    @PostConstruct
    public void init() {
        backlog.forEach((stream, count) ->
            Gauge.builder("wager.events.backlog", count, AtomicLong::get)
                .description("Events waiting to be published, per stream")
                .tag("stream", stream.tag())
                .register(meterRegistry));

        Gauge.builder("wager.events.backlog.age.seconds", oldestPendingSeconds, AtomicLong::get)
            .description("Age of the oldest event still waiting to be published")
            .register(meterRegistry);

        Gauge.builder("wager.events.dead_letter", deadLettered, AtomicLong::get)
            .description("Events that used up their publish retries")
            .register(meterRegistry);
    }

    /**
     * Reloads the backlog gauges. Failures keep the previous values.
     */
    @Transactional(readOnly = true)
    public void refreshMetrics() {
        try {
            Map<Stream, Long> pending = new EnumMap<>(Stream.class);
            for (Object[] row : outboxRepository.countPendingByAggregateType(maxRetries)) {
                pending.merge(Stream.ofAggregate((String) row[0]), ((Number) row[1]).longValue(), Long::sum);
            }
            backlog.forEach((stream, count) -> count.set(pending.getOrDefault(stream, 0L)));

            oldestPendingSeconds.set(outboxRepository.findOldestPendingCreatedAt(maxRetries)
                .map(oldest -> Math.max(0, Duration.between(oldest, Instant.now()).getSeconds()))
                .orElse(0L));
            deadLettered.set(outboxRepository.countDeadLettered(maxRetries));

            log.debug("Event backlog refreshed: {}, oldest={}s, deadLetter={}",
                pending, oldestPendingSeconds.get(), deadLettered.get());
        } catch (Exception e) {
            log.warn("Failed to refresh event backlog metrics: {}", e.getMessage());
        }
    }

    public void recordPublished(OutboxEvent event) {
        published(event, "success");
    }

    public void recordPublishFailed(OutboxEvent event) {
        published(event, "failure");
    }

    public void recordDeadLettered(OutboxEvent event) {
        meterRegistry.counter("wager.events.dead_lettered",
            "stream", Stream.of(event).tag(),
            "event_type", event.getEventType()
        ).increment();
    }

    private void published(OutboxEvent event, String result) {
        meterRegistry.counter("wager.events.published",
            "stream", Stream.of(event).tag(),
            "event_type", event.getEventType(),
            "result", result
        ).increment();
    }
}
