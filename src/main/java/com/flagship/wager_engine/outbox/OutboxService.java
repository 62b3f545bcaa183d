package com.flagship.wager_engine.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.wager_engine.event.WagerEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Transactional outbox of bet, round and wallet events.
 *
 * Writers join the settlement, registration or reconciliation transaction, so an event
 * exists exactly when the balance change it describes committed. {@link OutboxPublisher}
 * drains the table afterwards.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;

    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(WagerEvent event) {
        return saveEvent(event.getAggregateType(), event.getAggregateId(), event.getEventType(), event);
    }

    /**
     * Appends an event inside the caller's transaction.
     *
     * @param aggregateType Bet, Round or Transaction; decides the Kafka topic
     * @param aggregateId   Kafka record key
     * @param payload       serialized as JSON
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(String aggregateType, UUID aggregateId, String eventType, Object payload) {
        OutboxEvent event = OutboxEvent.create(aggregateType, aggregateId, eventType, toJson(payload));
        OutboxEventEntity saved = repository.save(OutboxEventEntity.fromDomain(event));

        log.debug("Outbox append: {} {} {}", eventType, aggregateType, aggregateId);
        return saved.toDomain();
    }

    /**
     * Claims up to {@code limit} events that still have retries left. Rows claimed by a
     * concurrent publisher are skipped.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> claimBatch(int limit, int maxRetries) {
        return repository.claimPublishable(limit, maxRetries).stream()
            .map(OutboxEventEntity::toDomain)
            .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        OutboxEventEntity entity = load(eventId);
        entity.markPublished(Instant.now());
        repository.save(entity);
    }

    /**
     * Records a failed publish.
     *
     * @return true if the event has no retries left and is now a dead letter
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean markFailed(UUID eventId, String error, int maxRetries) {
        OutboxEventEntity entity = load(eventId);
        boolean deadLettered = entity.recordFailure(error, maxRetries);
        repository.save(entity);

        if (deadLettered) {
            log.error("Outbox event {} ({} {}) dead-lettered after {} attempts: {}",
                eventId, entity.getEventType(), entity.getAggregateId(), entity.getRetryCount(), error);
        } else {
            log.warn("Outbox event {} failed attempt #{}: {}", eventId, entity.getRetryCount(), error);
        }
        return deadLettered;
    }

    /**
     * Events of one bet, round or transaction in the order they were written.
     */
    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForAggregate(String aggregateType, UUID aggregateId) {
        return repository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(aggregateType, aggregateId)
            .stream()
            .map(OutboxEventEntity::toDomain)
            .toList();
    }

    private OutboxEventEntity load(UUID eventId) {
        return repository.findById(eventId)
            .orElseThrow(() -> new IllegalArgumentException("Unknown outbox event: " + eventId));
    }

    private String toJson(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Event payload is not serializable: " + payload.getClass().getSimpleName(), e);
        }
    }
}
