package com.flagship.wager_engine.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for events written to the outbox.
 *
 * All events share:
 * - Event ID for deduplication by consumers
 * - Aggregate ID, also used as the Kafka key
 * - Timestamp of when the event occurred
 */
public interface WagerEvent {

    UUID getEventId();

    /**
     * The bet, round or transaction this event is about.
     */
    UUID getAggregateId();

    Instant getOccurredAt();

    /**
     * Event type name for routing/filtering.
     */
    String getEventType();

    /**
     * Aggregate type name, used for topic routing.
     */
    String getAggregateType();
}
