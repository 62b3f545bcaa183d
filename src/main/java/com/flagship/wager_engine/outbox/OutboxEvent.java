package com.flagship.wager_engine.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A bet, round or wallet event waiting in the outbox.
 */
@Value
public class OutboxEvent {

    private static final String WALLET_AGGREGATE = "Transaction";

    UUID id;
    String aggregateType;
    UUID aggregateId;
    String eventType;
    String payload;
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;   // assigned on insert

    static OutboxEvent create(String aggregateType, UUID aggregateId, String eventType, String payload) {
        return new OutboxEvent(UUID.randomUUID(), aggregateType, aggregateId, eventType, payload,
            Instant.now(), null, 0, null, null);
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    /**
     * Deposits and withdrawals; everything else is game traffic.
     */
    public boolean isWalletEvent() {
        return isWalletAggregate(aggregateType);
    }

    public static boolean isWalletAggregate(String aggregateType) {
        return WALLET_AGGREGATE.equals(aggregateType);
    }
}
