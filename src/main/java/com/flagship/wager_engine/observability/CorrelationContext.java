package com.flagship.wager_engine.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC keys the engine logs with, and the correlation ID of the work running on the
 * current thread.
 *
 * HTTP requests take the ID from the {@value #CORRELATION_ID_HEADER} header or get a fresh
 * one; channel messages always get a fresh one. Settlement adds bet and round IDs for the
 * duration of one bet.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String BET_ID_MDC_KEY = "betId";
    public static final String ROUND_ID_MDC_KEY = "roundId";
    public static final String ADDRESS_MDC_KEY = "address";

    private CorrelationContext() {
    }

    /**
     * Starts a unit of work on this thread.
     *
     * @param requestedId ID supplied by the caller, or null/blank for a fresh one
     * @param address     player the work is for, or null
     * @return the correlation ID in effect
     */
    public static String open(String requestedId, String address) {
        String id = requestedId == null || requestedId.isBlank() ? generateCorrelationId() : requestedId;
        MDC.put(CORRELATION_ID_MDC_KEY, id);
        if (address != null) {
            MDC.put(ADDRESS_MDC_KEY, address);
        }
        return id;
    }

    /**
     * Ends the unit of work, dropping every key {@link #open} or settlement put in MDC.
     */
    public static void close() {
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(BET_ID_MDC_KEY);
        MDC.remove(ROUND_ID_MDC_KEY);
        MDC.remove(ADDRESS_MDC_KEY);
    }

    private static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
