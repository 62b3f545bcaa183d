package com.flagship.wager_engine.verification;

import com.flagship.wager_engine.exception.VerificationFailedException;
import com.flagship.wager_engine.ledger.PlayerAddress;
import com.flagship.wager_engine.observability.GameMetrics;
import com.flagship.wager_engine.transaction.IdempotencyGuard;
import com.flagship.wager_engine.transaction.LedgerTransaction;
import com.flagship.wager_engine.transaction.TransactionType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Confirms external payment proofs against the external ledger.
 *
 * Each attempt asks the endpoints in priority order, starting from the last one that answered,
 * and fails over to the next on a transport error. Attempts are repeated a fixed number of
 * times with a fixed delay. A transfer is accepted only when it is confirmed and its sender,
 * receiver and amount match the expectation (amounts within {@code verification.amount-tolerance}).
 */
@Service
@Slf4j
public class TransactionVerifier {

    private final ExternalLedgerClient ledgerClient;
    private final IdempotencyGuard idempotencyGuard;
    private final GameMetrics metrics;
    private final List<String> endpoints;
    private final int maxRetries;
    private final long retryDelayMs;
    private final BigDecimal amountTolerance;
    private final boolean allowUnverified;
    private final String houseAddress;
    private final AtomicInteger currentEndpoint = new AtomicInteger();

    public TransactionVerifier(ExternalLedgerClient ledgerClient,
                               IdempotencyGuard idempotencyGuard,
                               GameMetrics metrics,
                               Environment environment,
                               @Value("${verification.endpoints}") List<String> endpoints,
                               @Value("${verification.max-retries:2}") int maxRetries,
                               @Value("${verification.retry-delay-ms:3000}") long retryDelayMs,
                               @Value("${verification.amount-tolerance:0.0001}") BigDecimal amountTolerance,
                               @Value("${verification.allow-unverified:false}") boolean allowUnverified,
                               @Value("${verification.house-address:}") String houseAddress) {
        if (endpoints.isEmpty()) {
            throw new IllegalStateException("At least one verification endpoint must be configured");
        }
        if (allowUnverified && environment.acceptsProfiles(Profiles.of("prod"))) {
            throw new IllegalStateException("verification.allow-unverified must not be enabled in production");
        }
        this.ledgerClient = ledgerClient;
        this.idempotencyGuard = idempotencyGuard;
        this.metrics = metrics;
        this.endpoints = List.copyOf(endpoints);
        this.maxRetries = maxRetries;
        this.retryDelayMs = retryDelayMs;
        this.amountTolerance = amountTolerance;
        this.allowUnverified = allowUnverified;
        this.houseAddress = houseAddress.isBlank() ? "" : PlayerAddress.normalize(houseAddress);

        if (allowUnverified) {
            log.warn("Provisional acceptance of unverified proofs is ENABLED");
        }
    }

    /**
     * Admits a proof for a new bet or deposit.
     *
     * @return CONFIRMED if the external ledger confirmed the transfer, PROVISIONAL if it did not
     *         but provisional acceptance is enabled
     * @throws com.flagship.wager_engine.exception.DuplicateProofException if the proof is already held by a transaction
     * @throws VerificationFailedException if confirmation failed and provisional acceptance is disabled
     */
    public VerificationOutcome submit(String proof, ExpectedTransfer expected) {
        idempotencyGuard.requireUnused(proof);

        if (verify(proof, expected, maxRetries, retryDelayMs)) {
            return VerificationOutcome.CONFIRMED;
        }
        if (allowUnverified) {
            log.warn("Proof {} could not be verified, accepting provisionally", proof);
            return VerificationOutcome.PROVISIONAL;
        }
        throw new VerificationFailedException("Transaction " + proof + " could not be verified");
    }

    /**
     * Verifies a proof with the given retry policy.
     *
     * @return true if some attempt found a confirmed, matching transfer
     */
    public boolean verify(String proof, ExpectedTransfer expected, int retries, long delayMs) {
        for (int attempt = 0; attempt <= retries; attempt++) {
            if (attempt > 0) {
                log.info("Verification attempt {} for {} failed, retrying in {}ms", attempt, proof, delayMs);
                if (!pause(delayMs)) {
                    return false;
                }
            }
            if (verifyOnce(proof, expected)) {
                return true;
            }
        }
        log.warn("Transaction {} not verified after {} attempts", proof, retries + 1);
        return false;
    }

    /**
     * Broadcasts a signed transfer, failing over across endpoints.
     */
    public String broadcast(byte[] signedTransfer) {
        ExternalLedgerUnavailableException last = null;
        for (int i = 0; i < endpoints.size(); i++) {
            String endpoint = endpoints.get(currentEndpoint.get() % endpoints.size());
            try {
                return ledgerClient.broadcast(endpoint, signedTransfer);
            } catch (ExternalLedgerUnavailableException e) {
                last = e;
                rotateFrom(endpoint);
            }
        }
        throw new VerificationFailedException("All endpoints failed to broadcast the transfer", last);
    }

    /**
     * The transfer a stored transaction's proof must show: a withdrawal goes from the house to
     * its destination, anything else from the player to the house.
     */
    public ExpectedTransfer expectedFor(LedgerTransaction tx) {
        String house = houseAddress.isEmpty() ? null : houseAddress;
        if (tx.getType() == TransactionType.WITHDRAWAL) {
            return new ExpectedTransfer(house, tx.getDestination(), tx.getAmount());
        }
        return new ExpectedTransfer(tx.getAddress(), house, tx.getAmount());
    }

    public String getHouseAddress() {
        return houseAddress;
    }

    public boolean isAllowUnverified() {
        return allowUnverified;
    }

    private boolean verifyOnce(String proof, ExpectedTransfer expected) {
        for (int i = 0; i < endpoints.size(); i++) {
            String endpoint = endpoints.get(currentEndpoint.get() % endpoints.size());
            Optional<ExternalTransactionRecord> record;
            try {
                record = ledgerClient.fetchTransaction(endpoint, proof);
            } catch (ExternalLedgerUnavailableException e) {
                log.warn("Endpoint {} failed: {}", endpoint, e.getMessage());
                metrics.recordVerificationAttempt(endpoint, "error");
                rotateFrom(endpoint);
                continue;
            }

            if (record.isEmpty()) {
                metrics.recordVerificationAttempt(endpoint, "not_found");
                log.debug("Transaction {} not found on {}", proof, endpoint);
                return false;
            }
            boolean matched = matches(record.get(), expected);
            metrics.recordVerificationAttempt(endpoint, matched ? "verified" : "mismatch");
            if (!matched) {
                log.info("Transaction {} does not match: confirmed={}, from={}, to={}, amount={}",
                    proof, record.get().isConfirmed(), record.get().getFrom(), record.get().getTo(), record.get().getAmount());
            }
            return matched;
        }
        log.warn("All {} verification endpoints failed for {}", endpoints.size(), proof);
        return false;
    }

    private boolean matches(ExternalTransactionRecord record, ExpectedTransfer expected) {
        if (!record.isConfirmed()) {
            return false;
        }
        if (expected.getFrom() != null && !sameAddress(record.getFrom(), expected.getFrom())) {
            return false;
        }
        if (expected.getTo() != null && !sameAddress(record.getTo(), expected.getTo())) {
            return false;
        }
        if (expected.getAmount() != null) {
            return record.getAmount() != null
                && record.getAmount().subtract(expected.getAmount()).abs().compareTo(amountTolerance) < 0;
        }
        return true;
    }

    private static boolean sameAddress(String actual, String expected) {
        if (actual == null || actual.isBlank()) {
            return false;
        }
        return PlayerAddress.normalize(actual).equals(PlayerAddress.normalize(expected));
    }

    private void rotateFrom(String failed) {
        int index = endpoints.indexOf(failed);
        int next = (index + 1) % endpoints.size();
        currentEndpoint.set(next);
        log.info("Switched to verification endpoint {}", endpoints.get(next));
    }

    private static boolean pause(long delayMs) {
        if (delayMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
