package com.flagship.wager_engine.verification;

import com.flagship.wager_engine.transaction.LedgerTransaction;
import com.flagship.wager_engine.transaction.LedgerTransactionPersistenceService;
import com.flagship.wager_engine.transaction.TransactionView;
import com.flagship.wager_engine.verification.dto.ManualVerificationRequest;
import com.flagship.wager_engine.verification.dto.ManualVerificationResponse;
import com.flagship.wager_engine.verification.dto.PendingVerificationResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

/**
 * Operator view of proof verification. Checking a hash here never changes a balance or a
 * transaction; reconciliation stays the only path that finalizes pending proofs.
 */
@RestController
@RequestMapping("/api/verification")
@RequiredArgsConstructor
@Slf4j
public class VerificationController {

    static final int STATUS_LIMIT = 20;

    private final TransactionVerifier verifier;
    private final LedgerTransactionPersistenceService transactionPersistenceService;

    @PostMapping("/verify")
    public ResponseEntity<ManualVerificationResponse> verify(@Valid @RequestBody ManualVerificationRequest request) {
        String proof = request.getTxHash().trim();
        log.info("Manual verification request for transaction {}", proof);

        Optional<LedgerTransaction> stored = transactionPersistenceService.findByExternalProof(proof);
        ExpectedTransfer expected = stored.map(verifier::expectedFor)
            .orElseGet(() -> new ExpectedTransfer(request.getFrom(), request.getTo(), request.getAmount()));
        boolean verified = verifier.verify(proof, expected, 0, 0);

        return ResponseEntity.ok(new ManualVerificationResponse(proof, verified,
            stored.map(TransactionView::from).orElse(null)));
    }

    @GetMapping("/status")
    public ResponseEntity<PendingVerificationResponse> status() {
        return ResponseEntity.ok(PendingVerificationResponse.of(
            transactionPersistenceService.findRecentPendingWithProof(STATUS_LIMIT)));
    }
}
