package com.flagship.wager_engine.wallet;

import com.flagship.wager_engine.observability.GameMetrics;
import com.flagship.wager_engine.transaction.LedgerTransaction;
import com.flagship.wager_engine.transaction.TransactionStatus;
import com.flagship.wager_engine.verification.TransactionVerifier;
import com.flagship.wager_engine.wallet.dto.DepositRequest;
import com.flagship.wager_engine.wallet.dto.WalletTransactionResponse;
import com.flagship.wager_engine.wallet.dto.WithdrawRequest;
import com.flagship.wager_engine.wallet.dto.WithdrawalProofRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.UUID;

/**
 * REST endpoints for deposits and withdrawals.
 *
 * A confirmed deposit answers 201, a provisionally accepted one 202: its credit waits for
 * reconciliation. Withdrawals always answer 202 since they complete asynchronously.
 */
@RestController
@RequestMapping("/api/payment")
@RequiredArgsConstructor
@Slf4j
public class WalletController {

    private final DepositService depositService;
    private final WithdrawalService withdrawalService;
    private final TransactionVerifier verifier;
    private final GameMetrics metrics;

    @PostMapping("/deposit")
    public ResponseEntity<WalletTransactionResponse> deposit(@Valid @RequestBody DepositRequest request) {
        long startTime = System.currentTimeMillis();
        log.info("Received deposit request: txHash={}, amount={}", request.getTxHash(), request.getAmount());
        try {
            LedgerTransaction tx = depositService.deposit(request.getAddress(), request.getAmount(), request.getTxHash());
            HttpStatus status = tx.getStatus() == TransactionStatus.CONFIRMED ? HttpStatus.CREATED : HttpStatus.ACCEPTED;
            return ResponseEntity.status(status).body(WalletTransactionResponse.from(tx));
        } finally {
            metrics.recordLatency("deposit", System.currentTimeMillis() - startTime);
        }
    }

    @GetMapping("/deposit-address")
    public ResponseEntity<Map<String, String>> depositAddress() {
        return ResponseEntity.ok(Map.of("address", verifier.getHouseAddress()));
    }

    @PostMapping("/withdraw")
    public ResponseEntity<WalletTransactionResponse> withdraw(@Valid @RequestBody WithdrawRequest request) {
        LedgerTransaction tx = withdrawalService.request(request.getAddress(), request.getAmount(), request.getDestination());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(WalletTransactionResponse.from(tx));
    }

    @PostMapping("/withdraw/{id}/proof")
    public ResponseEntity<WalletTransactionResponse> attachWithdrawalProof(
            @PathVariable("id") UUID id,
            @RequestBody WithdrawalProofRequest request) {
        LedgerTransaction tx = withdrawalService.attachProof(id, request.getTxHash());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(WalletTransactionResponse.from(tx));
    }
}
