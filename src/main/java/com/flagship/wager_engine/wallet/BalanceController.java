package com.flagship.wager_engine.wallet;

import com.flagship.wager_engine.ledger.LedgerService;
import com.flagship.wager_engine.ledger.PlayerAddress;
import com.flagship.wager_engine.wallet.dto.BalanceResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Balance lookup. An unknown address is created with a zero balance.
 */
@RestController
@RequestMapping("/api/balance")
public class BalanceController {

    private final LedgerService ledgerService;
    private final String currency;

    public BalanceController(LedgerService ledgerService, @Value("${game.currency:QUBIC}") String currency) {
        this.ledgerService = ledgerService;
        this.currency = currency;
    }

    @GetMapping("/{address}")
    public ResponseEntity<BalanceResponse> getBalance(@PathVariable("address") String address) {
        return ResponseEntity.ok(BalanceResponse.from(ledgerService.getBalance(PlayerAddress.normalize(address)), currency));
    }
}
