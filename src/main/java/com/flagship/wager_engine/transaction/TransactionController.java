package com.flagship.wager_engine.transaction;

import com.flagship.wager_engine.game.GameType;
import com.flagship.wager_engine.ledger.PlayerAddress;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/transactions")
@RequiredArgsConstructor
public class TransactionController {

    private final TransactionHistoryService historyService;

    /**
     * Transactions of a player, newest first.
     */
    @GetMapping("/{address}")
    public ResponseEntity<List<TransactionView>> history(
            @PathVariable("address") String address,
            @RequestParam(name = "limit", defaultValue = "" + TransactionHistoryService.DEFAULT_LIMIT) int limit,
            @RequestParam(name = "offset", defaultValue = "0") int offset,
            @RequestParam(name = "type", required = false) TransactionType type,
            @RequestParam(name = "gameType", required = false) GameType gameType) {
        return ResponseEntity.ok(historyService.history(PlayerAddress.normalize(address), limit, offset, type, gameType));
    }

    @GetMapping("/{address}/statistics")
    public ResponseEntity<TransactionStatistics> statistics(@PathVariable("address") String address) {
        return ResponseEntity.ok(historyService.statistics(PlayerAddress.normalize(address)));
    }
}
