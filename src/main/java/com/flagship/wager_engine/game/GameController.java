package com.flagship.wager_engine.game;

import com.flagship.wager_engine.exception.ResourceNotFoundException;
import com.flagship.wager_engine.game.dto.AddressRequest;
import com.flagship.wager_engine.game.dto.PlaceBetRequest;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * REST access to the timed games. The real-time channels offer the same operations.
 */
@RestController
@RequestMapping("/api/games")
@Slf4j
public class GameController {

    private final Map<GameType, RoundScheduler> schedulers = new EnumMap<>(GameType.class);

    public GameController(List<RoundScheduler> schedulers) {
        schedulers.forEach(scheduler -> this.schedulers.put(scheduler.getGameType(), scheduler));
    }

    @PostMapping("/place-bet")
    public ResponseEntity<BetView> placeBet(@Valid @RequestBody PlaceBetRequest request) {
        RoundScheduler scheduler = scheduler(request.getGameType());
        log.info("Received {} bet request: amount={}, target={}",
            scheduler.getGameType(), request.getAmount(), request.getTarget());
        Bet bet = scheduler.join(request.getAddress(), request.getAmount(), request.getTarget(), request.getProof());
        return ResponseEntity.status(HttpStatus.CREATED).body(BetView.from(bet));
    }

    @PostMapping("/cashout")
    public ResponseEntity<Settlement> cashout(@Valid @RequestBody AddressRequest request) {
        return ResponseEntity.ok(schedulerFor(GameType.CRASH).cashout(request.getAddress()));
    }

    @GetMapping("/{game}/status")
    public ResponseEntity<RoundStatus> status(@PathVariable("game") String game) {
        return ResponseEntity.ok(scheduler(game).status());
    }

    @GetMapping("/{game}/history")
    public ResponseEntity<List<RoundHistoryEntry>> history(@PathVariable("game") String game,
                                                           @RequestParam(name = "limit", defaultValue = "20") int limit) {
        return ResponseEntity.ok(scheduler(game).history(limit));
    }

    private RoundScheduler scheduler(String game) {
        GameType gameType;
        try {
            gameType = GameType.valueOf(game.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown game type: " + game);
        }
        return schedulerFor(gameType);
    }

    private RoundScheduler schedulerFor(GameType gameType) {
        RoundScheduler scheduler = schedulers.get(gameType);
        if (scheduler == null) {
            throw new ResourceNotFoundException(gameType + " has no timed rounds");
        }
        return scheduler;
    }
}
