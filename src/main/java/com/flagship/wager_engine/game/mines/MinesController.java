package com.flagship.wager_engine.game.mines;

import com.flagship.wager_engine.game.dto.AddressRequest;
import com.flagship.wager_engine.game.dto.SessionRequest;
import com.flagship.wager_engine.game.mines.dto.CreateMinesRequest;
import com.flagship.wager_engine.game.mines.dto.RevealRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints of the mine-field game.
 */
@RestController
@RequestMapping("/api/mine")
@RequiredArgsConstructor
@Slf4j
public class MinesController {

    private final MinesSessionService sessionService;

    @PostMapping("/create")
    public ResponseEntity<MineSessionView> create(@Valid @RequestBody CreateMinesRequest request) {
        log.info("Received mines session request: mines={}, amount={}", request.getMines(), request.getAmount());
        MineSessionView view = sessionService.create(request.getAddress(), request.getAmount(), request.getMines());
        return ResponseEntity.status(HttpStatus.CREATED).body(view);
    }

    @PostMapping("/reveal")
    public ResponseEntity<MineSessionView> reveal(@Valid @RequestBody RevealRequest request) {
        return ResponseEntity.ok(sessionService.reveal(request.getSessionId(), request.getPoint()));
    }

    @PostMapping("/cashout")
    public ResponseEntity<MineSessionView> cashout(@Valid @RequestBody SessionRequest request) {
        return ResponseEntity.ok(sessionService.cashout(request.getSessionId()));
    }

    /**
     * The caller's active session, 404 if there is none.
     */
    @PostMapping("/status")
    public ResponseEntity<MineSessionView> status(@Valid @RequestBody AddressRequest request) {
        return ResponseEntity.ok(sessionService.status(request.getAddress()));
    }
}
