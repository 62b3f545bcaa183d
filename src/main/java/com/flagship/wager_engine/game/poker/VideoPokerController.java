package com.flagship.wager_engine.game.poker;

import com.flagship.wager_engine.game.dto.AddressRequest;
import com.flagship.wager_engine.game.poker.dto.DrawRequest;
import com.flagship.wager_engine.game.poker.dto.InitPokerRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/videopoker")
@RequiredArgsConstructor
public class VideoPokerController {

    private final VideoPokerSessionService sessionService;

    @PostMapping("/init")
    public ResponseEntity<PokerSessionView> init(@Valid @RequestBody InitPokerRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(sessionService.init(request.getAddress(), request.getAmount()));
    }

    @PostMapping("/draw")
    public ResponseEntity<PokerSessionView> draw(@Valid @RequestBody DrawRequest request) {
        return ResponseEntity.ok(sessionService.draw(request.getSessionId(), request.getHeld()));
    }

    @PostMapping("/fetch")
    public ResponseEntity<PokerSessionView> fetch(@Valid @RequestBody AddressRequest request) {
        return ResponseEntity.ok(sessionService.fetch(request.getAddress()));
    }
}
