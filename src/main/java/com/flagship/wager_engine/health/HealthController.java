package com.flagship.wager_engine.health;

import com.flagship.wager_engine.game.RoundScheduler;
import com.flagship.wager_engine.game.RoundStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Public health endpoint for load balancers and the game client: database reachability plus
 * the live state of each timed game. Actuator's /actuator/health stays the detailed one.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private static final int DB_VALIDATION_TIMEOUT_SECONDS = 2;

    private final DataSource dataSource;
    private final List<RoundScheduler> schedulers;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean databaseUp = databaseUp();

        Map<String, Object> games = new LinkedHashMap<>();
        for (RoundScheduler scheduler : schedulers) {
            RoundStatus status = scheduler.status();
            Map<String, Object> game = new LinkedHashMap<>();
            game.put("phase", status.getPhase());
            game.put("roundId", status.getRoundId());
            game.put("players", status.getPlayers());
            games.put(scheduler.getGameType().name().toLowerCase(Locale.ROOT), game);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", databaseUp ? "UP" : "DOWN");
        body.put("database", databaseUp ? "UP" : "DOWN");
        body.put("games", games);
        body.put("timestamp", Instant.now());

        return ResponseEntity.status(databaseUp ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    private boolean databaseUp() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(DB_VALIDATION_TIMEOUT_SECONDS);
        } catch (SQLException e) {
            log.warn("Health check could not reach the database: {}", e.getMessage());
            return false;
        }
    }
}
