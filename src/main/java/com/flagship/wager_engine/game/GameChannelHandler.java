package com.flagship.wager_engine.game;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.wager_engine.exception.ErrorCode;
import com.flagship.wager_engine.exception.WagerException;
import com.flagship.wager_engine.ledger.PlayerAddress;
import com.flagship.wager_engine.observability.CorrelationContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;

/**
 * Real-time channel of a timed game.
 *
 * The player's address comes from the {@code address} query parameter; a session without one
 * can watch but not bet. Closing the connection never cancels a bet: it stays open and is
 * settled with the round.
 */
@Slf4j
public abstract class GameChannelHandler extends TextWebSocketHandler {

    private static final int HISTORY_ON_CONNECT = 10;

    private final RoundScheduler scheduler;
    private final GameChannelRegistry registry;
    private final ObjectMapper objectMapper;

    protected GameChannelHandler(RoundScheduler scheduler, GameChannelRegistry registry, ObjectMapper objectMapper) {
        this.scheduler = scheduler;
        this.registry = registry;
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        String address = addressOf(session.getUri());
        if (address != null) {
            session.getAttributes().put(GameChannelRegistry.ADDRESS_ATTRIBUTE, address);
        }
        GameType gameType = scheduler.getGameType();
        registry.register(gameType, session);
        registry.send(gameType, session, "status", scheduler.status());
        registry.send(gameType, session, "history", scheduler.history(HISTORY_ON_CONNECT));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        GameType gameType = scheduler.getGameType();
        ChannelMessage request;
        try {
            request = objectMapper.readValue(message.getPayload(), ChannelMessage.class);
        } catch (JsonProcessingException e) {
            registry.sendError(gameType, session, "INVALID_REQUEST", "Malformed message");
            return;
        }

        String address = (String) session.getAttributes().get(GameChannelRegistry.ADDRESS_ATTRIBUTE);
        CorrelationContext.open(null, address);
        try {
            if (address == null) {
                throw new IllegalArgumentException("Connect with an address to play");
            }
            String type = request.getType() == null ? "" : request.getType();
            switch (type) {
                case "join" -> {
                    Bet bet = scheduler.join(address, request.getAmount(), request.getTarget(), request.getProof());
                    registry.send(gameType, session, "joined", BetView.from(bet));
                }
                case "cashout" -> scheduler.cashout(address);
                default -> registry.sendError(gameType, session, "INVALID_REQUEST", "Unknown message type: " + type);
            }
        } catch (WagerException e) {
            log.info("{} channel request rejected: code={}, message={}", gameType, e.getErrorCode(), e.getMessage());
            registry.sendError(gameType, session, e.getErrorCode().name(), e.getMessage());
        } catch (IllegalArgumentException e) {
            registry.sendError(gameType, session, "INVALID_REQUEST", e.getMessage());
        } catch (DataAccessException e) {
            log.error("{} channel request failed in the store", gameType, e);
            registry.sendError(gameType, session, ErrorCode.STORE_FAILURE.name(),
                "The operation could not be committed, resubmit the request");
        } finally {
            CorrelationContext.close();
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        registry.unregister(scheduler.getGameType(), session);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error on session {}: {}", session.getId(), exception.getMessage());
    }

    private static String addressOf(URI uri) {
        if (uri == null) {
            return null;
        }
        String raw = UriComponentsBuilder.fromUri(uri).build().getQueryParams().getFirst("address");
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return PlayerAddress.normalize(raw);
    }
}
