package com.flagship.wager_engine.game;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Connected channel sessions per game, and the {@link RoundBroadcaster} writing to them.
 *
 * Messages are JSON objects {@code {"type": ..., "data": ...}}; errors are
 * {@code {"type": "error", "code": ..., "message": ...}}. Sessions are wrapped so that timer
 * threads and request threads can send concurrently.
 */
@Component
@Slf4j
public class GameChannelRegistry implements RoundBroadcaster {

    public static final String ADDRESS_ATTRIBUTE = "address";

    private static final int SEND_TIME_LIMIT_MS = 5000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final ObjectMapper objectMapper;
    private final Map<GameType, Map<String, WebSocketSession>> channels = new ConcurrentHashMap<>();

    public GameChannelRegistry(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void register(GameType gameType, WebSocketSession session) {
        channels.computeIfAbsent(gameType, g -> new ConcurrentHashMap<>())
            .put(session.getId(), new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT));
        log.debug("Session {} joined {} channel", session.getId(), gameType);
    }

    public void unregister(GameType gameType, WebSocketSession session) {
        Map<String, WebSocketSession> sessions = channels.get(gameType);
        if (sessions != null) {
            sessions.remove(session.getId());
        }
        log.debug("Session {} left {} channel", session.getId(), gameType);
    }

    public int connected(GameType gameType) {
        return channels.getOrDefault(gameType, Map.of()).size();
    }

    /**
     * Sends a message to one session.
     */
    public void send(GameType gameType, WebSocketSession session, String type, Object data) {
        write(resolve(gameType, session), envelope(type, data));
    }

    public void sendError(GameType gameType, WebSocketSession session, String code, String message) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("type", "error");
        error.put("code", code);
        error.put("message", message);
        write(resolve(gameType, session), serialize(error));
    }

    @Override
    public void broadcast(GameType gameType, String type, Object data) {
        String payload = envelope(type, data);
        if (payload == null) {
            return;
        }
        channels.getOrDefault(gameType, Map.of()).values().forEach(session -> write(session, payload));
    }

    @Override
    public void sendTo(GameType gameType, String address, String type, Object data) {
        String payload = envelope(type, data);
        if (payload == null) {
            return;
        }
        channels.getOrDefault(gameType, Map.of()).values().stream()
            .filter(session -> Objects.equals(address, session.getAttributes().get(ADDRESS_ATTRIBUTE)))
            .forEach(session -> write(session, payload));
    }

    private WebSocketSession resolve(GameType gameType, WebSocketSession session) {
        return channels.getOrDefault(gameType, Map.of()).getOrDefault(session.getId(), session);
    }

    private String envelope(String type, Object data) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", type);
        message.put("data", data);
        return serialize(message);
    }

    private String serialize(Map<String, Object> message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} message", message.get("type"), e);
            return null;
        }
    }

    private void write(WebSocketSession session, String payload) {
        if (payload == null || !session.isOpen()) {
            return;
        }
        try {
            session.sendMessage(new TextMessage(payload));
        } catch (IOException | IllegalStateException e) {
            log.warn("Failed to send to session {}: {}", session.getId(), e.getMessage());
        }
    }
}
