package com.flagship.wager_engine.game.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.UUID;

/**
 * Request body addressing one turn-based session.
 */
@Value
public class SessionRequest {

    @NotNull(message = "Session ID is required")
    @JsonProperty("sessionId")
    UUID sessionId;
}
