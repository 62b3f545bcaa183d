package com.flagship.wager_engine.game.poker.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
public class DrawRequest {

    @NotNull(message = "Session ID is required")
    @JsonProperty("sessionId")
    UUID sessionId;

    @NotNull(message = "Held flags are required")
    @Size(min = 5, max = 5, message = "Held must contain exactly 5 flags")
    @JsonProperty("held")
    List<Boolean> held;
}
