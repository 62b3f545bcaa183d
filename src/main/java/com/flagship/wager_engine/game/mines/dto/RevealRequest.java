package com.flagship.wager_engine.game.mines.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.UUID;

@Value
public class RevealRequest {

    @NotNull(message = "Session ID is required")
    @JsonProperty("sessionId")
    UUID sessionId;

    @NotNull(message = "Point is required")
    @Min(value = 0, message = "Point must be between 0 and 24")
    @Max(value = 24, message = "Point must be between 0 and 24")
    @JsonProperty("point")
    Integer point;
}
