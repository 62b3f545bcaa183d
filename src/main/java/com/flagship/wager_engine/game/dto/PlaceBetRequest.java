package com.flagship.wager_engine.game.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class PlaceBetRequest {

    @NotBlank(message = "Address is required")
    @JsonProperty("address")
    String address;

    @NotBlank(message = "Game type is required")
    @JsonProperty("gameType")
    String gameType;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0", inclusive = false, message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    /** Auto cashout multiplier for crash, predicted minimum result for slide. */
    @JsonProperty("target")
    BigDecimal target;

    @JsonProperty("proof")
    String proof;
}
