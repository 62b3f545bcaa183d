package com.flagship.wager_engine.game.mines.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class CreateMinesRequest {

    @NotBlank(message = "Address is required")
    @JsonProperty("address")
    String address;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0", inclusive = false, message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotNull(message = "Mines is required")
    @Min(value = 1, message = "Mines must be between 1 and 24")
    @Max(value = 24, message = "Mines must be between 1 and 24")
    @JsonProperty("mines")
    Integer mines;
}
