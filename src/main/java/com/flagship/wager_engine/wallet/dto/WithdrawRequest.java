package com.flagship.wager_engine.wallet.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class WithdrawRequest {

    @NotBlank(message = "Address is required")
    @JsonProperty("address")
    String address;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0", inclusive = false, message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotBlank(message = "Destination is required")
    @JsonProperty("destination")
    String destination;
}
