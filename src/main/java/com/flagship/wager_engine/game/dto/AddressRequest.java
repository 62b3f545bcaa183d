package com.flagship.wager_engine.game.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

/**
 * Request body that only identifies the player.
 */
@Value
public class AddressRequest {

    @NotBlank(message = "Address is required")
    @JsonProperty("address")
    String address;
}
