package com.flagship.wager_engine.game;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Client message on a game channel: {@code join} with amount, optional target and proof,
 * or {@code cashout}.
 */
@Value
public class ChannelMessage {

    @JsonProperty("type")
    String type;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("target")
    BigDecimal target;

    @JsonProperty("proof")
    String proof;
}
