package com.flagship.wager_engine.verification.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Hash to re-check against the external ledger. The optional transfer fields only apply to
 * hashes the store does not know; a stored transaction defines its own expected transfer.
 */
@Value
public class ManualVerificationRequest {

    @NotBlank(message = "Transaction hash is required")
    @JsonProperty("txHash")
    String txHash;

    @JsonProperty("from")
    String from;

    @JsonProperty("to")
    String to;

    @JsonProperty("amount")
    BigDecimal amount;
}
