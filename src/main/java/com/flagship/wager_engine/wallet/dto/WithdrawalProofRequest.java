package com.flagship.wager_engine.wallet.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Proof of an outgoing transfer. A missing hash asks the engine to sign and broadcast
 * the transfer itself.
 */
@Value
public class WithdrawalProofRequest {

    @JsonProperty("txHash")
    String txHash;
}
