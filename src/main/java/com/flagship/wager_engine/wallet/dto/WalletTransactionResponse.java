package com.flagship.wager_engine.wallet.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wager_engine.transaction.LedgerTransaction;
import com.flagship.wager_engine.transaction.TransactionStatus;
import com.flagship.wager_engine.transaction.TransactionType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Response DTO for deposits and withdrawals.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WalletTransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("type")
    TransactionType type;

    @JsonProperty("status")
    TransactionStatus status;

    @JsonProperty("address")
    String address;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("txHash")
    String txHash;

    @JsonProperty("destination")
    String destination;

    @JsonProperty("createdAt")
    Instant createdAt;

    public static WalletTransactionResponse from(LedgerTransaction tx) {
        return WalletTransactionResponse.builder()
            .id(tx.getId())
            .type(tx.getType())
            .status(tx.getStatus())
            .address(tx.getAddress())
            .amount(tx.getAmount())
            .txHash(tx.getExternalProof())
            .destination(tx.getDestination())
            .createdAt(tx.getCreatedAt())
            .build();
    }
}
