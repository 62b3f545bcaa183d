package com.flagship.wager_engine.wallet.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wager_engine.ledger.BalanceSnapshot;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class BalanceResponse {

    @JsonProperty("address")
    String address;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("lockedBalance")
    BigDecimal lockedBalance;

    @JsonProperty("availableBalance")
    BigDecimal availableBalance;

    @JsonProperty("currency")
    String currency;

    public static BalanceResponse from(BalanceSnapshot snapshot, String currency) {
        return BalanceResponse.builder()
            .address(snapshot.getAddress())
            .balance(snapshot.getBalance())
            .lockedBalance(snapshot.getLockedBalance())
            .availableBalance(snapshot.getAvailableBalance())
            .currency(currency)
            .build();
    }
}
