package com.flagship.wager_engine.verification.dto;

import com.flagship.wager_engine.transaction.TransactionView;
import lombok.Value;

@Value
public class ManualVerificationResponse {
    String txHash;
    boolean verified;
    TransactionView databaseRecord;
}
