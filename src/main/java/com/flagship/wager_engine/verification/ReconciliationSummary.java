package com.flagship.wager_engine.verification;

import lombok.Value;

@Value
public class ReconciliationSummary {
    int examined;
    int confirmed;
    int expired;
    int stillPending;

    public static ReconciliationSummary empty() {
        return new ReconciliationSummary(0, 0, 0, 0);
    }
}
