package com.flagship.wager_engine.game;

import com.flagship.wager_engine.verification.TransactionVerifier;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Collaborators shared by every round driver.
 */
@Component
@Getter
@RequiredArgsConstructor
public class RoundServices {
    private final BetRegistry betRegistry;
    private final RoundPersistenceService roundPersistenceService;
    private final SettlementEngine settlementEngine;
    private final OutcomeGenerator outcomeGenerator;
    private final TransactionVerifier verifier;
    private final RoundTimer timer;
    private final RoundBroadcaster broadcaster;
}
