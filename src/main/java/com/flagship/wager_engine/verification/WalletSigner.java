package com.flagship.wager_engine.verification;

import java.math.BigDecimal;

/**
 * Signs outgoing transfers from the house wallet.
 *
 * Optional capability: deployments without a signing adapter register no bean, and
 * withdrawal proofs are then attached by an operator.
 */
public interface WalletSigner {

    /**
     * @return the signed transfer, ready to be broadcast to the external ledger
     */
    byte[] sign(String destination, BigDecimal amount, long sequenceNumber);

    /**
     * Sequence number the next transfer must carry.
     */
    long currentSequenceNumber();
}
