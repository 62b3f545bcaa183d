package com.flagship.wager_engine.verification;

import java.util.Optional;

/**
 * Port to the external ledger network.
 */
public interface ExternalLedgerClient {

    /**
     * Looks up a transfer by its hash on one endpoint.
     *
     * @return the transfer, or empty if the endpoint does not know it
     * @throws ExternalLedgerUnavailableException if the endpoint cannot be reached or answers with an error
     */
    Optional<ExternalTransactionRecord> fetchTransaction(String endpoint, String proof);

    /**
     * Broadcasts a signed transfer.
     *
     * @return the hash under which the network registered the transfer
     * @throws ExternalLedgerUnavailableException if the endpoint cannot be reached or answers with an error
     */
    String broadcast(String endpoint, byte[] signedTransfer);
}
