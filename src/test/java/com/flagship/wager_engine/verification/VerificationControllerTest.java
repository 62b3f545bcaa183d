package com.flagship.wager_engine.verification;

import com.flagship.wager_engine.support.IntegrationTestBase;
import com.flagship.wager_engine.transaction.LedgerTransaction;
import com.flagship.wager_engine.transaction.LedgerTransactionPersistenceService;
import com.flagship.wager_engine.transaction.TransactionStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class VerificationControllerTest extends IntegrationTestBase {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private LedgerTransactionPersistenceService transactionPersistenceService;

    private LedgerTransaction pendingDeposit(String player, String amount) {
        return transactionPersistenceService.save(
            LedgerTransaction.deposit(player, new BigDecimal(amount), "pend-" + UUID.randomUUID(), false));
    }

    @Test
    @DisplayName("Manual verification reports the result and leaves the stored transaction untouched")
    void testVerifyStoredProof() throws Exception {
        // Given
        String player = newPlayer();
        LedgerTransaction tx = pendingDeposit(player, "12");
        when(externalLedgerClient.fetchTransaction(anyString(), eq(tx.getExternalProof())))
            .thenReturn(Optional.of(new ExternalTransactionRecord(tx.getExternalProof(), player, HOUSE,
                new BigDecimal("12"), true)));

        // When / Then
        mockMvc.perform(post("/api/verification/verify").contentType(MediaType.APPLICATION_JSON)
                .content("{\"txHash\":\"" + tx.getExternalProof() + "\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.verified").value(true))
            .andExpect(jsonPath("$.databaseRecord.id").value(tx.getId().toString()))
            .andExpect(jsonPath("$.databaseRecord.status").value("PENDING"));

        assertEquals(TransactionStatus.PENDING,
            transactionPersistenceService.findById(tx.getId()).orElseThrow().getStatus());
        assertAmount("0", ledgerService.getBalance(player).getBalance());
    }

    @Test
    @DisplayName("Unknown hash is checked against the transfer given in the request")
    void testVerifyUnknownProof() throws Exception {
        String proof = "ext-" + UUID.randomUUID();
        String sender = newPlayer();
        when(externalLedgerClient.fetchTransaction(anyString(), eq(proof)))
            .thenReturn(Optional.of(new ExternalTransactionRecord(proof, sender, HOUSE, new BigDecimal("5"), true)));

        mockMvc.perform(post("/api/verification/verify").contentType(MediaType.APPLICATION_JSON)
                .content("{\"txHash\":\"" + proof + "\",\"from\":\"" + sender + "\",\"amount\":7}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.verified").value(false))
            .andExpect(jsonPath("$.databaseRecord").doesNotExist());

        mockMvc.perform(post("/api/verification/verify").contentType(MediaType.APPLICATION_JSON)
                .content("{\"txHash\":\"" + proof + "\",\"from\":\"" + sender + "\",\"amount\":5}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.verified").value(true));
    }

    @Test
    @DisplayName("Missing hash answers 400")
    void testVerifyRequiresHash() throws Exception {
        mockMvc.perform(post("/api/verification/verify").contentType(MediaType.APPLICATION_JSON).content("{}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"));
    }

    @Test
    @DisplayName("Status lists the most recent pending proofs first")
    void testStatus() throws Exception {
        String player = newPlayer();
        pendingDeposit(player, "3");
        LedgerTransaction newest = pendingDeposit(player, "4");

        mockMvc.perform(get("/api/verification/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.pendingCount").value(lessThanOrEqualTo(20)))
            .andExpect(jsonPath("$.transactions[0].id").value(newest.getId().toString()))
            .andExpect(jsonPath("$.transactions[0].txHash").value(newest.getExternalProof()))
            .andExpect(jsonPath("$.transactions[0].address").value(player))
            .andExpect(jsonPath("$.transactions[0].type").value("DEPOSIT"));
    }
}
