package com.flagship.wager_engine.verification;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * WebClient-based {@link ExternalLedgerClient}.
 *
 * Lookups go through the node's JSON-RPC {@code getTransaction} method first and fall back
 * to the REST form {@code GET {endpoint}/transaction/{hash}} when the RPC answer carries no result.
 * Every call is bounded by {@code verification.timeout-ms}.
 */
@Component
@Slf4j
public class RpcExternalLedgerClient implements ExternalLedgerClient {

    private final WebClient webClient;
    private final Duration timeout;

    public RpcExternalLedgerClient(WebClient.Builder webClientBuilder,
                                   @Value("${verification.timeout-ms:10000}") long timeoutMs) {
        this.webClient = webClientBuilder.build();
        this.timeout = Duration.ofMillis(timeoutMs);
    }

    @Override
    public Optional<ExternalTransactionRecord> fetchTransaction(String endpoint, String proof) {
        log.debug("Calling getTransaction: endpoint={}, hash={}", endpoint, proof);
        try {
            JsonNode response = webClient.post()
                .uri(endpoint)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(rpcRequest("getTransaction", List.of(proof)))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(timeout)
                .block();
            if (response != null && response.hasNonNull("result")) {
                return Optional.of(toRecord(proof, response.get("result")));
            }

            JsonNode rest = webClient.get()
                .uri(endpoint + "/transaction/{hash}", proof)
                .exchangeToMono(r -> {
                    if (r.statusCode().value() == HttpStatus.NOT_FOUND.value()) {
                        return Mono.empty();
                    }
                    if (r.statusCode().isError()) {
                        return r.createException().flatMap(Mono::error);
                    }
                    return r.bodyToMono(JsonNode.class);
                })
                .timeout(timeout)
                .block();
            return Optional.ofNullable(rest).map(node -> toRecord(proof, node));
        } catch (RuntimeException e) {
            throw new ExternalLedgerUnavailableException("Lookup on " + endpoint + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String broadcast(String endpoint, byte[] signedTransfer) {
        log.debug("Calling broadcastTransaction: endpoint={}, size={}", endpoint, signedTransfer.length);
        JsonNode response;
        try {
            response = webClient.post()
                .uri(endpoint)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(rpcRequest("broadcastTransaction",
                    List.of(Base64.getEncoder().encodeToString(signedTransfer))))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(timeout)
                .block();
        } catch (RuntimeException e) {
            throw new ExternalLedgerUnavailableException("Broadcast on " + endpoint + " failed: " + e.getMessage(), e);
        }

        JsonNode result = response != null ? response.get("result") : null;
        if (result == null || result.isNull()) {
            throw new ExternalLedgerUnavailableException("Broadcast on " + endpoint + " returned no transaction hash", null);
        }
        return result.isTextual() ? result.asText() : result.path("hash").asText();
    }

    private static Map<String, Object> rpcRequest(String method, List<?> params) {
        return Map.of("jsonrpc", "2.0", "method", method, "params", params, "id", 1);
    }

    private static ExternalTransactionRecord toRecord(String proof, JsonNode node) {
        JsonNode amount = node.path("amount");
        BigDecimal value = amount.isNumber() ? amount.decimalValue()
            : amount.isTextual() ? new BigDecimal(amount.asText()) : null;
        boolean confirmed = node.path("confirmed").asBoolean(false)
            || "confirmed".equalsIgnoreCase(node.path("status").asText())
            || node.hasNonNull("blockNumber");
        return new ExternalTransactionRecord(proof,
            node.path("from").asText(null),
            node.path("to").asText(null),
            value,
            confirmed);
    }
}
