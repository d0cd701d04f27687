package com.coinledger.ingestion.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.coinledger.common.RetryPolicy;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.function.Function;

/**
 * Blocking JSON GET for indexer APIs using WebClient. Each attempt waits for a rate-limit permit; transport
 * errors, 429 and 5xx are retried with the configured backoff. Callers run on the chain-fetch executor.
 */
public class IndexerHttpClient {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final RetryPolicy retryPolicy;

    public IndexerHttpClient(WebClient.Builder builder, ObjectMapper objectMapper, RetryPolicy retryPolicy) {
        this.webClient = builder.build();
        this.objectMapper = objectMapper;
        this.retryPolicy = retryPolicy;
    }

    public JsonNode getJson(String url, RateLimiter rateLimiter) {
        return getJson(url, rateLimiter, Function.identity());
    }

    /**
     * Like {@link #getJson(String, RateLimiter)} with a body check run inside the retry loop, so a body that
     * reports throttling can throw {@link IndexerCallException#rateLimited(String)} and be retried.
     */
    public JsonNode getJson(String url, RateLimiter rateLimiter, Function<JsonNode, JsonNode> bodyCheck) {
        return retryPolicy.execute(() -> bodyCheck.apply(fetchOnce(url, rateLimiter)), IndexerHttpClient::isRetryable);
    }

    private JsonNode fetchOnce(String url, RateLimiter rateLimiter) {
        RateLimiter.waitForPermission(rateLimiter);
        String body = webClient.get()
                .uri(url)
                .retrieve()
                .bodyToMono(String.class)
                .onErrorMap(WebClientResponseException.class,
                        e -> IndexerCallException.ofStatus(e.getStatusCode().value(), e.getMessage(), e))
                .onErrorMap(WebClientRequestException.class,
                        e -> new IndexerCallException(0, true, e.getMessage(), e))
                .block();
        if (body == null || body.isBlank()) {
            throw new IndexerCallException(200, false, "Empty response body", null);
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new IndexerCallException(200, false, "Response is not JSON: " + e.getOriginalMessage(), e);
        }
    }

    static boolean isRetryable(RuntimeException e) {
        if (e instanceof RequestNotPermitted) {
            return true;
        }
        return e instanceof IndexerCallException ice && ice.isRetryable();
    }
}
