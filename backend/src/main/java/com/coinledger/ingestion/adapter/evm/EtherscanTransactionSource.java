package com.coinledger.ingestion.adapter.evm;

import com.fasterxml.jackson.databind.JsonNode;
import com.coinledger.domain.ChainId;
import com.coinledger.ingestion.adapter.ChainTransactionSource;
import com.coinledger.ingestion.adapter.IndexerCallException;
import com.coinledger.ingestion.adapter.IndexerHttpClient;
import com.coinledger.ingestion.adapter.RawChainTransaction;
import com.coinledger.ingestion.adapter.SourceUnavailableException;
import com.coinledger.ingestion.config.IngestionAdapterConfig;
import com.coinledger.ingestion.config.IngestionChainProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Account-chain history through Etherscan-compatible explorers: {@code txlist} for native transfers and
 * {@code tokentx} for token transfers, paged with page/offset in ascending block order.
 */
@Slf4j
@Component
public class EtherscanTransactionSource implements ChainTransactionSource {

    static final String NO_TRANSACTIONS = "No transactions found";

    private final IndexerHttpClient httpClient;
    private final IngestionChainProperties properties;
    private final RateLimiter rateLimiter;

    public EtherscanTransactionSource(
            IndexerHttpClient httpClient,
            IngestionChainProperties properties,
            @Qualifier(IngestionAdapterConfig.EXPLORER_RATE_LIMITER) RateLimiter rateLimiter
    ) {
        this.httpClient = httpClient;
        this.properties = properties;
        this.rateLimiter = rateLimiter;
    }

    @Override
    public boolean supports(ChainId chain) {
        return chain != null && chain.isAccountBased();
    }

    @Override
    public List<RawChainTransaction> fetchTransactions(ChainId chain, String address) {
        IngestionChainProperties.ExplorerEntry explorer = properties.explorerFor(chain)
                .orElseThrow(() -> new SourceUnavailableException(chain, address, "No explorer configured for " + chain.id()));
        List<RawChainTransaction> all = new ArrayList<>();
        all.addAll(fetchAction(chain, explorer, address, "txlist", RawChainTransaction.Kind.NATIVE));
        all.addAll(fetchAction(chain, explorer, address, "tokentx", RawChainTransaction.Kind.TOKEN));
        log.debug("Fetched {} {} records for {}", all.size(), chain.id(), address);
        return all;
    }

    private List<RawChainTransaction> fetchAction(ChainId chain, IngestionChainProperties.ExplorerEntry explorer,
                                                  String address, String action, RawChainTransaction.Kind kind) {
        int pageSize = properties.getExplorerPageSize();
        List<RawChainTransaction> records = new ArrayList<>();
        for (int page = 1; page <= properties.getExplorerMaxPages(); page++) {
            String url = buildUrl(explorer, address, action, page, pageSize);
            JsonNode result = get(chain, address, url).path("result");
            for (JsonNode node : result) {
                records.add(new RawChainTransaction(chain, address, node.path("hash").asText(), kind, node));
            }
            if (result.size() < pageSize) {
                break;
            }
        }
        return records;
    }

    static String buildUrl(IngestionChainProperties.ExplorerEntry explorer, String address, String action, int page, int pageSize) {
        StringBuilder url = new StringBuilder(explorer.getBaseUrl()).append('?');
        if (explorer.getEvmChainId() != null && !explorer.getEvmChainId().isBlank()) {
            url.append("chainid=").append(explorer.getEvmChainId()).append('&');
        }
        url.append("module=account&action=").append(action)
                .append("&address=").append(address)
                .append("&startblock=0&endblock=99999999")
                .append("&page=").append(page)
                .append("&offset=").append(pageSize)
                .append("&sort=asc");
        if (explorer.getApiKey() != null && !explorer.getApiKey().isBlank()) {
            url.append("&apikey=").append(explorer.getApiKey());
        }
        return url.toString();
    }

    private JsonNode get(ChainId chain, String address, String url) {
        JsonNode body;
        try {
            body = httpClient.getJson(url, rateLimiter, EtherscanTransactionSource::failOnThrottle);
        } catch (RuntimeException e) {
            throw new SourceUnavailableException(chain, address, chain.id() + " explorer request failed: " + e.getMessage(), e);
        }
        if ("1".equals(body.path("status").asText())) {
            return body;
        }
        JsonNode result = body.path("result");
        if ((result.isArray() && result.isEmpty()) || NO_TRANSACTIONS.equalsIgnoreCase(body.path("message").asText())) {
            return body;
        }
        String message = body.path("message").asText("explorer error");
        if (result.isTextual()) {
            message = message + ": " + result.asText();
        }
        throw new SourceUnavailableException(chain, address, chain.id() + " explorer error: " + message);
    }

    private static JsonNode failOnThrottle(JsonNode body) {
        if (!"1".equals(body.path("status").asText()) && body.path("result").isTextual()
                && body.path("result").asText().toLowerCase(Locale.ROOT).contains("rate limit")) {
            throw IndexerCallException.rateLimited(body.path("result").asText());
        }
        return body;
    }
}
